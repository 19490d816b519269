package org.permafrost.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.permafrost.archive.EligibilityClassifier;
import org.permafrost.archive.RegionArchiver;
import org.permafrost.archive.storage.ArchiveStore;
import org.permafrost.decay.DecayEngine;
import org.permafrost.decay.DecaySettings;
import org.permafrost.runtime.internal.services.RowMajorGridCodec;
import org.permafrost.runtime.internal.services.SeasonalClimateModel;
import org.permafrost.runtime.internal.services.SeededRandomProvider;
import org.permafrost.utils.PathExpansion;
import org.permafrost.utils.compression.CompressionCodecFactory;
import org.permafrost.utils.compression.ICompressionCodec;
import org.permafrost.world.WorldStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed view of the {@code permafrost} configuration block, and the place where the archiver
 * and its collaborators are assembled from it.
 *
 * <pre>
 * permafrost {
 *   storage.root = "${user.home}/permafrost"
 *   world-id = "default"
 *   seed = 42
 *   excluded-defs = ["VoidMonolith"]
 *   compression { enabled = true, codec = "zstd", level = 3 }
 *   decay { ... }
 *   climate { mean-temperature = 8.0, tiles = [{ id = 7, rainfall = 600, temperature-offset = -12 }] }
 * }
 * </pre>
 */
public final class PermafrostSettings {

    private static final Logger log = LoggerFactory.getLogger(PermafrostSettings.class);

    public static final String ROOT_PATH = "permafrost";

    private final Path storageRoot;
    private final String worldId;
    private final long seed;
    private final List<String> excludedDefs;
    private final ICompressionCodec compression;
    private final DecaySettings decay;
    private final SeasonalClimateModel climate;

    private PermafrostSettings(Config options) {
        this.storageRoot = options.hasPath("storage.root")
            ? PathExpansion.toAbsolutePath(options.getString("storage.root"))
            : null;
        this.worldId = options.hasPath("world-id") ? options.getString("world-id") : "default";
        this.seed = options.hasPath("seed") ? options.getLong("seed") : 0L;
        this.excludedDefs = options.hasPath("excluded-defs")
            ? new ArrayList<>(options.getStringList("excluded-defs"))
            : List.of(EligibilityClassifier.DEFAULT_EXCLUDED_DEF);
        this.compression = CompressionCodecFactory.create(options);
        this.decay = DecaySettings.fromConfig(options.hasPath("decay") ? options.getConfig("decay") : ConfigFactory.empty());
        this.climate = buildClimate(options.hasPath("climate") ? options.getConfig("climate") : ConfigFactory.empty(), decay);
    }

    /**
     * @param config Full application configuration; the {@code permafrost} block is optional.
     * @return the settings
     * @throws IllegalArgumentException if a value is out of range or names an unknown codec
     */
    public static PermafrostSettings fromConfig(Config config) {
        return new PermafrostSettings(config.hasPath(ROOT_PATH) ? config.getConfig(ROOT_PATH) : ConfigFactory.empty());
    }

    private static SeasonalClimateModel buildClimate(Config c, DecaySettings decay) {
        SeasonalClimateModel model = new SeasonalClimateModel(
            c.hasPath("mean-temperature") ? c.getDouble("mean-temperature") : 10.0,
            c.hasPath("seasonal-amplitude") ? c.getDouble("seasonal-amplitude") : 12.0,
            c.hasPath("diurnal-amplitude") ? c.getDouble("diurnal-amplitude") : 4.0,
            c.hasPath("default-rainfall") ? c.getDouble("default-rainfall") : 1000.0,
            decay.getTicksPerYear(),
            decay.getTicksPerDay());
        if (c.hasPath("tiles")) {
            for (Config tile : c.getConfigList("tiles")) {
                model.withTile(tile.getInt("id"),
                    tile.hasPath("rainfall") ? tile.getDouble("rainfall") : model.rainfall(tile.getInt("id")),
                    tile.hasPath("temperature-offset") ? tile.getDouble("temperature-offset") : 0.0);
            }
        }
        return model;
    }

    /**
     * @return the archive store, or null if no storage root is configured
     */
    public ArchiveStore createStore() {
        if (storageRoot == null) {
            log.warn("No permafrost.storage.root configured; region archiving is disabled");
            return null;
        }
        return new ArchiveStore(storageRoot, compression);
    }

    /**
     * @return a region archiver wired from these settings
     */
    public RegionArchiver createArchiver() {
        return new RegionArchiver(
            createStore(),
            new RowMajorGridCodec(),
            new EligibilityClassifier(excludedDefs),
            new DecayEngine(climate, decay),
            new SeededRandomProvider(seed));
    }

    /**
     * @return a world state store, or null if no storage root is configured
     */
    public WorldStateStore createWorldStateStore() {
        ArchiveStore store = createStore();
        return store != null ? new WorldStateStore(store) : null;
    }

    public Path getStorageRoot() {
        return storageRoot;
    }

    public String getWorldId() {
        return worldId;
    }

    public long getSeed() {
        return seed;
    }

    public List<String> getExcludedDefs() {
        return excludedDefs;
    }

    public ICompressionCodec getCompression() {
        return compression;
    }

    public DecaySettings getDecay() {
        return decay;
    }

    public SeasonalClimateModel getClimate() {
        return climate;
    }
}
