package org.permafrost.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.permafrost.archive.RegionArchiver;
import org.permafrost.decay.DecaySettings;
import org.permafrost.junit.extensions.logging.ExpectLog;
import org.permafrost.junit.extensions.logging.LogLevel;
import org.permafrost.junit.extensions.logging.LogWatchExtension;
import org.permafrost.runtime.model.Material;
import org.permafrost.utils.compression.NoneCodec;
import org.permafrost.utils.compression.ZstdCodec;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class PermafrostSettingsTest {

    @TempDir
    Path tempDir;

    @Test
    void referenceDefaultsMatchBuiltInDefaults() {
        PermafrostSettings settings = PermafrostSettings.fromConfig(ConfigFactory.defaultReference());
        DecaySettings decay = settings.getDecay();
        DecaySettings builtIn = DecaySettings.defaults();

        assertThat(settings.getWorldId()).isEqualTo("default");
        assertThat(settings.getStorageRoot()).isEqualTo(Path.of(System.getProperty("user.home"), ".permafrost", "archives"));
        assertThat(settings.getExcludedDefs()).containsExactly("VoidMonolith");
        assertThat(settings.getCompression()).isInstanceOf(NoneCodec.class);
        assertThat(decay.getTicksPerYear()).isEqualTo(builtIn.getTicksPerYear());
        assertThat(decay.getOutdoorDamagePerInterval()).isEqualTo(builtIn.getOutdoorDamagePerInterval());
        assertThat(decay.materialFactor(Material.WOOD)).isEqualTo(builtIn.materialFactor(Material.WOOD));
        assertThat(decay.getMaxFailureEvents()).isEqualTo(builtIn.getMaxFailureEvents());
        assertThat(decay.getSeverityTimeConstantYears()).isEqualTo(builtIn.getSeverityTimeConstantYears());
    }

    @Test
    void overridesAreApplied() {
        Config config = ConfigFactory.parseString("""
            permafrost {
              storage.root = "%s"
              world-id = "tundra"
              seed = 99
              excluded-defs = ["AncientShrine"]
              compression { enabled = true, codec = "zstd", level = 7 }
              decay {
                ticks-per-year = 1000000
                structural.material-factors.wood = 0.3
              }
              climate {
                mean-temperature = -5.0
                tiles = [{ id = 7, rainfall = 250, temperature-offset = -12 }]
              }
            }
            """.formatted(tempDir.toString().replace("\\", "\\\\")));

        PermafrostSettings settings = PermafrostSettings.fromConfig(config);

        assertThat(settings.getStorageRoot()).isEqualTo(tempDir.toAbsolutePath().normalize());
        assertThat(settings.getWorldId()).isEqualTo("tundra");
        assertThat(settings.getSeed()).isEqualTo(99L);
        assertThat(settings.getExcludedDefs()).containsExactly("AncientShrine");
        assertThat(settings.getCompression()).isInstanceOf(ZstdCodec.class);
        assertThat(settings.getCompression().getLevel()).isEqualTo(7);
        assertThat(settings.getDecay().getTicksPerYear()).isEqualTo(1_000_000L);
        assertThat(settings.getDecay().materialFactor(Material.WOOD)).isEqualTo(0.3);
        assertThat(settings.getDecay().materialFactor(Material.STONE)).isEqualTo(0.02);
        assertThat(settings.getClimate().rainfall(7)).isEqualTo(250.0);
        assertThat(settings.getClimate().rainfall(1)).isEqualTo(1000.0);
        assertThat(settings.getClimate().seasonalTemperature(500_000L, 1)).isCloseTo(7.0, within(1e-9));

        RegionArchiver archiver = settings.createArchiver();
        assertThat(archiver.getStore().getRoot()).isEqualTo(settings.getStorageRoot());
        assertThat(archiver.getClassifier().getExcludedDefNames()).containsExactly("AncientShrine");
        assertThat(settings.createWorldStateStore()).isNotNull();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "No permafrost.storage.root configured.*", occurrences = 2)
    void missingStorageRootDisablesArchiving() {
        PermafrostSettings settings = PermafrostSettings.fromConfig(ConfigFactory.empty());

        assertThat(settings.getStorageRoot()).isNull();
        assertThat(settings.createStore()).isNull();
        assertThat(settings.createWorldStateStore()).isNull();
    }

    @Test
    void invalidValuesRejected() {
        assertThatThrownBy(() -> PermafrostSettings.fromConfig(
            ConfigFactory.parseString("permafrost.compression { enabled = true, codec = brotli }")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PermafrostSettings.fromConfig(
            ConfigFactory.parseString("permafrost.decay.ticks-per-day = 0")))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
