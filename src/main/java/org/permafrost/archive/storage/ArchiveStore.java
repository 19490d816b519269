package org.permafrost.archive.storage;

import org.permafrost.archive.session.ArchiveException;
import org.permafrost.utils.compression.CompressionCodecFactory;
import org.permafrost.utils.compression.ICompressionCodec;
import org.permafrost.utils.compression.NoneCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.UUID;

/**
 * File layout of archived regions and world state:
 * {@code <root>/<worldId>/Region_<regionId>.json[.zst]} and {@code <root>/<worldId>/World.json[.zst]}.
 * <p>
 * Writes go to a {@code .UUID.tmp} sibling that is atomically moved into place, so readers
 * never see a partial file. Reads pick the codec from the file extension, so switching
 * compression on or off keeps older files readable.
 * </p>
 */
public class ArchiveStore {

    private static final Logger log = LoggerFactory.getLogger(ArchiveStore.class);

    private static final String REGION_PREFIX = "Region_";
    private static final String WORLD_FILE = "World";
    private static final String EXTENSION = ".json";

    private final Path root;
    private final ICompressionCodec codec;

    /**
     * @param root Storage root; created lazily on first write.
     * @param codec Codec for new files.
     */
    public ArchiveStore(Path root, ICompressionCodec codec) {
        this.root = root;
        this.codec = codec != null ? codec : new NoneCodec();
    }

    public Path getRoot() {
        return root;
    }

    public ICompressionCodec getCodec() {
        return codec;
    }

    /**
     * @param worldId World id.
     * @param regionId Region id.
     * @return where a new archive of the region is written
     */
    public Path regionPath(String worldId, int regionId) {
        return worldDirectory(worldId).resolve(REGION_PREFIX + regionId + EXTENSION + codec.getFileExtension());
    }

    public Path worldStatePath(String worldId) {
        return worldDirectory(worldId).resolve(WORLD_FILE + EXTENSION + codec.getFileExtension());
    }

    /**
     * Finds an existing region archive, compressed or not.
     *
     * @param worldId World id.
     * @param regionId Region id.
     * @return the file, or empty if none exists
     */
    public Optional<Path> locateRegion(String worldId, int regionId) {
        return locate(worldDirectory(worldId), REGION_PREFIX + regionId + EXTENSION);
    }

    public Optional<Path> locateWorldState(String worldId) {
        return locate(worldDirectory(worldId), WORLD_FILE + EXTENSION);
    }

    public boolean regionExists(String worldId, int regionId) {
        return locateRegion(worldId, regionId).isPresent();
    }

    /**
     * @return size of the written file in bytes
     */
    public long writeRegion(String worldId, int regionId, byte[] document) throws ArchiveException {
        Path target = regionPath(worldId, regionId);
        long size = write(target, document);
        deleteStaleVariant(worldDirectory(worldId), REGION_PREFIX + regionId + EXTENSION, target);
        return size;
    }

    public byte[] readRegion(String worldId, int regionId) throws ArchiveException {
        Path file = locateRegion(worldId, regionId)
            .orElseThrow(() -> new ArchiveException("No archive for region " + regionId + " of world " + worldId));
        return read(file);
    }

    /**
     * @return true if an archive was deleted
     */
    public boolean deleteRegion(String worldId, int regionId) throws ArchiveException {
        Optional<Path> file = locateRegion(worldId, regionId);
        if (file.isEmpty()) {
            return false;
        }
        try {
            return Files.deleteIfExists(file.get());
        } catch (IOException e) {
            throw new ArchiveException("Failed to delete " + file.get(), e);
        }
    }

    public long writeWorldState(String worldId, byte[] document) throws ArchiveException {
        Path target = worldStatePath(worldId);
        long size = write(target, document);
        deleteStaleVariant(worldDirectory(worldId), WORLD_FILE + EXTENSION, target);
        return size;
    }

    public byte[] readWorldState(String worldId) throws ArchiveException {
        Path file = locateWorldState(worldId)
            .orElseThrow(() -> new ArchiveException("No world state for world " + worldId));
        return read(file);
    }

    /**
     * Writes a document through the configured codec, atomically.
     *
     * @param target Final file.
     * @param document Uncompressed document bytes.
     * @return size of the file on disk
     * @throws ArchiveException on I/O failure; no partial target is left behind
     */
    public long write(Path target, byte[] document) throws ArchiveException {
        Path parent = target.getParent();
        Path temp = parent.resolve(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.createDirectories(parent);
            try (OutputStream raw = Files.newOutputStream(temp);
                 OutputStream out = codec.wrapOutputStream(raw)) {
                out.write(document);
            }
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            return Files.size(target);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temp file after write failure: {}", temp, cleanupEx);
            }
            throw new ArchiveException("Failed to write " + target + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads and decompresses a file.
     *
     * @param file The file.
     * @return the document bytes
     * @throws ArchiveException if the file cannot be read or decompressed
     */
    public byte[] read(Path file) throws ArchiveException {
        ICompressionCodec fileCodec = CompressionCodecFactory.forFileName(file.getFileName().toString());
        try (InputStream raw = Files.newInputStream(file);
             InputStream in = fileCodec.wrapInputStream(raw)) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            in.transferTo(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new ArchiveException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    private Path worldDirectory(String worldId) {
        validateWorldId(worldId);
        return root.resolve(worldId);
    }

    private static Optional<Path> locate(Path directory, String baseName) {
        Path compressed = directory.resolve(baseName + ".zst");
        if (Files.isRegularFile(compressed)) {
            return Optional.of(compressed);
        }
        Path plain = directory.resolve(baseName);
        return Files.isRegularFile(plain) ? Optional.of(plain) : Optional.empty();
    }

    private static void deleteStaleVariant(Path directory, String baseName, Path written) {
        for (Path variant : new Path[] {directory.resolve(baseName), directory.resolve(baseName + ".zst")}) {
            if (!variant.equals(written)) {
                try {
                    Files.deleteIfExists(variant);
                } catch (IOException e) {
                    log.warn("Failed to delete stale archive variant {}", variant, e);
                }
            }
        }
    }

    private static void validateWorldId(String worldId) {
        if (worldId == null || worldId.isBlank()) {
            throw new IllegalArgumentException("World id cannot be null or empty");
        }
        if (worldId.contains("..") || worldId.contains("/") || worldId.contains("\\") || worldId.contains(":")) {
            throw new IllegalArgumentException("World id cannot contain path separators or '..': " + worldId);
        }
    }
}
