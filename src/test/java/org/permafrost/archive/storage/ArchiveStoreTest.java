package org.permafrost.archive.storage;

import org.permafrost.archive.session.ArchiveException;
import org.permafrost.junit.extensions.logging.LogWatchExtension;
import org.permafrost.utils.compression.NoneCodec;
import org.permafrost.utils.compression.ZstdCodec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class ArchiveStoreTest {

    private static final byte[] DOCUMENT = "{\"format\":1,\"entities\":[]}".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path root;

    @Nested
    @DisplayName("Layout")
    class Layout {

        @Test
        void regionAndWorldFilesLiveUnderTheWorldDirectory() {
            ArchiveStore plain = new ArchiveStore(root, new NoneCodec());
            ArchiveStore zstd = new ArchiveStore(root, new ZstdCodec());

            assertEquals(root.resolve("tundra").resolve("Region_7.json"), plain.regionPath("tundra", 7));
            assertEquals(root.resolve("tundra").resolve("Region_7.json.zst"), zstd.regionPath("tundra", 7));
            assertEquals(root.resolve("tundra").resolve("World.json.zst"), zstd.worldStatePath("tundra"));
        }

        @Test
        void nullCodecMeansUncompressed() {
            assertThat(new ArchiveStore(root, null).getCodec()).isInstanceOf(NoneCodec.class);
        }

        @Test
        void worldIdsCannotEscapeTheRoot() {
            ArchiveStore store = new ArchiveStore(root, new NoneCodec());

            for (String bad : new String[] {"..", "a/b", "a\\b", "c:", " "}) {
                assertThatThrownBy(() -> store.regionPath(bad, 1))
                    .as(bad)
                    .isInstanceOf(IllegalArgumentException.class);
            }
            assertThatThrownBy(() -> store.regionPath(null, 1)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Reading and writing")
    class ReadWrite {

        @Test
        void writtenRegionReadsBack() throws ArchiveException {
            ArchiveStore store = new ArchiveStore(root, new NoneCodec());

            long size = store.writeRegion("tundra", 3, DOCUMENT);

            assertEquals(DOCUMENT.length, size);
            assertThat(store.regionExists("tundra", 3)).isTrue();
            assertArrayEquals(DOCUMENT, store.readRegion("tundra", 3));
        }

        @Test
        void compressedRegionReadsBackThroughAnyStore() throws ArchiveException {
            new ArchiveStore(root, new ZstdCodec()).writeRegion("tundra", 3, DOCUMENT);

            ArchiveStore uncompressedStore = new ArchiveStore(root, new NoneCodec());

            assertThat(uncompressedStore.locateRegion("tundra", 3)).contains(root.resolve("tundra/Region_3.json.zst"));
            assertArrayEquals(DOCUMENT, uncompressedStore.readRegion("tundra", 3));
        }

        @Test
        void switchingCodecRemovesTheStaleVariant() throws ArchiveException {
            new ArchiveStore(root, new NoneCodec()).writeRegion("tundra", 3, DOCUMENT);
            new ArchiveStore(root, new ZstdCodec()).writeRegion("tundra", 3, DOCUMENT);

            assertThat(root.resolve("tundra/Region_3.json")).doesNotExist();
            assertThat(root.resolve("tundra/Region_3.json.zst")).exists();

            new ArchiveStore(root, new NoneCodec()).writeWorldState("tundra", DOCUMENT);
            new ArchiveStore(root, new NoneCodec()).writeRegion("tundra", 3, DOCUMENT);

            assertThat(root.resolve("tundra/Region_3.json.zst")).doesNotExist();
            assertThat(root.resolve("tundra/World.json")).exists();
        }

        @Test
        void writesLeaveNoTempFiles() throws Exception {
            ArchiveStore store = new ArchiveStore(root, new ZstdCodec());
            store.writeRegion("tundra", 1, DOCUMENT);
            store.writeRegion("tundra", 1, DOCUMENT);
            store.writeWorldState("tundra", DOCUMENT);

            try (Stream<Path> files = Files.list(root.resolve("tundra"))) {
                assertThat(files.map(p -> p.getFileName().toString()))
                    .containsExactlyInAnyOrder("Region_1.json.zst", "World.json.zst");
            }
        }

        @Test
        void missingRegionFailsToRead() {
            ArchiveStore store = new ArchiveStore(root, new NoneCodec());

            assertThat(store.locateRegion("tundra", 9)).isEmpty();
            assertThatThrownBy(() -> store.readRegion("tundra", 9))
                .isInstanceOf(ArchiveException.class)
                .hasMessageContaining("region 9");
            assertThatThrownBy(() -> store.readWorldState("tundra")).isInstanceOf(ArchiveException.class);
        }

        @Test
        void corruptCompressedFileFailsToRead() throws IOException {
            Path file = root.resolve("tundra/Region_4.json.zst");
            Files.createDirectories(file.getParent());
            Files.write(file, DOCUMENT);

            assertThatThrownBy(() -> new ArchiveStore(root, new NoneCodec()).readRegion("tundra", 4))
                .isInstanceOf(ArchiveException.class);
        }

        @Test
        void deleteRegion() throws ArchiveException {
            ArchiveStore store = new ArchiveStore(root, new NoneCodec());
            store.writeRegion("tundra", 5, DOCUMENT);

            assertThat(store.deleteRegion("tundra", 5)).isTrue();
            assertThat(store.deleteRegion("tundra", 5)).isFalse();
            assertThat(store.regionExists("tundra", 5)).isFalse();
        }

        @Test
        void worldStateRoundTrip() throws ArchiveException {
            ArchiveStore store = new ArchiveStore(root, new ZstdCodec(9));

            store.writeWorldState("tundra", DOCUMENT);

            assertThat(store.locateWorldState("tundra")).isPresent();
            assertArrayEquals(DOCUMENT, store.readWorldState("tundra"));
        }
    }
}
