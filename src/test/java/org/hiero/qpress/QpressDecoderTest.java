// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Stream;
import org.hiero.qpress.codec.BlockCodec;
import org.hiero.qpress.codec.DecompressionException;
import org.hiero.qpress.codec.DeclaredSizes;
import org.hiero.qpress.codec.QuickLzCodec;
import org.hiero.qpress.config.ChecksumPolicy;
import org.hiero.qpress.config.DecoderConfig;
import org.hiero.qpress.decode.DecodeResult;
import org.hiero.qpress.decode.FileOutcome;
import org.hiero.qpress.fixtures.ExampleArchive;
import org.hiero.qpress.fixtures.QpressArchiveBuilder;
import org.hiero.qpress.fixtures.QuickLzPackets;
import org.hiero.qpress.format.ChecksumMismatchException;
import org.hiero.qpress.format.QpressFormatException;
import org.hiero.qpress.format.UnsupportedFeatureException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

/**
 * End to end tests for {@link QpressDecoder}.
 */
@Timeout(value = 30)
class QpressDecoderTest {
    private static final byte[] CORRUPT_PACKET = QuickLzPackets.withFlags(QuickLzPackets.HELLO, 0x49);

    @TempDir
    private Path tempDir;

    private static byte[] randomBytes(int size, long seed) {
        final byte[] bytes = new byte[size];
        new Random(seed).nextBytes(bytes);
        return bytes;
    }

    private static DecodeResult extract(DecoderConfig config, byte[] archive, Path destination)
            throws Exception {
        return new QpressDecoder(config).decodeToDirectory(new ByteArrayInputStream(archive), destination);
    }

    private static String read(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.US_ASCII);
    }

    /** Delegates to QuickLZ after sleeping a random few milliseconds, so workers finish out of order. */
    private static final class DelayingCodec implements BlockCodec {
        private final QuickLzCodec delegate = new QuickLzCodec();

        @Override
        public int headerLength(byte flags) {
            return delegate.headerLength(flags);
        }

        @Override
        public DeclaredSizes declaredSizes(byte[] header) {
            return delegate.declaredSizes(header);
        }

        @Override
        public long maxDecompressedSize(byte[] header) {
            return delegate.maxDecompressedSize(header);
        }

        @Override
        public int decompress(byte[] packet, byte[] destination) throws DecompressionException {
            try {
                Thread.sleep(ThreadLocalRandom.current().nextInt(4));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DecompressionException("interrupted");
            }
            return delegate.decompress(packet, destination);
        }
    }

    @Nested
    @DisplayName("Documented example archive")
    class Example {
        @Test
        @DisplayName("extracts c.txt then rejects the directory record")
        void directoriesAreUnsupported() throws Exception {
            final Path out = tempDir.resolve("out");
            assertThatThrownBy(() -> extract(DecoderConfig.defaults(), ExampleArchive.BYTES, out))
                    .isInstanceOf(UnsupportedFeatureException.class)
                    .hasMessageContaining("FOO");
            assertThat(read(out.resolve("c.txt"))).isEqualTo("hello");
            assertThat(out.resolve("d.txt")).doesNotExist();
        }

        @Test
        @DisplayName("without directory records both files are extracted with verified checksums")
        void flattened() throws Exception {
            final DecoderConfig config = DecoderConfig.defaults().withChecksumPolicy(ChecksumPolicy.FAIL);
            final DecodeResult result = extract(config, ExampleArchive.withoutDirectories(), tempDir);
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.isPartial()).isFalse();
            assertThat(result.header().chunkSize()).isEqualTo(65536);
            assertThat(read(tempDir.resolve("c.txt"))).isEqualTo("hello");
            assertThat(read(tempDir.resolve("d.txt"))).isEqualTo("there");
        }

        @Test
        @DisplayName("sink variant writes both files in archive order")
        void sink() throws Exception {
            final ByteArrayOutputStream out = new ByteArrayOutputStream();
            final DecodeResult result = new QpressDecoder(DecoderConfig.defaults())
                    .decodeToSink(new ByteArrayInputStream(ExampleArchive.withoutDirectories()), out);
            assertThat(out.toString(StandardCharsets.US_ASCII)).isEqualTo("hellothere");
            assertThat(result.files()).extracting(FileOutcome::name).containsExactly("c.txt", "d.txt");
        }
    }

    @Nested
    @DisplayName("Round trip")
    class RoundTrip {
        @Test
        @DisplayName("multi block files are reassembled exactly")
        void multiBlock() throws Exception {
            final byte[] first = randomBytes(100_000, 1);
            final byte[] second = randomBytes(12_345, 2);
            final byte[] archive = QpressArchiveBuilder.create()
                    .compressedFile("first.bin", first, 1000)
                    .storedFile("second.bin", second, 4096)
                    .file("empty.bin")
                    .build();
            final DecodeResult result = extract(DecoderConfig.defaults(), archive, tempDir);
            assertThat(Files.readAllBytes(tempDir.resolve("first.bin"))).isEqualTo(first);
            assertThat(Files.readAllBytes(tempDir.resolve("second.bin"))).isEqualTo(second);
            assertThat(Files.size(tempDir.resolve("empty.bin"))).isZero();
            assertThat(result.files())
                    .extracting(FileOutcome::bytes)
                    .containsExactly((long) first.length, (long) second.length, 0L);
            assertThat(result.files()).extracting(FileOutcome::blocks).containsExactly(100, 4, 0);
            assertThat(result.totalBytes()).isEqualTo(first.length + second.length);
        }

        @Test
        @DisplayName("back reference packets decode through the pipeline")
        void backReferences() throws Exception {
            final byte[] archive = QpressArchiveBuilder.create()
                    .file("matches.txt", QuickLzPackets.LEVEL1_MATCH, QuickLzPackets.LEVEL3_MATCH)
                    .build();
            extract(DecoderConfig.defaults(), archive, tempDir);
            assertThat(read(tempDir.resolve("matches.txt")))
                    .isEqualTo(QuickLzPackets.LEVEL1_MATCH_CONTENT + QuickLzPackets.LEVEL3_MATCH_CONTENT);
        }

        @Test
        @DisplayName("compressor output at both levels decodes through the pipeline")
        void compressorOutput() throws Exception {
            final byte[] archive = QpressArchiveBuilder.create()
                    .file("lines.txt", QuickLzPackets.LINES_LEVEL1, QuickLzPackets.LINES_LEVEL3)
                    .file("mixed.txt", QuickLzPackets.MIXED_LEVEL3, QuickLzPackets.MIXED_LEVEL1)
                    .build();
            final DecodeResult result =
                    extract(DecoderConfig.defaults().withChecksumPolicy(ChecksumPolicy.FAIL), archive, tempDir);
            assertThat(result.isSuccess()).isTrue();
            assertThat(read(tempDir.resolve("lines.txt")))
                    .isEqualTo(QuickLzPackets.LINES_CONTENT + QuickLzPackets.LINES_CONTENT);
            assertThat(read(tempDir.resolve("mixed.txt")))
                    .isEqualTo(QuickLzPackets.MIXED_CONTENT + QuickLzPackets.MIXED_CONTENT);
        }

        @Test
        @DisplayName("output does not depend on the order workers finish in")
        void deterministicUnderRandomDelays() throws Exception {
            final byte[] content = randomBytes(64 * 500, 3);
            final byte[] archive =
                    QpressArchiveBuilder.create().compressedFile("shuffled.bin", content, 64).build();
            final DecoderConfig config = DecoderConfig.defaults().withConcurrency(8, 16);
            for (int run = 0; run < 3; run++) {
                final Path out = tempDir.resolve("run" + run);
                new QpressDecoder(config, new DelayingCodec())
                        .decodeToDirectory(new ByteArrayInputStream(archive), out);
                assertThat(Files.readAllBytes(out.resolve("shuffled.bin"))).isEqualTo(content);
            }
        }

        @Test
        @DisplayName("a single worker with one pending task gives the same result")
        void singleWorker() throws Exception {
            final byte[] content = randomBytes(10_000, 4);
            final byte[] archive = QpressArchiveBuilder.create().compressedFile("one.bin", content, 777).build();
            extract(DecoderConfig.defaults().withConcurrency(1, 1), archive, tempDir);
            assertThat(Files.readAllBytes(tempDir.resolve("one.bin"))).isEqualTo(content);
        }

        @Test
        @DisplayName("extracting into an in memory file system")
        void inMemoryFileSystem() throws Exception {
            try (FileSystem fileSystem = Jimfs.newFileSystem(Configuration.unix())) {
                final Path out = fileSystem.getPath("/data/out");
                final byte[] content = randomBytes(5000, 5);
                final byte[] archive =
                        QpressArchiveBuilder.create().compressedFile("a.bin", content, 999).build();
                extract(DecoderConfig.defaults(), archive, out);
                assertThat(Files.readAllBytes(out.resolve("a.bin"))).isEqualTo(content);
            }
        }
    }

    @Nested
    @DisplayName("Size limit")
    class SizeLimit {
        private final byte[] archive = QpressArchiveBuilder.create()
                .storedFile("a.txt", "aaaabbbbcccc".getBytes(StandardCharsets.US_ASCII), 4)
                .storedFile("b.txt", "dd".getBytes(StandardCharsets.US_ASCII), 4)
                .build();

        @Test
        @DisplayName("equal to the file size extracts everything")
        void equalLimit() throws Exception {
            final DecodeResult result = extract(DecoderConfig.defaults().withSizeLimit(12), archive, tempDir);
            assertThat(result.isPartial()).isFalse();
            assertThat(read(tempDir.resolve("a.txt"))).isEqualTo("aaaabbbbcccc");
            assertThat(read(tempDir.resolve("b.txt"))).isEqualTo("dd");
        }

        @Test
        @DisplayName("one byte less keeps the whole blocks before the limit and stops")
        void smallerLimit() throws Exception {
            final DecodeResult result = extract(DecoderConfig.defaults().withSizeLimit(11), archive, tempDir);
            assertThat(result.isPartial()).isTrue();
            assertThat(result.isSuccess()).isTrue();
            assertThat(read(tempDir.resolve("a.txt"))).isEqualTo("aaaabbbb");
            assertThat(tempDir.resolve("b.txt")).doesNotExist();
        }

        @Test
        @DisplayName("sink variant stops at the same point")
        void sinkLimit() throws Exception {
            final ByteArrayOutputStream out = new ByteArrayOutputStream();
            final DecodeResult result = new QpressDecoder(DecoderConfig.defaults().withSizeLimit(5))
                    .decodeToSink(new ByteArrayInputStream(archive), out);
            assertThat(result.isPartial()).isTrue();
            assertThat(out.toString(StandardCharsets.US_ASCII)).isEqualTo("aaaa");
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {
        @Test
        @DisplayName("bad magic writes nothing")
        void badMagic() {
            final byte[] archive = QuickLzPackets.hex("7171726573733130" + "0000010000000000");
            final Path out = tempDir.resolve("out");
            assertThatThrownBy(() -> extract(DecoderConfig.defaults(), archive, out))
                    .isInstanceOf(QpressFormatException.class)
                    .hasMessageContaining("magic");
            assertThat(out).doesNotExist();
        }

        @Test
        @DisplayName("an existing file is neither overwritten nor truncated")
        void noOverwrite() throws Exception {
            Files.writeString(tempDir.resolve("c.txt"), "original content");
            assertThatThrownBy(() -> extract(DecoderConfig.defaults(), ExampleArchive.withoutDirectories(), tempDir))
                    .isInstanceOf(FileAlreadyExistsException.class);
            assertThat(read(tempDir.resolve("c.txt"))).isEqualTo("original content");
            assertThat(tempDir.resolve("d.txt")).doesNotExist();
        }

        @Test
        @DisplayName("a corrupt block fails its file only")
        void failureIsolation() throws Exception {
            final byte[] archive = QpressArchiveBuilder.create()
                    .file("bad.txt", QuickLzPackets.HELLO, CORRUPT_PACKET, QuickLzPackets.HELLO)
                    .file("good.txt", QuickLzPackets.HELLO)
                    .build();
            final DecodeResult result = extract(DecoderConfig.defaults(), archive, tempDir);
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.failures()).singleElement().satisfies(file -> {
                assertThat(file.name()).isEqualTo("bad.txt");
                assertThat(file.failure()).isInstanceOf(DecompressionException.class);
            });
            assertThat(tempDir.resolve("bad.txt")).doesNotExist();
            assertThat(read(tempDir.resolve("good.txt"))).isEqualTo("hello");
        }

        @Test
        @DisplayName("sink variant throws the first block failure")
        void sinkFailure() {
            final byte[] archive =
                    QpressArchiveBuilder.create().file("bad.txt", CORRUPT_PACKET).build();
            assertThatThrownBy(() -> new QpressDecoder(DecoderConfig.defaults())
                            .decodeToSink(new ByteArrayInputStream(archive), new ByteArrayOutputStream()))
                    .isInstanceOf(DecompressionException.class);
        }

        @Test
        @DisplayName("truncated archive removes the incomplete file")
        void truncatedArchive() throws Exception {
            final byte[] archive = QpressArchiveBuilder.create()
                    .beginFile("cut.txt")
                    .block(QuickLzPackets.HELLO)
                    .build();
            assertThatThrownBy(() -> extract(DecoderConfig.defaults(), archive, tempDir))
                    .isInstanceOf(QpressFormatException.class);
            try (Stream<Path> files = Files.list(tempDir)) {
                assertThat(files).isEmpty();
            }
        }
    }

    @Nested
    @DisplayName("Checksum policy")
    class Checksums {
        private final byte[] archive = QpressArchiveBuilder.create()
                .beginFile("tampered.txt")
                .block(QuickLzPackets.HELLO, 0x12345678L)
                .trailer()
                .file("fine.txt", QuickLzPackets.HELLO)
                .build();

        @Test
        void ignore() throws Exception {
            final DecodeResult result =
                    extract(DecoderConfig.defaults().withChecksumPolicy(ChecksumPolicy.IGNORE), archive, tempDir);
            assertThat(result.isSuccess()).isTrue();
            assertThat(read(tempDir.resolve("tampered.txt"))).isEqualTo("hello");
        }

        @Test
        void warn() throws Exception {
            final DecodeResult result =
                    extract(DecoderConfig.defaults().withChecksumPolicy(ChecksumPolicy.WARN), archive, tempDir);
            assertThat(result.isSuccess()).isTrue();
            assertThat(read(tempDir.resolve("tampered.txt"))).isEqualTo("hello");
        }

        @Test
        void fail() throws Exception {
            final DecodeResult result =
                    extract(DecoderConfig.defaults().withChecksumPolicy(ChecksumPolicy.FAIL), archive, tempDir);
            assertThat(result.failures()).singleElement().satisfies(file -> {
                assertThat(file.name()).isEqualTo("tampered.txt");
                assertThat(file.failure()).isInstanceOf(ChecksumMismatchException.class);
            });
            assertThat(tempDir.resolve("tampered.txt")).doesNotExist();
            assertThat(read(tempDir.resolve("fine.txt"))).isEqualTo("hello");
        }
    }
}
