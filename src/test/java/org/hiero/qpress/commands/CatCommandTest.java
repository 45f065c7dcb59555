// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.hiero.qpress.QpressTool;
import org.hiero.qpress.fixtures.ExampleArchive;
import org.hiero.qpress.fixtures.QpressArchiveBuilder;
import org.hiero.qpress.fixtures.QuickLzPackets;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

/**
 * Tests for {@link CatCommand} run through the root command.
 */
class CatCommandTest {
    @TempDir
    private Path tempDir;

    @Test
    void writesEveryFileToTheOutputFile() throws Exception {
        final Path archive = Files.write(tempDir.resolve("example.qp"), ExampleArchive.withoutDirectories());
        final Path output = tempDir.resolve("all.txt");
        final CommandLine cmd = new CommandLine(new QpressTool());

        final int exitCode = cmd.execute("cat", archive.toString(), "-O", output.toString());

        assertThat(exitCode).isEqualTo(ExtractCommand.EXIT_OK);
        assertThat(Files.readString(output, StandardCharsets.US_ASCII)).isEqualTo("hellothere");
    }

    @Test
    void sizeLimitStopsOutput() throws Exception {
        final Path archive = Files.write(tempDir.resolve("example.qp"), ExampleArchive.withoutDirectories());
        final Path output = tempDir.resolve("limited.txt");

        final int exitCode = new CommandLine(new QpressTool())
                .execute("cat", archive.toString(), "-O", output.toString(), "--size-limit", "4");

        assertThat(exitCode).isEqualTo(ExtractCommand.EXIT_OK);
        assertThat(Files.readString(output, StandardCharsets.US_ASCII)).isEmpty();
    }

    @Test
    void failedDecodeRemovesTheOutputFile() throws Exception {
        // the second block uses the unsupported compression level 2
        final byte[] corrupt = QpressArchiveBuilder.create()
                .file("bad.txt", QuickLzPackets.HELLO, QuickLzPackets.withFlags(QuickLzPackets.HELLO, 0x49))
                .build();
        final Path archive = Files.write(tempDir.resolve("corrupt.qp"), corrupt);
        final Path output = tempDir.resolve("partial.txt");
        final StringWriter err = new StringWriter();
        final CommandLine cmd = new CommandLine(new QpressTool());
        cmd.setErr(new PrintWriter(err));

        final int exitCode = cmd.execute("cat", archive.toString(), "-O", output.toString());

        assertThat(exitCode).isEqualTo(ExtractCommand.EXIT_FATAL);
        assertThat(output).doesNotExist();
        assertThat(err.toString()).contains("level 2");
    }

    @Test
    void existingOutputFileIsFatal() throws Exception {
        final Path archive = Files.write(tempDir.resolve("example.qp"), ExampleArchive.withoutDirectories());
        final Path output = Files.writeString(tempDir.resolve("exists.txt"), "keep");
        final StringWriter err = new StringWriter();
        final CommandLine cmd = new CommandLine(new QpressTool());
        cmd.setErr(new PrintWriter(err));

        final int exitCode = cmd.execute("cat", archive.toString(), "-O", output.toString());

        assertThat(exitCode).isEqualTo(ExtractCommand.EXIT_FATAL);
        assertThat(Files.readString(output)).isEqualTo("keep");
        assertThat(err.toString()).contains("exists.txt");
    }
}
