// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.commands;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.Callable;
import org.hiero.qpress.QpressDecoder;
import org.hiero.qpress.config.ChecksumPolicy;
import org.hiero.qpress.config.DecoderConfig;
import org.hiero.qpress.format.QpressException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Decode a qpress archive to standard output or a single file, the content of every file one after the other.
 */
@Command(
        name = "cat",
        description = "Write the decoded content of every file of a qpress archive to standard output",
        mixinStandardHelpOptions = true)
public class CatCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "qpress archive to decode, - for standard input")
    private Path archive;

    @Option(
            names = {"-O", "--output-file"},
            description = "Write to this file instead of standard output, it must not exist")
    private Path outputFile;

    @Option(
            names = {"--size-limit"},
            description = "Stop once a file would exceed this many bytes, 0 for no limit",
            defaultValue = "0")
    private long sizeLimit;

    @Option(
            names = {"--checksum"},
            description = "Block checksum handling: ${COMPLETION-CANDIDATES}",
            defaultValue = "IGNORE")
    private ChecksumPolicy checksumPolicy;

    @Override
    public Integer call() {
        final DecoderConfig config =
                DecoderConfig.defaults().withSizeLimit(sizeLimit).withChecksumPolicy(checksumPolicy);
        try (InputStream in = ArchiveSource.open(archive)) {
            if (outputFile == null) {
                final OutputStream out = new BufferedOutputStream(System.out);
                new QpressDecoder(config).decodeToSink(in, out);
            } else {
                decodeToFile(in, config);
            }
            return ExtractCommand.EXIT_OK;
        } catch (IOException | QpressException e) {
            spec.commandLine().getErr().println(Ansi.AUTO.string("@|red Error:|@ ") + e.getMessage());
            return ExtractCommand.EXIT_FATAL;
        }
    }

    /**
     * Decode into {@link #outputFile}, which must not exist yet. If decoding fails the partly written file is deleted,
     * an existing file is never touched.
     */
    private void decodeToFile(InputStream in, DecoderConfig config) throws IOException, QpressException {
        final OutputStream file =
                Files.newOutputStream(outputFile, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        try (OutputStream out = new BufferedOutputStream(file)) {
            new QpressDecoder(config).decodeToSink(in, out);
        } catch (IOException | QpressException | RuntimeException e) {
            try {
                Files.deleteIfExists(outputFile);
            } catch (IOException deleteFailure) {
                e.addSuppressed(deleteFailure);
            }
            throw e;
        }
    }
}
