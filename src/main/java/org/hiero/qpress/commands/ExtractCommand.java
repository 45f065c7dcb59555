// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.commands;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.hiero.qpress.QpressDecoder;
import org.hiero.qpress.config.ChecksumPolicy;
import org.hiero.qpress.config.DecoderConfig;
import org.hiero.qpress.decode.DecodeResult;
import org.hiero.qpress.decode.FileOutcome;
import org.hiero.qpress.format.QpressException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Extract every file of a qpress archive into a directory, decompressing blocks in parallel.
 * <p>
 * Exit codes: {@value #EXIT_OK} when every file was extracted, also when the size limit stopped extraction early,
 * {@value #EXIT_FILE_FAILED} when at least one file failed to decompress, {@value #EXIT_FATAL} when the archive could
 * not be decoded.
 */
@SuppressWarnings("FieldCanBeLocal")
@Command(
        name = "extract",
        description = "Extract the files of a qpress archive into a directory",
        mixinStandardHelpOptions = true)
public class ExtractCommand implements Callable<Integer> {
    /** Every file was extracted. */
    public static final int EXIT_OK = 0;
    /** At least one file failed, the others were extracted. */
    public static final int EXIT_FILE_FAILED = 1;
    /** The archive could not be decoded. */
    public static final int EXIT_FATAL = 2;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "qpress archive to extract, - for standard input")
    private Path archive;

    @Option(
            names = {"-o", "--output-dir"},
            description = "Directory to extract into, created if missing",
            defaultValue = ".")
    private Path outputDir;

    @Option(
            names = {"--size-limit"},
            description = "Stop once a file would exceed this many bytes, 0 for no limit",
            defaultValue = "0")
    private long sizeLimit;

    @Option(
            names = {"-w", "--workers"},
            description = "Number of decompression threads",
            defaultValue = "" + DecoderConfig.DEFAULT_WORKER_COUNT)
    private int workers;

    @Option(
            names = {"--max-pending"},
            description = "Maximum number of blocks queued or being decompressed at once",
            defaultValue = "" + DecoderConfig.DEFAULT_MAX_PENDING_TASKS)
    private int maxPending;

    @Option(
            names = {"--checksum"},
            description = "Block checksum handling: ${COMPLETION-CANDIDATES}",
            defaultValue = "IGNORE")
    private ChecksumPolicy checksumPolicy;

    @Override
    public Integer call() {
        final DecoderConfig config;
        try {
            config = new DecoderConfig(workers, maxPending, sizeLimit, checksumPolicy);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }
        final PrintWriter out = spec.commandLine().getOut();
        final DecodeResult result;
        try (InputStream in = ArchiveSource.open(archive)) {
            result = new QpressDecoder(config).decodeToDirectory(in, outputDir);
        } catch (IOException | QpressException e) {
            spec.commandLine().getErr().println(Ansi.AUTO.string("@|red Error:|@ ") + e.getMessage());
            return EXIT_FATAL;
        }
        for (FileOutcome file : result.files()) {
            switch (file.status()) {
                case COMPLETE -> out.println(Ansi.AUTO.string("@|green extracted|@ ") + file.name());
                case PARTIAL -> out.println(Ansi.AUTO.string("@|yellow partial|@   ") + file.name());
                case FAILED -> out.println(
                        Ansi.AUTO.string("@|red failed|@    ") + file.name() + ": " + file.failure().getMessage());
            }
        }
        if (result.isPartial()) {
            out.println("Size limit of " + sizeLimit + " bytes reached, remaining files not extracted");
        }
        out.flush();
        return result.isSuccess() ? EXIT_OK : EXIT_FILE_FAILED;
    }
}
