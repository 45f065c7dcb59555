// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress;

import org.hiero.qpress.commands.CatCommand;
import org.hiero.qpress.commands.ExtractCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Command line tool for extracting qpress archives
 */
@SuppressWarnings("InstantiationOfUtilityClass")
@Command(
        name = "qpress-tool",
        mixinStandardHelpOptions = true,
        version = "qpress-tool 0.1",
        subcommands = {ExtractCommand.class, CatCommand.class})
public final class QpressTool {

    /**
     * Empty Default constructor to remove Javadoc warning
     */
    public QpressTool() {}

    /**
     * Main entry point for the app
     * @param args command line arguments
     */
    public static void main(String... args) {
        int exitCode = new CommandLine(new QpressTool()).execute(args);
        System.exit(exitCode);
    }
}
