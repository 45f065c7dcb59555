// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.commands;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens the archive named on the command line, {@code -} meaning standard input.
 */
final class ArchiveSource {
    /** Archive argument that selects standard input. */
    static final String STDIN = "-";

    private ArchiveSource() {}

    /**
     * @param archive the archive path argument
     * @return a stream over the archive, closing it never closes standard input
     * @throws IOException if the archive file cannot be opened
     */
    static InputStream open(Path archive) throws IOException {
        if (archive.toString().equals(STDIN)) {
            return new FilterInputStream(System.in) {
                @Override
                public void close() {
                    // standard input belongs to the process
                }
            };
        }
        return Files.newInputStream(archive);
    }
}
