// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.decode;

import java.util.List;
import org.hiero.qpress.format.ArchiveHeader;

/**
 * The result of decoding a whole archive.
 *
 * @param header the archive header
 * @param files the outcome of every file target decoded, in archive order
 * @param partial true if decoding stopped early because a file reached the size limit
 */
public record DecodeResult(ArchiveHeader header, List<FileOutcome> files, boolean partial) {
    /**
     * Constructor.
     */
    public DecodeResult {
        files = List.copyOf(files);
    }

    /**
     * @return true if decoding stopped early because a file reached the size limit
     */
    public boolean isPartial() {
        return partial;
    }

    /**
     * @return true if no file failed
     */
    public boolean isSuccess() {
        return failures().isEmpty();
    }

    /**
     * @return the outcomes of the files that failed
     */
    public List<FileOutcome> failures() {
        return files.stream()
                .filter(f -> f.status() == FileOutcome.Status.FAILED)
                .toList();
    }

    /**
     * @return total decompressed bytes over all files
     */
    public long totalBytes() {
        return files.stream().mapToLong(FileOutcome::bytes).sum();
    }
}
