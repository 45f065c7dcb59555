// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.config;

/**
 * What to do with the Adler-32 checksum stored with every data block.
 */
public enum ChecksumPolicy {
    /** Do not compute checksums. */
    IGNORE,
    /** Compute checksums and log a warning on mismatch, the block is still decompressed. */
    WARN,
    /** Compute checksums and fail the owning file on mismatch. */
    FAIL
}
