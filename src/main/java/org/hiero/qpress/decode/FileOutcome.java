// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.decode;

import java.util.Objects;

/**
 * The result of decoding one file target.
 *
 * @param name the file name as stored in the archive
 * @param status how decoding of the file ended
 * @param bytes number of decompressed bytes belonging to the blocks dispatched for the file
 * @param blocks number of blocks dispatched for the file
 * @param failure the cause when {@code status} is {@link Status#FAILED}, otherwise null
 */
public record FileOutcome(String name, Status status, long bytes, int blocks, Throwable failure) {
    /** How decoding of a file ended. */
    public enum Status {
        /** Every block up to the trailer was written. */
        COMPLETE,
        /** The size limit stopped the file early, the blocks before the limit were written. */
        PARTIAL,
        /** A block failed to decompress, verify or write. The output was removed. */
        FAILED
    }

    /**
     * Constructor.
     */
    public FileOutcome {
        Objects.requireNonNull(name);
        Objects.requireNonNull(status);
        if ((status == Status.FAILED) != (failure != null)) {
            throw new IllegalArgumentException("failure must be set exactly when status is FAILED");
        }
    }

    static FileOutcome complete(String name, long bytes, int blocks) {
        return new FileOutcome(name, Status.COMPLETE, bytes, blocks, null);
    }

    static FileOutcome partial(String name, long bytes, int blocks) {
        return new FileOutcome(name, Status.PARTIAL, bytes, blocks, null);
    }

    static FileOutcome failed(String name, long bytes, int blocks, Throwable failure) {
        return new FileOutcome(name, Status.FAILED, bytes, blocks, Objects.requireNonNull(failure));
    }
}
