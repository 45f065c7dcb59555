// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.config;

import java.util.Objects;

/**
 * Settings for one decode. Passed explicitly to every component that needs it, nothing is kept in static state.
 *
 * @param workerCount number of threads decompressing and writing blocks
 * @param maxPendingTasks maximum number of blocks queued or in flight at once, submission blocks beyond this
 * @param sizeLimit per file limit on decompressed bytes, decoding stops with a partial result once a block would take
 *     a file past it. Zero or negative means unbounded.
 * @param checksumPolicy how block checksums are handled
 */
public record DecoderConfig(int workerCount, int maxPendingTasks, long sizeLimit, ChecksumPolicy checksumPolicy) {
    /** Default number of worker threads. */
    public static final int DEFAULT_WORKER_COUNT = 10;
    /** Default limit on queued plus in flight blocks. */
    public static final int DEFAULT_MAX_PENDING_TASKS = 40;

    /**
     * Constructor.
     */
    public DecoderConfig {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1, was " + workerCount);
        }
        if (maxPendingTasks < 1) {
            throw new IllegalArgumentException("maxPendingTasks must be at least 1, was " + maxPendingTasks);
        }
        Objects.requireNonNull(checksumPolicy, "checksumPolicy cannot be null");
    }

    /**
     * @return the default configuration, unbounded size and checksums ignored
     */
    public static DecoderConfig defaults() {
        return new DecoderConfig(DEFAULT_WORKER_COUNT, DEFAULT_MAX_PENDING_TASKS, 0, ChecksumPolicy.IGNORE);
    }

    /**
     * @return true if a positive size limit is configured
     */
    public boolean hasSizeLimit() {
        return sizeLimit > 0;
    }

    /**
     * @param newSizeLimit the per file size limit, zero or negative for unbounded
     * @return a copy of this config with the size limit replaced
     */
    public DecoderConfig withSizeLimit(long newSizeLimit) {
        return new DecoderConfig(workerCount, maxPendingTasks, newSizeLimit, checksumPolicy);
    }

    /**
     * @param newChecksumPolicy the checksum policy
     * @return a copy of this config with the checksum policy replaced
     */
    public DecoderConfig withChecksumPolicy(ChecksumPolicy newChecksumPolicy) {
        return new DecoderConfig(workerCount, maxPendingTasks, sizeLimit, newChecksumPolicy);
    }

    /**
     * @param newWorkerCount number of worker threads
     * @param newMaxPendingTasks maximum number of queued plus in flight blocks
     * @return a copy of this config with the concurrency settings replaced
     */
    public DecoderConfig withConcurrency(int newWorkerCount, int newMaxPendingTasks) {
        return new DecoderConfig(newWorkerCount, newMaxPendingTasks, sizeLimit, checksumPolicy);
    }
}
