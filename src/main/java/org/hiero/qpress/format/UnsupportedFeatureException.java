// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.format;

/**
 * Exception thrown when an archive contains a well formed record this decoder does not reconstruct, for example
 * directory up and down records.
 */
public class UnsupportedFeatureException extends QpressException {
    public UnsupportedFeatureException(final String message) {
        super(message);
    }
}
