// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.codec;

import org.hiero.qpress.format.QpressException;

/**
 * Exception thrown by a {@link BlockCodec} when a compressed packet is structurally invalid for the algorithm.
 */
public class DecompressionException extends QpressException {
    public DecompressionException(final String message) {
        super(message);
    }
}
