// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.codec;

/**
 * The sizes a compressed packet declares in its own header.
 *
 * @param compressedSize total size of the packet in bytes, header included
 * @param decompressedSize size of the data the packet decompresses to
 */
public record DeclaredSizes(long compressedSize, long decompressedSize) {}
