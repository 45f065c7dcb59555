// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.io;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;
import org.hiero.qpress.format.QpressFormat;
import org.hiero.qpress.format.QpressFormatException;

/**
 * Sequential reader for the primitive fields of a qpress archive: little endian integers, fixed marker sequences and
 * length prefixed names. Reaching the end of the stream in the middle of a field is a {@link QpressFormatException},
 * failures of the underlying stream are passed through as {@link IOException}.
 * <p>
 * The stream keeps track of the number of bytes consumed so errors can report where in the archive they happened.
 */
public class QpressInputStream extends FilterInputStream {
    /** Largest buffer allocated for a field before its bytes have been read. */
    private static final int MAX_READ_AHEAD = 1 << 20;

    /** Number of bytes consumed from the underlying stream. */
    private long position = 0;

    /**
     * Create a new QpressInputStream reading from the given stream.
     *
     * @param in the archive stream, should be buffered by the caller
     */
    public QpressInputStream(InputStream in) {
        super(Objects.requireNonNull(in, "in cannot be null"));
    }

    /**
     * @return the number of bytes consumed so far
     */
    public long position() {
        return position;
    }

    /**
     * Read a single type or marker byte.
     *
     * @return the marker as an unsigned value, or -1 when the stream is exhausted
     * @throws IOException if the underlying stream fails
     */
    public int readMarker() throws IOException {
        final int b = in.read();
        if (b >= 0) position++;
        return b;
    }

    /**
     * Read exactly {@code length} bytes.
     *
     * @param length number of bytes to read
     * @param field name of the field being read, used in error messages
     * @return a new array holding the bytes
     * @throws QpressFormatException if the stream ends before all bytes are read
     * @throws IOException if the underlying stream fails
     */
    public byte[] readExactly(int length, String field) throws IOException, QpressFormatException {
        final byte[] buf = new byte[length];
        readExactly(buf, 0, length, field);
        return buf;
    }

    /**
     * Fill {@code buf[off, off + len)} from the stream.
     *
     * @param buf destination buffer
     * @param off offset of the first byte to fill
     * @param len number of bytes to fill
     * @param field name of the field being read, used in error messages
     * @throws QpressFormatException if the stream ends before all bytes are read
     * @throws IOException if the underlying stream fails
     */
    public void readExactly(byte[] buf, int off, int len, String field) throws IOException, QpressFormatException {
        final long fieldStart = position;
        int read = 0;
        while (read < len) {
            final int r = in.read(buf, off + read, len - read);
            if (r < 0) {
                throw new QpressFormatException("Unexpected end of stream reading %s at offset %d: got %d of %d bytes"
                        .formatted(field, fieldStart, read, len));
            }
            read += r;
            position += r;
        }
    }

    /**
     * Read a field whose first bytes are already known, up to a total of {@code length} bytes. The length usually comes
     * from the archive itself, so the buffer grows as bytes actually arrive instead of being sized up front.
     *
     * @param prefix bytes already read, copied to the start of the result
     * @param length total length of the field, prefix included
     * @param field name of the field being read, used in error messages
     * @return a new array of {@code length} bytes
     * @throws QpressFormatException if the stream ends before all bytes are read
     * @throws IOException if the underlying stream fails
     */
    public byte[] readExactly(byte[] prefix, int length, String field) throws IOException, QpressFormatException {
        if (length < prefix.length) {
            throw new IllegalArgumentException("length " + length + " is shorter than the prefix");
        }
        final long fieldStart = position;
        byte[] buf = Arrays.copyOf(prefix, Math.min(length, Math.max(prefix.length, MAX_READ_AHEAD)));
        int filled = prefix.length;
        while (filled < length) {
            if (filled == buf.length) {
                buf = Arrays.copyOf(buf, (int) Math.min(length, 2L * buf.length));
            }
            final int r = in.read(buf, filled, buf.length - filled);
            if (r < 0) {
                throw new QpressFormatException("Unexpected end of stream reading %s at offset %d: got %d of %d bytes"
                        .formatted(field, fieldStart, filled - prefix.length, length - prefix.length));
            }
            filled += r;
            position += r;
        }
        return buf;
    }

    /**
     * Read an unsigned 32 bit little endian integer.
     *
     * @param field name of the field being read, used in error messages
     * @return the value in the range [0, 2^32)
     * @throws QpressFormatException if the stream ends inside the field
     * @throws IOException if the underlying stream fails
     */
    public long readUnsignedIntLE(String field) throws IOException, QpressFormatException {
        final byte[] b = readExactly(Integer.BYTES, field);
        return (b[0] & 0xFFL) | (b[1] & 0xFFL) << 8 | (b[2] & 0xFFL) << 16 | (b[3] & 0xFFL) << 24;
    }

    /**
     * Read a 64 bit little endian integer. Values of 2^63 and above come back negative and should be treated as
     * unsigned by the caller.
     *
     * @param field name of the field being read, used in error messages
     * @return the raw 64 bit value
     * @throws QpressFormatException if the stream ends inside the field
     * @throws IOException if the underlying stream fails
     */
    public long readLongLE(String field) throws IOException, QpressFormatException {
        final byte[] b = readExactly(Long.BYTES, field);
        long value = 0;
        for (int i = Long.BYTES - 1; i >= 0; i--) {
            value = (value << 8) | (b[i] & 0xFFL);
        }
        return value;
    }

    /**
     * Read {@code expected.length} bytes and check they equal {@code expected}.
     *
     * @param expected the fixed byte sequence
     * @param field name of the field being read, used in error messages
     * @throws QpressFormatException if the bytes differ or the stream ends inside the field
     * @throws IOException if the underlying stream fails
     */
    public void expect(byte[] expected, String field) throws IOException, QpressFormatException {
        final long fieldStart = position;
        final byte[] actual = readExactly(expected.length, field);
        if (!Arrays.equals(expected, actual)) {
            throw new QpressFormatException("Invalid %s at offset %d: expected %s but found %s"
                    .formatted(
                            field,
                            fieldStart,
                            HexFormat.of().formatHex(expected),
                            HexFormat.of().formatHex(actual)));
        }
    }

    /**
     * Read a name: an unsigned 32 bit little endian length, that many bytes of UTF-8, then a mandatory zero
     * terminator byte.
     *
     * @param field name of the field being read, used in error messages
     * @return the decoded name
     * @throws QpressFormatException if the length is too large, the bytes are not valid UTF-8, the terminator is
     *     missing or the stream ends early
     * @throws IOException if the underlying stream fails
     */
    public String readName(String field) throws IOException, QpressFormatException {
        final long length = readUnsignedIntLE(field + " length");
        if (length > QpressFormat.MAX_NAME_LENGTH) {
            throw new QpressFormatException("Invalid %s length %d at offset %d, maximum is %d"
                    .formatted(field, length, position - Integer.BYTES, QpressFormat.MAX_NAME_LENGTH));
        }
        final byte[] name = readExactly((int) length, field);
        final int terminator = readMarker();
        if (terminator < 0) {
            throw new QpressFormatException(
                    "Unexpected end of stream reading %s terminator at offset %d".formatted(field, position));
        }
        if (terminator != QpressFormat.NAME_TERMINATOR) {
            throw new QpressFormatException("Invalid %s terminator 0x%02x at offset %d"
                    .formatted(field, terminator, position - 1));
        }
        try {
            return StandardCharsets.UTF_8
                    .newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(name))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new QpressFormatException(
                    "Invalid UTF-8 in %s at offset %d".formatted(field, position - 1 - name.length), e);
        }
    }
}
