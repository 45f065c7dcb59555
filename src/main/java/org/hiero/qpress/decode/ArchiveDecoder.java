// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.decode;

import static java.lang.System.Logger.Level.DEBUG;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.hiero.qpress.codec.BlockCodec;
import org.hiero.qpress.config.DecoderConfig;
import org.hiero.qpress.format.ArchiveHeader;
import org.hiero.qpress.format.QpressException;
import org.hiero.qpress.format.QpressFormat;
import org.hiero.qpress.format.Target;
import org.hiero.qpress.format.TargetType;
import org.hiero.qpress.format.UnsupportedFeatureException;
import org.hiero.qpress.io.QpressInputStream;

/**
 * Top level state machine of the decoder: reads the archive header then one target after another until the stream
 * ends or a zero type byte is read. Only file targets are supported, directory records are parsed and then rejected.
 */
public final class ArchiveDecoder {
    private final System.Logger LOGGER = System.getLogger(getClass().getName());

    private final FileTargetDecoder fileDecoder;

    /**
     * Constructor.
     *
     * @param codec the codec used to read packet headers
     * @param config supplies the per file size limit
     */
    public ArchiveDecoder(BlockCodec codec, DecoderConfig config) {
        this.fileDecoder = new FileTargetDecoder(codec, config);
    }

    /**
     * Decode an archive.
     *
     * @param in the archive stream, positioned at the header
     * @param output where the files are written
     * @return the outcome of every file decoded
     * @throws UnsupportedFeatureException if the archive contains a directory record
     * @throws QpressException if the archive is malformed
     * @throws IOException if reading the archive or writing the output fails
     */
    public DecodeResult decode(QpressInputStream in, FileOutput output) throws IOException, QpressException {
        final ArchiveHeader header = ArchiveHeader.read(in);
        LOGGER.log(DEBUG, "Read {0}", header);
        final List<FileOutcome> files = new ArrayList<>();
        while (true) {
            final long offset = in.position();
            final int marker = in.readMarker();
            if (marker < 0 || marker == QpressFormat.END_OF_ARCHIVE) {
                return new DecodeResult(header, files, false);
            }
            final Target target = Target.read(TargetType.fromMarker(marker, offset), in);
            if (target instanceof Target.FileTarget file) {
                final FileTargetDecoder.Decoded decoded = fileDecoder.decode(file.name(), in, header, output);
                files.add(decoded.outcome());
                if (decoded.limitReached()) {
                    return new DecodeResult(header, files, true);
                }
            } else if (target instanceof Target.DownDirectory directory) {
                throw new UnsupportedFeatureException("Directory '%s' at offset %d: directories are not supported"
                        .formatted(directory.name(), offset));
            } else {
                throw new UnsupportedFeatureException(
                        "Up directory record at offset %d: directories are not supported".formatted(offset));
            }
        }
    }
}
