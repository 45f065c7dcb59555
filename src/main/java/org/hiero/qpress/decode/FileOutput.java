// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.decode;

import java.io.IOException;
import org.hiero.qpress.format.ArchiveHeader;
import org.hiero.qpress.format.QpressException;

/**
 * Where the files of an archive are materialised.
 */
public interface FileOutput {

    /**
     * Open the output for a file target.
     *
     * @param name the file name as stored in the archive
     * @param header the archive header
     * @return the sink receiving the file's blocks
     * @throws java.nio.file.FileAlreadyExistsException if the destination already exists
     * @throws IOException if the output cannot be created
     * @throws QpressException if the name cannot be used as a destination
     */
    BlockSink open(String name, ArchiveHeader header) throws IOException, QpressException;
}
