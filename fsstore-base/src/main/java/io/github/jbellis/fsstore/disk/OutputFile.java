/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.jbellis.fsstore.disk;

import io.github.jbellis.fsstore.exceptions.AlreadyClosedException;
import io.github.jbellis.fsstore.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Path;

/**
 * Unbuffered write handle that keeps one file open from construction until {@link #close()}.
 * <p>
 * Every failure surfaces immediately as an exception naming the path. Not thread-safe; a file
 * has a single writer at a time.
 */
public class OutputFile implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(OutputFile.class);

    private final Path path;
    private final boolean syncOnFlush;
    private RandomAccessFile file;

    /**
     * Opens {@code path} for writing, creating it or truncating it to zero length.
     *
     * @param syncOnFlush if true, {@link #flush()} also forces written data to the storage device
     * @throws IOException if the file cannot be opened for writing
     */
    public OutputFile(Path path, boolean syncOnFlush) throws IOException {
        this.path = path;
        this.syncOnFlush = syncOnFlush;
        RandomAccessFile raf = null;
        try {
            raf = new RandomAccessFile(path.toFile(), "rw");
            raf.setLength(0);
        } catch (IOException e) {
            if (raf != null) {
                try {
                    raf.close();
                } catch (IOException suppressed) {
                    e.addSuppressed(suppressed);
                }
            }
            throw new IOException("failed to open file for write: " + path, e);
        }
        this.file = raf;
        if (!isValid()) {
            close();
            throw new IOException("failed to open file for write: " + path);
        }
    }

    public Path getPath() {
        return path;
    }

    /**
     * Writes {@code length} bytes at the current write position.
     *
     * @throws AlreadyClosedException if the file has been closed
     * @throws IOException if the write fails
     */
    public void write(byte[] b, int offset, int length) throws IOException {
        RandomAccessFile f = ensureOpen();
        long position = -1;
        try {
            position = f.getFilePointer();
            f.write(b, offset, length);
        } catch (IOException e) {
            throw new IOException("error writing file: " + path + " (position=" + position
                                  + ", length=" + length + ", valid=" + isValid() + ")", e);
        }
    }

    /**
     * Moves the write position. Positions past the end of the file are allowed; writing there extends the file.
     */
    public void setPosition(long position) throws IOException {
        RandomAccessFile f = ensureOpen();
        try {
            f.seek(position);
        } catch (IOException e) {
            throw new IOException("failed to seek file: " + path + " to " + position, e);
        }
    }

    public long getPosition() throws IOException {
        return ensureOpen().getFilePointer();
    }

    /**
     * @return the current on-disk size, read from the filesystem on every call
     */
    public long getLength() throws IOException {
        ensureOpen();
        return FileUtils.fileLength(path);
    }

    /**
     * Truncates or extends the file to {@code length} bytes. The write position is unchanged.
     */
    public void setLength(long length) throws IOException {
        ensureOpen();
        FileUtils.setFileLength(path, length);
    }

    /**
     * Hands written bytes to the operating system; with sync-on-flush, also forces them to the device.
     * {@link RandomAccessFile} does not buffer in the JVM, so without sync this only checks the handle.
     * A no-op once closed.
     */
    public void flush() throws IOException {
        if (file == null) {
            return;
        }
        if (syncOnFlush) {
            try {
                file.getChannel().force(false);
            } catch (IOException e) {
                throw new IOException("failed to sync file: " + path, e);
            }
        }
    }

    public boolean isValid() {
        if (file == null) {
            return false;
        }
        try {
            return file.getFD().valid();
        } catch (IOException e) {
            logger.warn("{} has no usable descriptor", path, e);
            return false;
        }
    }

    /**
     * Releases the handle. Later calls are no-ops.
     */
    @Override
    public void close() throws IOException {
        if (file == null) {
            return;
        }
        try {
            file.close();
        } finally {
            file = null;
        }
    }

    private RandomAccessFile ensureOpen() {
        RandomAccessFile f = file;
        if (f == null) {
            throw new AlreadyClosedException("file is closed: " + path);
        }
        return f;
    }

    @Override
    public String toString() {
        return "OutputFile(path=" + path + ")";
    }
}
