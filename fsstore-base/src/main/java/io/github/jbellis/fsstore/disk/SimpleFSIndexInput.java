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

import io.github.jbellis.fsstore.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.nio.file.Path;

/**
 * A {@link BufferedIndexInput} over an {@link InputFile}.
 * <p>
 * Buffer fills are served by the "fill loop": one or more physical reads of at most {@code chunkSize}
 * bytes each, repeated until the request is satisfied. Short physical reads are absorbed by the loop;
 * only a genuine end of file or I/O fault is reported, as {@link EOFException} or {@link IOException}.
 * <p>
 * Clones share the InputFile of the input they descend from. Each fill holds the InputFile's monitor
 * while it reconciles the shared position and reads, so clones may be used concurrently from
 * different threads. Closing a clone affects only that clone; closing the original does not
 * invalidate clones already made.
 */
public class SimpleFSIndexInput extends BufferedIndexInput {
    private static final Logger logger = LoggerFactory.getLogger(SimpleFSIndexInput.class);

    private final InputFile file;
    private final Path path;
    private final int chunkSize;
    private boolean isClone;
    private boolean closed;

    /**
     * @param path the file to read
     * @param bufferSize size of this input's buffer, also used by each clone
     * @param chunkSize maximum bytes requested from the file in one physical read
     * @throws java.io.FileNotFoundException if the file does not exist
     */
    public SimpleFSIndexInput(Path path, int bufferSize, int chunkSize) throws IOException {
        this(new InputFile(path), bufferSize, chunkSize);
    }

    @VisibleForTesting
    SimpleFSIndexInput(InputFile file, int bufferSize, int chunkSize) {
        super("SimpleFSIndexInput(path=\"" + file.getPath() + "\")", bufferSize);
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        this.file = file;
        this.path = file.getPath();
        this.chunkSize = chunkSize;
        this.isClone = false;
        logger.debug("Opened {} ({} bytes, bufferSize={}, chunkSize={})", path, file.getLength(), bufferSize, chunkSize);
    }

    @Override
    protected void readInternal(byte[] b, int offset, int length) throws IOException {
        synchronized (file) {
            long position = getFilePointer();
            if (position != file.getPosition()) {
                file.setPosition(position);
            }

            int total = 0;
            while (total < length) {
                int readLength = Math.min(length - total, chunkSize);
                ReadResult result = file.read(b, offset + total, readLength);
                switch (result.kind()) {
                    case END_OF_FILE:
                        throw new EOFException("read past EOF: " + this + " (position=" + (position + total)
                                               + ", remaining=" + (length - total) + ", length=" + length() + ")");
                    case ERROR:
                        throw new IOException("Failed to read from file: " + path, result.cause());
                    default:
                        if (logger.isTraceEnabled()) {
                            logger.trace("Read {} of {} bytes from {} at {}", result.count(), readLength, path, position + total);
                        }
                        total += result.count();
                }
            }
        }
    }

    @Override
    protected void seekInternal(long position) {
        // the shared file is repositioned lazily by readInternal
    }

    /**
     * @return the file size when the original input was opened
     */
    @Override
    public long length() {
        return file.getLength();
    }

    public Path getPath() {
        return path;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    /**
     * @return true if the underlying file can currently be opened at the shared position
     */
    public boolean isValid() {
        synchronized (file) {
            return file.isValid();
        }
    }

    @Override
    protected boolean isOpen() {
        return !closed;
    }

    @VisibleForTesting
    boolean isClone() {
        return isClone;
    }

    @VisibleForTesting
    InputFile getFile() {
        return file;
    }

    @Override
    public SimpleFSIndexInput clone() {
        SimpleFSIndexInput clone = (SimpleFSIndexInput) super.clone();
        clone.isClone = true;
        return clone;
    }

    /**
     * Closes this instance. Closing twice is a no-op.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        releaseBuffer();
        if (!isClone) {
            file.close();
            logger.debug("Closed {}", path);
        }
    }
}
