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

import io.github.jbellis.fsstore.util.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.zip.CRC32;

/**
 * A {@link BufferedIndexOutput} that owns one {@link OutputFile}.
 * <p>
 * Every buffer flush writes through to the file and flushes it, so bytes leave the JVM as soon as a
 * buffer fills rather than only at close. Outputs are never shared or cloned.
 */
public class SimpleFSIndexOutput extends BufferedIndexOutput {
    private static final Logger logger = LoggerFactory.getLogger(SimpleFSIndexOutput.class);

    private static final int CHECKSUM_CHUNK_SIZE = 8192;

    private final Path path;
    private final OutputFile file;
    private boolean isOpen;

    /**
     * Creates {@code path}, or truncates it if it exists.
     */
    public SimpleFSIndexOutput(Path path) throws IOException {
        this(path, BUFFER_SIZE, false);
    }

    /**
     * @param bufferSize size of the write buffer
     * @param syncOnFlush if true, each buffer flush also forces the data to the storage device
     */
    public SimpleFSIndexOutput(Path path, int bufferSize, boolean syncOnFlush) throws IOException {
        super("SimpleFSIndexOutput(path=\"" + path + "\")", bufferSize);
        this.path = path;
        this.file = new OutputFile(path, syncOnFlush);
        this.isOpen = true;
        logger.debug("Created {} (bufferSize={}, syncOnFlush={})", path, bufferSize, syncOnFlush);
    }

    @Override
    protected void flushBuffer(byte[] b, int offset, int length) throws IOException {
        file.write(b, offset, length);
        file.flush();
    }

    @Override
    protected void seekInternal(long position) throws IOException {
        file.setPosition(position);
    }

    @Override
    public long length() throws IOException {
        ensureOpen();
        return file.getLength();
    }

    /**
     * Flushes buffered bytes, then truncates or extends the file to {@code length} bytes.
     * The write position is unchanged.
     */
    @Override
    public void setLength(long length) throws IOException {
        flush();
        file.setLength(length);
    }

    /**
     * Flushes buffered bytes and computes the CRC32 of {@code [startOffset, endOffset)} as it is on disk.
     */
    @Override
    public long checksum(long startOffset, long endOffset) throws IOException {
        flush();
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("invalid range [" + startOffset + ", " + endOffset + ")");
        }

        var in = new InputFile(path);
        if (endOffset > in.getLength()) {
            throw new EOFException("checksum range [" + startOffset + ", " + endOffset + ") past EOF: " + this);
        }
        in.setPosition(startOffset);

        var crc = new CRC32();
        byte[] chunk = new byte[(int) Math.min(CHECKSUM_CHUNK_SIZE, endOffset - startOffset)];
        long remaining = endOffset - startOffset;
        while (remaining > 0) {
            ReadResult result = in.read(chunk, 0, (int) Math.min(chunk.length, remaining));
            switch (result.kind()) {
                case END_OF_FILE:
                    throw new EOFException("checksum range [" + startOffset + ", " + endOffset + ") past EOF: " + this);
                case ERROR:
                    throw new IOException("Failed to read back file: " + path, result.cause());
                default:
                    crc.update(chunk, 0, result.count());
                    remaining -= result.count();
            }
        }
        return crc.getValue();
    }

    public Path getPath() {
        return path;
    }

    public boolean isValid() {
        return isOpen && file.isValid();
    }

    @Override
    protected boolean isOpen() {
        return isOpen;
    }

    /**
     * Flushes remaining bytes and releases the file. The file is released even if the flush fails.
     * Closing twice is a no-op.
     */
    @Override
    public void close() throws IOException {
        if (!isOpen) {
            return;
        }
        Throwable failure = null;
        try {
            super.close();
        } catch (Throwable t) {
            failure = t;
        }
        try {
            file.close();
        } catch (Throwable t) {
            failure = ExceptionUtils.firstOrSuppressed(failure, t);
        }
        isOpen = false;
        if (failure != null) {
            ExceptionUtils.throwIoException(failure);
        }
        logger.debug("Closed {}", path);
    }
}
