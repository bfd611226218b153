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

import io.github.jbellis.fsstore.exceptions.PositionOutOfRangeException;
import io.github.jbellis.fsstore.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Unbuffered read handle bound to one file path.
 * <p>
 * No file descriptor is held between calls: every {@link #read} opens the file, reads at the
 * current position and closes it again, so any number of readers can share one InputFile
 * without consuming descriptors. The length is a snapshot taken at construction.
 * <p>
 * The position is mutable shared state. Callers that share an InputFile across threads must hold
 * its monitor while they reposition and read, as {@link SimpleFSIndexInput} does.
 */
public class InputFile implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(InputFile.class);

    private final Path path;
    private final long length;
    private long position;

    /**
     * @param path the file to read
     * @throws FileNotFoundException if {@code path} does not exist
     * @throws IOException if the file size cannot be read
     */
    public InputFile(Path path) throws IOException {
        this.path = path;
        if (!FileUtils.fileExists(path)) {
            throw new FileNotFoundException(path.toString());
        }
        this.length = FileUtils.fileLength(path);
        this.position = 0;
    }

    public Path getPath() {
        return path;
    }

    /**
     * @return the file size at the time this handle was created
     */
    public long getLength() {
        return length;
    }

    public long getPosition() {
        return position;
    }

    /**
     * Sets the offset of the next read.
     *
     * @throws PositionOutOfRangeException if {@code position} is negative or past {@link #getLength()}
     */
    public void setPosition(long position) throws PositionOutOfRangeException {
        if (position < 0 || position > length) {
            throw new PositionOutOfRangeException(path.toString(), position, length);
        }
        this.position = position;
    }

    /**
     * Reads up to {@code length} bytes at the current position into {@code b}. A single call may
     * transfer fewer bytes than requested; the position advances by the count transferred.
     * Never throws for I/O faults: they are reported as {@link ReadResult.Kind#ERROR}.
     *
     * @return the number of bytes read, {@link ReadResult#endOfFile()} if the position is at or past
     *         the end of the data currently on disk, or an error result
     */
    public ReadResult read(byte[] b, int offset, int length) {
        Objects.checkFromIndexSize(offset, length, b.length);
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            if (position >= channel.size()) {
                return ReadResult.endOfFile();
            }
            if (length == 0) {
                return ReadResult.bytes(0);
            }
            int count = channel.read(ByteBuffer.wrap(b, offset, length), position);
            if (count <= 0) {
                return ReadResult.endOfFile();
            }
            position += count;
            return ReadResult.bytes(count);
        } catch (IOException e) {
            return ReadResult.error(e);
        }
    }

    /**
     * Checks that the file can currently be opened and positioned at {@link #getPosition()}.
     * A health probe only; reads report their own failures.
     */
    public boolean isValid() {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            channel.position(position);
            return true;
        } catch (IOException e) {
            logger.warn("{} cannot be opened at position {}: {}", path, position, e.toString());
            return false;
        }
    }

    @Override
    public void close() {
        // no descriptor is held between reads
    }

    @Override
    public String toString() {
        return "InputFile(path=" + path + ", length=" + length + ", position=" + position + ")";
    }
}
