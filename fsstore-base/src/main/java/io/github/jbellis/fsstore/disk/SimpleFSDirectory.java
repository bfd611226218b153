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
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Maps file names in one filesystem directory to {@link SimpleFSIndexInput}s and {@link SimpleFSIndexOutput}s,
 * and carries the I/O tunables applied to the streams it opens.
 * <p>
 * Locking between writers, listing and deleting files are left to the caller.
 */
public class SimpleFSDirectory implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(SimpleFSDirectory.class);

    /**
     * Default maximum bytes per physical read, configurable via the fsstore.read_chunk_size system property.
     * Kept well below the size at which some platforms stop servicing a read in one call.
     */
    public static final int DEFAULT_READ_CHUNK_SIZE = Integer.getInteger("fsstore.read_chunk_size", 8192);

    /**
     * Whether outputs force data to the device on every flush, configurable via the fsstore.sync_on_flush system property
     */
    private static final boolean DEFAULT_SYNC_ON_FLUSH = Boolean.getBoolean("fsstore.sync_on_flush");

    private final Path directory;
    private volatile int chunkSize = DEFAULT_READ_CHUNK_SIZE;
    private volatile boolean syncOnFlush = DEFAULT_SYNC_ON_FLUSH;
    private volatile boolean isOpen = true;

    /**
     * @param directory an existing directory
     * @throws FileNotFoundException if {@code directory} is not an existing directory
     */
    public SimpleFSDirectory(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new FileNotFoundException("directory does not exist: " + directory);
        }
        this.directory = directory;
        logger.debug("Opened directory {} (readChunkSize={}, syncOnFlush={})", directory, chunkSize, syncOnFlush);
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * Opens {@code name} for reading with the default buffer size.
     */
    public SimpleFSIndexInput openInput(String name) throws IOException {
        return openInput(name, BufferedIndexInput.BUFFER_SIZE);
    }

    /**
     * Opens {@code name} for reading.
     *
     * @throws FileNotFoundException if the file does not exist
     */
    public SimpleFSIndexInput openInput(String name, int bufferSize) throws IOException {
        ensureOpen();
        return new SimpleFSIndexInput(FileUtils.joinPath(directory, name), bufferSize, chunkSize);
    }

    /**
     * Opens {@code name} and returns a supplier of independent readers over it.
     */
    public ReaderSupplier openReaderSupplier(String name) throws IOException {
        return new SimpleFSReaderSupplier(openInput(name));
    }

    /**
     * Creates {@code name}, truncating any existing file, with the default buffer size.
     */
    public SimpleFSIndexOutput createOutput(String name) throws IOException {
        return createOutput(name, BufferedIndexOutput.BUFFER_SIZE);
    }

    public SimpleFSIndexOutput createOutput(String name, int bufferSize) throws IOException {
        ensureOpen();
        return new SimpleFSIndexOutput(FileUtils.joinPath(directory, name), bufferSize, syncOnFlush);
    }

    public boolean fileExists(String name) {
        ensureOpen();
        return FileUtils.fileExists(FileUtils.joinPath(directory, name));
    }

    public long fileLength(String name) throws IOException {
        ensureOpen();
        return FileUtils.fileLength(FileUtils.joinPath(directory, name));
    }

    /**
     * Sets the maximum number of bytes read from a file in one physical read.
     * Inputs already open keep the value they were opened with.
     */
    public void setReadChunkSize(int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        this.chunkSize = chunkSize;
    }

    public int getReadChunkSize() {
        return chunkSize;
    }

    /**
     * Applies to outputs created afterwards.
     */
    public void setSyncOnFlush(boolean syncOnFlush) {
        this.syncOnFlush = syncOnFlush;
    }

    public boolean isSyncOnFlush() {
        return syncOnFlush;
    }

    /**
     * Prevents further opens. Streams already handed out stay usable.
     */
    @Override
    public void close() {
        isOpen = false;
    }

    private void ensureOpen() {
        if (!isOpen) {
            throw new AlreadyClosedException("this Directory is closed: " + this);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "@" + directory;
    }
}
