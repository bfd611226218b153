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

package io.github.jbellis.fsstore.util;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Path-level filesystem primitives used by the file handles: name resolution, existence, length.
 * These never cache; every call goes to the filesystem.
 */
public final class FileUtils {
    private FileUtils() {
    }

    /**
     * Resolves {@code name} against {@code baseDir}.
     */
    public static Path joinPath(Path baseDir, String name) {
        return baseDir.resolve(name);
    }

    /**
     * @return true if {@code path} names an existing regular file
     */
    public static boolean fileExists(Path path) {
        return Files.isRegularFile(path);
    }

    /**
     * @return the current on-disk size of {@code path} in bytes
     * @throws IOException if the size cannot be read
     */
    public static long fileLength(Path path) throws IOException {
        return Files.size(path);
    }

    /**
     * Truncates or extends {@code path} to exactly {@code length} bytes. Bytes added by extension read as zero.
     *
     * @throws IOException if the file cannot be opened for writing or resized
     */
    public static void setFileLength(Path path, long length) throws IOException {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative: " + length);
        }
        try (var raf = new RandomAccessFile(path.toFile(), "rw")) {
            raf.setLength(length);
        }
    }
}
