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

/**
 * Provides the file access layer of the index store: buffered, seekable readers and writers
 * over files in a filesystem directory.
 *
 * <h2>Layers</h2>
 *
 * <h3>Raw file handles</h3>
 * <ul>
 *   <li>{@link io.github.jbellis.fsstore.disk.InputFile} - Unbuffered reader bound to a path. Opens the
 *       file for each physical read, so it holds no descriptor between calls. Reports end of file and
 *       I/O faults as {@link io.github.jbellis.fsstore.disk.ReadResult} values instead of exceptions.</li>
 *   <li>{@link io.github.jbellis.fsstore.disk.OutputFile} - Unbuffered writer holding one open file from
 *       creation until close. Fails loudly on every fault.</li>
 * </ul>
 *
 * <h3>Buffered streams</h3>
 * <ul>
 *   <li>{@link io.github.jbellis.fsstore.disk.BufferedIndexInput} /
 *       {@link io.github.jbellis.fsstore.disk.SimpleFSIndexInput} - Buffered
 *       {@link io.github.jbellis.fsstore.disk.RandomAccessReader}. Buffer fills run a loop of physical reads
 *       no larger than the configured chunk size. Inputs can be cloned into independent cursors that share
 *       one {@code InputFile}.</li>
 *   <li>{@link io.github.jbellis.fsstore.disk.BufferedIndexOutput} /
 *       {@link io.github.jbellis.fsstore.disk.SimpleFSIndexOutput} - Buffered
 *       {@link io.github.jbellis.fsstore.disk.RandomAccessWriter}. Every buffer flush is written through
 *       to the file.</li>
 * </ul>
 *
 * <h3>Entry points</h3>
 * <ul>
 *   <li>{@link io.github.jbellis.fsstore.disk.SimpleFSDirectory} - Resolves file names against a
 *       directory and applies buffer and chunk size settings.</li>
 *   <li>{@link io.github.jbellis.fsstore.disk.ReaderSupplier} - Hands out per-thread readers;
 *       {@link io.github.jbellis.fsstore.disk.SimpleFSReaderSupplier} does so by cloning.</li>
 * </ul>
 *
 * <h2>Usage Pattern</h2>
 * <pre>{@code
 * SimpleFSDirectory dir = new SimpleFSDirectory(path);
 * try (var out = dir.createOutput("postings")) {
 *     out.writeVInt(docCount);
 *     out.writeString(field);
 * }
 *
 * try (var in = dir.openInput("postings")) {
 *     int docCount = in.readVInt();
 *     var other = in.clone();   // hand to another thread
 *     other.seek(offset);
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <ul>
 *   <li>A single input or output instance is <b>not thread-safe</b>.</li>
 *   <li>Clones of an input may be used from different threads at the same time; physical reads on
 *       the shared {@code InputFile} are serialized on its monitor.</li>
 *   <li>Only one output may write a given file at a time. This layer does not enforce it.</li>
 * </ul>
 */
package io.github.jbellis.fsstore.disk;
