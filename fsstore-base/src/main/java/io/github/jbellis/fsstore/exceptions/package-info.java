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
 * Provides custom exception types used by the fsstore file access layer.
 *
 * <h2>Exception Types</h2>
 * <ul>
 *   <li>{@link io.github.jbellis.fsstore.exceptions.AlreadyClosedException} - An unchecked
 *       exception thrown when a stream, handle or directory is used after {@code close()}.
 *       Using a closed object is a programming error, so it is not declared.</li>
 *   <li>{@link io.github.jbellis.fsstore.exceptions.PositionOutOfRangeException} - An
 *       {@link java.io.IOException} thrown when a read position falls outside {@code [0, length]}.</li>
 * </ul>
 *
 * <h2>Standard Exceptions</h2>
 * <p>
 * The remaining failure modes use the JDK types callers already handle:
 * <ul>
 *   <li>{@link java.io.FileNotFoundException} when a file to be read does not exist</li>
 *   <li>{@link java.io.EOFException} when a read asks for bytes past the end of the file</li>
 *   <li>{@link java.io.IOException} for any other open, seek, read or write fault, always naming the path</li>
 * </ul>
 *
 * <h2>Exception Handling Example</h2>
 * <pre>{@code
 * try (var in = directory.openInput("segments_1")) {
 *     in.seek(offset);
 *     int count = in.readVInt();
 * } catch (FileNotFoundException e) {
 *     // no such segment; treat as an empty index
 * } catch (EOFException e) {
 *     // truncated or corrupt file
 * }
 * }</pre>
 */
package io.github.jbellis.fsstore.exceptions;
