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

package io.github.jbellis.fsstore.exceptions;

import java.io.IOException;

/**
 * Thrown when a read position is set outside {@code [0, length]} of the file it addresses.
 */
public class PositionOutOfRangeException extends IOException {
    private final long position;
    private final long length;

    public PositionOutOfRangeException(String resource, long position, long length) {
        super("position " + position + " out of range [0, " + length + "]: " + resource);
        this.position = position;
        this.length = length;
    }

    /** @return the rejected position */
    public long getPosition() {
        return position;
    }

    /** @return the length of the file the position was checked against */
    public long getLength() {
        return length;
    }
}
