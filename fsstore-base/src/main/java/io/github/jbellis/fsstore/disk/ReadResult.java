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

import java.util.Objects;

/**
 * Outcome of a single physical read on an {@link InputFile}: a byte count, end of file, or an error.
 * <p>
 * Short reads are routine, so the raw handle reports these as values and leaves it to the
 * buffered layer to decide which outcomes are failures.
 */
public final class ReadResult {
    public enum Kind {
        BYTES,
        END_OF_FILE,
        ERROR
    }

    private static final ReadResult END_OF_FILE = new ReadResult(Kind.END_OF_FILE, 0, null);

    private final Kind kind;
    private final int count;
    private final Throwable cause;

    private ReadResult(Kind kind, int count, Throwable cause) {
        this.kind = kind;
        this.count = count;
        this.cause = cause;
    }

    /**
     * @param count number of bytes transferred, zero only for an empty request
     */
    public static ReadResult bytes(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("byte count must be non-negative: " + count);
        }
        return new ReadResult(Kind.BYTES, count, null);
    }

    public static ReadResult endOfFile() {
        return END_OF_FILE;
    }

    /**
     * @param cause the fault that prevented the read, may be null if none was raised
     */
    public static ReadResult error(Throwable cause) {
        return new ReadResult(Kind.ERROR, 0, cause);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return the number of bytes transferred; zero unless {@link #kind()} is {@link Kind#BYTES}
     */
    public int count() {
        return count;
    }

    /**
     * @return the fault behind an {@link Kind#ERROR} result, or null
     */
    public Throwable cause() {
        return cause;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReadResult)) return false;
        ReadResult that = (ReadResult) o;
        return count == that.count && kind == that.kind && Objects.equals(cause, that.cause);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, count, cause);
    }

    @Override
    public String toString() {
        switch (kind) {
            case BYTES:
                return "ReadResult{bytes=" + count + "}";
            case END_OF_FILE:
                return "ReadResult{EOF}";
            default:
                return "ReadResult{error=" + cause + "}";
        }
    }
}
