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
import io.github.jbellis.fsstore.exceptions.PositionOutOfRangeException;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Base implementation for inputs that read through an in-memory buffer.
 * <p>
 * Subclasses supply {@link #readInternal}, which must transfer exactly the requested bytes starting at
 * {@link #getFilePointer()}, and {@link #seekInternal}. Reads of at least one buffer's worth bypass the
 * buffer. A seek that lands inside the buffered window costs no I/O.
 * <p>
 * Not thread-safe: use {@link #clone()} to give each thread its own cursor over the same file.
 */
public abstract class BufferedIndexInput implements RandomAccessReader, Cloneable {
    /**
     * Default buffer size, configurable via the fsstore.input_buffer_size system property
     */
    public static final int BUFFER_SIZE = Integer.getInteger("fsstore.input_buffer_size", 1024);

    private static final int SCRATCH_SIZE = 8192;

    private final String resourceDescription;
    private final int bufferSize;

    private byte[] buffer;
    // position in the file of buffer[0]
    private long bufferStart;
    // end of valid bytes in buffer
    private int bufferLength;
    // next byte to read
    private int bufferPosition;

    protected BufferedIndexInput(String resourceDescription, int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive: " + bufferSize);
        }
        this.resourceDescription = Objects.requireNonNull(resourceDescription);
        this.bufferSize = bufferSize;
    }

    /**
     * Reads {@code length} bytes into {@code b} starting at {@link #getFilePointer()}.
     * Must either transfer all the bytes or throw.
     */
    protected abstract void readInternal(byte[] b, int offset, int length) throws IOException;

    /**
     * Called when a seek moves outside the buffered window; {@code position} is where the next
     * {@link #readInternal} will start.
     */
    protected abstract void seekInternal(long position) throws IOException;

    /**
     * @return false once this instance has been closed
     */
    protected abstract boolean isOpen();

    public final int getBufferSize() {
        return bufferSize;
    }

    public byte readByte() throws IOException {
        ensureOpen();
        if (bufferPosition >= bufferLength) {
            refill();
        }
        return buffer[bufferPosition++];
    }

    public void readBytes(byte[] b, int offset, int length) throws IOException {
        readBytes(b, offset, length, true);
    }

    /**
     * Reads {@code length} bytes into {@code b}.
     *
     * @param useBuffer if false, a read that misses the buffer goes straight to {@link #readInternal}
     *                  even when it is smaller than the buffer, leaving the buffer empty
     * @throws EOFException if fewer than {@code length} bytes remain before {@link #length()}
     */
    public void readBytes(byte[] b, int offset, int length, boolean useBuffer) throws IOException {
        ensureOpen();
        Objects.checkFromIndexSize(offset, length, b.length);

        int available = bufferLength - bufferPosition;
        if (length <= available) {
            if (length > 0) {
                System.arraycopy(buffer, bufferPosition, b, offset, length);
            }
            bufferPosition += length;
            return;
        }

        if (available > 0) {
            System.arraycopy(buffer, bufferPosition, b, offset, available);
            offset += available;
            length -= available;
            bufferPosition += available;
        }

        if (useBuffer && length < bufferSize) {
            refill();
            if (bufferLength < length) {
                throw new EOFException("read past EOF: " + this);
            }
            System.arraycopy(buffer, 0, b, offset, length);
            bufferPosition = length;
        } else {
            long after = bufferStart + bufferPosition + length;
            if (after > length()) {
                throw new EOFException("read past EOF: " + this + " (position=" + getFilePointer()
                                       + ", requested=" + length + ", length=" + length() + ")");
            }
            readInternal(b, offset, length);
            bufferStart = after;
            bufferPosition = 0;
            bufferLength = 0;
        }
    }

    public short readShort() throws IOException {
        return (short) (((readByte() & 0xFF) << 8) | (readByte() & 0xFF));
    }

    @Override
    public int readInt() throws IOException {
        return ((readByte() & 0xFF) << 24) | ((readByte() & 0xFF) << 16)
               | ((readByte() & 0xFF) << 8) | (readByte() & 0xFF);
    }

    @Override
    public long readLong() throws IOException {
        return (((long) readInt()) << 32) | (readInt() & 0xFFFFFFFFL);
    }

    @Override
    public float readFloat() throws IOException {
        return Float.intBitsToFloat(readInt());
    }

    /**
     * Reads an int stored in variable-length format: one to five bytes, seven bits per byte,
     * low-order group first. Smaller values take fewer bytes.
     */
    public int readVInt() throws IOException {
        byte b = readByte();
        int i = b & 0x7F;
        for (int shift = 7; (b & 0x80) != 0; shift += 7) {
            if (shift > 28) {
                throw new IOException("invalid vInt: " + this);
            }
            b = readByte();
            i |= (b & 0x7F) << shift;
        }
        return i;
    }

    /**
     * Reads a long stored in variable-length format: one to nine bytes.
     */
    public long readVLong() throws IOException {
        byte b = readByte();
        long i = b & 0x7F;
        for (int shift = 7; (b & 0x80) != 0; shift += 7) {
            if (shift > 56) {
                throw new IOException("invalid vLong: " + this);
            }
            b = readByte();
            i |= (b & 0x7FL) << shift;
        }
        return i;
    }

    /**
     * Reads a string written by {@link BufferedIndexOutput#writeString}: a vInt byte count followed by UTF-8.
     */
    public String readString() throws IOException {
        int length = readVInt();
        byte[] bytes = new byte[length];
        readBytes(bytes, 0, length);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public void readFully(byte[] bytes) throws IOException {
        readBytes(bytes, 0, bytes.length);
    }

    @Override
    public void readFully(ByteBuffer buffer) throws IOException {
        if (buffer.hasArray()) {
            int length = buffer.remaining();
            readBytes(buffer.array(), buffer.arrayOffset() + buffer.position(), length);
            buffer.position(buffer.position() + length);
            return;
        }
        byte[] scratch = new byte[Math.min(buffer.remaining(), SCRATCH_SIZE)];
        while (buffer.hasRemaining()) {
            int n = Math.min(buffer.remaining(), scratch.length);
            readBytes(scratch, 0, n);
            buffer.put(scratch, 0, n);
        }
    }

    @Override
    public void readFully(long[] longs) throws IOException {
        for (int i = 0; i < longs.length; i++) {
            longs[i] = readLong();
        }
    }

    @Override
    public void read(int[] ints, int offset, int count) throws IOException {
        Objects.checkFromIndexSize(offset, count, ints.length);
        for (int i = 0; i < count; i++) {
            ints[offset + i] = readInt();
        }
    }

    @Override
    public void read(float[] floats, int offset, int count) throws IOException {
        Objects.checkFromIndexSize(offset, count, floats.length);
        for (int i = 0; i < count; i++) {
            floats[offset + i] = readFloat();
        }
    }

    private void refill() throws IOException {
        long start = bufferStart + bufferPosition;
        long end = Math.min(start + bufferSize, length());
        int newLength = (int) (end - start);
        if (newLength <= 0) {
            throw new EOFException("read past EOF: " + this);
        }

        if (buffer == null) {
            buffer = new byte[bufferSize];
        }
        readInternal(buffer, 0, newLength);
        bufferLength = newLength;
        bufferStart = start;
        bufferPosition = 0;
    }

    /**
     * @return the offset of the next byte to be read
     */
    public final long getFilePointer() {
        return bufferStart + bufferPosition;
    }

    @Override
    public long getPosition() {
        return getFilePointer();
    }

    /**
     * Sets the offset of the next read. Only moves a logical cursor; physical repositioning is left
     * to the next buffer fill.
     *
     * @throws PositionOutOfRangeException if {@code position} is outside {@code [0, length()]}
     */
    @Override
    public void seek(long position) throws IOException {
        ensureOpen();
        if (position < 0 || position > length()) {
            throw new PositionOutOfRangeException(toString(), position, length());
        }
        if (position >= bufferStart && position < bufferStart + bufferLength) {
            bufferPosition = (int) (position - bufferStart);
        } else {
            bufferStart = position;
            bufferPosition = 0;
            bufferLength = 0;
            seekInternal(position);
        }
    }

    /**
     * Returns an independent cursor over the same data, positioned where this one is.
     * The clone gets its own (initially empty) buffer; no I/O is performed.
     *
     * @throws AlreadyClosedException if this input is closed
     */
    @Override
    public BufferedIndexInput clone() {
        ensureOpen();
        BufferedIndexInput clone;
        try {
            clone = (BufferedIndexInput) super.clone();
        } catch (CloneNotSupportedException e) {
            throw new AssertionError(e);
        }
        clone.buffer = null;
        clone.bufferStart = getFilePointer();
        clone.bufferLength = 0;
        clone.bufferPosition = 0;
        return clone;
    }

    /**
     * Drops the buffer so a closed input holds no memory beyond the object itself.
     */
    protected final void releaseBuffer() {
        buffer = null;
        bufferStart += bufferPosition;
        bufferPosition = 0;
        bufferLength = 0;
    }

    protected final void ensureOpen() {
        if (!isOpen()) {
            throw new AlreadyClosedException("this IndexInput is closed: " + this);
        }
    }

    @Override
    public String toString() {
        return resourceDescription;
    }
}
