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

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Base implementation for outputs that write through an in-memory buffer.
 * <p>
 * The buffer is handed to {@link #flushBuffer} whenever it fills, and on {@link #flush()},
 * {@link #seek(long)} and {@link #close()}. Writes larger than the buffer go straight to
 * {@link #flushBuffer}. Multi-byte values are big-endian, as specified by {@link java.io.DataOutput}.
 * <p>
 * Not thread-safe.
 */
public abstract class BufferedIndexOutput implements RandomAccessWriter {
    /**
     * Default buffer size, configurable via the fsstore.output_buffer_size system property
     */
    public static final int BUFFER_SIZE = Integer.getInteger("fsstore.output_buffer_size", 16384);

    private static final int COPY_BUFFER_SIZE = 16384;

    private final String resourceDescription;
    private final int bufferSize;
    private final byte[] buffer;
    // position in the file of buffer[0]
    private long bufferStart;
    // next free slot in buffer
    private int bufferPosition;

    protected BufferedIndexOutput(String resourceDescription, int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive: " + bufferSize);
        }
        this.resourceDescription = Objects.requireNonNull(resourceDescription);
        this.bufferSize = bufferSize;
        this.buffer = new byte[bufferSize];
    }

    /**
     * Writes {@code length} bytes to the underlying storage at its current position.
     */
    protected abstract void flushBuffer(byte[] b, int offset, int length) throws IOException;

    /**
     * Repositions the underlying storage; called by {@link #seek(long)} after buffered bytes are flushed.
     */
    protected abstract void seekInternal(long position) throws IOException;

    /**
     * @return false once this instance has been closed
     */
    protected abstract boolean isOpen();

    /**
     * @return the current size of the underlying file; bytes still in the buffer are not counted
     */
    public abstract long length() throws IOException;

    /**
     * Truncates or extends the underlying file.
     */
    public abstract void setLength(long length) throws IOException;

    public final int getBufferSize() {
        return bufferSize;
    }

    @Override
    public void write(int b) throws IOException {
        ensureOpen();
        if (bufferPosition >= bufferSize) {
            flushInternal();
        }
        buffer[bufferPosition++] = (byte) b;
    }

    @Override
    public void write(byte[] b) throws IOException {
        write(b, 0, b.length);
    }

    @Override
    public void write(byte[] b, int offset, int length) throws IOException {
        ensureOpen();
        Objects.checkFromIndexSize(offset, length, b.length);

        int bytesLeft = bufferSize - bufferPosition;
        if (bytesLeft >= length) {
            System.arraycopy(b, offset, buffer, bufferPosition, length);
            bufferPosition += length;
            if (bufferPosition == bufferSize) {
                flushInternal();
            }
        } else if (length > bufferSize) {
            flushInternal();
            flushBuffer(b, offset, length);
            bufferStart += length;
        } else {
            int pos = 0;
            while (pos < length) {
                int pieceLength = Math.min(length - pos, bytesLeft);
                System.arraycopy(b, offset + pos, buffer, bufferPosition, pieceLength);
                pos += pieceLength;
                bufferPosition += pieceLength;
                bytesLeft = bufferSize - bufferPosition;
                if (bytesLeft == 0) {
                    flushInternal();
                    bytesLeft = bufferSize;
                }
            }
        }
    }

    public void writeBytes(byte[] b, int offset, int length) throws IOException {
        write(b, offset, length);
    }

    @Override
    public void writeBoolean(boolean v) throws IOException {
        write(v ? 1 : 0);
    }

    @Override
    public void writeByte(int v) throws IOException {
        write(v);
    }

    @Override
    public void writeShort(int v) throws IOException {
        write((v >>> 8) & 0xFF);
        write(v & 0xFF);
    }

    @Override
    public void writeChar(int v) throws IOException {
        writeShort(v);
    }

    @Override
    public void writeInt(int v) throws IOException {
        write((v >>> 24) & 0xFF);
        write((v >>> 16) & 0xFF);
        write((v >>> 8) & 0xFF);
        write(v & 0xFF);
    }

    @Override
    public void writeLong(long v) throws IOException {
        writeInt((int) (v >>> 32));
        writeInt((int) v);
    }

    @Override
    public void writeFloat(float v) throws IOException {
        writeInt(Float.floatToIntBits(v));
    }

    @Override
    public void writeDouble(double v) throws IOException {
        writeLong(Double.doubleToLongBits(v));
    }

    @Override
    public void writeBytes(String s) throws IOException {
        for (int i = 0; i < s.length(); i++) {
            write((byte) s.charAt(i));
        }
    }

    @Override
    public void writeChars(String s) throws IOException {
        for (int i = 0; i < s.length(); i++) {
            writeChar(s.charAt(i));
        }
    }

    @Override
    public void writeUTF(String s) throws IOException {
        var bytes = new ByteArrayOutputStream(s.length() + 2);
        new DataOutputStream(bytes).writeUTF(s);
        write(bytes.toByteArray());
    }

    /**
     * Writes an int in variable-length format: seven bits per byte, low-order group first.
     * Negative values always take five bytes.
     */
    public void writeVInt(int i) throws IOException {
        while ((i & ~0x7F) != 0) {
            write((i & 0x7F) | 0x80);
            i >>>= 7;
        }
        write(i);
    }

    /**
     * Writes a non-negative long in variable-length format.
     */
    public void writeVLong(long i) throws IOException {
        if (i < 0) {
            throw new IllegalArgumentException("cannot write negative vLong: " + i);
        }
        while ((i & ~0x7FL) != 0L) {
            write((int) ((i & 0x7FL) | 0x80L));
            i >>>= 7;
        }
        write((int) i);
    }

    /**
     * Writes a vInt byte count followed by the UTF-8 bytes of {@code s}.
     */
    public void writeString(String s) throws IOException {
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        writeVInt(bytes.length);
        write(bytes, 0, bytes.length);
    }

    /**
     * Copies {@code numBytes} bytes from the current position of {@code input}.
     */
    public void copyBytes(BufferedIndexInput input, long numBytes) throws IOException {
        if (numBytes < 0) {
            throw new IllegalArgumentException("numBytes must be non-negative: " + numBytes);
        }
        byte[] copyBuffer = new byte[(int) Math.min(numBytes, COPY_BUFFER_SIZE)];
        long left = numBytes;
        while (left > 0) {
            int toCopy = (int) Math.min(left, copyBuffer.length);
            input.readBytes(copyBuffer, 0, toCopy);
            write(copyBuffer, 0, toCopy);
            left -= toCopy;
        }
    }

    /**
     * Writes any buffered bytes through to the underlying storage.
     */
    @Override
    public void flush() throws IOException {
        ensureOpen();
        flushInternal();
    }

    private void flushInternal() throws IOException {
        if (bufferPosition > 0) {
            flushBuffer(buffer, 0, bufferPosition);
            bufferStart += bufferPosition;
            bufferPosition = 0;
        }
    }

    /**
     * @return the offset at which the next byte will be written
     */
    public final long getFilePointer() {
        return bufferStart + bufferPosition;
    }

    @Override
    public long position() {
        return getFilePointer();
    }

    /**
     * Flushes buffered bytes at their old position, then moves the write position.
     */
    @Override
    public void seek(long position) throws IOException {
        ensureOpen();
        if (position < 0) {
            throw new IllegalArgumentException("position must be non-negative: " + position);
        }
        flushInternal();
        bufferStart = position;
        seekInternal(position);
    }

    /**
     * Flushes buffered bytes. Subclasses release their resources after calling this.
     */
    @Override
    public void close() throws IOException {
        flushInternal();
    }

    protected final void ensureOpen() {
        if (!isOpen()) {
            throw new AlreadyClosedException("this IndexOutput is closed: " + this);
        }
    }

    @Override
    public String toString() {
        return resourceDescription;
    }
}
