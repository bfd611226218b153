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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.carrotsearch.randomizedtesting.annotations.ThreadLeakScope;
import io.github.jbellis.fsstore.DiskTestUtil;
import io.github.jbellis.fsstore.exceptions.AlreadyClosedException;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.zip.CRC32;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestSimpleFSIndexOutput extends RandomizedTest {
    private Path testDirectory;

    @Before
    public void setUp() throws IOException {
        testDirectory = Files.createTempDirectory(this.getClass().getSimpleName());
    }

    @After
    public void tearDown() throws IOException {
        DiskTestUtil.deleteRecursively(testDirectory);
    }

    @Test
    public void testArbitraryWriteSizes() throws IOException {
        int bufferSize = randomIntBetween(1, 128);
        Path path = testDirectory.resolve("data");
        var expected = new ByteArrayOutputStream();
        try (var out = new SimpleFSIndexOutput(path, bufferSize, randomBoolean())) {
            for (int i = 0; i < 100; i++) {
                if (randomBoolean()) {
                    int b = randomIntBetween(0, 255);
                    out.writeByte(b);
                    expected.write(b);
                } else {
                    byte[] chunk = DiskTestUtil.randomBytes(getRandom(), randomIntBetween(0, 3 * bufferSize));
                    int offset = randomIntBetween(0, chunk.length);
                    int length = randomIntBetween(0, chunk.length - offset);
                    out.writeBytes(chunk, offset, length);
                    expected.write(chunk, offset, length);
                }
                assertEquals(expected.size(), out.getFilePointer());
            }
        }
        assertArrayEquals(expected.toByteArray(), Files.readAllBytes(path));
    }

    @Test
    public void testFullBufferIsWrittenThrough() throws IOException {
        Path path = testDirectory.resolve("data");
        try (var out = new SimpleFSIndexOutput(path, 16, false)) {
            out.write(new byte[10]);
            assertEquals(0, out.length());
            out.write(new byte[6]);
            // the buffer filled, so its contents are already in the file
            assertEquals(16, out.length());
            assertEquals(16, Files.size(path));
            out.write(new byte[3]);
            assertEquals(16, out.length());
            out.flush();
            assertEquals(19, out.length());
        }
    }

    @Test
    public void testSeekAndOverwrite() throws IOException {
        Path path = testDirectory.resolve("data");
        try (var out = new SimpleFSIndexOutput(path, 8, false)) {
            out.writeInt(0);
            out.write(DiskTestUtil.patternBytes(20));
            long end = out.getFilePointer();
            out.seek(0);
            out.writeInt((int) end);
            assertEquals(4, out.position());
            out.seek(end);
            out.writeByte(99);
        }

        try (var in = new SimpleFSIndexInput(path, 8, 8)) {
            assertEquals(24, in.readInt());
            byte[] body = new byte[20];
            in.readBytes(body, 0, 20);
            assertArrayEquals(DiskTestUtil.patternBytes(20), body);
            assertEquals(99, in.readByte());
        }
    }

    @Test
    public void testSetLengthThenWritePastOldEnd() throws IOException {
        Path path = testDirectory.resolve("data");
        byte[] head = DiskTestUtil.randomBytes(getRandom(), 10);
        try (var out = new SimpleFSIndexOutput(path, 64, false)) {
            out.write(head);
            out.setLength(100);
            assertEquals(100, out.length());
            out.setLength(4);
            assertEquals(4, out.length());

            out.seek(20);
            out.write(new byte[] {1, 2, 3, 4, 5});
        }

        byte[] actual = Files.readAllBytes(path);
        assertEquals(25, actual.length);
        assertArrayEquals(Arrays.copyOf(head, 4), Arrays.copyOf(actual, 4));
        for (int i = 4; i < 20; i++) {
            assertEquals(0, actual[i]);
        }
        assertArrayEquals(new byte[] {1, 2, 3, 4, 5}, Arrays.copyOfRange(actual, 20, 25));
    }

    @Test
    public void testChecksum() throws IOException {
        byte[] contents = DiskTestUtil.randomBytes(getRandom(), randomIntBetween(1, 20000));
        Path path = testDirectory.resolve("data");
        try (var out = new SimpleFSIndexOutput(path, randomIntBetween(1, 512), false)) {
            out.write(contents);
            int start = randomIntBetween(0, contents.length);
            int end = randomIntBetween(start, contents.length);

            var crc = new CRC32();
            crc.update(contents, start, end - start);
            assertEquals(crc.getValue(), out.checksum(start, end));
            assertEquals(0L, out.checksum(start, start));

            assertThrows(EOFException.class, () -> out.checksum(0, contents.length + 1));
            assertThrows(IllegalArgumentException.class, () -> out.checksum(end, start - 1));
        }
    }

    @Test
    public void testCloseTwiceAndUseAfterClose() throws IOException {
        Path path = testDirectory.resolve("data");
        var out = new SimpleFSIndexOutput(path, 32, false);
        out.writeLong(7L);
        assertTrue(out.isValid());
        out.close();
        out.close();
        assertFalse(out.isValid());

        assertThrows(AlreadyClosedException.class, () -> out.writeByte(1));
        assertThrows(AlreadyClosedException.class, () -> out.write(new byte[4], 0, 4));
        assertThrows(AlreadyClosedException.class, out::flush);
        assertThrows(AlreadyClosedException.class, () -> out.seek(0));
        assertThrows(AlreadyClosedException.class, out::length);
        assertThrows(AlreadyClosedException.class, () -> out.setLength(0));

        assertEquals(8, Files.size(path));
        try (var in = new SimpleFSIndexInput(path, 8, 8)) {
            assertEquals(7L, in.readLong());
        }
    }

    @Test
    public void testDataOutputEncodings() throws IOException {
        Path path = testDirectory.resolve("data");
        try (var out = new SimpleFSIndexOutput(path, randomIntBetween(1, 32), false)) {
            out.writeBoolean(true);
            out.writeChar('x');
            out.writeDouble(Math.PI);
            out.writeBytes("ab");
            out.writeChars("cd");
            out.writeUTF("héllo");
        }

        try (var in = new DataInputStream(new ByteArrayInputStream(Files.readAllBytes(path)))) {
            assertTrue(in.readBoolean());
            assertEquals('x', in.readChar());
            assertEquals(Math.PI, in.readDouble(), 0.0);
            assertEquals('a', in.readByte());
            assertEquals('b', in.readByte());
            assertEquals('c', in.readChar());
            assertEquals('d', in.readChar());
            assertEquals("héllo", in.readUTF());
            assertEquals(-1, in.read());
        }
    }

    @Test
    public void testCopyBytes() throws IOException {
        byte[] contents = DiskTestUtil.randomBytes(getRandom(), randomIntBetween(1, 50000));
        Path source = DiskTestUtil.writeFile(testDirectory, "source", contents);
        Path target = testDirectory.resolve("target");
        int from = randomIntBetween(0, contents.length);
        try (var in = new SimpleFSIndexInput(source, randomIntBetween(1, 256), randomIntBetween(1, 256));
             var out = new SimpleFSIndexOutput(target, randomIntBetween(1, 256), false)) {
            in.seek(from);
            out.copyBytes(in, contents.length - from);
            assertThrows(IllegalArgumentException.class, () -> out.copyBytes(in, -1));
        }
        assertArrayEquals(Arrays.copyOfRange(contents, from, contents.length), Files.readAllBytes(target));
    }

    @Test
    public void testNegativeVLongRejected() throws IOException {
        try (var out = new SimpleFSIndexOutput(testDirectory.resolve("data"), 8, false)) {
            assertThrows(IllegalArgumentException.class, () -> out.writeVLong(-1));
            assertThrows(IllegalArgumentException.class, () -> out.seek(-1));
        }
    }
}
