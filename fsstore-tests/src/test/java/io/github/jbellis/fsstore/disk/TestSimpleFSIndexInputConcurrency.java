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
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 * Tests that clones of one SimpleFSIndexInput can be read concurrently from multiple threads.
 */
@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestSimpleFSIndexInputConcurrency extends RandomizedTest {
    private static final int FILE_SIZE = 256 * 1024;
    private static final int NUM_THREADS = 8;
    private static final int OPERATIONS_PER_THREAD = 500;

    private Path testDirectory;
    private Path testFilePath;
    private byte[] contents;

    @Before
    public void setUp() throws IOException {
        testDirectory = Files.createTempDirectory(this.getClass().getSimpleName());
        contents = DiskTestUtil.patternBytes(FILE_SIZE);
        testFilePath = DiskTestUtil.writeFile(testDirectory, "segment", contents);
    }

    @After
    public void tearDown() throws IOException {
        DiskTestUtil.deleteRecursively(testDirectory);
    }

    @Test
    public void testConcurrentCloneReads() throws Exception {
        int bufferSize = randomIntBetween(16, 4096);
        int chunkSize = randomIntBetween(1, 1024);
        long seed = getRandom().nextLong();
        var input = new SimpleFSIndexInput(testFilePath, bufferSize, chunkSize);

        ExecutorService executor = Executors.newFixedThreadPool(NUM_THREADS);
        CyclicBarrier barrier = new CyclicBarrier(NUM_THREADS);
        AtomicInteger mismatches = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < NUM_THREADS; t++) {
                SimpleFSIndexInput clone = input.clone();
                Random random = new Random(seed + t);
                futures.add(executor.submit(() -> {
                    barrier.await();
                    for (int i = 0; i < OPERATIONS_PER_THREAD; i++) {
                        int start = random.nextInt(FILE_SIZE);
                        int count = random.nextInt(Math.min(FILE_SIZE - start, 3 * bufferSize) + 1);
                        clone.seek(start);
                        byte[] actual = new byte[count];
                        clone.readBytes(actual, 0, count);
                        if (!Arrays.equals(Arrays.copyOfRange(contents, start, start + count), actual)) {
                            mismatches.incrementAndGet();
                        }
                        if (clone.getFilePointer() != start + count) {
                            mismatches.incrementAndGet();
                        }
                    }
                    clone.close();
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(1, TimeUnit.MINUTES));
        }

        assertEquals("Expected no corrupted reads", 0, mismatches.get());
        input.close();
    }

    @Test
    public void testSequentialScansOfOverlappingRanges() throws Exception {
        var input = new SimpleFSIndexInput(testFilePath, randomIntBetween(16, 1024), randomIntBetween(1, 512));
        input.seek(FILE_SIZE / 2);

        ExecutorService executor = Executors.newFixedThreadPool(NUM_THREADS);
        CyclicBarrier barrier = new CyclicBarrier(NUM_THREADS);
        List<Future<byte[]>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < NUM_THREADS; t++) {
                SimpleFSIndexInput clone = input.clone();
                int start = t * (FILE_SIZE / (2 * NUM_THREADS));
                futures.add(executor.submit(() -> {
                    clone.seek(start);
                    barrier.await();
                    byte[] scanned = new byte[FILE_SIZE / 2];
                    // byte-at-a-time forces one buffer fill per window
                    for (int i = 0; i < scanned.length; i++) {
                        scanned[i] = clone.readByte();
                    }
                    return scanned;
                }));
            }
            for (int t = 0; t < NUM_THREADS; t++) {
                int start = t * (FILE_SIZE / (2 * NUM_THREADS));
                assertArrayEquals(Arrays.copyOfRange(contents, start, start + FILE_SIZE / 2), futures.get(t).get());
            }
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(1, TimeUnit.MINUTES));
        }

        // the original kept its own position throughout
        assertEquals(FILE_SIZE / 2, input.getFilePointer());
        byte[] tail = new byte[FILE_SIZE / 2];
        input.readBytes(tail, 0, tail.length);
        assertArrayEquals(Arrays.copyOfRange(contents, FILE_SIZE / 2, FILE_SIZE), tail);
        input.close();
    }

    @Test
    public void testReaderSupplierPerThread() throws Exception {
        var directory = new SimpleFSDirectory(testDirectory);
        directory.setReadChunkSize(randomIntBetween(1, 4096));
        try (var supplier = directory.openReaderSupplier("segment")) {
            ExecutorService executor = Executors.newFixedThreadPool(NUM_THREADS);
            List<Future<Integer>> futures = new ArrayList<>();
            try {
                for (int t = 0; t < NUM_THREADS; t++) {
                    int offset = t * 4096;
                    futures.add(executor.submit(() -> {
                        try (var reader = supplier.get()) {
                            assertEquals(0, reader.getPosition());
                            reader.seek(offset);
                            byte[] bytes = new byte[4];
                            reader.readFully(bytes);
                            return ((bytes[0] & 0xFF) << 24) | ((bytes[1] & 0xFF) << 16) | ((bytes[2] & 0xFF) << 8) | (bytes[3] & 0xFF);
                        }
                    }));
                }
                for (int t = 0; t < NUM_THREADS; t++) {
                    int offset = t * 4096;
                    int expected = ((contents[offset] & 0xFF) << 24) | ((contents[offset + 1] & 0xFF) << 16)
                                   | ((contents[offset + 2] & 0xFF) << 8) | (contents[offset + 3] & 0xFF);
                    assertEquals(expected, (int) futures.get(t).get());
                }
            } finally {
                executor.shutdown();
                assertTrue(executor.awaitTermination(1, TimeUnit.MINUTES));
            }
        }
    }
}
