package org.calista.metatot.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class FileIOTest {

    @TempDir
    Path dir;

    @Test
    void testResolve_RejectsTraversalAndAbsolute() {
        FileIO io = new FileIO(dir);

        assertThrows(IllegalArgumentException.class, () -> io.resolve("../outside.json"));
        assertThrows(IllegalArgumentException.class, () -> io.resolve(dir.toAbsolutePath().toString()));
        assertEquals(io.baseDir().resolve("a/b.json"), io.resolve("a/b.json"));
    }

    @Test
    void testWriteString_AtomicReplaceCreatesParents() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = io.resolve("nested/state.json");

        io.writeString(file, "one");
        io.writeString(file, "two");

        assertEquals("two", io.readString(file));
        assertFalse(Files.exists(file.resolveSibling("state.json.tmp")));
    }

    @Test
    void testAppendJsonl_SkipsBlankAndRejectsMultiline() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = io.resolve("log.jsonl");

        io.appendJsonl(file, "{\"a\":1}");
        io.appendJsonl(file, "   ");
        io.appendJsonl(file, "{\"a\":2}");

        assertEquals(List.of("{\"a\":1}", "{\"a\":2}"), io.readJsonl(file));
        assertThrows(IllegalArgumentException.class, () -> io.appendJsonl(file, "{\n}"));
        assertTrue(io.readJsonl(io.resolve("missing.jsonl")).isEmpty());
        assertTrue(io.readStringIfExists(io.resolve("missing.json")).isEmpty());
    }

    @Test
    void testAppendJsonl_ConcurrentLockedWritersKeepEveryLine() throws Exception {
        // Given
        FileIO.Options opts = FileIO.Options.builder().lockWrites(true).lockTimeout(Duration.ofSeconds(10)).build();
        FileIO first = new FileIO(dir, opts);
        FileIO second = new FileIO(dir, opts);
        Path file = first.resolve("events.jsonl");
        int threads = 8;
        int perThread = 25;

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            // When
            for (int t = 0; t < threads; t++) {
                int id = t;
                FileIO io = (t % 2 == 0) ? first : second;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) io.appendJsonl(file, "{\"t\":" + id + ",\"i\":" + i + "}");
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        // Then
        List<String> lines = first.readJsonl(file);
        assertEquals(threads * perThread, lines.size());
        assertEquals(threads * perThread, new HashSet<>(lines).size());
        assertTrue(lines.stream().allMatch(l -> l.startsWith("{\"t\":") && l.endsWith("}")));
    }

    @Test
    void testAppendJsonl_HeldLockTimesOutAsIOException() throws Exception {
        // Given
        FileIO io = new FileIO(dir, FileIO.Options.builder()
                .lockWrites(true)
                .lockTimeout(Duration.ofMillis(50))
                .build());
        Path file = io.resolve("busy.jsonl");
        Files.createFile(file);

        // When / Then
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.WRITE);
             FileLock held = ch.lock()) {
            IOException e = assertThrows(IOException.class, () -> io.appendJsonl(file, "{\"a\":1}"));
            assertTrue(e.getMessage().contains("lock timeout"));
            assertTrue(held.isValid());
        }
        io.appendJsonl(file, "{\"a\":2}");
        assertEquals(List.of("{\"a\":2}"), io.readJsonl(file));
    }

    @Test
    void testOptions_UnlockedPlainWritesAndRejectsZeroTimeout() throws Exception {
        FileIO io = new FileIO(dir, FileIO.Options.builder().atomicWrites(false).lockWrites(false).build());
        Path file = io.resolve("plain.json");

        io.writeString(file, "x");
        io.appendJsonl(io.resolve("plain.jsonl"), "{}");

        assertEquals("x", io.readString(file));
        assertEquals(List.of("{}"), io.readJsonl(io.resolve("plain.jsonl")));
        assertThrows(IllegalArgumentException.class, () -> FileIO.Options.builder().lockTimeout(Duration.ZERO));
    }
}
