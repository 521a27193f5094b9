package org.calista.metatot.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * FileIO — единая точка файлового I/O для хранилищ движка.
 *
 * <p>Используется конфигом, журналом событий, JSONL-хранилищем трасс и
 * состоянием адаптивных порогов.</p>
 *
 * - атомарные записи (tmp + move) для файлов целиком
 * - append для JSONL с опциональной блокировкой файла
 * - безопасный resolve внутри baseDir (anti path traversal)
 */
public final class FileIO {

    private static final Logger log = LogManager.getLogger(FileIO.class);

    public static final class Options {
        public final Charset charset;
        public final boolean atomicWrites;
        public final boolean lockWrites;
        public final Duration lockTimeout;

        private Options(Builder b) {
            this.charset = b.charset;
            this.atomicWrites = b.atomicWrites;
            this.lockWrites = b.lockWrites;
            this.lockTimeout = b.lockTimeout;
        }

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private Charset charset = StandardCharsets.UTF_8;
            private boolean atomicWrites = true;
            private boolean lockWrites = false;
            private Duration lockTimeout = Duration.ofSeconds(3);

            public Builder charset(Charset v) {
                this.charset = Objects.requireNonNull(v);
                return this;
            }

            public Builder atomicWrites(boolean v) {
                this.atomicWrites = v;
                return this;
            }

            public Builder lockWrites(boolean v) {
                this.lockWrites = v;
                return this;
            }

            public Builder lockTimeout(Duration v) {
                this.lockTimeout = Objects.requireNonNull(v);
                if (v.isNegative() || v.isZero()) throw new IllegalArgumentException("lockTimeout must be > 0");
                return this;
            }

            public Options build() {
                return new Options(this);
            }
        }
    }

    /** Appends to one file are serialized inside the process; the OS lock only guards against other processes. */
    private static final ConcurrentHashMap<Path, Object> APPEND_MONITORS = new ConcurrentHashMap<>();

    private final Path baseDir;
    private final Options opt;

    public FileIO(Path baseDir) {
        this(baseDir, Options.builder().build());
    }

    public FileIO(Path baseDir, Charset charset, boolean atomicWrites) {
        this(baseDir, Options.builder()
                .charset(Objects.requireNonNull(charset, "charset"))
                .atomicWrites(atomicWrites)
                .build());
    }

    public FileIO(Path baseDir, Options options) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.opt = Objects.requireNonNull(options, "options");
        try {
            ensureBaseDir();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to ensure base directory exists: " + this.baseDir, e);
        }
        log.debug("FileIO init: baseDir={}, charset={}, atomicWrites={}, lockWrites={}, lockTimeout={}",
                this.baseDir, opt.charset, opt.atomicWrites, opt.lockWrites, opt.lockTimeout);
    }

    // ----------------------------
    // Base dir / Resolve
    // ----------------------------

    public Path baseDir() {
        return baseDir;
    }

    public void ensureBaseDir() throws IOException {
        Files.createDirectories(baseDir);
    }

    /**
     * Резолвит относительный путь внутри baseDir. Абсолютные пути и выход через ".." запрещены.
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        Path rel = Paths.get(relative.replace('\\', '/'));
        if (rel.isAbsolute()) throw new IllegalArgumentException("resolve(relative) does not accept absolute paths: " + relative);

        Path p = baseDir.resolve(rel).normalize().toAbsolutePath();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path traversal detected: " + relative);
        return p;
    }

    public void ensureParentDir(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    public boolean exists(Path file) {
        Objects.requireNonNull(file, "file");
        return Files.exists(file);
    }

    // ----------------------------
    // Whole-file text
    // ----------------------------

    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.readString(file, opt.charset);
    }

    public Optional<String> readStringIfExists(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) return Optional.empty();
        return Optional.of(readString(file));
    }

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        ensureParentDir(file);

        if (!opt.atomicWrites) {
            Files.writeString(file, content, opt.charset,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            return;
        }

        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.writeString(tmp, content, opt.charset,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    // ----------------------------
    // JSONL
    // ----------------------------

    public void appendJsonl(Path file, String jsonLine) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(jsonLine, "jsonLine");
        String s = jsonLine.trim();
        if (s.isEmpty()) return;
        if (s.indexOf('\n') >= 0) throw new IllegalArgumentException("JSONL record must be a single line");
        ensureParentDir(file);

        byte[] bytes = (s + System.lineSeparator()).getBytes(opt.charset);
        Object monitor = APPEND_MONITORS.computeIfAbsent(file.toAbsolutePath().normalize(), k -> new Object());
        synchronized (monitor) {
            if (!opt.lockWrites) {
                Files.write(file, bytes, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
                return;
            }
            withWriteLock(file, bytes);
        }
    }

    private void withWriteLock(Path file, byte[] bytes) throws IOException {
        long deadlineNs = System.nanoTime() + opt.lockTimeout.toNanos();
        try (FileChannel ch = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            while (true) {
                try {
                    FileLock lock = ch.tryLock();
                    if (lock != null) {
                        try (lock) {
                            ch.write(java.nio.ByteBuffer.wrap(bytes));
                            return;
                        }
                    }
                } catch (OverlappingFileLockException e) {
                    // region locked elsewhere in this JVM; retry until the deadline
                    log.trace("appendJsonl: lock held in-process for {}", file);
                }
                if (System.nanoTime() >= deadlineNs) throw new IOException("Write lock timeout for " + file);
                sleepQuiet(10);
            }
        }
    }

    private static void sleepQuiet(long ms) throws IOException {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for write lock", e);
        }
    }

    /**
     * Стрим непустых строк JSONL. ВАЖНО: stream надо закрыть (try-with-resources).
     * Отсутствующий файл даёт пустой стрим.
     */
    public Stream<String> jsonlStream(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) return Stream.empty();
        return Files.lines(file, opt.charset)
                .map(String::trim)
                .filter(s -> !s.isEmpty());
    }

    public List<String> readJsonl(Path file) throws IOException {
        try (Stream<String> s = jsonlStream(file)) {
            List<String> out = s.collect(Collectors.toList());
            log.debug("readJsonl: {} ({} records)", file, out.size());
            return out;
        }
    }
}
