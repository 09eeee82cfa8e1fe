package com.aigreentick.services.otprelay.repository;

import com.aigreentick.services.otprelay.exception.MappingLockTimeoutException;
import com.aigreentick.services.otprelay.exception.MappingStorageException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Two-level exclusive lock around every read-modify-write of the mappings file.
 *
 *   1. ReentrantLock   — serializes callers inside this JVM
 *   2. FileLock        — advisory lock on the "<file>.lock" sidecar, serializes
 *                        other processes running the same binary
 *
 * Both are acquired against one deadline. If either is not obtained in time,
 * {@link MappingLockTimeoutException} is thrown and nothing stays held.
 * Use with try-with-resources so the lock is released on every exit path.
 */
@Slf4j
public class MappingFileLock {

    private static final long POLL_INTERVAL_MS = 50L;

    private final Path lockFile;
    private final Duration timeout;
    private final ReentrantLock processLock = new ReentrantLock();

    public MappingFileLock(Path lockFile, Duration timeout) {
        this.lockFile = lockFile;
        this.timeout = timeout;
    }

    public Handle acquire() {
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            if (!processLock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new MappingLockTimeoutException("process lock for " + lockFile, timeout);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new MappingStorageException("Interrupted while waiting for " + lockFile, ex);
        }

        try {
            FileChannel channel = FileChannel.open(lockFile,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            try {
                FileLock fileLock = acquireFileLock(channel, deadline);
                return new Handle(channel, fileLock);
            } catch (IOException | RuntimeException ex) {
                closeQuietly(channel);
                throw ex;
            }
        } catch (IOException ex) {
            processLock.unlock();
            throw new MappingStorageException("Cannot open lock file " + lockFile, ex);
        } catch (RuntimeException ex) {
            processLock.unlock();
            throw ex;
        }
    }

    private FileLock acquireFileLock(FileChannel channel, long deadline) throws IOException {
        while (true) {
            FileLock fileLock;
            try {
                fileLock = channel.tryLock();
            } catch (OverlappingFileLockException ex) {
                // held through another channel in this JVM
                fileLock = null;
            }
            if (fileLock != null) {
                return fileLock;
            }
            if (System.nanoTime() >= deadline) {
                throw new MappingLockTimeoutException("file lock " + lockFile, timeout);
            }
            try {
                Thread.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new MappingStorageException("Interrupted while waiting for " + lockFile, ex);
            }
        }
    }

    private void closeQuietly(FileChannel channel) {
        try {
            channel.close();
        } catch (IOException ex) {
            log.warn("Failed to close lock channel {}: {}", lockFile, ex.getMessage());
        }
    }

    /**
     * Held lock. Closing releases the file lock, then the process lock.
     */
    public final class Handle implements AutoCloseable {

        private final FileChannel channel;
        private final FileLock fileLock;
        private boolean released;

        private Handle(FileChannel channel, FileLock fileLock) {
            this.channel = channel;
            this.fileLock = fileLock;
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            try {
                fileLock.release();
            } catch (IOException ex) {
                log.warn("Failed to release file lock {}: {}", lockFile, ex.getMessage());
            } finally {
                closeQuietly(channel);
                processLock.unlock();
            }
        }
    }
}
