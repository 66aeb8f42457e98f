package com.fcube.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;

/**
 * Advisory install lock: at most one real install runs against a project
 * at a time. Uses OS-level file locking via {@link FileLock} on
 * {@code <projectRoot>/.fcube-install.lock}. The file is truncated on release but
 * never deleted, so every waiter locks the same inode.
 */
@Slf4j
public class InstallLock {

    public static final String LOCK_FILENAME = ".fcube-install.lock";

    private static final long DEFAULT_TIMEOUT_MS = 5000;
    private static final long DEFAULT_POLL_INTERVAL_MS = 100;

    private InstallLock() {
    }

    /**
     * Handle to a held install lock. Call {@link #release()} (or close) when done.
     */
    public static class LockHandle implements Closeable {
        private final Path lockPath;
        private final FileChannel channel;
        private final FileLock lock;
        private volatile boolean released = false;

        LockHandle(Path lockPath, FileChannel channel, FileLock lock) {
            this.lockPath = lockPath;
            this.channel = channel;
            this.lock = lock;
        }

        public Path getLockPath() {
            return lockPath;
        }

        public void release() {
            if (released)
                return;
            released = true;
            try {
                channel.truncate(0);
            } catch (IOException e) {
                log.debug("Failed to clear lock file: {}", e.getMessage());
            }
            try {
                lock.release();
            } catch (IOException e) {
                log.debug("Failed to release install lock: {}", e.getMessage());
            }
            try {
                channel.close();
            } catch (IOException e) {
                log.debug("Failed to close lock channel: {}", e.getMessage());
            }
        }

        @Override
        public void close() {
            release();
        }
    }

    /**
     * Thrown when the install lock cannot be acquired.
     */
    public static class InstallLockException extends RuntimeException {
        public InstallLockException(String message) {
            super(message);
        }

        public InstallLockException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static Path resolveLockPath(Path projectRoot) {
        return projectRoot.resolve(LOCK_FILENAME);
    }

    public static LockHandle acquire(Path projectRoot) {
        return acquire(projectRoot, DEFAULT_TIMEOUT_MS, DEFAULT_POLL_INTERVAL_MS);
    }

    /**
     * Acquire the lock, polling until {@code timeoutMs} elapses.
     *
     * @throws InstallLockException if another install holds the lock past the timeout
     */
    public static LockHandle acquire(Path projectRoot, long timeoutMs, long pollIntervalMs) {
        Path lockPath = resolveLockPath(projectRoot);
        if (!Files.isDirectory(projectRoot)) {
            throw new InstallLockException("Project root does not exist: " + projectRoot);
        }

        long startedAt = System.currentTimeMillis();

        do {
            FileChannel channel = null;
            try {
                channel = FileChannel.open(lockPath,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.WRITE);

                FileLock lock = tryLock(channel);
                if (lock != null) {
                    String payload = String.format(
                            "{\"pid\":%d,\"createdAt\":\"%s\"}",
                            ProcessHandle.current().pid(),
                            Instant.now().toString());
                    channel.truncate(0);
                    channel.write(ByteBuffer.wrap(payload.getBytes(StandardCharsets.UTF_8)));
                    channel.force(true);

                    log.debug("Acquired install lock: {}", lockPath);
                    return new LockHandle(lockPath, channel, lock);
                }

                // Held by another process or another handle in this JVM
                channel.close();
            } catch (IOException e) {
                log.debug("Lock attempt failed: {}", e.getMessage());
                closeQuietly(channel);
            }

            try {
                Thread.sleep(pollIntervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InstallLockException("Interrupted while waiting for install lock", e);
            }
        } while (System.currentTimeMillis() - startedAt < timeoutMs);

        throw new InstallLockException(String.format(
                "Another install is running in this project (lock %s held for more than %d ms)",
                lockPath, timeoutMs));
    }

    private static FileLock tryLock(FileChannel channel) throws IOException {
        try {
            return channel.tryLock();
        } catch (OverlappingFileLockException e) {
            return null;
        }
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null)
            return;
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Failed to close lock channel: {}", e.getMessage());
        }
    }
}
