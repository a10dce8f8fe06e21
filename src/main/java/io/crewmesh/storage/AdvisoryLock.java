package io.crewmesh.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive lock on a {@code .lock} file, shared by every thread and process on the host.
 *
 * <p>OS file locks are held per process, so threads of one JVM are serialized first through a
 * path-keyed {@link ReentrantLock}. Nested acquisition by the owning thread is allowed and only
 * the outermost hold touches the file lock.
 */
public final class AdvisoryLock implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AdvisoryLock.class);
    private static final ConcurrentMap<Path, ReentrantLock> LOCAL_LOCKS = new ConcurrentHashMap<>();
    private static final long RETRY_SLEEP_MS = 5L;

    private final Path lockFile;
    private final ReentrantLock localLock;
    private final FileChannel channel;
    private final FileLock fileLock;

    private AdvisoryLock(Path lockFile, ReentrantLock localLock, FileChannel channel, FileLock fileLock) {
        this.lockFile = lockFile;
        this.localLock = localLock;
        this.channel = channel;
        this.fileLock = fileLock;
    }

    public static AdvisoryLock acquire(Path lockFile, Duration timeout) {
        Path key = lockFile.toAbsolutePath().normalize();
        long deadline = System.nanoTime() + timeout.toNanos();
        ReentrantLock local = LOCAL_LOCKS.computeIfAbsent(key, k -> new ReentrantLock());
        try {
            if (!local.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new LockTimeoutException(key, timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockTimeoutException(key, timeout, e);
        }
        if (local.getHoldCount() > 1) {
            return new AdvisoryLock(key, local, null, null);
        }

        boolean acquired = false;
        FileChannel channel = null;
        try {
            Files.createDirectories(key.getParent());
            channel = FileChannel.open(key, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            while (true) {
                FileLock lock = channel.tryLock();
                if (lock != null) {
                    acquired = true;
                    return new AdvisoryLock(key, local, channel, lock);
                }
                if (System.nanoTime() >= deadline) {
                    throw new LockTimeoutException(key, timeout);
                }
                Thread.sleep(RETRY_SLEEP_MS);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to open lock file: " + key, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockTimeoutException(key, timeout, e);
        } finally {
            if (!acquired) {
                closeChannel(channel, key);
                local.unlock();
            }
        }
    }

    public Path lockFile() {
        return lockFile;
    }

    @Override
    public void close() {
        try {
            if (fileLock != null) {
                fileLock.release();
            }
        } catch (IOException e) {
            LOG.warn("Failed to release file lock {}", lockFile, e);
        } finally {
            closeChannel(channel, lockFile);
            localLock.unlock();
        }
    }

    private static void closeChannel(FileChannel channel, Path lockFile) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            LOG.warn("Failed to close lock channel {}", lockFile, e);
        }
    }
}
