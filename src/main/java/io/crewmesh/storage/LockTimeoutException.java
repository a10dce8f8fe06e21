package io.crewmesh.storage;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Advisory lock not acquired within its bound. Transient: callers retry on their next cycle.
 */
public final class LockTimeoutException extends RuntimeException {
    private final Path lockFile;

    public LockTimeoutException(Path lockFile, Duration timeout) {
        super("Timed out after " + timeout.toMillis() + "ms waiting for lock: " + lockFile);
        this.lockFile = lockFile;
    }

    public LockTimeoutException(Path lockFile, Duration timeout, Throwable cause) {
        super("Interrupted after " + timeout.toMillis() + "ms budget waiting for lock: " + lockFile, cause);
        this.lockFile = lockFile;
    }

    public Path lockFile() {
        return lockFile;
    }
}
