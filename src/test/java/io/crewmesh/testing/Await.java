package io.crewmesh.testing;

import java.time.Duration;
import java.util.function.BooleanSupplier;

public final class Await {
    private Await() {
    }

    /**
     * Polls {@code condition} until it holds or {@code timeout} passes.
     */
    public static boolean until(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(10L);
        }
        return condition.getAsBoolean();
    }
}
