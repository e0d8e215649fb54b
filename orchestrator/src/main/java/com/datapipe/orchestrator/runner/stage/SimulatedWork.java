package com.datapipe.orchestrator.runner.stage;

import java.time.Duration;

/**
 * Stand-in for the time real processing would take. Zero in tests.
 */
final class SimulatedWork {

    private SimulatedWork() {}

    static void pause(Duration delay) throws InterruptedException {
        if (delay != null && !delay.isZero() && !delay.isNegative()) {
            Thread.sleep(delay.toMillis());
        }
    }
}
