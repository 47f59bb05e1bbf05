package io.github.flock.swim;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lifeguard local health of this node. A missed ack or having to refute a suspicion about itself hints that this
 * node is the slow one, so the multiplier grows and stretches its ping timeouts; every acked probe shrinks it.
 */
class LocalHealth {

    private final int maxMultiplier;
    private final AtomicInteger multiplier = new AtomicInteger();

    LocalHealth(int maxMultiplier) {
        this.maxMultiplier = maxMultiplier;
    }

    void probeSucceeded() {
        multiplier.updateAndGet(n -> Math.max(n - 1, 0));
    }

    void probeFailed() {
        worsen();
    }

    void refuted() {
        worsen();
    }

    int multiplier() {
        return multiplier.get();
    }

    private void worsen() {
        multiplier.updateAndGet(n -> Math.min(n + 1, maxMultiplier));
    }
}
