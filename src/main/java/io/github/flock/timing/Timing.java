package io.github.flock.timing;

import io.github.flock.FlockException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Protocol cadence. Deadlines are monotonic {@link System#nanoTime()} values, never wall clock.
 */
public class Timing {

    private Duration protocolPeriod;
    private Duration pingTimeout;
    private Duration pingReqTimeout;
    private Duration gossipPeriod;
    private int suspicionTimeoutPeriods;
    private LongSupplier nanoClock;

    public Duration protocolPeriod() {
        return protocolPeriod;
    }

    public Duration gossipPeriod() {
        return gossipPeriod;
    }

    public Duration pingReqTimeout() {
        return pingReqTimeout;
    }

    public int suspicionTimeoutPeriods() {
        return suspicionTimeoutPeriods;
    }

    /**
     * Direct ping timeout stretched by the local health multiplier, never leaving less than
     * {@link #pingReqTimeout()} of the protocol period for indirect probes.
     */
    public Duration pingTimeout(int localHealthMultiplier) {
        long stretched = pingTimeout.toMillis() * (localHealthMultiplier + 1);
        long limit = protocolPeriod.toMillis() - pingReqTimeout.toMillis();
        return Duration.ofMillis(Math.min(stretched, limit));
    }

    public long now() {
        return nanoClock.getAsLong();
    }

    public long nextProtocolPeriod() {
        return now() + protocolPeriod.toNanos();
    }

    public long nextGossipPeriod() {
        return now() + gossipPeriod.toNanos();
    }

    public boolean hasPassed(long deadline) {
        return now() - deadline >= 0;
    }

    /**
     * Completes once {@code deadline} has passed, immediately if it already has.
     */
    public Mono<Void> untilDeadline(long deadline) {
        return Mono.defer(() -> {
            long remaining = deadline - now();
            if (remaining <= 0) {
                return Mono.empty();
            }
            return Mono.delay(Duration.ofNanos(remaining)).then();
        });
    }

    public Mono<Void> protocolPeriodPassed() {
        return Mono.defer(() -> untilDeadline(nextProtocolPeriod()));
    }

    @Override
    public String toString() {
        return "Timing{" +
                "protocolPeriod=" + protocolPeriod +
                ", pingTimeout=" + pingTimeout +
                ", pingReqTimeout=" + pingReqTimeout +
                ", gossipPeriod=" + gossipPeriod +
                ", suspicionTimeoutPeriods=" + suspicionTimeoutPeriods +
                '}';
    }

    private Timing() {}

    public static Timing defaultTiming() {
        return builder().build();
    }

    public static Timing.Builder builder() {
        return new Timing.Builder();
    }

    public static class Builder {

        private Duration protocolPeriod = Duration.ofMillis(1000);
        private Duration pingTimeout = Duration.ofMillis(200);
        private Duration pingReqTimeout = Duration.ofMillis(500);
        private Duration gossipPeriod = Duration.ofMillis(250);
        private int suspicionTimeoutPeriods = 3;
        private LongSupplier nanoClock = System::nanoTime;

        private Builder() {
        }

        public Timing.Builder protocolPeriod(Duration protocolPeriod) {
            this.protocolPeriod = protocolPeriod;
            return this;
        }

        public Timing.Builder pingTimeout(Duration pingTimeout) {
            this.pingTimeout = pingTimeout;
            return this;
        }

        public Timing.Builder pingReqTimeout(Duration pingReqTimeout) {
            this.pingReqTimeout = pingReqTimeout;
            return this;
        }

        public Timing.Builder gossipPeriod(Duration gossipPeriod) {
            this.gossipPeriod = gossipPeriod;
            return this;
        }

        public Timing.Builder suspicionTimeoutPeriods(int suspicionTimeoutPeriods) {
            this.suspicionTimeoutPeriods = suspicionTimeoutPeriods;
            return this;
        }

        public Timing.Builder nanoClock(LongSupplier nanoClock) {
            this.nanoClock = nanoClock;
            return this;
        }

        public Timing build() {
            if (pingTimeout.plus(pingReqTimeout).compareTo(protocolPeriod) > 0) {
                throw new FlockException(String.format("Ping timeout %s and ping-req timeout %s must fit in protocol period %s!", pingTimeout, pingReqTimeout, protocolPeriod));
            }
            if (suspicionTimeoutPeriods < 1) {
                throw new FlockException("Suspicion timeout must be at least one protocol period!");
            }
            Timing timing = new Timing();
            timing.protocolPeriod = protocolPeriod;
            timing.pingTimeout = pingTimeout;
            timing.pingReqTimeout = pingReqTimeout;
            timing.gossipPeriod = gossipPeriod;
            timing.suspicionTimeoutPeriods = suspicionTimeoutPeriods;
            timing.nanoClock = nanoClock;
            return timing;
        }
    }
}
