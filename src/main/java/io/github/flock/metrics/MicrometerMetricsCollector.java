package io.github.flock.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

public class MicrometerMetricsCollector implements MetricsCollector {

    private final Counter swimRounds;
    private final Counter gossipRounds;
    private final Counter probeFailures;
    private final Counter rumorsReceived;

    public MicrometerMetricsCollector(MeterRegistry registry, String nodeName) {
        swimRounds = registry.counter("flock.swim.rounds", "node", nodeName);
        gossipRounds = registry.counter("flock.gossip.rounds", "node", nodeName);
        probeFailures = registry.counter("flock.swim.probe.failures", "node", nodeName);
        rumorsReceived = registry.counter("flock.gossip.rumors.received", "node", nodeName);
    }

    @Override
    public void swimRoundCompleted() {
        swimRounds.increment();
    }

    @Override
    public void gossipRoundCompleted() {
        gossipRounds.increment();
    }

    @Override
    public void probeFailed() {
        probeFailures.increment();
    }

    @Override
    public void rumorsReceived(int count) {
        rumorsReceived.increment(count);
    }
}
