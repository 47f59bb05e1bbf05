package io.github.flock.metrics;

public class NoMetricsCollector implements MetricsCollector {

    @Override
    public void swimRoundCompleted() {
    }

    @Override
    public void gossipRoundCompleted() {
    }

    @Override
    public void probeFailed() {
    }

    @Override
    public void rumorsReceived(int count) {
    }
}
