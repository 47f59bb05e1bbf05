package io.github.flock.metrics;

public interface MetricsCollector {

    void swimRoundCompleted();

    void gossipRoundCompleted();

    void probeFailed();

    void rumorsReceived(int count);

}
