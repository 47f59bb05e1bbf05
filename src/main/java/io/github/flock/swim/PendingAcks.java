package io.github.flock.swim;

import io.github.flock.protobuf.Ack;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoProcessor;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outstanding acks by sequence number. A waiter is registered before its ping is sent, so an early ack is never lost.
 */
class PendingAcks {

    private final AtomicLong sequence = new AtomicLong();
    private final Map<Long, MonoProcessor<Ack>> pending = new ConcurrentHashMap<>();

    long nextSequence() {
        return sequence.incrementAndGet();
    }

    /**
     * Registers a waiter for {@code seq} and returns a Mono completing with the ack, or erroring with
     * {@link java.util.concurrent.TimeoutException} after {@code timeout}.
     */
    Mono<Ack> await(long seq, Duration timeout) {
        MonoProcessor<Ack> processor = MonoProcessor.create();
        pending.put(seq, processor);
        return processor
                .timeout(timeout)
                .doFinally(signalType -> pending.remove(seq));
    }

    /**
     * @return true if somebody was waiting for this ack
     */
    boolean complete(Ack ack) {
        MonoProcessor<Ack> processor = pending.remove(ack.getSequence());
        if (processor == null) {
            return false;
        }
        processor.onNext(ack);
        return true;
    }

    int size() {
        return pending.size();
    }
}
