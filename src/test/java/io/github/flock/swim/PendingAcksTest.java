package io.github.flock.swim;

import io.github.flock.protobuf.Ack;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class PendingAcksTest {

    PendingAcks pendingAcks = new PendingAcks();

    @Test
    void ackBeforeSubscription() {
        // given
        long sequence = pendingAcks.nextSequence();
        Ack ack = Ack.newBuilder().setSequence(sequence).build();

        // when
        boolean completed = pendingAcks.complete(ack);

        // then
        assertThat(completed).isFalse();
    }

    @Test
    void ackCompletesWaiter() {
        // given
        long sequence = pendingAcks.nextSequence();
        Ack ack = Ack.newBuilder().setSequence(sequence).build();

        // when
        StepVerifier.create(pendingAcks.await(sequence, Duration.ofSeconds(1)))
                .then(() -> assertThat(pendingAcks.complete(ack)).isTrue())
                .expectNext(ack)
                .verifyComplete();

        // then
        assertThat(pendingAcks.size()).isZero();
    }

    @Test
    void ackArrivingBeforeSubscribeIsKept() {
        // given
        long sequence = pendingAcks.nextSequence();
        Ack ack = Ack.newBuilder().setSequence(sequence).build();
        Mono<Ack> waiter = pendingAcks.await(sequence, Duration.ofSeconds(1));

        // when
        pendingAcks.complete(ack);

        // then
        StepVerifier.create(waiter)
                .expectNext(ack)
                .verifyComplete();
    }

    @Test
    void timeout() {
        long sequence = pendingAcks.nextSequence();

        StepVerifier.create(pendingAcks.await(sequence, Duration.ofMillis(50)))
                .expectError(TimeoutException.class)
                .verify();

        assertThat(pendingAcks.size()).isZero();
    }

    @Test
    void sequencesAreUnique() {
        assertThat(pendingAcks.nextSequence()).isNotEqualTo(pendingAcks.nextSequence());
    }
}
