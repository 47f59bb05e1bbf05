package io.github.flock.transport;

import io.github.flock.protobuf.Member;
import io.github.flock.protobuf.Rumors;
import io.github.flock.protobuf.Swim;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

/**
 * Unreliable, asynchronous delivery of SWIM messages and rumor batches. Sending completes once the message is
 * handed over; delivery is never confirmed.
 */
public interface Transport extends Disposable {

    Mono<Endpoint> start(Receiver receiver);

    Mono<Void> send(Member recipient, Swim swim);

    Mono<Void> send(Member recipient, Rumors rumors);

}
