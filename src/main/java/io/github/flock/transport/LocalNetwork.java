package io.github.flock.transport;

import io.github.flock.FlockException;
import io.github.flock.protobuf.Member;
import io.github.flock.protobuf.Rumors;
import io.github.flock.protobuf.Swim;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * In-process network. Every message is handed to the recipient on the network's scheduler, never on the
 * sender's thread, so nodes only share immutable protobuf messages.
 */
public class LocalNetwork implements Disposable {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalNetwork.class);

    static final String LOCAL_ADDRESS = "local";

    private final Map<Integer, LocalTransport> transports = new ConcurrentHashMap<>();
    private final AtomicInteger ports = new AtomicInteger(10000);
    private final Scheduler scheduler = Schedulers.newParallel("local-network", 4, true);

    public Transport transport() {
        return new LocalTransport();
    }

    public int size() {
        return transports.size();
    }

    @Override
    public void dispose() {
        transports.clear();
        scheduler.dispose();
    }

    @Override
    public boolean isDisposed() {
        return scheduler.isDisposed();
    }

    private Mono<Void> deliver(Member recipient, String type, Consumer<Receiver> delivery) {
        return Mono.fromRunnable(() -> {
            LocalTransport transport = transports.get(recipient.getSwimPort());
            if (transport == null || !LOCAL_ADDRESS.equals(recipient.getAddress())) {
                throw new FlockException(String.format("Member %s is unreachable [%s:%s]", recipient.getId(), recipient.getAddress(), recipient.getSwimPort()));
            }
            scheduler.schedule(() -> {
                try {
                    delivery.accept(transport.receiver);
                } catch (Exception e) {
                    LOGGER.warn("[{}] Delivery to {} failed", type, recipient.getId(), e);
                }
            });
        });
    }

    private class LocalTransport implements Transport {

        private volatile Receiver receiver;
        private volatile int port;

        @Override
        public Mono<Endpoint> start(Receiver receiver) {
            return Mono.fromCallable(() -> {
                this.receiver = receiver;
                this.port = ports.incrementAndGet();
                transports.put(port, this);
                return new Endpoint(LOCAL_ADDRESS, port, port);
            });
        }

        @Override
        public Mono<Void> send(Member recipient, Swim swim) {
            return deliver(recipient, "swim", r -> r.onSwim(swim));
        }

        @Override
        public Mono<Void> send(Member recipient, Rumors rumors) {
            return deliver(recipient, "gossip", r -> r.onRumors(rumors));
        }

        @Override
        public void dispose() {
            transports.remove(port, this);
        }

        @Override
        public boolean isDisposed() {
            return !transports.containsKey(port);
        }
    }
}
