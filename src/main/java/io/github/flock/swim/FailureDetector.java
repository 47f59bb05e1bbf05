package io.github.flock.swim;

import io.github.flock.member.Blacklist;
import io.github.flock.member.Health;
import io.github.flock.member.MemberEntry;
import io.github.flock.member.MemberList;
import io.github.flock.metrics.MetricsCollector;
import io.github.flock.metrics.NoMetricsCollector;
import io.github.flock.protobuf.Ack;
import io.github.flock.protobuf.Member;
import io.github.flock.protobuf.Ping;
import io.github.flock.protobuf.PingReq;
import io.github.flock.protobuf.Swim;
import io.github.flock.timing.Timing;
import io.github.flock.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * SWIM failure detector. One call to {@link #protocolPeriod()} probes one member directly, falls back to
 * indirect probes through proxies, escalates suspicions and waits out the rest of the period.
 */
public class FailureDetector {

    private static final Logger LOGGER = LoggerFactory.getLogger(FailureDetector.class);

    private String nodeName;
    private MemberList memberList;
    private Memberships memberships;
    private Blacklist blacklist;
    private Transport transport;
    private Timing timing;
    private int pingReqProxies;
    private MetricsCollector metrics;
    private ProbeTargets probeTargets;
    private final PendingAcks pendingAcks = new PendingAcks();
    private final Map<String, Suspicion> suspicions = new ConcurrentHashMap<>();
    private final AtomicLong rounds = new AtomicLong();

    public Mono<Void> protocolPeriod() {
        return Mono.defer(() -> {
            long deadline = timing.nextProtocolPeriod();
            Mono<Void> probe = memberships.hasDeparted() ? Mono.empty() : probeAndEscalate();
            return probe
                    .then(timing.untilDeadline(deadline))
                    .doOnSuccess(done -> {
                        rounds.incrementAndGet();
                        metrics.swimRoundCompleted();
                    });
        });
    }

    private Mono<Void> probeAndEscalate() {
        return probeTargets.next()
                .map(target -> probe(target).doOnNext(this::probeCompleted).then())
                .orElseGet(() -> {
                    LOGGER.trace("[Node {}][ping] Nobody to probe", nodeName);
                    return Mono.empty();
                })
                .then(Mono.fromRunnable(this::escalateSuspicions));
    }

    public long rounds() {
        return rounds.get();
    }

    int localHealthMultiplier() {
        return memberships.localHealth().multiplier();
    }

    Mono<ProbeResult> probe(MemberEntry target) {
        Member targetMember = target.getMember();
        Duration pingTimeout = timing.pingTimeout(localHealthMultiplier());
        return ping(targetMember, pingTimeout)
                .map(ack -> ProbeResult.direct(target))
                .onErrorResume(throwable -> {
                    LOGGER.debug("[Node {}][ping] Direct probe to {} failed. Reason {}.", nodeName, target.getMemberId(), throwable.toString());
                    return pingReq(target)
                            .map(ack -> ProbeResult.indirect(target))
                            .onErrorResume(t -> {
                                LOGGER.debug("[Node {}][ping-req] Indirect probe to {} failed. Reason {}.", nodeName, target.getMemberId(), t.toString());
                                return Mono.just(ProbeResult.failed(target));
                            });
                });
    }

    void probeCompleted(ProbeResult probeResult) {
        String targetId = probeResult.getTarget().getMemberId();
        if (probeResult.hasAck()) {
            memberships.localHealth().probeSucceeded();
            LOGGER.trace("[Node {}][ping] Probing {} successful.", nodeName, targetId);
            return;
        }
        memberships.localHealth().probeFailed();
        metrics.probeFailed();
        memberList.get(targetId)
                .filter(current -> current.getHealth() == Health.ALIVE)
                .ifPresent(current -> {
                    LOGGER.info("[Node {}][ping] No ack from {}, suspecting it", nodeName, targetId);
                    memberships.suspect(current);
                });
    }

    /**
     * Counts one more period for every suspect and confirms those suspected for long enough.
     */
    void escalateSuspicions() {
        suspicions.keySet().removeIf(memberId -> !memberList.healthOf(memberId).map(health -> health == Health.SUSPECT).orElse(false));
        memberList.peers()
                .filter(memberEntry -> memberEntry.getHealth() == Health.SUSPECT)
                .forEach(memberEntry -> {
                    Suspicion suspicion = suspicions.compute(memberEntry.getMemberId(), (id, current) ->
                            current == null || current.incarnation != memberEntry.getIncarnation()
                                    ? new Suspicion(memberEntry.getIncarnation(), 1)
                                    : new Suspicion(current.incarnation, current.periods + 1));
                    if (suspicion.periods > timing.suspicionTimeoutPeriods()) {
                        LOGGER.info("[Node {}] Member {} suspected for {} periods, confirming", nodeName, memberEntry.getMemberId(), timing.suspicionTimeoutPeriods());
                        suspicions.remove(memberEntry.getMemberId());
                        memberships.confirm(memberEntry);
                    }
                });
    }

    public void onSwim(Swim swim) {
        switch (swim.getType()) {
            case PING:
                onPing(swim.getPing());
                break;
            case ACK:
                onAck(swim.getAck());
                break;
            case PINGREQ:
                onPingReq(swim.getPingreq());
                break;
            default:
                LOGGER.warn("[Node {}] Unknown SWIM message type {}", nodeName, swim.getType());
        }
    }

    void onPing(Ping ping) {
        Member from = ping.getFrom();
        if (rejects(from) || (ping.hasForwardTo() && rejects(ping.getForwardTo()))) {
            return;
        }
        memberships.applyAll(ping.getMembershipList());
        memberships.alive(from);
        Ack.Builder ack = Ack.newBuilder()
                .setFrom(memberships.self())
                .setSequence(ping.getSequence())
                .addAllMembership(memberships.piggyback(from.getId()));
        if (ping.hasForwardTo()) {
            ack.setForwardTo(ping.getForwardTo());
        }
        send(from, Swim.newBuilder().setType(Swim.Type.ACK).setAck(ack).build()).subscribe();
    }

    void onAck(Ack ack) {
        Member from = ack.getFrom();
        if (rejects(from)) {
            return;
        }
        memberships.applyAll(ack.getMembershipList());
        if (ack.hasForwardTo() && !memberList.isSelf(ack.getForwardTo().getId())) {
            Member origin = ack.getForwardTo();
            LOGGER.trace("[Node {}][ping-req] Forwarding ack from {} to {}", nodeName, from.getId(), origin.getId());
            send(origin, Swim.newBuilder().setType(Swim.Type.ACK).setAck(ack).build()).subscribe();
            return;
        }
        memberships.alive(from);
        if (!pendingAcks.complete(ack)) {
            LOGGER.trace("[Node {}][ping] Late ack {} from {}", nodeName, ack.getSequence(), from.getId());
        }
    }

    void onPingReq(PingReq pingReq) {
        Member from = pingReq.getFrom();
        if (rejects(from)) {
            return;
        }
        memberships.applyAll(pingReq.getMembershipList());
        memberships.alive(from);
        Ping ping = Ping.newBuilder()
                .setFrom(memberships.self())
                .setForwardTo(from)
                .setSequence(pingReq.getSequence())
                .addAllMembership(memberships.piggyback(pingReq.getTarget().getId()))
                .build();
        send(pingReq.getTarget(), Swim.newBuilder().setType(Swim.Type.PING).setPing(ping).build()).subscribe();
    }

    private Mono<Ack> ping(Member target, Duration timeout) {
        return Mono.defer(() -> {
            long sequence = pendingAcks.nextSequence();
            Mono<Ack> ack = pendingAcks.await(sequence, timeout);
            Ping ping = Ping.newBuilder()
                    .setFrom(memberships.self())
                    .setSequence(sequence)
                    .addAllMembership(memberships.piggyback(target.getId()))
                    .build();
            return send(target, Swim.newBuilder().setType(Swim.Type.PING).setPing(ping).build()).then(ack);
        });
    }

    private Mono<Ack> pingReq(MemberEntry target) {
        return Mono.defer(() -> {
            List<MemberEntry> proxies = probeTargets.proxies(target.getMemberId(), pingReqProxies);
            if (proxies.isEmpty()) {
                return Mono.error(new NoProxiesException(target.getMemberId()));
            }
            long sequence = pendingAcks.nextSequence();
            Mono<Ack> ack = pendingAcks.await(sequence, timing.pingReqTimeout());
            PingReq pingReq = PingReq.newBuilder()
                    .setFrom(memberships.self())
                    .setTarget(target.getMember())
                    .setSequence(sequence)
                    .addAllMembership(memberships.piggyback())
                    .build();
            Swim swim = Swim.newBuilder().setType(Swim.Type.PINGREQ).setPingreq(pingReq).build();
            return Flux.fromIterable(proxies)
                    .flatMap(proxy -> send(proxy.getMember(), swim))
                    .then(ack);
        });
    }

    /**
     * Transport failures are logged and left to the ack timeout.
     */
    private Mono<Void> send(Member recipient, Swim swim) {
        if (blacklist.contains(recipient.getId())) {
            LOGGER.trace("[Node {}][{}] Not sending to blacklisted member {}", nodeName, swim.getType(), recipient.getId());
            return Mono.empty();
        }
        return transport.send(recipient, swim)
                .onErrorResume(throwable -> {
                    LOGGER.debug("[Node {}][{}] Sending to {} failed. Reason {}.", nodeName, swim.getType(), recipient.getId(), throwable.getMessage());
                    return Mono.empty();
                });
    }

    private boolean rejects(Member sender) {
        if (blacklist.contains(sender.getId())) {
            LOGGER.trace("[Node {}] Dropping message from blacklisted member {}", nodeName, sender.getId());
            return true;
        }
        return false;
    }

    Optional<Suspicion> suspicion(String memberId) {
        return Optional.ofNullable(suspicions.get(memberId));
    }

    static final class Suspicion {

        private final long incarnation;
        private final int periods;

        Suspicion(long incarnation, int periods) {
            this.incarnation = incarnation;
            this.periods = periods;
        }

        int getPeriods() {
            return periods;
        }
    }

    static final class NoProxiesException extends RuntimeException {

        NoProxiesException(String targetId) {
            super("No proxies available to probe " + targetId);
        }
    }

    private FailureDetector() {}

    public static FailureDetector.Builder builder() {
        return new FailureDetector.Builder();
    }

    public static class Builder {

        private String nodeName;
        private MemberList memberList;
        private Memberships memberships;
        private Blacklist blacklist;
        private Transport transport;
        private Timing timing = Timing.defaultTiming();
        private int pingReqProxies = 3;
        private MetricsCollector metrics = new NoMetricsCollector();

        private Builder() {
        }

        public FailureDetector.Builder nodeName(String nodeName) {
            this.nodeName = nodeName;
            return this;
        }

        public FailureDetector.Builder memberList(MemberList memberList) {
            this.memberList = memberList;
            return this;
        }

        public FailureDetector.Builder memberships(Memberships memberships) {
            this.memberships = memberships;
            return this;
        }

        public FailureDetector.Builder blacklist(Blacklist blacklist) {
            this.blacklist = blacklist;
            return this;
        }

        public FailureDetector.Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        public FailureDetector.Builder timing(Timing timing) {
            this.timing = timing;
            return this;
        }

        public FailureDetector.Builder pingReqProxies(int pingReqProxies) {
            this.pingReqProxies = pingReqProxies;
            return this;
        }

        public FailureDetector.Builder metrics(MetricsCollector metrics) {
            this.metrics = metrics;
            return this;
        }

        public FailureDetector build() {
            FailureDetector failureDetector = new FailureDetector();
            failureDetector.nodeName = nodeName;
            failureDetector.memberList = memberList;
            failureDetector.memberships = memberships;
            failureDetector.blacklist = blacklist;
            failureDetector.transport = transport;
            failureDetector.timing = timing;
            failureDetector.pingReqProxies = pingReqProxies;
            failureDetector.metrics = metrics;
            failureDetector.probeTargets = new ProbeTargets(memberList, blacklist);
            return failureDetector;
        }
    }
}
