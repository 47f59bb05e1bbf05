package io.github.flock.gossip;

import io.github.flock.FlockException;
import io.github.flock.election.ElectionEngine;
import io.github.flock.member.Blacklist;
import io.github.flock.member.MemberEntry;
import io.github.flock.member.MemberList;
import io.github.flock.metrics.MetricsCollector;
import io.github.flock.metrics.NoMetricsCollector;
import io.github.flock.protobuf.Rumor;
import io.github.flock.protobuf.Rumors;
import io.github.flock.rumor.RumorHeat;
import io.github.flock.rumor.RumorKind;
import io.github.flock.rumor.RumorStore;
import io.github.flock.service.Services;
import io.github.flock.swim.Memberships;
import io.github.flock.timing.Timing;
import io.github.flock.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Push gossip. Every gossip period the hot rumors are sent to {@code fanout} random live peers; a rumor cools
 * down once it has been pushed in enough rounds.
 */
public class GossipDisseminator {

    private static final Logger LOGGER = LoggerFactory.getLogger(GossipDisseminator.class);

    private String nodeName;
    private MemberList memberList;
    private Memberships memberships;
    private Blacklist blacklist;
    private RumorStore rumorStore;
    private Services services;
    private ElectionEngine electionEngine;
    private Transport transport;
    private Timing timing;
    private int fanout;
    private int maxRumors;
    private RumorHeat rumorHeat;
    private MetricsCollector metrics;
    private final AtomicLong rounds = new AtomicLong();

    public Mono<Void> gossipPeriod() {
        return Mono.defer(() -> {
            long deadline = timing.nextGossipPeriod();
            return gossipRound()
                    .then(timing.untilDeadline(deadline))
                    .doOnSuccess(done -> {
                        rounds.incrementAndGet();
                        metrics.gossipRoundCompleted();
                    });
        });
    }

    public long rounds() {
        return rounds.get();
    }

    Mono<Void> gossipRound() {
        return Mono.defer(() -> {
            List<MemberEntry> targets = targets();
            List<Rumor> hot = rumorStore.hot(rumorHeat.maxHeat(memberList.size()), maxRumors);
            if (targets.isEmpty() || hot.isEmpty()) {
                electionEngine.tick();
                return Mono.empty();
            }
            Rumors rumors = Rumors.newBuilder()
                    .setFromId(memberList.self().getMemberId())
                    .addAllRumors(hot)
                    .build();
            LOGGER.trace("[Node {}][gossip] Sending {} rumors to {}", nodeName, hot.size(), targets);
            return Flux.fromIterable(targets)
                    .flatMap(target -> send(target, rumors))
                    .then(Mono.fromRunnable(() -> {
                        rumorStore.markSent(hot);
                        electionEngine.tick();
                    }));
        });
    }

    public void onRumors(Rumors rumors) {
        if (blacklist.contains(rumors.getFromId())) {
            LOGGER.trace("[Node {}][gossip] Dropping rumors from blacklisted member {}", nodeName, rumors.getFromId());
            return;
        }
        metrics.rumorsReceived(rumors.getRumorsCount());
        rumors.getRumorsList().forEach(rumor -> {
            try {
                onRumor(rumor);
            } catch (FlockException e) {
                LOGGER.warn("[Node {}][gossip] Invalid rumor from {}. Reason {}.", nodeName, rumors.getFromId(), e.getMessage());
            }
        });
    }

    private void onRumor(Rumor rumor) {
        RumorKind kind = RumorKind.of(rumor);
        switch (kind) {
            case MEMBER:
                memberships.apply(rumor.getMember());
                break;
            case SERVICE:
                services.merge(rumor);
                break;
            case ELECTION:
                electionEngine.merge(rumor);
                break;
            default:
                throw new FlockException("Unsupported rumor kind " + kind);
        }
    }

    private List<MemberEntry> targets() {
        List<MemberEntry> candidates = memberList.peers()
                .filter(memberEntry -> memberEntry.getHealth().isAvailable())
                .filter(memberEntry -> blacklist.allows(memberEntry.getMemberId()))
                .collect(Collectors.toList());
        Collections.shuffle(candidates);
        return candidates.stream().limit(fanout).collect(Collectors.toList());
    }

    private Mono<Void> send(MemberEntry target, Rumors rumors) {
        return transport.send(target.getMember(), rumors)
                .onErrorResume(throwable -> {
                    LOGGER.debug("[Node {}][gossip] Sending rumors to {} failed. Reason {}.", nodeName, target.getMemberId(), throwable.getMessage());
                    return Mono.empty();
                });
    }

    private GossipDisseminator() {}

    public static GossipDisseminator.Builder builder() {
        return new GossipDisseminator.Builder();
    }

    public static class Builder {

        private String nodeName;
        private MemberList memberList;
        private Memberships memberships;
        private Blacklist blacklist;
        private RumorStore rumorStore;
        private Services services;
        private ElectionEngine electionEngine;
        private Transport transport;
        private Timing timing = Timing.defaultTiming();
        private int fanout = 3;
        private int maxRumors = 100;
        private RumorHeat rumorHeat = RumorHeat.scaled(1.5f);
        private MetricsCollector metrics = new NoMetricsCollector();

        private Builder() {
        }

        public GossipDisseminator.Builder nodeName(String nodeName) {
            this.nodeName = nodeName;
            return this;
        }

        public GossipDisseminator.Builder memberList(MemberList memberList) {
            this.memberList = memberList;
            return this;
        }

        public GossipDisseminator.Builder memberships(Memberships memberships) {
            this.memberships = memberships;
            return this;
        }

        public GossipDisseminator.Builder blacklist(Blacklist blacklist) {
            this.blacklist = blacklist;
            return this;
        }

        public GossipDisseminator.Builder rumorStore(RumorStore rumorStore) {
            this.rumorStore = rumorStore;
            return this;
        }

        public GossipDisseminator.Builder services(Services services) {
            this.services = services;
            return this;
        }

        public GossipDisseminator.Builder electionEngine(ElectionEngine electionEngine) {
            this.electionEngine = electionEngine;
            return this;
        }

        public GossipDisseminator.Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        public GossipDisseminator.Builder timing(Timing timing) {
            this.timing = timing;
            return this;
        }

        public GossipDisseminator.Builder fanout(int fanout) {
            this.fanout = fanout;
            return this;
        }

        public GossipDisseminator.Builder maxRumors(int maxRumors) {
            this.maxRumors = maxRumors;
            return this;
        }

        public GossipDisseminator.Builder rumorHeat(RumorHeat rumorHeat) {
            this.rumorHeat = rumorHeat;
            return this;
        }

        public GossipDisseminator.Builder metrics(MetricsCollector metrics) {
            this.metrics = metrics;
            return this;
        }

        public GossipDisseminator build() {
            if (fanout < 1) {
                throw new FlockException("Fanout must be at least 1!");
            }
            GossipDisseminator gossipDisseminator = new GossipDisseminator();
            gossipDisseminator.nodeName = nodeName;
            gossipDisseminator.memberList = memberList;
            gossipDisseminator.memberships = memberships;
            gossipDisseminator.blacklist = blacklist;
            gossipDisseminator.rumorStore = rumorStore;
            gossipDisseminator.services = services;
            gossipDisseminator.electionEngine = electionEngine;
            gossipDisseminator.transport = transport;
            gossipDisseminator.timing = timing;
            gossipDisseminator.fanout = fanout;
            gossipDisseminator.maxRumors = maxRumors;
            gossipDisseminator.rumorHeat = rumorHeat;
            gossipDisseminator.metrics = metrics;
            return gossipDisseminator;
        }
    }
}
