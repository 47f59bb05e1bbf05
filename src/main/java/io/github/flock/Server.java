package io.github.flock;

import io.github.flock.election.ElectionEngine;
import io.github.flock.election.QuorumPolicy;
import io.github.flock.gossip.GossipDisseminator;
import io.github.flock.member.Blacklist;
import io.github.flock.member.Health;
import io.github.flock.member.MemberEntry;
import io.github.flock.member.MemberList;
import io.github.flock.metrics.MetricsCollector;
import io.github.flock.metrics.NoMetricsCollector;
import io.github.flock.protobuf.Election;
import io.github.flock.protobuf.Member;
import io.github.flock.protobuf.Rumors;
import io.github.flock.protobuf.Service;
import io.github.flock.protobuf.Swim;
import io.github.flock.rumor.RumorHeat;
import io.github.flock.rumor.RumorStore;
import io.github.flock.service.Services;
import io.github.flock.swim.FailureDetector;
import io.github.flock.swim.Memberships;
import io.github.flock.timing.Timing;
import io.github.flock.transport.Endpoint;
import io.github.flock.transport.Receiver;
import io.github.flock.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * One protocol node: a SWIM probe loop and a gossip loop over a member list and a rumor store.
 */
public class Server implements Disposable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Server.class);

    private final Builder config;
    private final String name;
    private final String memberId;
    private final Transport transport;
    private final Timing timing;
    private final Blacklist blacklist;

    private volatile boolean running;
    private volatile boolean paused;

    private MemberList memberList;
    private RumorStore rumorStore;
    private Memberships memberships;
    private Services services;
    private ElectionEngine electionEngine;
    private FailureDetector failureDetector;
    private GossipDisseminator gossipDisseminator;
    private volatile boolean initialized;

    private Mono<Void> swimLoop;
    private Mono<Void> gossipLoop;
    private Disposable memberChanges;

    private Server(Builder config) {
        this.config = config;
        this.name = config.name;
        this.memberId = config.memberId;
        this.transport = config.transport;
        this.timing = config.timing;
        this.blacklist = new Blacklist(name);
    }

    private Server initialize(Endpoint endpoint) {
        Member self = Member.newBuilder()
                .setId(memberId)
                .setAddress(endpoint.getAddress())
                .setSwimPort(endpoint.getSwimPort())
                .setGossipPort(endpoint.getGossipPort())
                .build();
        memberList = new MemberList(name, self);
        rumorStore = new RumorStore(name);
        memberships = new Memberships(name, memberList, rumorStore, blacklist, config.rumorHeat, config.maxPiggyback, config.maxLocalHealthMultiplier);
        services = new Services(name, memberId, rumorStore);
        electionEngine = ElectionEngine.builder()
                .nodeName(name)
                .memberId(memberId)
                .rumorStore(rumorStore)
                .services(services)
                .memberList(memberList)
                .quorumPolicy(config.quorumPolicy)
                .electionTimeoutRounds(config.electionTimeoutRounds)
                .build();
        failureDetector = FailureDetector.builder()
                .nodeName(name)
                .memberList(memberList)
                .memberships(memberships)
                .blacklist(blacklist)
                .transport(transport)
                .timing(timing)
                .pingReqProxies(config.pingReqProxies)
                .metrics(config.metrics)
                .build();
        gossipDisseminator = GossipDisseminator.builder()
                .nodeName(name)
                .memberList(memberList)
                .memberships(memberships)
                .blacklist(blacklist)
                .rumorStore(rumorStore)
                .services(services)
                .electionEngine(electionEngine)
                .transport(transport)
                .timing(timing)
                .fanout(config.fanout)
                .maxRumors(config.maxRumors)
                .rumorHeat(config.rumorHeat)
                .metrics(config.metrics)
                .build();
        memberChanges = memberList.changes().subscribe(this::onMemberChange, throwable -> LOGGER.error("[Node {}] Member change handling failed", name, throwable));
        initialized = true;

        running = true;
        swimLoop = loop(failureDetector::protocolPeriod, timing.protocolPeriod(), "swim");
        gossipLoop = loop(gossipDisseminator::gossipPeriod, timing.gossipPeriod(), "gossip");
        swimLoop.subscribe();
        gossipLoop.subscribe();
        LOGGER.info("[Node {}] Started as member {} on {} with {}", name, memberId, endpoint, timing);
        return this;
    }

    private Mono<Void> loop(Supplier<Mono<Void>> period, Duration pausedDelay, String loopName) {
        return Mono.defer(() -> paused ? Mono.delay(pausedDelay).then() : period.get())
                .repeat(() -> running)
                .then()
                .doOnError(throwable -> LOGGER.error("[Node {}] {} loop stopped", name, loopName, throwable))
                .doOnTerminate(() -> LOGGER.debug("[Node {}] {} loop finished", name, loopName))
                .cache();
    }

    private void onMemberChange(MemberEntry memberEntry) {
        if (memberEntry.getHealth() == Health.DEPARTED) {
            services.removeAll(memberEntry.getMemberId());
        }
        electionEngine.onMemberChange(memberEntry);
    }

    public String name() {
        return name;
    }

    public String memberId() {
        return memberId;
    }

    public Member member() {
        return memberList.self().getMember();
    }

    /**
     * Direct injection bypassing probing, for seeding.
     */
    public boolean insertMember(Member member, Health health) {
        return memberships.insert(member, health);
    }

    public MemberList getMemberList() {
        return memberList;
    }

    public RumorStore getRumorStore() {
        return rumorStore;
    }

    /**
     * Election rumors live in the node's single rumor store.
     */
    public RumorStore getElectionStore() {
        return rumorStore;
    }

    public Services getServices() {
        return services;
    }

    public Timing getTiming() {
        return timing;
    }

    public void addToBlacklist(String memberId) {
        blacklist.add(memberId);
    }

    public void removeFromBlacklist(String memberId) {
        blacklist.remove(memberId);
    }

    public boolean isBlacklisted(String memberId) {
        return blacklist.contains(memberId);
    }

    public long swimRounds() {
        return failureDetector.rounds();
    }

    public long gossipRounds() {
        return gossipDisseminator.rounds();
    }

    public boolean paused() {
        return paused;
    }

    /**
     * Stops scheduling new periods; a period already in flight runs to its end.
     */
    public void pause() {
        LOGGER.info("[Node {}] Paused", name);
        paused = true;
    }

    public void unpause() {
        LOGGER.info("[Node {}] Unpaused", name);
        paused = false;
    }

    public Election startElection(String serviceGroup, long suitability, long term) {
        return electionEngine.start(serviceGroup, suitability, term);
    }

    public Optional<Election> election(String serviceGroup) {
        return electionEngine.current(serviceGroup);
    }

    public Service insertService(Service service) {
        return services.insert(service);
    }

    public boolean removeService(String serviceGroup) {
        return services.remove(serviceGroup);
    }

    /**
     * Administrative departure. The node keeps answering and gossiping so the departure spreads, but stops probing.
     */
    public void depart() {
        memberships.depart();
    }

    @Override
    public void dispose() {
        if (!running) {
            return;
        }
        LOGGER.info("[Node {}] Stopping ...", name);
        running = false;
        Duration grace = timing.protocolPeriod().multipliedBy(2);
        Mono.when(swimLoop, gossipLoop)
                .timeout(grace)
                .doOnError(throwable -> LOGGER.warn("[Node {}] Loops did not finish within {}", name, grace))
                .onErrorResume(throwable -> Mono.empty())
                .block();
        memberChanges.dispose();
        transport.dispose();
        LOGGER.info("[Node {}] Stopped", name);
    }

    @Override
    public boolean isDisposed() {
        return !running;
    }

    /**
     * A paused node neither answers nor merges, so peers see it exactly as an unreachable one.
     */
    private class ServerReceiver implements Receiver {

        @Override
        public void onSwim(Swim swim) {
            if (initialized && !paused) {
                failureDetector.onSwim(swim);
            }
        }

        @Override
        public void onRumors(Rumors rumors) {
            if (initialized && !paused) {
                gossipDisseminator.onRumors(rumors);
            }
        }
    }

    public static Server.Builder builder() {
        return new Server.Builder();
    }

    public static class Builder {

        private String name;
        private String memberId = UUID.randomUUID().toString();
        private Transport transport;
        private Timing timing = Timing.defaultTiming();
        private int fanout = 3;
        private int pingReqProxies = 3;
        private int maxPiggyback = 10;
        private int maxRumors = 100;
        private int maxLocalHealthMultiplier = 8;
        private RumorHeat rumorHeat = RumorHeat.scaled(1.5f);
        private QuorumPolicy quorumPolicy = QuorumPolicy.KNOWN;
        private int electionTimeoutRounds = 20;
        private MetricsCollector metrics = new NoMetricsCollector();

        private Builder() {
        }

        public Server.Builder name(String name) {
            this.name = name;
            return this;
        }

        public Server.Builder memberId(String memberId) {
            this.memberId = memberId;
            return this;
        }

        public Server.Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        public Server.Builder timing(Timing timing) {
            this.timing = timing;
            return this;
        }

        public Server.Builder fanout(int fanout) {
            this.fanout = fanout;
            return this;
        }

        public Server.Builder pingReqProxies(int pingReqProxies) {
            this.pingReqProxies = pingReqProxies;
            return this;
        }

        public Server.Builder maxPiggyback(int maxPiggyback) {
            this.maxPiggyback = maxPiggyback;
            return this;
        }

        public Server.Builder maxRumors(int maxRumors) {
            this.maxRumors = maxRumors;
            return this;
        }

        public Server.Builder maxLocalHealthMultiplier(int maxLocalHealthMultiplier) {
            this.maxLocalHealthMultiplier = maxLocalHealthMultiplier;
            return this;
        }

        public Server.Builder rumorHeat(RumorHeat rumorHeat) {
            this.rumorHeat = rumorHeat;
            return this;
        }

        public Server.Builder quorumPolicy(QuorumPolicy quorumPolicy) {
            this.quorumPolicy = quorumPolicy;
            return this;
        }

        public Server.Builder electionTimeoutRounds(int electionTimeoutRounds) {
            this.electionTimeoutRounds = electionTimeoutRounds;
            return this;
        }

        public Server.Builder metrics(MetricsCollector metrics) {
            this.metrics = metrics;
            return this;
        }

        public Mono<Server> start() {
            return Mono.defer(() -> {
                if (name == null || name.isEmpty()) {
                    return Mono.error(new FlockException("Server name is required!"));
                }
                if (memberId == null || memberId.isEmpty()) {
                    return Mono.error(new FlockException("Member id must not be empty!"));
                }
                if (transport == null) {
                    return Mono.error(new FlockException("Transport is required!"));
                }
                Server server = new Server(this);
                return transport.start(server.new ServerReceiver()).map(server::initialize);
            });
        }
    }
}
