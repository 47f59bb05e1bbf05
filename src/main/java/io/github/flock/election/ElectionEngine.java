package io.github.flock.election;

import io.github.flock.FlockException;
import io.github.flock.member.Health;
import io.github.flock.member.MemberEntry;
import io.github.flock.member.MemberList;
import io.github.flock.protobuf.Election;
import io.github.flock.protobuf.Rumor;
import io.github.flock.protobuf.Service;
import io.github.flock.rumor.RumorKind;
import io.github.flock.rumor.RumorStore;
import io.github.flock.service.Services;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Leader election per service group, driven only by election rumors. The best candidate always wins a merge;
 * members of the group vote for whichever candidate they currently hold and finish the election once a quorum
 * of the group has voted for it.
 */
public class ElectionEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(ElectionEngine.class);

    private String nodeName;
    private String memberId;
    private RumorStore rumorStore;
    private Services services;
    private MemberList memberList;
    private QuorumPolicy quorumPolicy;
    private int electionTimeoutRounds;

    private final Map<String, Long> suitabilities = new ConcurrentHashMap<>();
    private final Map<String, RunningSince> running = new ConcurrentHashMap<>();
    private long round;

    /**
     * Starts (or restarts) an election naming this node. Registers this node in the group when it has no
     * service entry there.
     */
    public synchronized Election start(String serviceGroup, long suitability, long term) {
        if (serviceGroup.isEmpty()) {
            throw new FlockException("Service group must not be empty!");
        }
        if (!services.isMember(serviceGroup)) {
            services.insert(Service.newBuilder().setServiceGroup(serviceGroup).setMemberId(memberId).build());
        }
        suitabilities.put(serviceGroup, suitability);
        Election candidate = Elections.running(memberId, serviceGroup, suitability, term);
        LOGGER.info("[Node {}] Starting election for {} [term: {}, suitability: {}]", nodeName, serviceGroup, term, suitability);
        return merge(candidate);
    }

    /**
     * Merges an election rumor received from a peer.
     *
     * @return true if the stored election changed
     */
    public synchronized boolean merge(Rumor rumor) {
        Election incoming = rumor.getElection();
        Optional<Election> current = current(incoming.getServiceGroup());
        if (current.isPresent() && RumorKind.CANDIDATE_ORDER.compare(incoming, current.get()) < 0) {
            // the sender holds a worse candidate, make sure ours reaches it again
            rumorStore.reheat(incoming.getServiceGroup(), RumorKind.ELECTION);
            return false;
        }
        Election before = current.orElse(null);
        Election after = merge(incoming);
        if (!after.equals(incoming)) {
            rumorStore.reheat(incoming.getServiceGroup(), RumorKind.ELECTION);
        }
        return !after.equals(before);
    }

    public Optional<Election> current(String serviceGroup) {
        return rumorStore.get(serviceGroup, RumorKind.ELECTION).map(Rumor::getElection);
    }

    /**
     * Called once per gossip round: times out elections that could not reach a quorum.
     */
    public synchronized void tick() {
        round++;
        rumorStore.all(RumorKind.ELECTION).stream()
                .map(Rumor::getElection)
                .forEach(election -> {
                    String serviceGroup = election.getServiceGroup();
                    if (election.getStatus() != Election.Status.RUNNING) {
                        running.remove(serviceGroup);
                        return;
                    }
                    String signature = Elections.signature(election);
                    RunningSince since = running.compute(serviceGroup, (group, existing) ->
                            existing == null || !existing.signature.equals(signature) ? new RunningSince(signature, round) : existing);
                    Election settled = settle(election);
                    if (settled.getStatus() == Election.Status.RUNNING
                            && services.isMember(serviceGroup)
                            && round - since.round >= electionTimeoutRounds) {
                        LOGGER.info("[Node {}] Election for {} has no quorum [votes: {}]", nodeName, serviceGroup, settled.getVotesList());
                        settled = settled.toBuilder().setStatus(Election.Status.NO_QUORUM).build();
                    }
                    rumorStore.insert(RumorKind.election(settled));
                });
    }

    /**
     * Restarts elections whose leader was confirmed dead or departed.
     */
    public synchronized void onMemberChange(MemberEntry memberEntry) {
        if (memberEntry.getHealth() != Health.CONFIRMED && memberEntry.getHealth() != Health.DEPARTED) {
            return;
        }
        if (memberList.isSelf(memberEntry.getMemberId())) {
            return;
        }
        rumorStore.all(RumorKind.ELECTION).stream()
                .map(Rumor::getElection)
                .filter(election -> election.getMemberId().equals(memberEntry.getMemberId()))
                .filter(election -> services.isMember(election.getServiceGroup()))
                .forEach(election -> {
                    LOGGER.info("[Node {}] Leader {} of {} is {}, restarting election", nodeName, election.getMemberId(), election.getServiceGroup(), memberEntry.getHealth());
                    start(election.getServiceGroup(), suitabilities.getOrDefault(election.getServiceGroup(), 0L), election.getTerm() + 1);
                });
    }

    private Election merge(Election incoming) {
        Election merged = current(incoming.getServiceGroup())
                .filter(current -> Elections.sameCandidate(current, incoming))
                .map(current -> Elections.union(current, incoming))
                .orElseGet(() -> current(incoming.getServiceGroup())
                        .filter(current -> RumorKind.CANDIDATE_ORDER.compare(current, incoming) > 0)
                        .orElse(incoming));
        Election settled = settle(merged);
        rumorStore.insert(RumorKind.election(settled));
        return current(incoming.getServiceGroup()).orElse(settled);
    }

    /**
     * Adds this node's vote when it belongs to the group and finishes the election once a quorum voted.
     * Nodes outside the group only store and forward.
     */
    private Election settle(Election election) {
        String serviceGroup = election.getServiceGroup();
        if (!services.isMember(serviceGroup)) {
            return election;
        }
        Election voted = Elections.withVote(election, memberId);
        if (voted.getStatus() == Election.Status.FINISHED) {
            return voted;
        }
        Set<String> electorate = quorumPolicy.electorate(services.members(serviceGroup), memberList);
        long votes = voted.getVotesList().stream().filter(electorate::contains).count();
        int quorum = QuorumPolicy.quorum(electorate.size());
        if (votes >= quorum) {
            LOGGER.info("[Node {}] Election for {} finished, leader is {} [term: {}, votes: {}/{}]", nodeName, serviceGroup, voted.getMemberId(), voted.getTerm(), votes, electorate.size());
            return voted.toBuilder().setStatus(Election.Status.FINISHED).build();
        }
        return voted;
    }

    private static final class RunningSince {

        private final String signature;
        private final long round;

        RunningSince(String signature, long round) {
            this.signature = signature;
            this.round = round;
        }
    }

    private ElectionEngine() {}

    public static ElectionEngine.Builder builder() {
        return new ElectionEngine.Builder();
    }

    public static class Builder {

        private String nodeName;
        private String memberId;
        private RumorStore rumorStore;
        private Services services;
        private MemberList memberList;
        private QuorumPolicy quorumPolicy = QuorumPolicy.KNOWN;
        private int electionTimeoutRounds = 10;

        private Builder() {
        }

        public ElectionEngine.Builder nodeName(String nodeName) {
            this.nodeName = nodeName;
            return this;
        }

        public ElectionEngine.Builder memberId(String memberId) {
            this.memberId = memberId;
            return this;
        }

        public ElectionEngine.Builder rumorStore(RumorStore rumorStore) {
            this.rumorStore = rumorStore;
            return this;
        }

        public ElectionEngine.Builder services(Services services) {
            this.services = services;
            return this;
        }

        public ElectionEngine.Builder memberList(MemberList memberList) {
            this.memberList = memberList;
            return this;
        }

        public ElectionEngine.Builder quorumPolicy(QuorumPolicy quorumPolicy) {
            this.quorumPolicy = quorumPolicy;
            return this;
        }

        public ElectionEngine.Builder electionTimeoutRounds(int electionTimeoutRounds) {
            this.electionTimeoutRounds = electionTimeoutRounds;
            return this;
        }

        public ElectionEngine build() {
            if (electionTimeoutRounds < 1) {
                throw new FlockException("Election timeout must be at least one gossip round!");
            }
            ElectionEngine electionEngine = new ElectionEngine();
            electionEngine.nodeName = nodeName;
            electionEngine.memberId = memberId;
            electionEngine.rumorStore = rumorStore;
            electionEngine.services = services;
            electionEngine.memberList = memberList;
            electionEngine.quorumPolicy = quorumPolicy;
            electionEngine.electionTimeoutRounds = electionTimeoutRounds;
            return electionEngine;
        }
    }
}
