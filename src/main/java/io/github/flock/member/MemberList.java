package io.github.flock.member;

import io.github.flock.FlockException;
import io.github.flock.protobuf.Member;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.DirectProcessor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * One node's view of every known member. Entries are immutable and replaced atomically, so readers never observe
 * a half-written entry.
 */
public class MemberList {

    private static final Logger LOGGER = LoggerFactory.getLogger(MemberList.class);

    private final String nodeName;
    private final String selfId;
    private final Map<String, MemberEntry> members = new ConcurrentHashMap<>();
    private final DirectProcessor<MemberEntry> changesProcessor = DirectProcessor.create();
    private final FluxSink<MemberEntry> changesSink = changesProcessor.sink();

    public MemberList(String nodeName, Member self) {
        this.nodeName = nodeName;
        this.selfId = self.getId();
        this.members.put(selfId, new MemberEntry(self, Health.ALIVE));
    }

    /**
     * Applies the incarnation and health ordering.
     *
     * @return true if the stored entry changed
     */
    public boolean upsert(Member member, Health health) {
        String memberId = member.getId();
        if (memberId.isEmpty()) {
            throw new FlockException("Member id must not be empty!");
        }
        if (isSelf(memberId) && (health == Health.SUSPECT || health == Health.CONFIRMED)) {
            // refuted by incarnation, never stored
            return false;
        }
        MemberEntry candidate = new MemberEntry(member, health);
        MemberEntry[] replaced = new MemberEntry[1];
        MemberEntry result = members.compute(memberId, (id, current) -> {
            if (current == null || current.isSupersededBy(member, health)) {
                replaced[0] = current;
                return candidate;
            }
            return current;
        });
        boolean changed = result == candidate;
        if (changed) {
            if (replaced[0] == null || replaced[0].getHealth() != health) {
                LOGGER.info("[Node {}] Member {} is {} [inc: {}]", nodeName, memberId, health, member.getIncarnation());
            }
            changesSink.next(candidate);
        }
        return changed;
    }

    public Optional<Health> healthOf(String memberId) {
        return get(memberId).map(MemberEntry::getHealth);
    }

    public Optional<Health> healthOf(Member member) {
        return healthOf(member.getId());
    }

    public Optional<MemberEntry> get(String memberId) {
        return Optional.ofNullable(members.get(memberId));
    }

    /**
     * @throws FlockException if the member is unknown
     */
    public MemberEntry entry(String memberId) {
        MemberEntry memberEntry = members.get(memberId);
        if (memberEntry == null) {
            throw new FlockException(String.format("[Node %s] Unknown member %s!", nodeName, memberId));
        }
        return memberEntry;
    }

    public Stream<MemberEntry> each(Predicate<MemberEntry> predicate) {
        return members.values().stream().filter(predicate);
    }

    public Stream<MemberEntry> peers() {
        return each(memberEntry -> !isSelf(memberEntry.getMemberId()));
    }

    public MemberEntry self() {
        return members.get(selfId);
    }

    public boolean isSelf(String memberId) {
        return selfId.equals(memberId);
    }

    public int size() {
        return members.size();
    }

    /**
     * Every accepted change, including changes to the node itself.
     */
    public Flux<MemberEntry> changes() {
        return changesProcessor;
    }
}
