package io.github.flock.swim;

import io.github.flock.FlockException;
import io.github.flock.member.Blacklist;
import io.github.flock.member.Health;
import io.github.flock.member.MemberEntry;
import io.github.flock.member.MemberList;
import io.github.flock.protobuf.Member;
import io.github.flock.protobuf.Membership;
import io.github.flock.rumor.RumorHeat;
import io.github.flock.rumor.RumorKind;
import io.github.flock.rumor.RumorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Single entry point for health changes. Every accepted change lands in the member list and, as a membership
 * rumor, in the rumor store so that it is piggybacked on probes and gossiped.
 */
public class Memberships {

    private static final Logger LOGGER = LoggerFactory.getLogger(Memberships.class);

    private final String nodeName;
    private final MemberList memberList;
    private final RumorStore rumorStore;
    private final Blacklist blacklist;
    private final RumorHeat rumorHeat;
    private final int maxPiggyback;
    private final LocalHealth localHealth;

    public Memberships(String nodeName, MemberList memberList, RumorStore rumorStore, Blacklist blacklist, RumorHeat rumorHeat, int maxPiggyback) {
        this(nodeName, memberList, rumorStore, blacklist, rumorHeat, maxPiggyback, 8);
    }

    public Memberships(String nodeName, MemberList memberList, RumorStore rumorStore, Blacklist blacklist, RumorHeat rumorHeat,
                       int maxPiggyback, int maxLocalHealthMultiplier) {
        this.localHealth = new LocalHealth(maxLocalHealthMultiplier);
        this.nodeName = nodeName;
        this.memberList = memberList;
        this.rumorStore = rumorStore;
        this.blacklist = blacklist;
        this.rumorHeat = rumorHeat;
        this.maxPiggyback = maxPiggyback;
        publish(memberList.self());
    }

    /**
     * Direct insertion, used for seeding.
     */
    public boolean insert(Member member, Health health) {
        return apply(member, health);
    }

    /**
     * Applies a received membership. A membership with an unknown health is logged and skipped.
     */
    public boolean apply(Membership membership) {
        Health health;
        try {
            health = Health.fromProto(membership.getHealth());
        } catch (FlockException e) {
            LOGGER.warn("[Node {}] Invalid membership of {}. Reason {}.", nodeName, membership.getMember().getId(), e.getMessage());
            return false;
        }
        return apply(membership.getMember(), health);
    }

    public void applyAll(List<Membership> memberships) {
        memberships.forEach(this::apply);
    }

    public boolean alive(Member member) {
        return apply(member, Health.ALIVE);
    }

    public boolean suspect(MemberEntry memberEntry) {
        return apply(memberEntry.getMember(), Health.SUSPECT);
    }

    public boolean confirm(MemberEntry memberEntry) {
        return apply(memberEntry.getMember(), Health.CONFIRMED);
    }

    /**
     * Administrative departure of this node. Terminal.
     */
    public synchronized Member depart() {
        Member self = memberList.self().getMember();
        if (memberList.upsert(self, Health.DEPARTED)) {
            LOGGER.warn("[Node {}] Departing", nodeName);
            publish(memberList.self());
        }
        return self;
    }

    public Member self() {
        return memberList.self().getMember();
    }

    LocalHealth localHealth() {
        return localHealth;
    }

    public boolean hasDeparted() {
        return memberList.self().getHealth() == Health.DEPARTED;
    }

    /**
     * Hot membership rumors to piggyback on a probe message.
     */
    public List<Membership> piggyback() {
        return rumorStore.hot(RumorKind.MEMBER, rumorHeat.maxHeat(memberList.size()), maxPiggyback)
                .stream()
                .map(rumor -> rumor.getMember())
                .collect(Collectors.toList());
    }

    /**
     * Hot membership rumors plus the recipient's own entry when this node does not hold it alive, so that a
     * member coming back from a partition learns it has to refute.
     */
    public List<Membership> piggyback(String recipientId) {
        List<Membership> memberships = new ArrayList<>(piggyback());
        memberList.get(recipientId)
                .filter(memberEntry -> memberEntry.getHealth() != Health.ALIVE)
                .map(MemberEntry::toMembership)
                .filter(membership -> !memberships.contains(membership))
                .ifPresent(memberships::add);
        return memberships;
    }

    private boolean apply(Member member, Health health) {
        if (memberList.isSelf(member.getId())) {
            return applyAboutSelf(member, health);
        }
        if (blacklist.contains(member.getId()) && isRaise(member, health)) {
            LOGGER.debug("[Node {}] Ignoring {} about blacklisted member {}", nodeName, health, member.getId());
            return false;
        }
        boolean changed = memberList.upsert(member, health);
        if (changed) {
            publish(memberList.entry(member.getId()));
        }
        return changed;
    }

    private boolean isRaise(Member member, Health health) {
        return health == Health.ALIVE && memberList.healthOf(member.getId())
                .map(current -> current != Health.ALIVE)
                .orElse(false);
    }

    private synchronized boolean applyAboutSelf(Member member, Health health) {
        MemberEntry self = memberList.self();
        if (self.getHealth() == Health.DEPARTED) {
            return false;
        }
        if (health == Health.SUSPECT || health == Health.CONFIRMED) {
            if (member.getIncarnation() < self.getIncarnation()) {
                LOGGER.debug("[Node {}] Ignoring suspicion about itself due to stale incarnation number", nodeName);
                return false;
            }
            long incarnation = member.getIncarnation() + 1;
            LOGGER.info("[Node {}] I am {}! Refuting with incarnation {}", nodeName, health, incarnation);
            Member refuted = self.getMember().toBuilder().setIncarnation(incarnation).build();
            memberList.upsert(refuted, Health.ALIVE);
            localHealth.refuted();
            publish(memberList.self());
            return true;
        }
        if (health == Health.DEPARTED) {
            LOGGER.warn("[Node {}] Ignoring departure rumor about itself [inc: {}]", nodeName, member.getIncarnation());
        }
        return false;
    }

    private void publish(MemberEntry memberEntry) {
        rumorStore.insert(RumorKind.member(memberEntry.toMembership()));
    }
}
