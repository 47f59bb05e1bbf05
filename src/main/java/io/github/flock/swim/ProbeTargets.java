package io.github.flock.swim;

import io.github.flock.member.Blacklist;
import io.github.flock.member.Health;
import io.github.flock.member.MemberEntry;
import io.github.flock.member.MemberList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Shuffled round robin over probe targets. Every non-departed peer is probed once before any is probed again;
 * members joining mid-round are picked up with the next shuffle. Blacklisted peers stay targets: nothing is sent
 * to them, so their probes fail.
 */
class ProbeTargets {

    private final MemberList memberList;
    private final Blacklist blacklist;
    private final Deque<String> shuffled = new LinkedList<>();

    ProbeTargets(MemberList memberList, Blacklist blacklist) {
        this.memberList = memberList;
        this.blacklist = blacklist;
    }

    synchronized Optional<MemberEntry> next() {
        for (int attempt = 0; attempt < 2; attempt++) {
            while (!shuffled.isEmpty()) {
                Optional<MemberEntry> candidate = memberList.get(shuffled.poll()).filter(this::isProbeable);
                if (candidate.isPresent()) {
                    return candidate;
                }
            }
            reshuffle();
        }
        return Optional.empty();
    }

    /**
     * Up to {@code count} random alive members other than the target.
     */
    List<MemberEntry> proxies(String targetId, int count) {
        List<MemberEntry> candidates = memberList.peers()
                .filter(memberEntry -> memberEntry.getHealth() == Health.ALIVE)
                .filter(memberEntry -> !memberEntry.getMemberId().equals(targetId))
                .filter(memberEntry -> blacklist.allows(memberEntry.getMemberId()))
                .collect(Collectors.toList());
        Collections.shuffle(candidates);
        return candidates.stream().limit(count).collect(Collectors.toList());
    }

    private void reshuffle() {
        List<String> ids = memberList.peers()
                .filter(this::isProbeable)
                .map(MemberEntry::getMemberId)
                .collect(Collectors.toCollection(ArrayList::new));
        Collections.shuffle(ids);
        shuffled.addAll(ids);
    }

    private boolean isProbeable(MemberEntry memberEntry) {
        return !memberList.isSelf(memberEntry.getMemberId())
                && memberEntry.getHealth() != Health.DEPARTED;
    }
}
