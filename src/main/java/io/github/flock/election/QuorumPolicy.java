package io.github.flock.election;

import io.github.flock.member.Health;
import io.github.flock.member.MemberList;
import io.github.flock.protobuf.Service;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides which members of a service group may vote. Quorum is a strict majority of that electorate.
 */
public enum QuorumPolicy {

    /**
     * Every member with a live service entry, whatever its health.
     */
    KNOWN {
        @Override
        Set<String> electorate(List<Service> groupMembers, MemberList memberList) {
            return groupMembers.stream()
                    .map(Service::getMemberId)
                    .collect(Collectors.toSet());
        }
    },

    /**
     * Only group members currently seen alive.
     */
    ALIVE {
        @Override
        Set<String> electorate(List<Service> groupMembers, MemberList memberList) {
            return groupMembers.stream()
                    .map(Service::getMemberId)
                    .filter(memberId -> memberList.healthOf(memberId).map(health -> health == Health.ALIVE).orElse(false))
                    .collect(Collectors.toSet());
        }
    };

    abstract Set<String> electorate(List<Service> groupMembers, MemberList memberList);

    static int quorum(int electorateSize) {
        return electorateSize / 2 + 1;
    }
}
