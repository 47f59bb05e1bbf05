package io.github.flock.election;

import io.github.flock.protobuf.Election;
import io.github.flock.rumor.RumorKind;

import java.util.Set;
import java.util.TreeSet;

final class Elections {

    private Elections() {
    }

    static Election running(String memberId, String serviceGroup, long suitability, long term) {
        return Election.newBuilder()
                .setMemberId(memberId)
                .setServiceGroup(serviceGroup)
                .setSuitability(suitability)
                .setTerm(term)
                .setStatus(Election.Status.RUNNING)
                .addVotes(memberId)
                .build();
    }

    static boolean sameCandidate(Election left, Election right) {
        return RumorKind.CANDIDATE_ORDER.compare(left, right) == 0;
    }

    /**
     * Same candidate: votes are united and the more advanced status is kept.
     */
    static Election union(Election left, Election right) {
        Set<String> votes = new TreeSet<>(left.getVotesList());
        votes.addAll(right.getVotesList());
        Election.Status status = left.getStatusValue() >= right.getStatusValue() ? left.getStatus() : right.getStatus();
        return left.toBuilder()
                .setStatus(status)
                .clearVotes()
                .addAllVotes(votes)
                .build();
    }

    static Election withVote(Election election, String voterId) {
        if (election.getVotesList().contains(voterId)) {
            return election;
        }
        Set<String> votes = new TreeSet<>(election.getVotesList());
        votes.add(voterId);
        return election.toBuilder().clearVotes().addAllVotes(votes).build();
    }

    static String signature(Election election) {
        return election.getMemberId() + "@" + election.getTerm() + "/" + election.getSuitability();
    }
}
