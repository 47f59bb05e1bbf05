package io.github.flock.swim;

import io.github.flock.protobuf.Member;

final class SwimFixtures {

    private SwimFixtures() {
    }

    static Member member(String id) {
        return member(id, 0);
    }

    static Member member(String id, long incarnation) {
        return Member.newBuilder()
                .setId(id)
                .setIncarnation(incarnation)
                .setAddress("local")
                .setSwimPort(id.hashCode() & 0xffff)
                .setGossipPort(id.hashCode() & 0xffff)
                .build();
    }
}
