package io.github.flock.member;

import io.github.flock.FlockException;
import io.github.flock.protobuf.Member;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MemberListTest {

    private static final Member SELF = member("self", 0);

    MemberList memberList;

    @BeforeEach
    void setUp() {
        memberList = new MemberList("0", SELF);
    }

    @Test
    void selfIsAlive() {
        assertThat(memberList.healthOf("self")).hasValue(Health.ALIVE);
        assertThat(memberList.size()).isEqualTo(1);
        assertThat(memberList.peers()).isEmpty();
    }

    @Test
    void newMember() {
        // when
        boolean changed = memberList.upsert(member("a", 0), Health.ALIVE);

        // then
        assertThat(changed).isTrue();
        assertThat(memberList.healthOf("a")).hasValue(Health.ALIVE);
        assertThat(memberList.peers()).extracting(MemberEntry::getMemberId).containsExactly("a");
    }

    @Test
    void sameIncarnationWorseHealthWins() {
        // given
        memberList.upsert(member("a", 1), Health.ALIVE);

        // when
        boolean suspected = memberList.upsert(member("a", 1), Health.SUSPECT);
        boolean revived = memberList.upsert(member("a", 1), Health.ALIVE);

        // then
        assertThat(suspected).isTrue();
        assertThat(revived).isFalse();
        assertThat(memberList.healthOf("a")).hasValue(Health.SUSPECT);
    }

    @Test
    void higherIncarnationWins() {
        // given
        memberList.upsert(member("a", 1), Health.CONFIRMED);

        // when
        boolean changed = memberList.upsert(member("a", 2), Health.ALIVE);

        // then
        assertThat(changed).isTrue();
        assertThat(memberList.entry("a").getIncarnation()).isEqualTo(2);
        assertThat(memberList.healthOf("a")).hasValue(Health.ALIVE);
    }

    @Test
    void lowerIncarnationIsIgnored() {
        // given
        memberList.upsert(member("a", 5), Health.ALIVE);

        // when
        boolean changed = memberList.upsert(member("a", 4), Health.CONFIRMED);

        // then
        assertThat(changed).isFalse();
        assertThat(memberList.healthOf("a")).hasValue(Health.ALIVE);
    }

    @Test
    void departedIsTerminal() {
        // given
        memberList.upsert(member("a", 1), Health.DEPARTED);

        // when
        boolean changed = memberList.upsert(member("a", 10), Health.ALIVE);

        // then
        assertThat(changed).isFalse();
        assertThat(memberList.healthOf("a")).hasValue(Health.DEPARTED);
    }

    @Test
    void departureWinsOverHigherIncarnation() {
        // given
        memberList.upsert(member("a", 10), Health.ALIVE);

        // when
        boolean changed = memberList.upsert(member("a", 3), Health.DEPARTED);

        // then
        assertThat(changed).isTrue();
        assertThat(memberList.healthOf("a")).hasValue(Health.DEPARTED);
    }

    @Test
    void selfIsNeverSuspected() {
        assertThat(memberList.upsert(member("self", 3), Health.SUSPECT)).isFalse();
        assertThat(memberList.upsert(member("self", 3), Health.CONFIRMED)).isFalse();
        assertThat(memberList.self().getHealth()).isEqualTo(Health.ALIVE);
    }

    @Test
    void unknownMember() {
        assertThat(memberList.healthOf("unknown")).isEmpty();
        assertThatThrownBy(() -> memberList.entry("unknown"))
                .isInstanceOf(FlockException.class)
                .hasMessageContaining("unknown");
    }

    @Test
    void emptyMemberId() {
        assertThatThrownBy(() -> memberList.upsert(member("", 0), Health.ALIVE))
                .isInstanceOf(FlockException.class);
    }

    @Test
    void eachFiltersByPredicate() {
        // given
        memberList.upsert(member("a", 0), Health.ALIVE);
        memberList.upsert(member("b", 0), Health.SUSPECT);
        memberList.upsert(member("c", 0), Health.CONFIRMED);

        // when
        // then
        assertThat(memberList.each(memberEntry -> memberEntry.getHealth().isAvailable()))
                .extracting(MemberEntry::getMemberId)
                .containsExactlyInAnyOrder("self", "a", "b");
    }

    @Test
    void changesEmitAcceptedUpdatesOnly() {
        StepVerifier.create(memberList.changes().take(2))
                .then(() -> {
                    memberList.upsert(member("a", 0), Health.ALIVE);
                    memberList.upsert(member("a", 0), Health.ALIVE);
                    memberList.upsert(member("a", 0), Health.SUSPECT);
                })
                .assertNext(memberEntry -> assertThat(memberEntry.getHealth()).isEqualTo(Health.ALIVE))
                .assertNext(memberEntry -> assertThat(memberEntry.getHealth()).isEqualTo(Health.SUSPECT))
                .verifyComplete();
    }

    static Member member(String id, long incarnation) {
        return Member.newBuilder()
                .setId(id)
                .setIncarnation(incarnation)
                .setAddress("local")
                .setSwimPort(1)
                .setGossipPort(1)
                .build();
    }
}
