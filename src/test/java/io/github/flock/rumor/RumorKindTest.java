package io.github.flock.rumor;

import io.github.flock.FlockException;
import io.github.flock.protobuf.Election;
import io.github.flock.protobuf.Member;
import io.github.flock.protobuf.Membership;
import io.github.flock.protobuf.Rumor;
import io.github.flock.protobuf.Service;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RumorKindTest {

    @ParameterizedTest
    @CsvSource({
            "1, ALIVE, 1, SUSPECT, true",
            "1, SUSPECT, 1, ALIVE, false",
            "1, SUSPECT, 1, CONFIRMED, true",
            "1, CONFIRMED, 2, ALIVE, true",
            "2, ALIVE, 1, CONFIRMED, false",
            "5, ALIVE, 1, DEPARTED, true",
            "1, DEPARTED, 5, ALIVE, false",
            "1, ALIVE, 1, ALIVE, false"
    })
    void memberOrder(long currentIncarnation, Membership.Health currentHealth, long incomingIncarnation, Membership.Health incomingHealth, boolean supersedes) {
        Rumor current = member(currentIncarnation, currentHealth);
        Rumor incoming = member(incomingIncarnation, incomingHealth);

        assertThat(RumorKind.MEMBER.supersedes(incoming, current)).isEqualTo(supersedes);
    }

    @Test
    void serviceOrder() {
        Rumor registered = service(1, false);

        assertThat(RumorKind.SERVICE.supersedes(service(2, false), registered)).isTrue();
        assertThat(RumorKind.SERVICE.supersedes(service(1, true), registered)).isTrue();
        assertThat(RumorKind.SERVICE.supersedes(service(0, true), registered)).isFalse();
    }

    @Test
    void higherTermWins() {
        Rumor current = election("a", 5, 100, Election.Status.FINISHED, "a", "b");
        Rumor incoming = election("b", 6, 1, Election.Status.RUNNING, "b");

        assertThat(RumorKind.ELECTION.supersedes(incoming, current)).isTrue();
    }

    @Test
    void higherSuitabilityWins() {
        Rumor current = election("a", 0, 10, Election.Status.FINISHED, "a", "b", "c");
        Rumor incoming = election("b", 0, 20, Election.Status.RUNNING, "b");

        assertThat(RumorKind.ELECTION.supersedes(incoming, current)).isTrue();
        assertThat(RumorKind.ELECTION.supersedes(current, incoming)).isFalse();
    }

    @Test
    void lowerMemberIdBreaksTie() {
        Rumor a = election("a", 0, 10, Election.Status.RUNNING, "a");
        Rumor b = election("b", 0, 10, Election.Status.RUNNING, "b");

        assertThat(RumorKind.ELECTION.supersedes(a, b)).isTrue();
        assertThat(RumorKind.ELECTION.supersedes(b, a)).isFalse();
    }

    @Test
    void sameCandidateProgresses() {
        Rumor running = election("a", 0, 10, Election.Status.RUNNING, "a");
        Rumor moreVotes = election("a", 0, 10, Election.Status.RUNNING, "a", "b");
        Rumor finished = election("a", 0, 10, Election.Status.FINISHED, "a", "b");

        assertThat(RumorKind.ELECTION.supersedes(moreVotes, running)).isTrue();
        assertThat(RumorKind.ELECTION.supersedes(finished, moreVotes)).isTrue();
        assertThat(RumorKind.ELECTION.supersedes(running, finished)).isFalse();
    }

    @Test
    void keys() {
        assertThat(RumorKey.of(member(0, Membership.Health.ALIVE))).isEqualTo(new RumorKey("a", RumorKind.MEMBER));
        assertThat(RumorKey.of(service(0, false))).isEqualTo(new RumorKey("redis/a", RumorKind.SERVICE));
        assertThat(RumorKey.of(election("a", 0, 0, Election.Status.RUNNING))).isEqualTo(new RumorKey("redis", RumorKind.ELECTION));
    }

    @Test
    void payloadMustMatchType() {
        Rumor invalid = Rumor.newBuilder()
                .setType(Rumor.Type.ELECTION)
                .setService(Service.newBuilder().setServiceGroup("redis").build())
                .build();

        assertThatThrownBy(() -> RumorKind.of(invalid)).isInstanceOf(FlockException.class);
    }

    @Test
    void memberWithUnknownHealthIsInvalid() {
        Rumor invalid = RumorKind.member(Membership.newBuilder()
                .setMember(Member.newBuilder().setId("a").build())
                .setHealthValue(7)
                .build());

        assertThatThrownBy(() -> RumorKind.of(invalid)).isInstanceOf(FlockException.class);
    }

    private static Rumor member(long incarnation, Membership.Health health) {
        return RumorKind.member(Membership.newBuilder()
                .setMember(Member.newBuilder().setId("a").setIncarnation(incarnation).build())
                .setHealth(health)
                .build());
    }

    private static Rumor service(long incarnation, boolean departed) {
        return RumorKind.service(Service.newBuilder()
                .setMemberId("a")
                .setServiceGroup("redis")
                .setIncarnation(incarnation)
                .setDeparted(departed)
                .build());
    }

    private static Rumor election(String memberId, long term, long suitability, Election.Status status, String... votes) {
        return RumorKind.election(Election.newBuilder()
                .setMemberId(memberId)
                .setServiceGroup("redis")
                .setTerm(term)
                .setSuitability(suitability)
                .setStatus(status)
                .addAllVotes(Arrays.asList(votes))
                .build());
    }
}
