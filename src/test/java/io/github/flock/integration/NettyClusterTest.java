package io.github.flock.integration;

import io.github.flock.Server;
import io.github.flock.member.Health;
import io.github.flock.protobuf.Election;
import io.github.flock.protobuf.Member;
import io.github.flock.protobuf.Membership;
import io.github.flock.protobuf.Ping;
import io.github.flock.protobuf.Rumors;
import io.github.flock.protobuf.Swim;
import io.github.flock.transport.Endpoint;
import io.github.flock.transport.NettyTransport;
import io.github.flock.transport.Receiver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class NettyClusterTest {

    Server server1;
    Server server2;

    @BeforeEach
    void setUp() {
        server1 = start("server1");
        server2 = start("server2");
    }

    @AfterEach
    void tearDown() {
        server1.dispose();
        server2.dispose();
    }

    @Test
    void membersFindEachOtherOverNetwork() {
        // when
        server2.insertMember(server1.member(), Health.ALIVE);

        // then
        await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> {
            assertThat(server1.getMemberList().healthOf(server2.memberId())).hasValue(Health.ALIVE);
            assertThat(server2.getMemberList().healthOf(server1.memberId())).hasValue(Health.ALIVE);
        });
    }

    @Test
    void electionFinishesOverNetwork() {
        // given
        server2.insertMember(server1.member(), Health.ALIVE);
        await().atMost(Duration.ofSeconds(10))
                .until(() -> server1.getMemberList().healthOf(server2.memberId()).isPresent());

        // when
        server1.startElection("redis", 1, 0);
        server2.startElection("redis", 2, 0);

        // then
        await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> {
            assertThat(server1.election("redis")).isPresent().isEqualTo(server2.election("redis"));
            assertThat(server1.election("redis")).hasValueSatisfying(election -> {
                assertThat(election.getMemberId()).isEqualTo(server2.memberId());
                assertThat(election.getStatus()).isEqualTo(Election.Status.FINISHED);
            });
        });
    }

    @Test
    void pingWithUnknownHealthDoesNotSilenceMember() {
        // given
        RecordingReceiver acks = new RecordingReceiver();
        NettyTransport client = new NettyTransport("127.0.0.1", 0, 0);
        Endpoint endpoint = client.start(acks).block(Duration.ofSeconds(10));
        Member clientMember = Member.newBuilder()
                .setId("client")
                .setAddress(endpoint.getAddress())
                .setSwimPort(endpoint.getSwimPort())
                .setGossipPort(endpoint.getGossipPort())
                .build();
        Membership unknownHealth = Membership.newBuilder()
                .setMember(Member.newBuilder().setId("newer").setAddress("127.0.0.1"))
                .setHealthValue(7)
                .build();

        try {
            // when
            client.send(server1.member(), ping(clientMember, 1, unknownHealth)).block(Duration.ofSeconds(5));
            client.send(server1.member(), ping(clientMember, 2, null)).block(Duration.ofSeconds(5));

            // then
            await().atMost(Duration.ofSeconds(10)).untilAsserted(() ->
                    assertThat(acks.sequences).contains(2L));
            assertThat(server1.getMemberList().healthOf("newer")).isEmpty();
        } finally {
            client.dispose();
        }
    }

    private Server start(String name) {
        return Server.builder()
                .name(name)
                .transport(new NettyTransport("127.0.0.1", 0, 0))
                .timing(SwimNet.TIMING)
                .start()
                .block(Duration.ofSeconds(10));
    }

    private static Swim ping(Member from, long sequence, Membership membership) {
        Ping.Builder ping = Ping.newBuilder().setFrom(from).setSequence(sequence);
        if (membership != null) {
            ping.addMembership(membership);
        }
        return Swim.newBuilder().setType(Swim.Type.PING).setPing(ping).build();
    }

    private static class RecordingReceiver implements Receiver {

        private final List<Long> sequences = new CopyOnWriteArrayList<>();

        @Override
        public void onSwim(Swim swim) {
            if (swim.getType() == Swim.Type.ACK) {
                sequences.add(swim.getAck().getSequence());
            }
        }

        @Override
        public void onRumors(Rumors rumors) {
        }
    }
}
