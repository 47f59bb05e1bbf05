package io.github.flock.service;

import io.github.flock.FlockException;
import io.github.flock.protobuf.Rumor;
import io.github.flock.protobuf.Service;
import io.github.flock.rumor.RumorKind;
import io.github.flock.rumor.RumorStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServicesTest {

    RumorStore rumorStore;
    Services services;

    @BeforeEach
    void setUp() {
        rumorStore = new RumorStore("0");
        services = new Services("0", "self", rumorStore);
    }

    @Test
    void insertFillsMemberId() {
        // when
        Service inserted = services.insert(redis(""));

        // then
        assertThat(inserted.getMemberId()).isEqualTo("self");
        assertThat(services.isMember("redis")).isTrue();
        assertThat(services.members("redis")).containsExactly(inserted);
    }

    @Test
    void updateRaisesIncarnation() {
        // given
        services.insert(redis("self"));

        // when
        Service updated = services.insert(redis("self").toBuilder().setPort(6380).build());

        // then
        assertThat(updated.getIncarnation()).isEqualTo(1);
        assertThat(services.get("redis", "self")).hasValue(updated);
    }

    @Test
    void cannotInsertForeignEntry() {
        assertThatThrownBy(() -> services.insert(redis("other"))).isInstanceOf(FlockException.class);
    }

    @Test
    void removeLeavesTombstone() {
        // given
        services.insert(redis("self"));

        // when
        boolean removed = services.remove("redis");

        // then
        assertThat(removed).isTrue();
        assertThat(services.isMember("redis")).isFalse();
        assertThat(services.members("redis")).isEmpty();
        assertThat(services.get("redis", "self")).hasValueSatisfying(service -> {
            assertThat(service.getDeparted()).isTrue();
            assertThat(service.getIncarnation()).isEqualTo(1);
        });
        assertThat(services.remove("redis")).isFalse();
    }

    @Test
    void tombstoneBeatsLateRegistration() {
        // given
        Rumor registration = RumorKind.service(redis("a"));
        services.merge(registration);
        services.removeAll("a");

        // when
        boolean changed = services.merge(registration);

        // then
        assertThat(changed).isFalse();
        assertThat(services.isMember("redis", "a")).isFalse();
    }

    @Test
    void membersOfGroup() {
        // given
        services.merge(RumorKind.service(redis("a")));
        services.merge(RumorKind.service(redis("b")));
        services.merge(RumorKind.service(redis("c").toBuilder().setServiceGroup("postgres").build()));

        // then
        assertThat(services.members("redis")).extracting(Service::getMemberId).containsExactlyInAnyOrder("a", "b");
        assertThat(services.members("postgres")).extracting(Service::getMemberId).containsExactly("c");
    }

    private static Service redis(String memberId) {
        return Service.newBuilder()
                .setMemberId(memberId)
                .setServiceGroup("redis")
                .setIp("127.0.0.1")
                .setHostname("localhost")
                .setPort(6379)
                .addExposes(6379)
                .build();
    }
}
