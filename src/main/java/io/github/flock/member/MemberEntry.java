package io.github.flock.member;

import com.google.common.base.MoreObjects;
import io.github.flock.protobuf.Member;
import io.github.flock.protobuf.Membership;

import java.util.Objects;

/**
 * Immutable view of one member, swapped as a whole inside {@link MemberList}.
 */
public final class MemberEntry {

    private final Member member;
    private final Health health;

    public MemberEntry(Member member, Health health) {
        this.member = Objects.requireNonNull(member);
        this.health = Objects.requireNonNull(health);
    }

    public Member getMember() {
        return member;
    }

    public String getMemberId() {
        return member.getId();
    }

    public long getIncarnation() {
        return member.getIncarnation();
    }

    public Health getHealth() {
        return health;
    }

    public Membership toMembership() {
        return Membership.newBuilder()
                .setMember(member)
                .setHealth(health.toProto())
                .build();
    }

    /**
     * Whether {@code member} reported as {@code health} should replace this entry.
     */
    boolean isSupersededBy(Member member, Health health) {
        if (this.health == Health.DEPARTED) {
            return false;
        }
        if (health == Health.DEPARTED) {
            return true;
        }
        if (member.getIncarnation() != getIncarnation()) {
            return member.getIncarnation() > getIncarnation();
        }
        return health.dominates(this.health);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MemberEntry that = (MemberEntry) o;
        return member.equals(that.member) && health == that.health;
    }

    @Override
    public int hashCode() {
        return Objects.hash(member, health);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", member.getId())
                .add("incarnation", member.getIncarnation())
                .add("health", health)
                .toString();
    }
}
