package io.github.flock.member;

import io.github.flock.FlockException;
import io.github.flock.protobuf.Membership;

/**
 * Health of a member as seen by one observer. At equal incarnation a later constant dominates an earlier one.
 */
public enum Health {

    ALIVE(Membership.Health.ALIVE),
    SUSPECT(Membership.Health.SUSPECT),
    CONFIRMED(Membership.Health.CONFIRMED),
    DEPARTED(Membership.Health.DEPARTED);

    private final Membership.Health proto;

    Health(Membership.Health proto) {
        this.proto = proto;
    }

    public Membership.Health toProto() {
        return proto;
    }

    public boolean dominates(Health other) {
        return compareTo(other) > 0;
    }

    public boolean isAvailable() {
        return this == ALIVE || this == SUSPECT;
    }

    public static Health fromProto(Membership.Health health) {
        switch (health) {
            case ALIVE: return ALIVE;
            case SUSPECT: return SUSPECT;
            case CONFIRMED: return CONFIRMED;
            case DEPARTED: return DEPARTED;
            default: throw new FlockException("Unknown health " + health);
        }
    }
}
