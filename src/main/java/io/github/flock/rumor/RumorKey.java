package io.github.flock.rumor;

import io.github.flock.protobuf.Rumor;

import java.util.Objects;

public final class RumorKey {

    private final String key;
    private final RumorKind kind;

    public RumorKey(String key, RumorKind kind) {
        this.key = Objects.requireNonNull(key);
        this.kind = Objects.requireNonNull(kind);
    }

    public static RumorKey of(Rumor rumor) {
        RumorKind kind = RumorKind.of(rumor);
        return new RumorKey(kind.keyOf(rumor), kind);
    }

    public String getKey() {
        return key;
    }

    public RumorKind getKind() {
        return kind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RumorKey rumorKey = (RumorKey) o;
        return key.equals(rumorKey.key) && kind == rumorKey.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, kind);
    }

    @Override
    public String toString() {
        return kind + ":" + key;
    }
}
