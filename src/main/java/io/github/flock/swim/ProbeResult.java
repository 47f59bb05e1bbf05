package io.github.flock.swim;

import com.google.common.base.MoreObjects;
import io.github.flock.member.MemberEntry;

/**
 * Outcome of one protocol period's probe.
 */
class ProbeResult {

    private final MemberEntry target;
    private final boolean acked;
    private final boolean indirect;

    private ProbeResult(MemberEntry target, boolean acked, boolean indirect) {
        this.target = target;
        this.acked = acked;
        this.indirect = indirect;
    }

    static ProbeResult direct(MemberEntry target) {
        return new ProbeResult(target, true, false);
    }

    static ProbeResult indirect(MemberEntry target) {
        return new ProbeResult(target, true, true);
    }

    static ProbeResult failed(MemberEntry target) {
        return new ProbeResult(target, false, true);
    }

    MemberEntry getTarget() {
        return target;
    }

    boolean hasAck() {
        return acked;
    }

    boolean isIndirect() {
        return indirect;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("target", target.getMemberId())
                .add("acked", acked)
                .add("indirect", indirect)
                .toString();
    }
}
