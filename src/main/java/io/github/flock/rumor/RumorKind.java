package io.github.flock.rumor;

import io.github.flock.FlockException;
import io.github.flock.member.Health;
import io.github.flock.protobuf.Election;
import io.github.flock.protobuf.Membership;
import io.github.flock.protobuf.Rumor;
import io.github.flock.protobuf.Service;

import java.util.Comparator;

/**
 * Rumor tag. Each kind knows how to derive the store key from its payload and how to order two versions of the
 * same key; the store keeps the maximum.
 */
public enum RumorKind {

    MEMBER(Rumor.Type.MEMBER) {
        @Override
        String keyOf(Rumor rumor) {
            return rumor.getMember().getMember().getId();
        }

        @Override
        Comparator<Rumor> versionOrder() {
            return MEMBER_ORDER;
        }
    },

    SERVICE(Rumor.Type.SERVICE) {
        @Override
        String keyOf(Rumor rumor) {
            Service service = rumor.getService();
            return serviceKey(service.getServiceGroup(), service.getMemberId());
        }

        @Override
        Comparator<Rumor> versionOrder() {
            return SERVICE_ORDER;
        }
    },

    ELECTION(Rumor.Type.ELECTION) {
        @Override
        String keyOf(Rumor rumor) {
            return rumor.getElection().getServiceGroup();
        }

        @Override
        Comparator<Rumor> versionOrder() {
            return ELECTION_ORDER;
        }
    };

    /**
     * Better candidates sort last: higher term, then higher suitability, then lower member id.
     */
    public static final Comparator<Election> CANDIDATE_ORDER = Comparator
            .comparingLong(Election::getTerm)
            .thenComparingLong(Election::getSuitability)
            .thenComparing(Election::getMemberId, Comparator.reverseOrder());

    private static final Comparator<Rumor> MEMBER_ORDER = Comparator
            .comparing((Rumor rumor) -> health(rumor) == Health.DEPARTED)
            .thenComparingLong(rumor -> rumor.getMember().getMember().getIncarnation())
            .thenComparing(RumorKind::health);

    private static final Comparator<Rumor> SERVICE_ORDER = Comparator
            .comparingLong((Rumor rumor) -> rumor.getService().getIncarnation())
            .thenComparing(rumor -> rumor.getService().getDeparted());

    private static final Comparator<Rumor> ELECTION_ORDER = Comparator
            .comparing(Rumor::getElection, CANDIDATE_ORDER)
            .thenComparing(rumor -> rumor.getElection().getStatus().getNumber())
            .thenComparingInt(rumor -> rumor.getElection().getVotesCount())
            .thenComparing(rumor -> String.join(",", rumor.getElection().getVotesList()));

    private final Rumor.Type type;

    RumorKind(Rumor.Type type) {
        this.type = type;
    }

    abstract String keyOf(Rumor rumor);

    abstract Comparator<Rumor> versionOrder();

    public Rumor.Type getType() {
        return type;
    }

    /**
     * True if {@code incoming} is a strictly newer version than {@code current}.
     */
    public boolean supersedes(Rumor incoming, Rumor current) {
        return versionOrder().compare(incoming, current) > 0;
    }

    public static RumorKind of(Rumor rumor) {
        switch (rumor.getType()) {
            case MEMBER:
                health(rumor);
                return check(rumor, Rumor.PayloadCase.MEMBER, MEMBER);
            case SERVICE: return check(rumor, Rumor.PayloadCase.SERVICE, SERVICE);
            case ELECTION: return check(rumor, Rumor.PayloadCase.ELECTION, ELECTION);
            default: throw new FlockException(String.format("Unsupported rumor type %s!", rumor.getType()));
        }
    }

    public static String serviceKey(String serviceGroup, String memberId) {
        return serviceGroup + "/" + memberId;
    }

    public static Rumor member(Membership membership) {
        return Rumor.newBuilder().setType(Rumor.Type.MEMBER).setMember(membership).build();
    }

    public static Rumor service(Service service) {
        return Rumor.newBuilder().setType(Rumor.Type.SERVICE).setService(service).build();
    }

    public static Rumor election(Election election) {
        return Rumor.newBuilder().setType(Rumor.Type.ELECTION).setElection(election).build();
    }

    private static Health health(Rumor rumor) {
        return Health.fromProto(rumor.getMember().getHealth());
    }

    private static RumorKind check(Rumor rumor, Rumor.PayloadCase expected, RumorKind kind) {
        if (rumor.getPayloadCase() != expected) {
            throw new FlockException(String.format("Rumor of type %s carries %s payload!", rumor.getType(), rumor.getPayloadCase()));
        }
        return kind;
    }
}
