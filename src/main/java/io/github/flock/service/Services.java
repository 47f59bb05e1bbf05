package io.github.flock.service;

import io.github.flock.FlockException;
import io.github.flock.protobuf.Rumor;
import io.github.flock.protobuf.Service;
import io.github.flock.rumor.RumorKind;
import io.github.flock.rumor.RumorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Service group registry on top of the rumor store. An entry is removed by publishing a tombstone with a higher
 * incarnation, so removals spread like any other rumor.
 */
public class Services {

    private static final Logger LOGGER = LoggerFactory.getLogger(Services.class);

    private final String nodeName;
    private final String memberId;
    private final RumorStore rumorStore;

    public Services(String nodeName, String memberId, RumorStore rumorStore) {
        this.nodeName = nodeName;
        this.memberId = memberId;
        this.rumorStore = rumorStore;
    }

    /**
     * Publishes an entry of this node. The incarnation is raised above the stored one when needed so that the
     * update always wins.
     */
    public synchronized Service insert(Service service) {
        if (service.getServiceGroup().isEmpty()) {
            throw new FlockException("Service group must not be empty!");
        }
        Service.Builder builder = service.toBuilder();
        if (builder.getMemberId().isEmpty()) {
            builder.setMemberId(memberId);
        }
        if (!builder.getMemberId().equals(memberId)) {
            throw new FlockException(String.format("[Node %s] Cannot insert service of member %s!", nodeName, builder.getMemberId()));
        }
        get(builder.getServiceGroup(), memberId)
                .filter(current -> current.getIncarnation() >= builder.getIncarnation())
                .ifPresent(current -> builder.setIncarnation(current.getIncarnation() + 1));
        Service inserted = builder.setDeparted(false).build();
        rumorStore.insert(RumorKind.service(inserted));
        LOGGER.info("[Node {}] Service {} registered [inc: {}]", nodeName, inserted.getServiceGroup(), inserted.getIncarnation());
        return inserted;
    }

    /**
     * Applies an entry received from a peer.
     */
    public boolean merge(Rumor rumor) {
        return rumorStore.insert(rumor);
    }

    public synchronized boolean remove(String serviceGroup) {
        return tombstone(serviceGroup, memberId);
    }

    /**
     * Tombstones every entry of a departed member.
     */
    public void removeAll(String departedMemberId) {
        rumorStore.all(RumorKind.SERVICE).stream()
                .map(Rumor::getService)
                .filter(service -> service.getMemberId().equals(departedMemberId) && !service.getDeparted())
                .forEach(service -> tombstone(service.getServiceGroup(), departedMemberId));
    }

    public Optional<Service> get(String serviceGroup, String serviceMemberId) {
        return rumorStore.get(RumorKind.serviceKey(serviceGroup, serviceMemberId), RumorKind.SERVICE).map(Rumor::getService);
    }

    /**
     * Live entries of a group.
     */
    public List<Service> members(String serviceGroup) {
        return rumorStore.all(RumorKind.SERVICE).stream()
                .map(Rumor::getService)
                .filter(service -> service.getServiceGroup().equals(serviceGroup))
                .filter(service -> !service.getDeparted())
                .collect(Collectors.toList());
    }

    public boolean isMember(String serviceGroup) {
        return isMember(serviceGroup, memberId);
    }

    public boolean isMember(String serviceGroup, String serviceMemberId) {
        return get(serviceGroup, serviceMemberId).map(service -> !service.getDeparted()).orElse(false);
    }

    private boolean tombstone(String serviceGroup, String serviceMemberId) {
        Optional<Service> current = get(serviceGroup, serviceMemberId).filter(service -> !service.getDeparted());
        if (!current.isPresent()) {
            return false;
        }
        Service tombstone = current.get().toBuilder()
                .setIncarnation(current.get().getIncarnation() + 1)
                .setDeparted(true)
                .build();
        LOGGER.info("[Node {}] Service {} of member {} removed", nodeName, serviceGroup, serviceMemberId);
        return rumorStore.insert(RumorKind.service(tombstone));
    }
}
