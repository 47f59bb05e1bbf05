package io.github.flock.rumor;

import io.github.flock.protobuf.Rumor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Versioned rumors keyed by {@code (key, kind)}. {@link #insert(Rumor)} is the only mutation and keeps the
 * maximum version per key, so merging is commutative and idempotent. Each stored rumor carries its heat: the
 * number of gossip rounds it has been pushed since it last changed.
 */
public class RumorStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(RumorStore.class);

    private final String nodeName;
    private final Map<RumorKey, Dissemination> rumors = new ConcurrentHashMap<>();

    public RumorStore(String nodeName) {
        this.nodeName = nodeName;
    }

    /**
     * @return true if the stored value changed
     */
    public boolean insert(Rumor rumor) {
        RumorKey rumorKey = RumorKey.of(rumor);
        Dissemination inserted = new Dissemination(rumor, 0);
        Dissemination result = rumors.compute(rumorKey, (key, current) -> {
            if (current == null || key.getKind().supersedes(rumor, current.rumor)) {
                return inserted;
            }
            return current;
        });
        boolean changed = result == inserted;
        if (changed) {
            LOGGER.debug("[Node {}] Rumor {} stored", nodeName, rumorKey);
        } else {
            LOGGER.trace("[Node {}] Rumor {} is stale or already known", nodeName, rumorKey);
        }
        return changed;
    }

    public Optional<Rumor> get(String key, RumorKind kind) {
        return Optional.ofNullable(rumors.get(new RumorKey(key, kind))).map(Dissemination::getRumor);
    }

    /**
     * Scoped read of a single rumor; the rumor is an immutable copy so nothing escapes the store.
     */
    public void with(String key, RumorKind kind, Consumer<Optional<Rumor>> consumer) {
        consumer.accept(get(key, kind));
    }

    public <R> R apply(String key, RumorKind kind, Function<Optional<Rumor>, R> function) {
        return function.apply(get(key, kind));
    }

    public List<Rumor> all(RumorKind kind) {
        return rumors.entrySet().stream()
                .filter(entry -> entry.getKey().getKind() == kind)
                .map(entry -> entry.getValue().rumor)
                .collect(Collectors.toList());
    }

    /**
     * Rumors pushed fewer than {@code maxHeat} times, coolest first.
     */
    public List<Rumor> hot(int maxHeat, int limit) {
        return rumors.values().stream()
                .filter(dissemination -> dissemination.heat < maxHeat)
                .sorted(Comparator.comparingInt(Dissemination::getHeat))
                .map(Dissemination::getRumor)
                .limit(limit)
                .collect(Collectors.toList());
    }

    public List<Rumor> hot(RumorKind kind, int maxHeat, int limit) {
        return rumors.entrySet().stream()
                .filter(entry -> entry.getKey().getKind() == kind)
                .map(Map.Entry::getValue)
                .filter(dissemination -> dissemination.heat < maxHeat)
                .sorted(Comparator.comparingInt(Dissemination::getHeat))
                .map(Dissemination::getRumor)
                .limit(limit)
                .collect(Collectors.toList());
    }

    /**
     * Increments the heat of every rumor that has not changed since it was sent.
     */
    public void markSent(List<Rumor> sent) {
        sent.forEach(rumor -> rumors.computeIfPresent(RumorKey.of(rumor), (key, current) ->
                current.rumor.equals(rumor) ? new Dissemination(current.rumor, current.heat + 1) : current
        ));
    }

    /**
     * Makes the stored rumor hot again, typically because a peer was seen holding an older version.
     */
    public void reheat(String key, RumorKind kind) {
        rumors.computeIfPresent(new RumorKey(key, kind), (rumorKey, current) -> new Dissemination(current.rumor, 0));
    }

    public int heat(String key, RumorKind kind) {
        Dissemination dissemination = rumors.get(new RumorKey(key, kind));
        return dissemination == null ? 0 : dissemination.heat;
    }

    public int size() {
        return rumors.size();
    }

    @Override
    public String toString() {
        return "RumorStore{node=" + nodeName + ", rumors=" + rumors.keySet() + '}';
    }

    private static final class Dissemination {

        private final Rumor rumor;
        private final int heat;

        Dissemination(Rumor rumor, int heat) {
            this.rumor = rumor;
            this.heat = heat;
        }

        Rumor getRumor() {
            return rumor;
        }

        int getHeat() {
            return heat;
        }
    }
}
