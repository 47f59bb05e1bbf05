package io.github.flock.member;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Member ids this node must neither send to nor accept messages from. Used for explicit peer exclusion and for
 * simulating partitions.
 */
public class Blacklist {

    private static final Logger LOGGER = LoggerFactory.getLogger(Blacklist.class);

    private final String nodeName;
    private final Set<String> memberIds = ConcurrentHashMap.newKeySet();

    public Blacklist(String nodeName) {
        this.nodeName = nodeName;
    }

    public void add(String memberId) {
        if (memberIds.add(memberId)) {
            LOGGER.info("[Node {}] Member {} blacklisted", nodeName, memberId);
        }
    }

    public void remove(String memberId) {
        if (memberIds.remove(memberId)) {
            LOGGER.info("[Node {}] Member {} removed from blacklist", nodeName, memberId);
        }
    }

    public boolean contains(String memberId) {
        return memberIds.contains(memberId);
    }

    public boolean allows(String memberId) {
        return !contains(memberId);
    }
}
