package io.github.flock.transport;

import java.util.Objects;

public final class Endpoint {

    private final String address;
    private final int swimPort;
    private final int gossipPort;

    public Endpoint(String address, int swimPort, int gossipPort) {
        this.address = address;
        this.swimPort = swimPort;
        this.gossipPort = gossipPort;
    }

    public String getAddress() {
        return address;
    }

    public int getSwimPort() {
        return swimPort;
    }

    public int getGossipPort() {
        return gossipPort;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Endpoint endpoint = (Endpoint) o;
        return swimPort == endpoint.swimPort &&
                gossipPort == endpoint.gossipPort &&
                address.equals(endpoint.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, swimPort, gossipPort);
    }

    @Override
    public String toString() {
        return address + "[swim:" + swimPort + ", gossip:" + gossipPort + "]";
    }
}
