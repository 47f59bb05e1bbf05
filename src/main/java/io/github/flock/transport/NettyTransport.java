package io.github.flock.transport;

import com.google.protobuf.InvalidProtocolBufferException;
import io.github.flock.FlockException;
import io.github.flock.protobuf.Member;
import io.github.flock.protobuf.Rumors;
import io.github.flock.protobuf.Swim;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.socket.DatagramPacket;
import io.rsocket.Payload;
import io.rsocket.RSocket;
import io.rsocket.RSocketFactory;
import io.rsocket.transport.netty.client.TcpClientTransport;
import io.rsocket.transport.netty.server.CloseableChannel;
import io.rsocket.transport.netty.server.TcpServerTransport;
import io.rsocket.util.DefaultPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.Connection;
import reactor.netty.udp.UdpServer;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * SWIM messages travel as UDP datagrams, rumor batches as RSocket fire-and-forget frames over TCP.
 * Port 0 binds an ephemeral port.
 */
public class NettyTransport implements Transport {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyTransport.class);

    private final String host;
    private final int swimPort;
    private final int gossipPort;
    private final Map<String, Mono<RSocket>> gossipClients = new ConcurrentHashMap<>();

    private volatile Connection swimConnection;
    private volatile CloseableChannel gossipChannel;

    public NettyTransport(String host, int swimPort, int gossipPort) {
        this.host = host;
        this.swimPort = swimPort;
        this.gossipPort = gossipPort;
    }

    @Override
    public Mono<Endpoint> start(Receiver receiver) {
        Mono<Connection> swim = UdpServer.create()
                .host(host)
                .port(swimPort)
                .handle((inbound, outbound) -> inbound.receiveObject()
                        .cast(DatagramPacket.class)
                        .doOnNext(datagramPacket -> onDatagram(datagramPacket, receiver))
                        .then())
                .bind()
                .cast(Connection.class);

        Mono<CloseableChannel> gossip = RSocketFactory.receive()
                .acceptor((setup, sendingSocket) -> Mono.just(new GossipReceiver(receiver)))
                .transport(TcpServerTransport.create(host, gossipPort))
                .start();

        return Mono.zip(swim, gossip)
                .map(connections -> {
                    this.swimConnection = connections.getT1();
                    this.gossipChannel = connections.getT2();
                    InetSocketAddress swimAddress = (InetSocketAddress) swimConnection.address();
                    Endpoint endpoint = new Endpoint(host, swimAddress.getPort(), gossipChannel.address().getPort());
                    LOGGER.info("Transport bound to {}", endpoint);
                    return endpoint;
                });
    }

    @Override
    public Mono<Void> send(Member recipient, Swim swim) {
        return Mono.defer(() -> {
            Connection connection = swimConnection;
            if (connection == null) {
                return Mono.error(new FlockException("Transport has not been started!"));
            }
            DatagramPacket datagramPacket = new DatagramPacket(
                    Unpooled.wrappedBuffer(swim.toByteArray()),
                    new InetSocketAddress(recipient.getAddress(), recipient.getSwimPort())
            );
            return connection.outbound().sendObject(datagramPacket).then();
        });
    }

    @Override
    public Mono<Void> send(Member recipient, Rumors rumors) {
        return gossipClient(recipient)
                .flatMap(rSocket -> rSocket.fireAndForget(DefaultPayload.create(rumors.toByteArray())));
    }

    @Override
    public void dispose() {
        gossipClients.values().forEach(client -> client
                .doOnNext(RSocket::dispose)
                .onErrorResume(throwable -> Mono.empty())
                .subscribe());
        gossipClients.clear();
        if (swimConnection != null) {
            swimConnection.disposeNow(Duration.ofSeconds(1));
        }
        if (gossipChannel != null) {
            gossipChannel.dispose();
        }
    }

    @Override
    public boolean isDisposed() {
        return swimConnection == null || swimConnection.isDisposed();
    }

    private Mono<RSocket> gossipClient(Member recipient) {
        String key = recipient.getAddress() + ":" + recipient.getGossipPort();
        return gossipClients.computeIfAbsent(key, k -> RSocketFactory.connect()
                .transport(TcpClientTransport.create(recipient.getAddress(), recipient.getGossipPort()))
                .start()
                .doOnNext(rSocket -> rSocket.onClose()
                        .doFinally(signalType -> gossipClients.remove(k))
                        .subscribe())
                .doOnError(throwable -> {
                    LOGGER.debug("Cannot connect to {}. Reason {}.", k, throwable.getMessage());
                    gossipClients.remove(k);
                })
                .cache());
    }

    private void onDatagram(DatagramPacket datagramPacket, Receiver receiver) {
        Swim swim;
        try {
            swim = Swim.parseFrom(ByteBufUtil.getBytes(datagramPacket.content()));
        } catch (InvalidProtocolBufferException e) {
            LOGGER.warn("Datagram from {} cannot be converted to a SWIM message", datagramPacket.sender(), e);
            return;
        }
        try {
            receiver.onSwim(swim);
        } catch (RuntimeException e) {
            LOGGER.warn("SWIM message from {} cannot be handled", datagramPacket.sender(), e);
        }
    }

    private static class GossipReceiver implements RSocket {

        private final Receiver receiver;

        GossipReceiver(Receiver receiver) {
            this.receiver = receiver;
        }

        @Override
        public Mono<Void> fireAndForget(Payload payload) {
            try {
                receiver.onRumors(Rumors.parseFrom(payload.getData()));
                return Mono.empty();
            } catch (InvalidProtocolBufferException e) {
                return Mono.error(new FlockException("Payload cannot be converted to rumors", e));
            } finally {
                payload.release();
            }
        }
    }
}
