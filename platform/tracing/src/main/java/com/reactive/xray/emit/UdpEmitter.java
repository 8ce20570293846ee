package com.reactive.xray.emit;

import com.reactive.xray.observe.Log;
import com.reactive.xray.segment.Segment;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;

/**
 * Sends each segment as one UDP datagram to the trace daemon.
 *
 * Datagram layout: {@code {"format": "json", "version": 1}\n<segment json>}.
 * Segments over {@link #MAX_DATAGRAM_BYTES} are dropped with a warning.
 */
public final class UdpEmitter implements Emitter, AutoCloseable {

    static final String PROTOCOL_HEADER = "{\"format\": \"json\", \"version\": 1}\n";
    static final int MAX_DATAGRAM_BYTES = 64 * 1024 - 1;

    private final InetSocketAddress daemon;
    private final DatagramSocket socket;

    public UdpEmitter(InetSocketAddress daemonAddress) {
        // Config hands out unresolved addresses; resolve once here.
        this.daemon = daemonAddress.isUnresolved()
            ? new InetSocketAddress(daemonAddress.getHostString(), daemonAddress.getPort())
            : daemonAddress;
        try {
            this.socket = new DatagramSocket();
        } catch (SocketException e) {
            throw new UncheckedIOException("Failed to open UDP socket for " + daemon, e);
        }
        Log.info("Emitting segments to {}", daemon);
    }

    @Override
    public void send(Segment segment) {
        byte[] payload = encode(segment);
        if (payload.length > MAX_DATAGRAM_BYTES) {
            Log.warn("Segment {} is {} bytes, over the datagram limit; dropped", segment.id(), payload.length);
            return;
        }
        try {
            socket.send(new DatagramPacket(payload, payload.length, daemon));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to send segment " + segment.id() + " to " + daemon, e);
        }
    }

    static byte[] encode(Segment segment) {
        return (PROTOCOL_HEADER + SegmentJson.toJson(segment)).getBytes(StandardCharsets.UTF_8);
    }

    public InetSocketAddress daemonAddress() {
        return daemon;
    }

    @Override
    public void close() {
        socket.close();
    }
}
