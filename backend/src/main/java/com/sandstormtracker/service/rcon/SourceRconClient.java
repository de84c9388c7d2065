package com.sandstormtracker.service.rcon;

import com.sandstormtracker.config.TrackerProperties;
import com.sandstormtracker.config.TrackerProperties.ServerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Source RCON over TCP: authenticate, execute, read until the server echoes the empty terminator.
 * One connection per command; every socket operation is bounded by the configured timeout.
 */
@Service
@Slf4j
public class SourceRconClient implements CommandSender {

    private static final int TYPE_RESPONSE_VALUE = 0;
    private static final int TYPE_EXEC_OR_AUTH_RESPONSE = 2;
    private static final int TYPE_AUTH = 3;
    private static final int MAX_PACKET_SIZE = 16384;

    private final Map<String, ServerProperties> servers;
    private final int timeoutMillis;
    private final AtomicInteger requestIds = new AtomicInteger();

    public SourceRconClient(TrackerProperties properties) {
        this.servers = properties.enabledServers().stream()
            .collect(Collectors.toMap(ServerProperties::resolveId, Function.identity(), (first, second) -> first));
        this.timeoutMillis = (int) properties.getRcon().getTimeout().toMillis();
    }

    @Override
    public String sendCommand(String serverId, String command) throws RconException {
        ServerProperties server = servers.get(serverId);
        if (server == null || server.getRconAddress() == null || server.getRconAddress().isBlank()) {
            throw new RconException("No RCON address configured for server " + serverId);
        }

        InetSocketAddress address = parseAddress(server.getRconAddress());
        try (Socket socket = new Socket()) {
            socket.connect(address, timeoutMillis);
            socket.setSoTimeout(timeoutMillis);

            DataInputStream in = new DataInputStream(socket.getInputStream());
            OutputStream out = socket.getOutputStream();

            authenticate(in, out, server.getRconPassword() == null ? "" : server.getRconPassword(), serverId);
            return execute(in, out, command);
        } catch (RconException e) {
            throw e;
        } catch (IOException e) {
            throw new RconException("RCON command '" + command + "' to " + serverId + " failed: " + e.getMessage(), e);
        }
    }

    private void authenticate(DataInputStream in, OutputStream out, String password, String serverId) throws IOException {
        int authId = requestIds.incrementAndGet();
        write(out, authId, TYPE_AUTH, password);

        while (true) {
            Packet packet = read(in);
            if (packet.type() != TYPE_EXEC_OR_AUTH_RESPONSE) {
                continue;
            }
            if (packet.id() != authId) {
                throw new RconException("RCON authentication rejected by " + serverId);
            }
            return;
        }
    }

    private String execute(DataInputStream in, OutputStream out, String command) throws IOException {
        int commandId = requestIds.incrementAndGet();
        write(out, commandId, TYPE_EXEC_OR_AUTH_RESPONSE, command);

        StringBuilder response = new StringBuilder();
        boolean terminatorSent = false;
        while (true) {
            Packet packet = read(in);
            if (packet.id() != commandId) {
                log.debug("Ignoring RCON packet with unexpected id {}", packet.id());
                continue;
            }
            if (packet.type() != TYPE_RESPONSE_VALUE) {
                throw new RconException("Unexpected RCON packet type " + packet.type());
            }
            if (terminatorSent && packet.body().isEmpty()) {
                return response.toString();
            }
            response.append(packet.body());
            if (!terminatorSent) {
                write(out, commandId, TYPE_RESPONSE_VALUE, "");
                terminatorSent = true;
            }
        }
    }

    private static void write(OutputStream out, int id, int type, String body) throws IOException {
        byte[] payload = body.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buffer = ByteBuffer.allocate(4 + 4 + 4 + payload.length + 2).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(4 + 4 + payload.length + 2);
        buffer.putInt(id);
        buffer.putInt(type);
        buffer.put(payload);
        buffer.put((byte) 0);
        buffer.put((byte) 0);
        out.write(buffer.array());
        out.flush();
    }

    private static Packet read(DataInputStream data) throws IOException {
        byte[] sizeBytes = new byte[4];
        readFully(data, sizeBytes);
        int size = ByteBuffer.wrap(sizeBytes).order(ByteOrder.LITTLE_ENDIAN).getInt();
        if (size < 10 || size > MAX_PACKET_SIZE) {
            throw new RconException("Invalid RCON packet size " + size);
        }

        byte[] packet = new byte[size];
        readFully(data, packet);
        ByteBuffer buffer = ByteBuffer.wrap(packet).order(ByteOrder.LITTLE_ENDIAN);
        int id = buffer.getInt();
        int type = buffer.getInt();
        String body = new String(packet, 8, size - 10, StandardCharsets.UTF_8);
        return new Packet(id, type, body);
    }

    private static void readFully(DataInputStream in, byte[] target) throws IOException {
        try {
            in.readFully(target);
        } catch (EOFException e) {
            throw new RconException("RCON connection closed mid-packet", e);
        }
    }

    static InetSocketAddress parseAddress(String address) throws RconException {
        int colon = address.lastIndexOf(':');
        if (colon <= 0 || colon == address.length() - 1) {
            throw new RconException("RCON address must be host:port, got '" + address + "'");
        }
        try {
            return new InetSocketAddress(address.substring(0, colon), Integer.parseInt(address.substring(colon + 1)));
        } catch (NumberFormatException e) {
            throw new RconException("Invalid RCON port in '" + address + "'", e);
        }
    }

    private record Packet(int id, int type, String body) {}
}
