package com.p14n.eventbridge.store;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;
import org.newsclub.net.unix.AFUNIXServerSocket;
import org.newsclub.net.unix.AFUNIXSocketAddress;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 10, unit = TimeUnit.SECONDS)
class JedisFactoryTest {

    @TempDir
    Path dir;

    private RespServer server;

    @AfterEach
    void tearDown() throws IOException {
        if (server != null) {
            server.close();
        }
    }

    @Test
    void networkHandshakeWithPasswordSendsAuthFirst() throws Exception {
        server = RespServer.start(new ServerSocket(0, 50, InetAddress.getLoopbackAddress()));
        var connection = new JedisStoreConnection(
                StoreTarget.network("127.0.0.1", server.port()), "secret", 2000, 2000);

        connection.connect();
        long index = connection.execute(StoreCommand.incr("icinga:event.idx")).asLong();

        assertEquals(1L, index);
        assertEquals(List.of("AUTH secret", "INCR icinga:event.idx"), server.commands());
        connection.close();
    }

    @Test
    void networkHandshakeWithoutPasswordSendsNothingExtra() throws Exception {
        server = RespServer.start(new ServerSocket(0, 50, InetAddress.getLoopbackAddress()));
        var connection = new JedisStoreConnection(
                StoreTarget.network("127.0.0.1", server.port()), null, 2000, 2000);

        connection.connect();
        connection.execute(StoreCommand.incr("icinga:event.idx"));

        assertEquals(List.of("INCR icinga:event.idx"), server.commands());
        connection.close();
    }

    @Test
    void localSocketHandshakeWithPasswordSendsAuthFirst() throws Exception {
        File socketFile = dir.resolve("store.sock").toFile();
        AFUNIXServerSocket unix = AFUNIXServerSocket.newInstance();
        unix.bind(AFUNIXSocketAddress.of(socketFile));
        server = RespServer.start(unix);
        var connection = new JedisStoreConnection(
                StoreTarget.localSocket(socketFile.getPath()), "secret", 2000, 2000);

        connection.connect();
        connection.execute(StoreCommand.incr("icinga:event.idx"));

        assertEquals(List.of("AUTH secret", "INCR icinga:event.idx"), server.commands());
        connection.close();
    }

    @Test
    void localSocketHandshakeWithoutPassword() throws Exception {
        File socketFile = dir.resolve("store.sock").toFile();
        AFUNIXServerSocket unix = AFUNIXServerSocket.newInstance();
        unix.bind(AFUNIXSocketAddress.of(socketFile));
        server = RespServer.start(unix);
        var connection = new JedisStoreConnection(
                StoreTarget.localSocket(socketFile.getPath()), null, 2000, 2000);

        connection.connect();
        connection.execute(StoreCommand.incr("icinga:event.idx"));

        assertEquals(List.of("INCR icinga:event.idx"), server.commands());
        connection.close();
    }

    @Test
    void blankPathFallsBackToNetwork() throws Exception {
        server = RespServer.start(new ServerSocket(0, 50, InetAddress.getLoopbackAddress()));
        var connection = new JedisStoreConnection(
                new StoreTarget("127.0.0.1", server.port(), "  "), null, 2000, 2000);

        connection.connect();
        connection.execute(StoreCommand.incr("icinga:event.idx"));

        assertEquals(List.of("INCR icinga:event.idx"), server.commands());
        connection.close();
    }

    @Test
    void closedPortIsUnreachable() throws Exception {
        int port;
        try (ServerSocket reserved = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            port = reserved.getLocalPort();
        }
        var connection = new JedisStoreConnection(StoreTarget.network("127.0.0.1", port), null, 500, 500);

        StoreException e = assertThrows(StoreException.class, connection::connect);

        assertEquals(StoreException.Kind.UNREACHABLE, e.kind());
        assertFalse(connection.isConnected());
    }

    @Test
    void missingSocketFileIsUnreachable() {
        String path = dir.resolve("absent.sock").toString();
        var connection = new JedisStoreConnection(StoreTarget.localSocket(path), null, 500, 500);

        StoreException e = assertThrows(StoreException.class, connection::connect);

        assertEquals(StoreException.Kind.UNREACHABLE, e.kind());
        assertTrue(e.getMessage().contains(path));
    }

    /**
     * Minimal RESP server that records every command it receives and answers
     * INCR with 1 and anything else with OK.
     */
    private static class RespServer implements AutoCloseable {
        private final ServerSocket socket;
        private final List<String> commands = new CopyOnWriteArrayList<>();
        private final List<Socket> clients = new CopyOnWriteArrayList<>();

        private RespServer(ServerSocket socket) {
            this.socket = socket;
        }

        static RespServer start(ServerSocket socket) {
            RespServer server = new RespServer(socket);
            Thread acceptor = new Thread(server::accept, "resp-server");
            acceptor.setDaemon(true);
            acceptor.start();
            return server;
        }

        int port() {
            return socket.getLocalPort();
        }

        List<String> commands() {
            return List.copyOf(commands);
        }

        private void accept() {
            while (!socket.isClosed()) {
                try {
                    Socket client = socket.accept();
                    clients.add(client);
                    Thread handler = new Thread(() -> serve(client), "resp-client");
                    handler.setDaemon(true);
                    handler.start();
                } catch (IOException e) {
                    return;
                }
            }
        }

        private void serve(Socket client) {
            try (client) {
                InputStream in = client.getInputStream();
                OutputStream out = client.getOutputStream();
                while (true) {
                    List<String> command = readCommand(in);
                    if (command == null) {
                        return;
                    }
                    commands.add(String.join(" ", command));
                    String reply = command.get(0).equalsIgnoreCase("INCR") ? ":1\r\n" : "+OK\r\n";
                    out.write(reply.getBytes(StandardCharsets.UTF_8));
                    out.flush();
                }
            } catch (IOException e) {
                // client went away
            }
        }

        private static List<String> readCommand(InputStream in) throws IOException {
            String header = readLine(in);
            if (header == null) {
                return null;
            }
            int count = Integer.parseInt(header.substring(1));
            List<String> parts = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                int length = Integer.parseInt(readLine(in).substring(1));
                byte[] data = in.readNBytes(length);
                in.readNBytes(2);
                parts.add(new String(data, StandardCharsets.UTF_8));
            }
            return parts;
        }

        private static String readLine(InputStream in) throws IOException {
            ByteArrayOutputStream line = new ByteArrayOutputStream();
            int b;
            while ((b = in.read()) != -1) {
                if (b == '\r') {
                    in.read();
                    return line.toString(StandardCharsets.UTF_8);
                }
                line.write(b);
            }
            return null;
        }

        @Override
        public void close() throws IOException {
            socket.close();
            for (Socket client : clients) {
                client.close();
            }
        }
    }
}
