package com.p14n.eventbridge.store;

import java.io.File;
import java.io.IOException;
import java.net.Socket;

import org.newsclub.net.unix.AFUNIXSocket;
import org.newsclub.net.unix.AFUNIXSocketAddress;

import redis.clients.jedis.JedisSocketFactory;
import redis.clients.jedis.exceptions.JedisConnectionException;

/**
 * Creates sockets connected to the store's local socket file.
 */
public class UnixSocketFactory implements JedisSocketFactory {

    private final File path;
    private final int connectTimeoutMillis;
    private final int socketTimeoutMillis;

    public UnixSocketFactory(File path, int connectTimeoutMillis, int socketTimeoutMillis) {
        this.path = path;
        this.connectTimeoutMillis = connectTimeoutMillis;
        this.socketTimeoutMillis = socketTimeoutMillis;
    }

    @Override
    public Socket createSocket() throws JedisConnectionException {
        AFUNIXSocket socket = null;
        try {
            socket = AFUNIXSocket.newInstance();
            socket.setSoTimeout(socketTimeoutMillis);
            socket.connect(AFUNIXSocketAddress.of(path), connectTimeoutMillis);
            return socket;
        } catch (IOException e) {
            closeQuietly(socket, e);
            throw new JedisConnectionException("Failed to connect to " + path, e);
        }
    }

    private static void closeQuietly(Socket socket, IOException cause) {
        if (socket == null) {
            return;
        }
        try {
            socket.close();
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }
}
