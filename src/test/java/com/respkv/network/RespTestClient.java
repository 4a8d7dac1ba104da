package com.respkv.network;

import com.respkv.network.protocol.RespEncoder;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Minimal blocking RESP client for socket-level tests.
 * Replies are returned exactly as they appeared on the wire.
 */
class RespTestClient implements Closeable {

    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;

    RespTestClient(int port) throws IOException {
        this.socket = new Socket("127.0.0.1", port);
        socket.setTcpNoDelay(true);
        socket.setSoTimeout(10_000);
        this.in = socket.getInputStream();
        this.out = socket.getOutputStream();
    }

    void send(String... parts) throws IOException {
        sendRaw(toBytes(RespEncoder.encodeCommand(parts)));
    }

    void send(byte[]... parts) throws IOException {
        sendRaw(toBytes(RespEncoder.encodeCommand(parts)));
    }

    void sendRaw(byte[] bytes) throws IOException {
        out.write(bytes);
        out.flush();
    }

    void sendRaw(String wire) throws IOException {
        sendRaw(wire.getBytes(StandardCharsets.ISO_8859_1));
    }

    String call(String... parts) throws IOException {
        send(parts);
        return readReply();
    }

    /**
     * Read one reply and return its exact wire bytes as ISO-8859-1 text.
     */
    String readReply() throws IOException {
        return new String(readReplyBytes(), StandardCharsets.ISO_8859_1);
    }

    byte[] readReplyBytes() throws IOException {
        ByteArrayOutputStream reply = new ByteArrayOutputStream();
        byte[] line = readLine();
        reply.write(line);
        if (line[0] == '$') {
            int length = Integer.parseInt(new String(line, 1, line.length - 3, StandardCharsets.US_ASCII));
            if (length >= 0) {
                reply.write(readExactly(length + 2));
            }
        }
        return reply.toByteArray();
    }

    /**
     * Check whether the server has closed the connection.
     */
    boolean isClosedByServer() throws IOException {
        try {
            return in.read() == -1;
        } catch (SocketException e) {
            return true;
        }
    }

    private byte[] readLine() throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        int previous = -1;
        while (true) {
            int b = in.read();
            if (b == -1) {
                throw new EOFException("Connection closed after " + line.size() + " bytes");
            }
            line.write(b);
            if (previous == '\r' && b == '\n') {
                return line.toByteArray();
            }
            previous = b;
        }
    }

    private byte[] readExactly(int length) throws IOException {
        byte[] data = new byte[length];
        int offset = 0;
        while (offset < length) {
            int read = in.read(data, offset, length - offset);
            if (read == -1) {
                throw new EOFException("Connection closed mid-reply");
            }
            offset += read;
        }
        return data;
    }

    private static byte[] toBytes(ByteBuffer buffer) {
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        return bytes;
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }
}
