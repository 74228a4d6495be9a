package me.internalizable.tatc.testing;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Minimal HTTP/1.1 client over a plain socket.
 *
 * <p>Every response from the front end closes the connection, so a response is simply everything
 * read until end of stream.</p>
 */
public final class RawHttpClient {

    private static final Duration READ_TIMEOUT = Duration.ofSeconds(10);

    private RawHttpClient() {
    }

    /**
     * A parsed response. {@link #status()} is {@code -1} when the connection was closed without one.
     */
    public record Response(int status, Map<String, String> headers, String body) {

        public String header(String name) {
            return headers.get(name.toLowerCase(Locale.ROOT));
        }

        public boolean closedWithoutResponse() {
            return status == -1;
        }
    }

    public static Response get(int port, String target, String... headerPairs) throws IOException {
        return send(port, "GET", target, "", headerPairs);
    }

    public static Response send(int port, String method, String target, String body, String... headerPairs)
            throws IOException {
        if (headerPairs.length % 2 != 0) {
            throw new IllegalArgumentException("header names and values must come in pairs");
        }
        StringBuilder request = new StringBuilder()
                .append(method).append(' ').append(target).append(" HTTP/1.1\r\n")
                .append("Host: localhost:").append(port).append("\r\n");
        for (int i = 0; i < headerPairs.length; i += 2) {
            request.append(headerPairs[i]).append(": ").append(headerPairs[i + 1]).append("\r\n");
        }
        byte[] bodyBytes = body.getBytes(StandardCharsets.UTF_8);
        if (bodyBytes.length > 0) {
            request.append("Content-Length: ").append(bodyBytes.length).append("\r\n");
        }
        request.append("\r\n");

        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(InetAddress.getLoopbackAddress(), port), 5000);
            socket.setSoTimeout((int) READ_TIMEOUT.toMillis());

            OutputStream out = socket.getOutputStream();
            out.write(request.toString().getBytes(StandardCharsets.US_ASCII));
            out.write(bodyBytes);
            out.flush();

            return parse(readAll(socket.getInputStream()));
        }
    }

    private static byte[] readAll(InputStream in) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        byte[] chunk = new byte[4096];
        try {
            int read;
            while ((read = in.read(chunk)) != -1) {
                buffer.write(chunk, 0, read);
            }
        } catch (SocketException e) {
            // reset by the server after closing, keep what arrived
        }
        return buffer.toByteArray();
    }

    private static Response parse(byte[] raw) {
        if (raw.length == 0) {
            return new Response(-1, Map.of(), "");
        }
        String text = new String(raw, StandardCharsets.UTF_8);
        int headEnd = text.indexOf("\r\n\r\n");
        String head = headEnd >= 0 ? text.substring(0, headEnd) : text;
        String body = headEnd >= 0 ? text.substring(headEnd + 4) : "";

        String[] lines = head.split("\r\n");
        int status = Integer.parseInt(lines[0].split(" ")[1]);
        Map<String, String> headers = new LinkedHashMap<>();
        for (int i = 1; i < lines.length; i++) {
            int colon = lines[i].indexOf(':');
            if (colon > 0) {
                headers.put(lines[i].substring(0, colon).trim().toLowerCase(Locale.ROOT),
                        lines[i].substring(colon + 1).trim());
            }
        }
        return new Response(status, headers, body);
    }

    /**
     * Polls {@code condition} until it holds.
     *
     * @throws AssertionError if it does not hold within {@code timeout}
     */
    public static void awaitCondition(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within " + timeout);
            }
            Thread.sleep(10);
        }
    }
}
