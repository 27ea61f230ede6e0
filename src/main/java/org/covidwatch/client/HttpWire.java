package org.covidwatch.client;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;

/**
 * Low-level HTTP/1.1 wire formatting for the snapshot fetcher: request serialization and
 * splitting of a raw response into status, headers and body.
 */
final class HttpWire {

    static final int OK = 200;

    private static final byte[] HEADER_END = {'\r', '\n', '\r', '\n'};

    private HttpWire() {}

    /**
     * Builds a raw HTTP/1.1 request head.
     *
     * @param extraHeaders optional additional headers (can be null)
     */
    static String buildRequest(String method, String path, String host, int port,
                               Map<String, String> extraHeaders) {
        StringBuilder sb = new StringBuilder();
        sb.append(method).append(' ').append(path).append(" HTTP/1.1\r\n");
        sb.append("Host: ").append(host);
        if (port != 80 && port != 443) {
            sb.append(':').append(port);
        }
        sb.append("\r\n");
        if (extraHeaders != null) {
            for (Map.Entry<String, String> e : extraHeaders.entrySet()) {
                sb.append(e.getKey()).append(": ").append(e.getValue()).append("\r\n");
            }
        }
        sb.append("\r\n");
        return sb.toString();
    }

    static void send(OutputStream out, String head) throws IOException {
        out.write(head.getBytes(StandardCharsets.US_ASCII));
        out.flush();
    }

    /** Reads until the server closes the connection (requests always carry {@code Connection: close}). */
    static Response read(InputStream in) throws IOException {
        byte[] raw = in.readAllBytes();
        int split = indexOf(raw, HEADER_END);
        if (split < 0) {
            throw new IOException("truncated HTTP response (" + raw.length + " bytes, no header end)");
        }
        String head = new String(raw, 0, split, StandardCharsets.ISO_8859_1);
        byte[] body = Arrays.copyOfRange(raw, split + HEADER_END.length, raw.length);
        Response r = new Response(statusCodeOf(statusLineOf(head)), head, body);
        if ("chunked".equalsIgnoreCase(r.header("Transfer-Encoding"))) {
            return new Response(r.status(), head, dechunk(body));
        }
        return r;
    }

    /** Parsed response; {@code status} is -1 when the status line is malformed. */
    record Response(int status, String head, byte[] body) {

        /** Header value by name (case-insensitive), or {@code null}. */
        String header(String name) {
            String[] lines = head.split("\r\n");
            for (int i = 1; i < lines.length; i++) {
                int c = lines[i].indexOf(':');
                if (c > 0 && lines[i].substring(0, c).trim().equalsIgnoreCase(name)) {
                    return lines[i].substring(c + 1).trim();
                }
            }
            return null;
        }

        String statusLine() {
            return statusLineOf(head);
        }
    }

    static String statusLineOf(String head) {
        int i = head.indexOf("\r\n");
        return (i >= 0) ? head.substring(0, i) : head;
    }

    static int statusCodeOf(String statusLine) {
        String[] parts = statusLine.split(" ");
        if (parts.length >= 2) {
            try {
                return Integer.parseInt(parts[1]);
            } catch (NumberFormatException e) {
                return -1;
            }
        }
        return -1;
    }

    static byte[] dechunk(byte[] body) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(body.length);
        int pos = 0;
        while (true) {
            int eol = indexOf(body, new byte[]{'\r', '\n'}, pos);
            if (eol < 0) {
                throw new IOException("malformed chunked body");
            }
            String sizeLine = new String(body, pos, eol - pos, StandardCharsets.US_ASCII);
            int semi = sizeLine.indexOf(';');
            int size;
            try {
                size = Integer.parseInt((semi >= 0 ? sizeLine.substring(0, semi) : sizeLine).trim(), 16);
            } catch (NumberFormatException e) {
                throw new IOException("bad chunk size '" + sizeLine + "'", e);
            }
            pos = eol + 2;
            if (size == 0) {
                return out.toByteArray();
            }
            if (pos + size > body.length) {
                throw new IOException("truncated chunk");
            }
            out.write(body, pos, size);
            pos += size + 2;
        }
    }

    private static int indexOf(byte[] data, byte[] needle) {
        return indexOf(data, needle, 0);
    }

    private static int indexOf(byte[] data, byte[] needle, int from) {
        outer:
        for (int i = from; i <= data.length - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (data[i + j] != needle[j]) continue outer;
            }
            return i;
        }
        return -1;
    }
}
