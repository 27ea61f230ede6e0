package org.covidwatch;

import org.covidwatch.client.HttpSnapshotFetcher;
import org.covidwatch.client.PathSnapshotFetcher;
import org.covidwatch.client.SnapshotFetchers;
import org.covidwatch.exceptions.FetchException;
import org.covidwatch.exceptions.FetchTimeoutException;
import org.covidwatch.interfaces.SnapshotFetcher;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class HttpSnapshotFetcherTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Test
    void ok_returnsBody_andSendsGet() throws Exception {
        try (ServerSocket ss = new ServerSocket(0)) {
            List<String> requests = new CopyOnWriteArrayList<>();
            serve(ss, requests, response("200 OK", "Country_Region,Confirmed\r\nItaly,5\r\n"));

            byte[] body = new HttpSnapshotFetcher(uri(ss, "/daily.csv?x=1"), TIMEOUT).fetch();

            assertEquals("Country_Region,Confirmed\r\nItaly,5\r\n", new String(body, StandardCharsets.UTF_8));
            assertEquals(1, requests.size());
            assertTrue(requests.get(0).startsWith("GET /daily.csv?x=1 HTTP/1.1\r\n"), requests.get(0));
            assertTrue(requests.get(0).contains("Connection: close"));
        }
    }

    @Test
    void notFound_isFetchException() throws Exception {
        try (ServerSocket ss = new ServerSocket(0)) {
            serve(ss, new CopyOnWriteArrayList<>(), response("404 Not Found", ""));

            FetchException e = assertThrows(FetchException.class,
                    () -> new HttpSnapshotFetcher(uri(ss, "/missing.csv"), TIMEOUT).fetch());
            assertFalse(e instanceof FetchTimeoutException);
            assertTrue(e.getMessage().contains("404"), e.getMessage());
        }
    }

    @Test
    void chunkedBody_isReassembled() throws Exception {
        try (ServerSocket ss = new ServerSocket(0)) {
            String resp = "HTTP/1.1 200 OK\r\n"
                    + "Transfer-Encoding: chunked\r\n\r\n"
                    + "7\r\nCountry\r\n"
                    + "a\r\n_Region\r\nX\r\n"
                    + "0\r\n\r\n";
            serve(ss, new CopyOnWriteArrayList<>(), resp);

            byte[] body = new HttpSnapshotFetcher(uri(ss, "/"), TIMEOUT).fetch();
            assertEquals("Country_Region\r\nX", new String(body, StandardCharsets.UTF_8));
        }
    }

    @Test
    void redirect_isFollowed() throws Exception {
        try (ServerSocket ss = new ServerSocket(0)) {
            List<String> requests = new CopyOnWriteArrayList<>();
            serve(ss, requests,
                    "HTTP/1.1 302 Found\r\nLocation: /moved.csv\r\nContent-Length: 0\r\n\r\n",
                    response("200 OK", "moved"));

            byte[] body = new HttpSnapshotFetcher(uri(ss, "/old.csv"), TIMEOUT).fetch();

            assertEquals("moved", new String(body, StandardCharsets.UTF_8));
            assertEquals(2, requests.size());
            assertTrue(requests.get(1).startsWith("GET /moved.csv "), requests.get(1));
        }
    }

    @Test
    void silentServer_isFetchTimeout() throws Exception {
        try (ServerSocket ss = new ServerSocket(0)) {
            Thread stub = new Thread(() -> {
                try (Socket c = ss.accept()) {
                    consumeHeaders(c.getInputStream());
                    Thread.sleep(3_000);
                } catch (IOException | InterruptedException ignored) {}
            }, "silent-stub");
            stub.setDaemon(true);
            stub.start();

            assertThrows(FetchTimeoutException.class,
                    () -> new HttpSnapshotFetcher(uri(ss, "/slow.csv"), Duration.ofMillis(200)).fetch());
            stub.interrupt();
        }
    }

    @Test
    void refusedConnection_isFetchException() throws Exception {
        int port;
        try (ServerSocket ss = new ServerSocket(0)) {
            port = ss.getLocalPort();
        }
        SnapshotFetcher f = new HttpSnapshotFetcher(URI.create("http://localhost:" + port + "/"), TIMEOUT);
        assertThrows(FetchException.class, f::fetch);
    }

    @Test
    void nonHttpUri_isRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new HttpSnapshotFetcher(URI.create("ftp://example.org/x.csv"), TIMEOUT));
    }

    @Test
    void locations_pickTheRightFetcher(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("snapshot.csv");
        Files.writeString(file, "Country_Region\nItaly\n");

        assertTrue(SnapshotFetchers.forLocation("https://example.org/a.csv", TIMEOUT) instanceof HttpSnapshotFetcher);
        SnapshotFetcher byPath = SnapshotFetchers.forLocation(file.toString(), TIMEOUT);
        SnapshotFetcher byUri = SnapshotFetchers.forLocation(file.toUri().toString(), TIMEOUT);
        assertTrue(byPath instanceof PathSnapshotFetcher);
        assertArrayEquals(Files.readAllBytes(file), byPath.fetch());
        assertArrayEquals(Files.readAllBytes(file), byUri.fetch());
        assertThrows(IllegalArgumentException.class, () -> SnapshotFetchers.forLocation(" ", TIMEOUT));
    }

    @Test
    void missingFile_isFetchException(@TempDir Path dir) {
        SnapshotFetcher f = new PathSnapshotFetcher(dir.resolve("nope.csv"));
        FetchException e = assertThrows(FetchException.class, f::fetch);
        assertTrue(e.getMessage().contains("not found"), e.getMessage());
    }

    /* -------------------- stub server -------------------- */

    private static URI uri(ServerSocket ss, String path) {
        return URI.create("http://localhost:" + ss.getLocalPort() + path);
    }

    private static String response(String status, String body) {
        return "HTTP/1.1 " + status + "\r\n"
                + "Content-Type: text/csv\r\n"
                + "Content-Length: " + body.getBytes(StandardCharsets.UTF_8).length + "\r\n\r\n"
                + body;
    }

    /** Answers one connection per canned response, in order, recording each request head. */
    private static void serve(ServerSocket ss, List<String> requests, String... responses) {
        Thread stub = new Thread(() -> {
            for (String resp : responses) {
                try (Socket c = ss.accept()) {
                    requests.add(consumeHeaders(c.getInputStream()));
                    c.getOutputStream().write(resp.getBytes(StandardCharsets.UTF_8));
                    c.getOutputStream().flush();
                } catch (IOException e) {
                    return;
                }
            }
        }, "snapshot-stub");
        stub.setDaemon(true);
        stub.start();
    }

    private static String consumeHeaders(InputStream in) throws IOException {
        ByteArrayOutputStream head = new ByteArrayOutputStream();
        int state = 0, b;
        while ((b = in.read()) != -1) {
            head.write(b);
            if (state == 0 && b == '\r') state = 1;
            else if (state == 1 && b == '\n') state = 2;
            else if (state == 2 && b == '\r') state = 3;
            else if (state == 3 && b == '\n') break;
            else state = 0;
        }
        return head.toString(StandardCharsets.US_ASCII);
    }
}
