package org.covidwatch.client;

import org.covidwatch.exceptions.FetchException;
import org.covidwatch.exceptions.FetchTimeoutException;
import org.covidwatch.interfaces.SnapshotFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * HttpSnapshotFetcher downloads the raw snapshot with a plain HTTP/1.1 GET.
 * <p>
 * <b>Notes:</b>
 * <ul>
 *     <li>One connection per fetch, always {@code Connection: close}; the body ends at EOF.</li>
 *     <li>{@code https} URLs are layered over the same socket with the JVM default TLS settings.</li>
 *     <li>Redirects are followed up to {@value #MAX_REDIRECTS} hops.</li>
 *     <li>Any status other than 200 is a {@link FetchException}; a connect or read timeout is a
 *         {@link FetchTimeoutException}. Retrying is the caller's job.</li>
 * </ul>
 */
public final class HttpSnapshotFetcher implements SnapshotFetcher {

    private static final Logger log = LoggerFactory.getLogger(HttpSnapshotFetcher.class);

    static final int MAX_REDIRECTS = 3;

    private final URI uri;
    private final int connectTimeoutMs;
    private final int readTimeoutMs;

    /**
     * @param uri     http or https location of the CSV snapshot
     * @param timeout bound for connecting and for each blocking read
     */
    public HttpSnapshotFetcher(URI uri, Duration timeout) {
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("not an http(s) URL: " + uri);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("URL without host: " + uri);
        }
        this.uri = uri;
        int ms = (int) Math.min(Integer.MAX_VALUE, Math.max(1, timeout.toMillis()));
        this.connectTimeoutMs = ms;
        this.readTimeoutMs = ms;
    }

    @Override
    public byte[] fetch() throws FetchException {
        URI target = uri;
        for (int hop = 0; hop <= MAX_REDIRECTS; hop++) {
            HttpWire.Response resp = get(target);
            int status = resp.status();
            if (status == HttpWire.OK) {
                log.debug("Fetched {} bytes from {}", resp.body().length, target);
                return resp.body();
            }
            String location = resp.header("Location");
            if (isRedirect(status) && location != null) {
                target = target.resolve(location);
                log.debug("Following {} redirect to {}", status, target);
                continue;
            }
            throw new FetchException("HTTP " + status + " from " + target + " (" + resp.statusLine() + ")");
        }
        throw new FetchException("too many redirects from " + uri);
    }

    @Override
    public String describe() {
        return uri.toString();
    }

    private HttpWire.Response get(URI target) throws FetchException {
        boolean tls = "https".equalsIgnoreCase(target.getScheme());
        String host = target.getHost();
        int port = target.getPort() > 0 ? target.getPort() : (tls ? 443 : 80);
        String path = target.getRawPath() == null || target.getRawPath().isEmpty() ? "/" : target.getRawPath();
        if (target.getRawQuery() != null) {
            path += "?" + target.getRawQuery();
        }

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", "covid-watch");
        headers.put("Accept", "text/csv, text/plain, */*");
        headers.put("Connection", "close");
        String request = HttpWire.buildRequest("GET", path, host, port, headers);

        Socket plain = new Socket();
        try {
            plain.connect(new InetSocketAddress(host, port), connectTimeoutMs);
            plain.setSoTimeout(readTimeoutMs);
            Socket socket = tls ? wrapTls(plain, host, port) : plain;
            HttpWire.send(socket.getOutputStream(), request);
            return HttpWire.read(socket.getInputStream());
        } catch (SocketTimeoutException e) {
            throw new FetchTimeoutException("timed out fetching " + target, e);
        } catch (IOException e) {
            throw new FetchException("could not fetch " + target + ": " + e.getMessage(), e);
        } finally {
            closeQuietly(plain);
        }
    }

    private static Socket wrapTls(Socket plain, String host, int port) throws IOException {
        SSLSocket ssl = (SSLSocket) ((SSLSocketFactory) SSLSocketFactory.getDefault())
                .createSocket(plain, host, port, true);
        ssl.startHandshake();
        return ssl;
    }

    private static boolean isRedirect(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    private static void closeQuietly(Socket s) {
        try {
            s.close();
        } catch (IOException e) {
            log.debug("Closing socket failed: {}", e.getMessage());
        }
    }
}
