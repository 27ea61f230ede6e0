package org.covidwatch.persistence;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.covidwatch.exceptions.StoreCorruptionException;
import org.covidwatch.exceptions.StoreWriteException;
import org.covidwatch.exceptions.SubscriptionLimitException;
import org.covidwatch.interfaces.SubscriptionStore;
import org.covidwatch.model.MetricSet;
import org.covidwatch.model.Region;
import org.covidwatch.model.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FileSubscriptionStore keeps every subscription in one JSON document on disk.
 * <p>
 * <b>Durability notes:</b>
 * <ul>
 *     <li>Each mutation writes the whole document to {@code <file>.tmp}, forces it to disk and
 *         atomically moves it over the previous file, so a crash leaves either the old or the
 *         new document, never a partial one.</li>
 *     <li>The in-memory view is swapped only after the move succeeded; a failed write leaves
 *         both disk and memory at the previous state.</li>
 *     <li>All mutations run under one lock (single writer). Reads see an immutable copy and
 *         never block.</li>
 *     <li>An unreadable file stops startup with {@link StoreCorruptionException} unless
 *         recovery is enabled, in which case it is moved aside before starting empty.</li>
 * </ul>
 */
public final class FileSubscriptionStore implements SubscriptionStore {

    private static final Logger log = LoggerFactory.getLogger(FileSubscriptionStore.class);

    static final int FORMAT_VERSION = 1;

    private static final Gson GSON = new GsonBuilder()
            .registerTypeAdapter(Instant.class, new InstantTypeAdapter().nullSafe())
            .serializeNulls()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    // Timestamp pattern for quarantined files, ensures lexical ordering by time.
    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS");

    private final Path file;
    private final int maxPerSubscriber;
    private final ReentrantLock writeLock = new ReentrantLock(true);

    /** Immutable; replaced as a whole after every successful write. */
    private volatile Map<String, SortedMap<Region, Subscription>> state;

    private FileSubscriptionStore(Path file, int maxPerSubscriber,
                                  Map<String, SortedMap<Region, Subscription>> initial) {
        this.file = file;
        this.maxPerSubscriber = maxPerSubscriber;
        this.state = initial;
    }

    /**
     * Opens the store, loading the existing file if there is one.
     *
     * @param file                durable location
     * @param maxPerSubscriber    subscriptions allowed per subscriber
     * @param recoverOnCorruption quarantine an unreadable file and start empty instead of failing
     * @throws StoreCorruptionException when the file is unreadable and recovery is off
     */
    public static FileSubscriptionStore open(Path file, int maxPerSubscriber, boolean recoverOnCorruption) {
        if (maxPerSubscriber < 1) {
            throw new IllegalArgumentException("maxPerSubscriber must be >= 1: " + maxPerSubscriber);
        }
        Map<String, SortedMap<Region, Subscription>> initial;
        try {
            initial = load(file);
        } catch (StoreCorruptionException e) {
            if (!recoverOnCorruption) {
                throw e;
            }
            Path quarantined = quarantine(file);
            log.error("Subscription store {} was unreadable ({}); moved to {} and starting empty",
                    file, e.getMessage(), quarantined);
            initial = Collections.emptyMap();
        }
        int count = initial.values().stream().mapToInt(Map::size).sum();
        log.info("Opened subscription store {}: {} subscribers, {} subscriptions", file, initial.size(), count);
        return new FileSubscriptionStore(file, maxPerSubscriber, initial);
    }

    public Path file() {
        return file;
    }

    // -----------------------------------------------------------------------
    // SubscriptionStore
    // -----------------------------------------------------------------------

    @Override
    public boolean subscribe(String subscriberId, Region region)
            throws StoreWriteException, SubscriptionLimitException {
        requireId(subscriberId);
        writeLock.lock();
        try {
            SortedMap<Region, Subscription> current = state.getOrDefault(subscriberId, Collections.emptySortedMap());
            if (current.containsKey(region)) {
                return false;
            }
            if (current.size() >= maxPerSubscriber) {
                throw new SubscriptionLimitException(subscriberId, maxPerSubscriber);
            }
            Map<String, SortedMap<Region, Subscription>> next = copyState();
            next.computeIfAbsent(subscriberId, k -> new TreeMap<>())
                    .put(region, new Subscription(subscriberId, region, null));
            commit(next);
            log.info("Subscribed {} to {}", subscriberId, region.displayName());
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean unsubscribe(String subscriberId, Region region) throws StoreWriteException {
        requireId(subscriberId);
        writeLock.lock();
        try {
            SortedMap<Region, Subscription> current = state.get(subscriberId);
            if (current == null || !current.containsKey(region)) {
                return false;
            }
            Map<String, SortedMap<Region, Subscription>> next = copyState();
            SortedMap<Region, Subscription> regions = next.get(subscriberId);
            regions.remove(region);
            if (regions.isEmpty()) {
                // drop the whole entry once nothing is left
                next.remove(subscriberId);
            }
            commit(next);
            log.info("Unsubscribed {} from {}", subscriberId, region.displayName());
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public SortedSet<Region> listFor(String subscriberId) {
        SortedMap<Region, Subscription> regions = state.get(subscriberId);
        if (regions == null) {
            return Collections.emptySortedSet();
        }
        return Collections.unmodifiableSortedSet(new TreeSet<>(regions.keySet()));
    }

    @Override
    public List<Subscription> allSubscriptions() {
        List<Subscription> out = new ArrayList<>();
        new TreeMap<>(state).values().forEach(m -> out.addAll(m.values()));
        return Collections.unmodifiableList(out);
    }

    @Override
    public void recordNotified(String subscriberId, Region region, MetricSet metrics) throws StoreWriteException {
        writeLock.lock();
        try {
            SortedMap<Region, Subscription> current = state.get(subscriberId);
            if (current == null || !current.containsKey(region)) {
                log.debug("recordNotified for removed subscription {} / {}", subscriberId, region);
                return;
            }
            Map<String, SortedMap<Region, Subscription>> next = copyState();
            SortedMap<Region, Subscription> regions = next.get(subscriberId);
            regions.put(region, regions.get(region).withLastNotified(metrics));
            commit(next);
        } finally {
            writeLock.unlock();
        }
    }

    /* -------------------- write path -------------------- */

    private Map<String, SortedMap<Region, Subscription>> copyState() {
        Map<String, SortedMap<Region, Subscription>> copy = new TreeMap<>();
        state.forEach((id, regions) -> copy.put(id, new TreeMap<>(regions)));
        return copy;
    }

    /** Persist then publish; the caller holds the write lock. */
    private void commit(Map<String, SortedMap<Region, Subscription>> next) throws StoreWriteException {
        try {
            writeAtomically(file, toDocument(next));
        } catch (IOException e) {
            log.error("Subscription store write to {} failed: {}", file, e.getMessage());
            throw new StoreWriteException("could not persist subscriptions to " + file, e);
        }
        Map<String, SortedMap<Region, Subscription>> frozen = new TreeMap<>();
        next.forEach((id, regions) -> frozen.put(id, Collections.unmodifiableSortedMap(regions)));
        state = Collections.unmodifiableMap(frozen);
    }

    static void writeAtomically(Path file, StoreDocument doc) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        byte[] bytes = GSON.toJson(doc).getBytes(StandardCharsets.UTF_8);

        // Use temporary file for atomic write; a crash mid-write only ever damages the .tmp
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
        }

        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to replace", file);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /* -------------------- read path -------------------- */

    static Map<String, SortedMap<Region, Subscription>> load(Path file) {
        if (!Files.exists(file)) {
            return Collections.emptyMap();
        }
        StoreDocument doc;
        try {
            String json = Files.readString(file, StandardCharsets.UTF_8);
            if (json.isBlank()) {
                throw new StoreCorruptionException(file, "file is empty", null);
            }
            doc = GSON.fromJson(json, StoreDocument.class);
        } catch (IOException e) {
            throw new StoreCorruptionException(file, e.getMessage(), e);
        } catch (RuntimeException e) {
            if (e instanceof StoreCorruptionException) throw (StoreCorruptionException) e;
            throw new StoreCorruptionException(file, e.getMessage(), e);
        }
        return fromDocument(file, doc);
    }

    private static Map<String, SortedMap<Region, Subscription>> fromDocument(Path file, StoreDocument doc) {
        if (doc == null || doc.subscribers == null) {
            throw new StoreCorruptionException(file, "missing 'subscribers'", null);
        }
        if (doc.version != FORMAT_VERSION) {
            throw new StoreCorruptionException(file, "unsupported format version " + doc.version, null);
        }
        Map<String, SortedMap<Region, Subscription>> out = new TreeMap<>();
        for (Map.Entry<String, List<StoredSubscription>> e : doc.subscribers.entrySet()) {
            String id = e.getKey();
            if (id == null || id.isBlank() || e.getValue() == null) {
                throw new StoreCorruptionException(file, "invalid subscriber entry '" + id + "'", null);
            }
            SortedMap<Region, Subscription> regions = new TreeMap<>();
            for (StoredSubscription s : e.getValue()) {
                if (s == null || s.region == null) {
                    throw new StoreCorruptionException(file, "subscription without region for " + id, null);
                }
                regions.put(s.region, new Subscription(id, s.region, s.lastNotified));
            }
            if (!regions.isEmpty()) {
                out.put(id, Collections.unmodifiableSortedMap(regions));
            }
        }
        return Collections.unmodifiableMap(out);
    }

    private static StoreDocument toDocument(Map<String, SortedMap<Region, Subscription>> state) {
        StoreDocument doc = new StoreDocument();
        doc.version = FORMAT_VERSION;
        doc.subscribers = new LinkedHashMap<>();
        new TreeMap<>(state).forEach((id, regions) -> {
            List<StoredSubscription> list = new ArrayList<>();
            regions.values().forEach(s -> list.add(new StoredSubscription(s.region(), s.lastNotified())));
            doc.subscribers.put(id, list);
        });
        return doc;
    }

    private static Path quarantine(Path file) {
        String stamp = LocalDateTime.now().format(TS);
        Path target = file.resolveSibling(file.getFileName() + ".corrupt-" + stamp);
        try {
            Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
            return target;
        } catch (IOException e) {
            throw new StoreCorruptionException(file, "could not quarantine: " + e.getMessage(), e);
        }
    }

    private static void requireId(String subscriberId) {
        if (subscriberId == null || subscriberId.isBlank()) {
            throw new IllegalArgumentException("blank subscriber id");
        }
    }

    /* ---- JSON shape ---- */

    static final class StoreDocument {
        int version;
        Map<String, List<StoredSubscription>> subscribers;
    }

    static final class StoredSubscription {
        Region region;
        MetricSet lastNotified;

        StoredSubscription(Region region, MetricSet lastNotified) {
            this.region = region;
            this.lastNotified = lastNotified;
        }
    }
}
