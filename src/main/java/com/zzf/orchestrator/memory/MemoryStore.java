package com.zzf.orchestrator.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.RandomAccessFile;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only memory store backed by {@code memory.jsonl}.
 *
 * <p>Adds and updates append the full entry state, deletes append a tombstone. The current value
 * of an id is its most recent record. The index maps each live id to the byte offset of that
 * record and is rebuilt by replaying the log whenever {@code index.json} does not match the log
 * length. Appends are serialized by a write lock; reads share a read lock.
 */
@Slf4j
public class MemoryStore {
    static final String LOG_FILE = "memory.jsonl";
    static final String INDEX_FILE = "index.json";
    private static final byte NEWLINE = '\n';

    private final String name;
    private final Path directory;
    private final Path logPath;
    private final Path indexPath;
    private final int maxEntries;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, AccessStat> accessStats = new ConcurrentHashMap<>();
    private MemoryIndex index = new MemoryIndex();

    public MemoryStore(String name, Path directory, int maxEntries, ObjectMapper mapper) throws IOException {
        this(name, directory, maxEntries, mapper, Clock.systemUTC());
    }

    MemoryStore(String name, Path directory, int maxEntries, ObjectMapper mapper, Clock clock) throws IOException {
        this.name = name;
        this.directory = directory.toAbsolutePath().normalize();
        this.logPath = this.directory.resolve(LOG_FILE);
        this.indexPath = this.directory.resolve(INDEX_FILE);
        this.maxEntries = maxEntries;
        this.mapper = mapper;
        this.clock = clock;
        open();
    }

    public String getName() {
        return name;
    }

    public Path getDirectory() {
        return directory;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public StoreOutcome<MemoryEntry> add(String content, MemoryKind kind, Set<String> tags, double importance, String source) {
        String problem = validate(content, kind, importance);
        if (problem != null) {
            return StoreOutcome.invalid(problem);
        }
        lock.writeLock().lock();
        try {
            if (maxEntries > 0 && index.getCurrent().size() >= maxEntries) {
                log.warn("memory.capacity store={} maxEntries={}", name, maxEntries);
                return StoreOutcome.capacityExceeded(maxEntries);
            }
            long now = clock.millis();
            MemoryEntry entry = MemoryEntry.builder()
                    .id(newId())
                    .createdAt(now)
                    .updatedAt(now)
                    .lastAccessed(now)
                    .kind(kind)
                    .content(content)
                    .tags(cleanTags(tags))
                    .importance(importance)
                    .accessCount(0)
                    .source(source == null || source.isBlank() ? "llm" : source.trim())
                    .build();
            append(MemoryRecord.put(entry, now));
            log.info("memory.add store={} id={} kind={} importance={}", name, entry.getId(), kind.wireValue(), importance);
            return StoreOutcome.ok(entry.copy());
        } catch (IOException e) {
            return ioError("add", e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public StoreOutcome<MemoryEntry> get(String id) {
        if (id == null || id.isBlank()) {
            return StoreOutcome.invalid("memory id is required");
        }
        lock.readLock().lock();
        try {
            IndexEntry indexEntry = index.getCurrent().get(id.trim());
            if (indexEntry == null) {
                return StoreOutcome.notFound(id);
            }
            MemoryRecord record = readAt(indexEntry.getOffset());
            if (record == null || !record.isPut()) {
                log.error("memory.index_mismatch store={} id={} offset={}", name, id, indexEntry.getOffset());
                return StoreOutcome.notFound(id);
            }
            AccessStat stat = accessStats.computeIfAbsent(record.getId(), key -> new AccessStat());
            stat.touch(clock.millis());
            return StoreOutcome.ok(withAccess(record.getEntry()));
        } catch (IOException e) {
            return ioError("get", e);
        } finally {
            lock.readLock().unlock();
        }
    }

    public StoreOutcome<MemoryEntry> update(String id, MemoryPatch patch) {
        if (id == null || id.isBlank()) {
            return StoreOutcome.invalid("memory id is required");
        }
        if (patch == null || patch.isEmpty()) {
            return StoreOutcome.invalid("nothing to update");
        }
        lock.writeLock().lock();
        try {
            IndexEntry indexEntry = index.getCurrent().get(id.trim());
            if (indexEntry == null) {
                return StoreOutcome.notFound(id);
            }
            MemoryRecord record = readAt(indexEntry.getOffset());
            if (record == null || !record.isPut()) {
                return StoreOutcome.notFound(id);
            }
            MemoryEntry current = withAccess(record.getEntry());
            MemoryEntry next = current.toBuilder()
                    .content(patch.getContent() != null ? patch.getContent() : current.getContent())
                    .tags(patch.getTags() != null ? cleanTags(patch.getTags()) : current.getTags())
                    .importance(patch.getImportance() != null ? patch.getImportance() : current.getImportance())
                    .kind(patch.getKind() != null ? patch.getKind() : current.getKind())
                    .build();
            String problem = validate(next.getContent(), next.getKind(), next.getImportance());
            if (problem != null) {
                return StoreOutcome.invalid(problem);
            }
            long now = clock.millis();
            next.setUpdatedAt(now);
            next.setLastAccessed(now);
            append(MemoryRecord.put(next, now));
            accessStats.remove(next.getId());
            log.info("memory.update store={} id={}", name, next.getId());
            return StoreOutcome.ok(next.copy());
        } catch (IOException e) {
            return ioError("update", e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public StoreOutcome<String> delete(String id) {
        if (id == null || id.isBlank()) {
            return StoreOutcome.invalid("memory id is required");
        }
        lock.writeLock().lock();
        try {
            String key = id.trim();
            if (!index.getCurrent().containsKey(key)) {
                return StoreOutcome.notFound(id);
            }
            append(MemoryRecord.tombstone(key, clock.millis()));
            accessStats.remove(key);
            log.info("memory.delete store={} id={}", name, key);
            return StoreOutcome.ok(key);
        } catch (IOException e) {
            return ioError("delete", e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Single linear pass over the log; records superseded by a later record or a tombstone are
     * skipped.
     */
    public List<MemoryEntry> search(MemorySearchQuery query) {
        MemorySearchQuery q = query == null ? MemorySearchQuery.all() : query;
        String needle = q.getQuery() == null || q.getQuery().isBlank() ? null : q.getQuery().trim().toLowerCase(Locale.ROOT);
        List<Hit> hits = new ArrayList<>();
        lock.readLock().lock();
        try {
            forEachRecord((offset, record) -> {
                if (!record.isPut() || !index.isCurrent(record.getId(), offset)) {
                    return;
                }
                MemoryEntry entry = record.getEntry();
                if (matches(entry, q, needle)) {
                    hits.add(new Hit(offset, withAccess(entry)));
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + logPath, e);
        } finally {
            lock.readLock().unlock();
        }
        hits.sort(Comparator.comparingDouble((Hit h) -> h.entry.getImportance()).reversed()
                .thenComparing(Comparator.comparingLong((Hit h) -> h.entry.getUpdatedAt()).reversed())
                .thenComparing(Comparator.comparingLong((Hit h) -> h.offset).reversed()));
        List<MemoryEntry> results = new ArrayList<>();
        for (Hit hit : hits) {
            if (results.size() >= q.effectiveLimit()) {
                break;
            }
            results.add(hit.entry);
        }
        log.debug("memory.search store={} query={} hits={} returned={}", name, needle, hits.size(), results.size());
        return results;
    }

    public MemoryStats stats() {
        Map<String, Long> byKind = new TreeMap<>();
        double importanceSum = 0;
        long accesses = 0;
        int total;
        long sizeBytes;
        long lastUpdated;
        lock.readLock().lock();
        try {
            for (IndexEntry entry : index.getCurrent().values()) {
                byKind.merge(entry.getKind().wireValue(), 1L, Long::sum);
                importanceSum += entry.getImportance();
            }
            for (AccessStat stat : accessStats.values()) {
                accesses += stat.count();
            }
            accesses += persistedAccesses();
            total = index.getCurrent().size();
            sizeBytes = index.getLogSize();
            lastUpdated = index.getLastUpdated();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + logPath, e);
        } finally {
            lock.readLock().unlock();
        }
        return MemoryStats.builder()
                .memoryName(name)
                .totalEntries(total)
                .maxEntries(maxEntries)
                .countsByKind(byKind)
                .sizeBytes(sizeBytes)
                .lastUpdated(lastUpdated)
                .averageImportance(total == 0 ? 0.0 : importanceSum / total)
                .totalAccesses(accesses)
                .build();
    }

    public int size() {
        lock.readLock().lock();
        try {
            return index.getCurrent().size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isKnownId(String id) {
        lock.readLock().lock();
        try {
            return id != null && index.getKnownIds().contains(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    private void open() throws IOException {
        Files.createDirectories(directory);
        if (!Files.exists(logPath)) {
            Files.createFile(logPath);
        }
        truncatePartialTail();
        long logSize = Files.size(logPath);
        MemoryIndex cached = loadIndex();
        if (cached != null && cached.getLogSize() == logSize) {
            index = cached;
            log.info("memory.open store={} entries={} source=index", name, index.getCurrent().size());
            return;
        }
        MemoryIndex rebuilt = new MemoryIndex();
        forEachRecord((offset, record) -> rebuilt.apply(record, offset));
        rebuilt.setLogSize(logSize);
        index = rebuilt;
        saveIndex();
        log.info("memory.open store={} entries={} source=replay", name, index.getCurrent().size());
    }

    private void truncatePartialTail() throws IOException {
        try (FileChannel channel = FileChannel.open(logPath, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            long size = channel.size();
            if (size == 0) {
                return;
            }
            ByteBuffer one = ByteBuffer.allocate(1);
            long pos = size - 1;
            while (pos >= 0) {
                one.clear();
                channel.read(one, pos);
                if (one.get(0) == NEWLINE) {
                    break;
                }
                pos--;
            }
            long keep = pos + 1;
            if (keep < size) {
                log.warn("memory.truncate_tail store={} droppedBytes={}", name, size - keep);
                channel.truncate(keep);
            }
        }
    }

    private MemoryIndex loadIndex() {
        if (!Files.exists(indexPath)) {
            return null;
        }
        try {
            return mapper.readValue(indexPath.toFile(), MemoryIndex.class);
        } catch (IOException e) {
            log.warn("memory.index_unreadable store={} err={}", name, e.toString());
            return null;
        }
    }

    private void saveIndex() throws IOException {
        Path tmp = directory.resolve(INDEX_FILE + ".tmp");
        mapper.writeValue(tmp.toFile(), index);
        Files.move(tmp, indexPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    /**
     * Writes one record at the current end of the log. A failed write is truncated back to the
     * previous end and leaves the index untouched. A failed index save only costs a replay on the
     * next open, since the cached log size no longer matches.
     */
    private void append(MemoryRecord record) throws IOException {
        byte[] json = serialize(record);
        ByteBuffer line = ByteBuffer.allocate(json.length + 1);
        line.put(json).put(NEWLINE).flip();
        long offset;
        try (FileChannel channel = FileChannel.open(logPath, StandardOpenOption.WRITE)) {
            offset = channel.size();
            try {
                writeFully(channel, line, offset);
            } catch (IOException e) {
                rollback(channel, offset, e);
                throw e;
            }
        }
        index.apply(record, offset);
        index.setLogSize(offset + json.length + 1);
        try {
            saveIndex();
        } catch (IOException e) {
            log.warn("memory.index_save_failed store={} err={}", name, e.toString());
        }
    }

    void writeFully(FileChannel channel, ByteBuffer line, long position) throws IOException {
        long at = position;
        while (line.hasRemaining()) {
            at += channel.write(line, at);
        }
    }

    private void rollback(FileChannel channel, long offset, IOException cause) {
        try {
            channel.truncate(offset);
            log.warn("memory.append_rolled_back store={} offset={} err={}", name, offset, cause.toString());
        } catch (IOException truncateFailure) {
            cause.addSuppressed(truncateFailure);
        }
    }

    private <T> StoreOutcome<T> ioError(String operation, IOException e) {
        log.error("memory.io_error store={} op={} path={}", name, operation, logPath, e);
        return StoreOutcome.ioError("Memory " + operation + " failed: " + e.getMessage());
    }

    private byte[] serialize(MemoryRecord record) throws JsonProcessingException {
        return mapper.writeValueAsBytes(record);
    }

    private MemoryRecord readAt(long offset) throws IOException {
        try (RandomAccessFile file = new RandomAccessFile(logPath.toFile(), "r")) {
            file.seek(offset);
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            int b;
            while ((b = file.read()) != -1 && b != NEWLINE) {
                buffer.write(b);
            }
            return parse(buffer.toByteArray(), offset);
        }
    }

    private void forEachRecord(RecordVisitor visitor) throws IOException {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(logPath))) {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            long offset = 0;
            long lineStart = 0;
            int b;
            while ((b = in.read()) != -1) {
                offset++;
                if (b != NEWLINE) {
                    buffer.write(b);
                    continue;
                }
                MemoryRecord record = parse(buffer.toByteArray(), lineStart);
                if (record != null) {
                    visitor.visit(lineStart, record);
                }
                buffer.reset();
                lineStart = offset;
            }
        }
    }

    private MemoryRecord parse(byte[] line, long offset) {
        if (line.length == 0) {
            return null;
        }
        try {
            return mapper.readValue(line, MemoryRecord.class);
        } catch (IOException e) {
            log.warn("memory.bad_record store={} offset={} err={}", name, offset, e.getMessage());
            return null;
        }
    }

    private long persistedAccesses() throws IOException {
        long[] sum = {0};
        forEachRecord((offset, record) -> {
            if (record.isPut() && index.isCurrent(record.getId(), offset)) {
                sum[0] += record.getEntry().getAccessCount();
            }
        });
        return sum[0];
    }

    private MemoryEntry withAccess(MemoryEntry stored) {
        MemoryEntry copy = stored.copy();
        AccessStat stat = accessStats.get(stored.getId());
        if (stat != null) {
            copy.setAccessCount(copy.getAccessCount() + stat.count());
            copy.setLastAccessed(Math.max(copy.getLastAccessed(), stat.lastAccessed()));
        }
        return copy;
    }

    private static boolean matches(MemoryEntry entry, MemorySearchQuery q, String needle) {
        if (q.getKind() != null && q.getKind() != entry.getKind()) {
            return false;
        }
        if (q.getMinImportance() != null && entry.getImportance() < q.getMinImportance()) {
            return false;
        }
        if (q.getTags() != null && !q.getTags().isEmpty()) {
            Set<String> entryTags = entry.getTags() == null ? Set.of() : entry.getTags();
            boolean any = false;
            for (String tag : q.getTags()) {
                if (tag != null && entryTags.contains(tag.trim())) {
                    any = true;
                    break;
                }
            }
            if (!any) {
                return false;
            }
        }
        return needle == null
                || (entry.getContent() != null && entry.getContent().toLowerCase(Locale.ROOT).contains(needle));
    }

    private static String validate(String content, MemoryKind kind, double importance) {
        if (content == null || content.isBlank()) {
            return "content must not be blank";
        }
        if (kind == null) {
            return "memory kind is required";
        }
        if (Double.isNaN(importance) || importance < 0.0 || importance > 1.0) {
            return "importance must be between 0.0 and 1.0";
        }
        return null;
    }

    private static Set<String> cleanTags(Set<String> tags) {
        Set<String> cleaned = new LinkedHashSet<>();
        if (tags == null) {
            return cleaned;
        }
        for (String tag : tags) {
            if (tag != null && !tag.isBlank()) {
                cleaned.add(tag.trim());
            }
        }
        return cleaned;
    }

    private String newId() {
        String id;
        do {
            id = "mem_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        } while (index.getKnownIds().contains(id));
        return id;
    }

    @FunctionalInterface
    private interface RecordVisitor {
        void visit(long offset, MemoryRecord record);
    }

    /**
     * In-memory access counters; touched under the shared read lock, so updates are atomic.
     */
    private static final class AccessStat {
        private final AtomicLong count = new AtomicLong();
        private final AtomicLong lastAccessed = new AtomicLong();

        void touch(long now) {
            count.incrementAndGet();
            lastAccessed.accumulateAndGet(now, Math::max);
        }

        long count() {
            return count.get();
        }

        long lastAccessed() {
            return lastAccessed.get();
        }
    }

    private static final class Hit {
        private final long offset;
        private final MemoryEntry entry;

        private Hit(long offset, MemoryEntry entry) {
            this.offset = offset;
            this.entry = entry;
        }
    }
}
