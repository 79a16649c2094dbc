package com.rebootearth.burnrisk.infrastructure.cache;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rebootearth.burnrisk.application.exception.CacheCorruptionException;
import com.rebootearth.burnrisk.application.port.out.CacheStore;
import com.rebootearth.burnrisk.domain.model.BurnArea;
import com.rebootearth.burnrisk.domain.model.CacheEntry;
import com.rebootearth.burnrisk.domain.model.UpstreamSource;
import com.rebootearth.burnrisk.infrastructure.config.BurnRiskProperties;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Durable cache store backed by a single JSON document:
 * <pre>
 * { "data":  [ BurnArea, ... ],
 *   "index": { "34.05:-118.24": { "id", "computed-at", "ttl-seconds", "degraded-sources" } } }
 * </pre>
 * Reads are served from memory. Every write rewrites the document to a temp file and
 * moves it into place, and memory is only updated once the move succeeded.
 */
@Component
public class JsonFileCacheStore implements CacheStore {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileCacheStore.class);

    private final ObjectMapper objectMapper;
    private final Path file;
    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();
    private final AtomicLong version = new AtomicLong();

    @Autowired
    public JsonFileCacheStore(ObjectMapper objectMapper, BurnRiskProperties properties) {
        this(objectMapper, Paths.get(properties.getCache().getFile()));
    }

    JsonFileCacheStore(ObjectMapper objectMapper, Path file) {
        // Exact decimals keep quantized coordinates identical across reloads
        this.objectMapper = objectMapper.copy()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));
        this.file = file.toAbsolutePath();
        load();
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void put(String key, CacheEntry entry) {
        synchronized (writeLock) {
            Map<String, CacheEntry> next = new TreeMap<>(entries);
            next.put(key, entry);
            write(next);
            entries.put(key, entry);
            version.incrementAndGet();
        }
        logger.debug("Stored burn area {} under key {}", entry.getPayload().getId(), key);
    }

    @Override
    public boolean invalidate(String key) {
        synchronized (writeLock) {
            if (!entries.containsKey(key)) {
                return false;
            }
            Map<String, CacheEntry> next = new TreeMap<>(entries);
            next.remove(key);
            write(next);
            entries.remove(key);
            version.incrementAndGet();
        }
        logger.info("Invalidated cache entry {}", key);
        return true;
    }

    @Override
    public Collection<CacheEntry> all() {
        return List.copyOf(entries.values());
    }

    @Override
    public long version() {
        return version.get();
    }

    public Path getFile() {
        return file;
    }

    private void load() {
        if (!Files.exists(file)) {
            logger.info("No cache file at {}, starting empty", file);
            return;
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            quarantine(e);
            return;
        }
        if (root == null || !root.isObject()) {
            quarantine(new IOException("cache document is not a JSON object"));
            return;
        }

        Map<String, JsonNode> payloadsById = new HashMap<>();
        for (JsonNode node : root.path("data")) {
            JsonNode id = node.get("id");
            if (id != null && id.isTextual()) {
                payloadsById.put(id.asText(), node);
            }
        }

        int corrupt = 0;
        Iterator<Map.Entry<String, JsonNode>> fields = root.path("index").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            try {
                CacheEntry entry = readEntry(field.getKey(), field.getValue(), payloadsById);
                entries.put(field.getKey(), entry);
            } catch (CacheCorruptionException e) {
                corrupt++;
                logger.warn("Dropping corrupt cache entry {}: {}", field.getKey(), e.getMessage());
            }
        }
        logger.info("Loaded {} cache entries from {} ({} corrupt entries dropped)", entries.size(), file, corrupt);
    }

    private CacheEntry readEntry(String key, JsonNode indexNode, Map<String, JsonNode> payloadsById) {
        IndexRecord record;
        try {
            record = objectMapper.treeToValue(indexNode, IndexRecord.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new CacheCorruptionException("unreadable index record", e);
        }
        if (record.getId() == null || record.getComputedAt() == null) {
            throw new CacheCorruptionException("index record is missing id or computed-at");
        }

        JsonNode payloadNode = payloadsById.get(record.getId());
        if (payloadNode == null) {
            throw new CacheCorruptionException("no burn area with id " + record.getId());
        }
        try {
            BurnArea payload = objectMapper.treeToValue(payloadNode, BurnArea.class);
            return new CacheEntry(key, payload, Instant.parse(record.getComputedAt()),
                Duration.ofSeconds(record.getTtlSeconds()), record.getDegradedSources());
        } catch (IOException | IllegalArgumentException | DateTimeParseException e) {
            throw new CacheCorruptionException("unreadable burn area " + record.getId(), e);
        }
    }

    /**
     * Move an unreadable document aside so the next write does not destroy it.
     */
    private void quarantine(Exception cause) {
        Path aside = file.resolveSibling(file.getFileName() + ".corrupt");
        logger.warn("Cache file {} is unreadable ({}), moving it to {} and starting empty",
            file, cause.getMessage(), aside);
        try {
            Files.move(file, aside, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to move corrupt cache file " + file, e);
        }
    }

    private void write(Map<String, CacheEntry> snapshot) {
        ObjectNode document = objectMapper.createObjectNode();
        ArrayNode data = document.putArray("data");
        ObjectNode index = document.putObject("index");
        for (Map.Entry<String, CacheEntry> e : snapshot.entrySet()) {
            CacheEntry entry = e.getValue();
            data.add(objectMapper.valueToTree(entry.getPayload()));
            index.set(e.getKey(), objectMapper.valueToTree(IndexRecord.of(entry)));
        }

        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), document);
                moveIntoPlace(temp);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write cache file " + file, e);
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, replacing in place", file);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Per-key metadata stored next to the payloads.
     */
    @Getter
    static class IndexRecord {
        @JsonProperty("id")
        private final String id;

        @JsonProperty("computed-at")
        private final String computedAt;

        @JsonProperty("ttl-seconds")
        private final long ttlSeconds;

        @JsonProperty("degraded-sources")
        private final List<UpstreamSource> degradedSources;

        @JsonCreator
        IndexRecord(
            @JsonProperty("id") String id,
            @JsonProperty("computed-at") String computedAt,
            @JsonProperty("ttl-seconds") long ttlSeconds,
            @JsonProperty("degraded-sources") List<UpstreamSource> degradedSources) {
            this.id = id;
            this.computedAt = computedAt;
            this.ttlSeconds = ttlSeconds;
            this.degradedSources = degradedSources == null ? List.of() : new ArrayList<>(degradedSources);
        }

        static IndexRecord of(CacheEntry entry) {
            return new IndexRecord(entry.getPayload().getId(), entry.getComputedAt().toString(),
                entry.getTtl().getSeconds(), entry.getDegradedSources());
        }
    }
}
