package io.github.drompincen.clawwatch.runtime.listener;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable per-watcher key/value state, persisted as a single JSON document:
 * <pre>
 * { "mail": {"last_message_id": 4711}, "_meta": {"last_saved": "2025-03-01T14:30:00Z"} }
 * </pre>
 * Saves go through a temp file in the same directory followed by an atomic rename, so a crash
 * leaves either the previous or the new document on disk. A failed save rolls the in-memory
 * state back to what was last persisted and throws {@link WatermarkStoreException}.
 * <p>
 * Not thread-safe; owned by a single {@link EventListener}.
 */
public class WatermarkStore {

    private static final Logger log = LoggerFactory.getLogger(WatermarkStore.class);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    public static final String META_KEY = "_meta";

    private final Path path;
    private final Clock clock;
    private final ObjectMapper mapper;
    private Map<String, Map<String, Object>> state = new LinkedHashMap<>();
    private Map<String, Map<String, Object>> persisted = new LinkedHashMap<>();

    public WatermarkStore(Path path, Clock clock) {
        this.path = path;
        this.clock = clock;
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        load();
    }

    public Path getPath() {
        return path;
    }

    public Object get(String watcher, String key, Object defaultValue) {
        Map<String, Object> values = state.get(watcher);
        if (values == null || !values.containsKey(key) || values.get(key) == null) {
            return defaultValue;
        }
        return values.get(key);
    }

    public long getLong(String watcher, String key, long defaultValue) {
        Object value = get(watcher, key, null);
        if (value instanceof Number n) return n.longValue();
        if (value instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public String getString(String watcher, String key, String defaultValue) {
        Object value = get(watcher, key, null);
        return value instanceof String s ? s : defaultValue;
    }

    public List<String> getStringList(String watcher, String key) {
        Object value = get(watcher, key, null);
        if (!(value instanceof List<?> list)) return new ArrayList<>();
        List<String> result = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item != null) result.add(item.toString());
        }
        return result;
    }

    public List<Long> getLongList(String watcher, String key) {
        Object value = get(watcher, key, null);
        if (!(value instanceof List<?> list)) return new ArrayList<>();
        List<Long> result = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item instanceof Number n) {
                result.add(n.longValue());
            } else if (item instanceof String s) {
                try {
                    result.add(Long.parseLong(s.trim()));
                } catch (NumberFormatException e) {
                    log.debug("Dropping non-numeric entry '{}' from {}.{}", s, watcher, key);
                }
            }
        }
        return result;
    }

    public void set(String watcher, String key, Object value) {
        if (META_KEY.equals(watcher)) {
            throw new IllegalArgumentException(META_KEY + " is reserved");
        }
        state.computeIfAbsent(watcher, w -> new LinkedHashMap<>()).put(key, value);
    }

    public Map<String, Object> getAll(String watcher) {
        Map<String, Object> values = state.get(watcher);
        return values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public void save() {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("last_saved", clock.instant().toString());
        state.put(META_KEY, meta);

        Path target = path.toAbsolutePath();
        Path tmp = null;
        try {
            Files.createDirectories(target.getParent());
            tmp = Files.createTempFile(target.getParent(), target.getFileName() + ".", ".tmp");
            mapper.writeValue(tmp.toFile(), state);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            persisted = deepCopy(state);
        } catch (IOException | RuntimeException e) {
            deleteQuietly(tmp);
            state = deepCopy(persisted);
            throw new WatermarkStoreException("Failed to save watermark state to " + target, e);
        }
    }

    public void reset() {
        state = new LinkedHashMap<>();
        save();
        log.info("Watermark state reset");
    }

    private void load() {
        if (!Files.isRegularFile(path)) {
            log.debug("No watermark state at {}, starting fresh", path);
            return;
        }
        try {
            JsonNode root = mapper.readTree(path.toFile());
            if (root == null || !root.isObject()) {
                log.warn("Ignoring watermark state at {}: not a JSON object", path);
                return;
            }
            Map<String, Map<String, Object>> loaded = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isObject()) {
                    loaded.put(field.getKey(), mapper.convertValue(field.getValue(), MAP_TYPE));
                }
            }
            state = loaded;
            persisted = deepCopy(loaded);
            log.info("Loaded watermark state for {} watcher(s) from {}", loaded.size(), path);
        } catch (IOException e) {
            log.warn("Ignoring unreadable watermark state at {}: {}", path, e.getMessage());
        }
    }

    private Map<String, Map<String, Object>> deepCopy(Map<String, Map<String, Object>> source) {
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        source.forEach((watcher, values) -> copy.put(watcher, mapper.convertValue(values, MAP_TYPE)));
        return copy;
    }

    private static void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temp file {}: {}", file, e.getMessage());
        }
    }
}
