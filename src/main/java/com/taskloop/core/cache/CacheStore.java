package com.taskloop.core.cache;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskloop.core.io.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Durable key to snapshot store, one JSON file per key.
 * <p>
 * Writes go through {@link AtomicFiles}, so a reader never observes a half-written entry
 * and a crash mid-write leaves the previous snapshot in place. Unreadable files are
 * treated as absent.
 *
 * @param <T> payload item type
 */
public class CacheStore<T> {

    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

    private final Path directory;
    private final String prefix;
    private final ObjectMapper objectMapper;
    private final JavaType entryType;

    public CacheStore(Path directory, String prefix, Class<T> itemType, ObjectMapper objectMapper) {
        this.directory = directory;
        this.prefix = prefix;
        this.objectMapper = objectMapper;
        this.entryType = objectMapper.getTypeFactory().constructParametricType(CacheEntry.class, itemType);
    }

    public Optional<CacheEntry<T>> read(String key) {
        Path path = pathFor(key);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            CacheEntry<T> entry = objectMapper.readValue(path.toFile(), entryType);
            if (entry == null || !key.equals(entry.key()) || entry.fetchedAt() == null) {
                log.warn("Ignoring cache file {}: key or timestamp mismatch", path);
                return Optional.empty();
            }
            return Optional.of(entry);
        } catch (IOException e) {
            log.warn("Ignoring unreadable cache file {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    public void write(CacheEntry<T> entry) throws IOException {
        AtomicFiles.write(pathFor(entry.key()), objectMapper.writeValueAsBytes(entry));
        log.debug("Cached {} item(s) for {}", entry.payload().size(), entry.key());
    }

    public void invalidate(String key) throws IOException {
        Files.deleteIfExists(pathFor(key));
    }

    Path pathFor(String key) {
        return directory.resolve(prefix + "-" + digest(key) + ".json");
    }

    private static String digest(String key) {
        try {
            var sha = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha.digest(key.getBytes(StandardCharsets.UTF_8))).substring(0, 24);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
