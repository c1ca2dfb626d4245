package com.openaasx.harvester.harvest.persistence;

import com.openaasx.harvester.harvest.model.CatalogEntry;
import com.openaasx.harvester.harvest.model.LocalEnvironmentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * NDJSON catalog, one entry per line, at most one entry per fingerprint.
 */
public class CatalogStore {
    private static final Logger log = LoggerFactory.getLogger(CatalogStore.class);

    private final Path path;
    private final CatalogCodec codec;

    public CatalogStore(Path path, CatalogCodec codec) {
        this.path = path;
        this.codec = codec;
    }

    public Path path() {
        return path;
    }

    public List<CatalogEntry> readAll() {
        if (!Files.exists(path)) {
            return new ArrayList<>();
        }
        List<CatalogEntry> entries = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    entries.add(codec.decodeEntry(line));
                } catch (CatalogFormatException e) {
                    throw new CatalogFormatException(path + ":" + lineNumber + ": " + e.getMessage(), e);
                }
            }
        } catch (IOException e) {
            throw new LocalEnvironmentException("Cannot read catalog " + path, e);
        }
        return entries;
    }

    public void writeAll(List<CatalogEntry> entries) {
        StringBuilder content = new StringBuilder();
        for (CatalogEntry entry : entries) {
            content.append(codec.encodeEntry(entry)).append('\n');
        }
        try {
            AtomicFiles.write(path, content.toString());
        } catch (IOException e) {
            throw new LocalEnvironmentException("Cannot write catalog " + path, e);
        }
    }

    public void append(CatalogEntry entry) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Files.writeString(
                path,
                codec.encodeEntry(entry) + "\n",
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND
            );
        } catch (IOException e) {
            throw new LocalEnvironmentException("Cannot append to catalog " + path, e);
        }
    }

    public Optional<CatalogEntry> findById(String id) {
        return find(entry -> Objects.equals(entry.id(), id));
    }

    public Optional<CatalogEntry> findByUrl(String url) {
        return find(entry -> Objects.equals(entry.url(), url));
    }

    public Optional<CatalogEntry> findBySha256(String sha256) {
        return find(entry -> sha256 != null && Objects.equals(entry.sha256(), sha256));
    }

    /**
     * Inserts new fingerprints at the end and refreshes known ones in place.
     */
    public MergeOutcome merge(List<CatalogEntry> updates) {
        Map<String, CatalogEntry> byId = new LinkedHashMap<>();
        for (CatalogEntry entry : readAll()) {
            byId.put(entry.id(), entry);
        }
        int added = 0;
        int updated = 0;
        for (CatalogEntry update : updates) {
            CatalogEntry existing = byId.get(update.id());
            if (existing == null) {
                byId.put(update.id(), update);
                added++;
            } else {
                byId.put(update.id(), existing.refreshedBy(update));
                updated++;
            }
        }
        writeAll(new ArrayList<>(byId.values()));
        log.info("Catalog merged added={} updated={} total={}", added, updated, byId.size());
        return new MergeOutcome(added, updated, byId.size());
    }

    private Optional<CatalogEntry> find(Predicate<CatalogEntry> predicate) {
        return readAll().stream().filter(predicate).findFirst();
    }

    public record MergeOutcome(int added, int updated, int total) {
    }
}
