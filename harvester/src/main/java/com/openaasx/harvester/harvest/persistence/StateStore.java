package com.openaasx.harvester.harvest.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.openaasx.harvester.harvest.model.CatalogEntry;
import com.openaasx.harvester.harvest.model.HarvestState;
import com.openaasx.harvester.harvest.model.LocalEnvironmentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class StateStore {
    private static final Logger log = LoggerFactory.getLogger(StateStore.class);

    private final Path path;
    private final CatalogCodec codec;

    public StateStore(Path path, CatalogCodec codec) {
        this.path = path;
        this.codec = codec;
    }

    public HarvestState load() {
        if (!Files.exists(path)) {
            return new HarvestState();
        }
        String json;
        try {
            json = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LocalEnvironmentException("Cannot read state " + path, e);
        }
        if (json.isBlank()) {
            return new HarvestState();
        }
        try {
            return codec.decodeState(json);
        } catch (JsonProcessingException e) {
            log.warn("State file {} is unreadable, starting from an empty state: {}", path, e.getOriginalMessage());
            return new HarvestState();
        }
    }

    public void save(HarvestState state) {
        try {
            AtomicFiles.write(path, codec.encodeState(state));
        } catch (IOException e) {
            throw new LocalEnvironmentException("Cannot write state " + path, e);
        }
    }

    /**
     * Folds every URL and hash already in the catalog into the seen sets. Returns how many were
     * missing.
     */
    public int reconcile(HarvestState state, CatalogStore catalog) {
        int added = 0;
        for (CatalogEntry entry : catalog.readAll()) {
            if (state.markUrlSeen(entry.url())) {
                added++;
            }
            if (state.markSha256Seen(entry.sha256())) {
                added++;
            }
        }
        if (added > 0) {
            log.info("Reconciled state from catalog added={}", added);
        }
        return added;
    }
}
