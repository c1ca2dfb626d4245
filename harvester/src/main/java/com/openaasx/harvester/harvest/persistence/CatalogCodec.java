package com.openaasx.harvester.harvest.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.openaasx.harvester.harvest.model.CatalogEntry;
import com.openaasx.harvester.harvest.model.HarvestState;
import org.springframework.stereotype.Component;

/**
 * Wire format of catalog lines and the state document.
 */
@Component
public class CatalogCodec {
    private final ObjectMapper compact;
    private final ObjectMapper pretty;

    public CatalogCodec(ObjectMapper objectMapper) {
        this.compact = objectMapper.copy().disable(SerializationFeature.INDENT_OUTPUT);
        this.pretty = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String encodeEntry(CatalogEntry entry) {
        try {
            return compact.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode catalog entry " + entry.id(), e);
        }
    }

    public CatalogEntry decodeEntry(String line) {
        try {
            CatalogEntry entry = compact.readValue(line, CatalogEntry.class);
            if (entry == null) {
                throw new CatalogFormatException("Catalog line is not an entry object", null);
            }
            if (entry.id() == null || entry.id().isBlank()) {
                throw new CatalogFormatException("Catalog entry without id", null);
            }
            return entry;
        } catch (JsonProcessingException e) {
            throw new CatalogFormatException("Malformed catalog entry: " + e.getOriginalMessage(), e);
        }
    }

    public String encodeState(HarvestState state) {
        try {
            return pretty.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode harvest state", e);
        }
    }

    public HarvestState decodeState(String json) throws JsonProcessingException {
        HarvestState state = compact.readValue(json, HarvestState.class);
        return state == null ? new HarvestState() : state;
    }
}
