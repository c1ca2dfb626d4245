package com.openaasx.harvester.harvest.publish;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.openaasx.harvester.config.HarvesterProperties;
import com.openaasx.harvester.harvest.model.CatalogEntry;
import com.openaasx.harvester.harvest.model.FileFacts;
import com.openaasx.harvester.harvest.model.LocalEnvironmentException;
import com.openaasx.harvester.harvest.model.Provenance;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Component
public class CatalogPublisher {
    static final String[] CSV_HEADER = {
        "id", "url", "size_bytes", "sha256", "source_type", "source_ref", "license", "status",
        "discovered_at", "last_verified_at"
    };
    private static final Logger log = LoggerFactory.getLogger(CatalogPublisher.class);

    private final HarvesterProperties properties;
    private final ObjectWriter writer;

    public CatalogPublisher(HarvesterProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.writer = objectMapper.writer(SerializationFeature.INDENT_OUTPUT);
    }

    public void publish(List<CatalogEntry> entries, Path outputDir) {
        List<CatalogEntry> sorted = entries.stream()
            .sorted(Comparator.comparing(CatalogEntry::id))
            .toList();
        try {
            Files.createDirectories(outputDir);
            writer.writeValue(outputDir.resolve("catalog.json").toFile(), sorted);
            writeCsv(sorted, outputDir.resolve("catalog.csv"));
            writer.writeValue(outputDir.resolve("stats.json").toFile(), stats(sorted));
        } catch (IOException e) {
            throw new LocalEnvironmentException("Cannot publish catalog to " + outputDir, e);
        }
        log.info("Published catalog entries={} dir={}", sorted.size(), outputDir);
    }

    private void writeCsv(List<CatalogEntry> entries, Path path) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(CSV_HEADER)
            .build();
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(out, format)) {
            for (CatalogEntry entry : entries) {
                FileFacts file = entry.file();
                Provenance provenance = entry.provenance();
                printer.printRecord(
                    entry.id(),
                    file == null ? "" : orEmpty(file.url()),
                    file == null || file.sizeBytes() == null ? "" : file.sizeBytes(),
                    file == null ? "" : orEmpty(file.sha256()),
                    provenance == null || provenance.sourceType() == null ? "" : provenance.sourceType().id(),
                    provenance == null ? "" : orEmpty(provenance.sourceRef()),
                    provenance == null ? "" : orEmpty(provenance.license()),
                    entry.status().id(),
                    provenance == null || provenance.discoveredAt() == null ? "" : provenance.discoveredAt().toString(),
                    provenance == null || provenance.lastVerifiedAt() == null ? "" : provenance.lastVerifiedAt().toString()
                );
            }
        }
    }

    Map<String, Object> stats(List<CatalogEntry> entries) {
        Map<String, Integer> byStatus = new TreeMap<>();
        Map<String, Integer> bySource = new TreeMap<>();
        Map<String, Integer> semanticCounts = new TreeMap<>();
        for (CatalogEntry entry : entries) {
            byStatus.merge(entry.status().id(), 1, Integer::sum);
            String source = entry.provenance() == null || entry.provenance().sourceType() == null
                ? "unknown"
                : entry.provenance().sourceType().id();
            bySource.merge(source, 1, Integer::sum);
            for (String semanticId : entry.metadata().semanticIds()) {
                semanticCounts.merge(semanticId, 1, Integer::sum);
            }
        }
        Map<String, Integer> top = new LinkedHashMap<>();
        semanticCounts.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
            .limit(properties.getPublish().getTopSemanticIds())
            .forEach(e -> top.put(e.getKey(), e.getValue()));

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("by_source", bySource);
        stats.put("by_status", byStatus);
        stats.put("top_semantic_ids", top);
        stats.put("total_entries", entries.size());
        stats.put("unique_semantic_ids", semanticCounts.size());
        return stats;
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
