package com.openaasx.harvester.harvest.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openaasx.harvester.harvest.model.ShellInfo;
import com.openaasx.harvester.harvest.model.SubmodelInfo;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Reads shell, submodel and semantic identifiers from the AAS environment parts (XML or JSON)
 * of an AASX package. Element names are matched by local name, so v2 prefixed and v3 default
 * namespace documents both work.
 */
@Component
public class AasxMetadataExtractor implements MetadataExtractor {
    private static final Logger log = LoggerFactory.getLogger(AasxMetadataExtractor.class);
    private static final int MAX_ERROR_CHARS = 500;

    private final ObjectMapper objectMapper;

    public AasxMetadataExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ExtractionResult extract(Path file) {
        if (file == null || !Files.exists(file)) {
            return ExtractionResult.failure("File not found: " + file);
        }
        Collector collector = new Collector();
        int environments = 0;
        try (ZipFile zip = new ZipFile(file.toFile())) {
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                String name = entry.getName().toLowerCase(Locale.ROOT);
                if (entry.isDirectory() || name.endsWith(".rels") || name.endsWith("[content_types].xml")) {
                    continue;
                }
                if (name.endsWith(".xml")) {
                    environments += readXml(zip, entry, collector) ? 1 : 0;
                } else if (name.endsWith(".json")) {
                    environments += readJson(zip, entry, collector) ? 1 : 0;
                }
            }
        } catch (IOException | RuntimeException e) {
            log.debug("Metadata extraction failed file={} error={}", file, e.getMessage());
            return ExtractionResult.failure(truncate("Extraction failed: " + e.getMessage()));
        }
        if (environments == 0) {
            return ExtractionResult.failure("No AAS environment found in package");
        }
        return collector.result();
    }

    private boolean readXml(ZipFile zip, ZipEntry entry, Collector collector) throws IOException {
        String xml = read(zip, entry);
        Document doc = Jsoup.parse(xml, "", Parser.xmlParser());
        boolean environment = false;
        for (Element element : doc.getAllElements()) {
            String local = localName(element);
            if (local.equals("assetAdministrationShell") && hasParent(element, "assetAdministrationShells")) {
                environment = true;
                String id = firstNonBlank(childText(element, "id"), childText(element, "identification"));
                if (id != null) {
                    collector.shell(new ShellInfo(id, childText(element, "idShort"), globalAssetId(element)));
                }
            } else if (local.equals("submodel") && hasParent(element, "submodels")) {
                environment = true;
                String id = firstNonBlank(childText(element, "id"), childText(element, "identification"));
                Element semantic = child(element, "semanticId");
                String semanticId = semantic == null ? null : referenceValue(semantic);
                if (id != null) {
                    collector.submodel(new SubmodelInfo(id, childText(element, "idShort"), semanticId));
                }
            } else if (local.equals("semanticId")) {
                collector.semanticId(referenceValue(element));
            }
        }
        return environment;
    }

    private boolean readJson(ZipFile zip, ZipEntry entry, Collector collector) throws IOException {
        JsonNode root = objectMapper.readTree(read(zip, entry));
        if (root == null || !root.isObject()
            || (!root.has("assetAdministrationShells") && !root.has("submodels"))) {
            return false;
        }
        for (JsonNode shell : root.path("assetAdministrationShells")) {
            String id = firstNonBlank(text(shell.path("id")), text(shell.path("identification").path("id")));
            if (id == null) {
                continue;
            }
            JsonNode globalAsset = shell.path("assetInformation").path("globalAssetId");
            String globalAssetId = globalAsset.isObject() ? jsonReferenceValue(globalAsset) : text(globalAsset);
            collector.shell(new ShellInfo(id, text(shell.path("idShort")), globalAssetId));
        }
        for (JsonNode submodel : root.path("submodels")) {
            String id = firstNonBlank(text(submodel.path("id")), text(submodel.path("identification").path("id")));
            if (id != null) {
                collector.submodel(new SubmodelInfo(id, text(submodel.path("idShort")),
                    jsonReferenceValue(submodel.path("semanticId"))));
            }
        }
        collectJsonSemanticIds(root, collector);
        return true;
    }

    private void collectJsonSemanticIds(JsonNode node, Collector collector) {
        if (node.isObject()) {
            node.fields().forEachRemaining(field -> {
                if (field.getKey().equals("semanticId")) {
                    collector.semanticId(jsonReferenceValue(field.getValue()));
                } else {
                    collectJsonSemanticIds(field.getValue(), collector);
                }
            });
        } else if (node.isArray()) {
            for (JsonNode item : node) {
                collectJsonSemanticIds(item, collector);
            }
        }
    }

    private static String jsonReferenceValue(JsonNode reference) {
        for (JsonNode key : reference.path("keys")) {
            String value = text(key.path("value"));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String globalAssetId(Element shell) {
        Element info = child(shell, "assetInformation");
        if (info != null) {
            Element global = child(info, "globalAssetId");
            if (global != null) {
                String nested = referenceValue(global);
                return nested != null ? nested : blankToNull(global.text());
            }
        }
        Element assetRef = child(shell, "assetRef");
        return assetRef == null ? null : referenceValue(assetRef);
    }

    /**
     * First key value of a reference: v3 {@code keys/key/value}, v2 {@code keys/key} text.
     */
    private static String referenceValue(Element reference) {
        Element keys = child(reference, "keys");
        if (keys == null) {
            return null;
        }
        for (Element key : keys.children()) {
            if (!localName(key).equals("key")) {
                continue;
            }
            Element value = child(key, "value");
            String text = value != null ? value.text() : key.ownText();
            if (text != null && !text.isBlank()) {
                return text.trim();
            }
        }
        return null;
    }

    private static String read(ZipFile zip, ZipEntry entry) throws IOException {
        try (InputStream in = zip.getInputStream(entry)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static boolean hasParent(Element element, String parentLocalName) {
        Element parent = element.parent();
        return parent != null && localName(parent).equals(parentLocalName);
    }

    private static Element child(Element element, String localName) {
        for (Element child : element.children()) {
            if (localName(child).equals(localName)) {
                return child;
            }
        }
        return null;
    }

    private static String childText(Element element, String localName) {
        Element child = child(element, localName);
        return child == null ? null : blankToNull(child.text());
    }

    private static String localName(Element element) {
        String name = element.tagName();
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }

    private static String text(JsonNode node) {
        return node == null || !node.isTextual() ? null : blankToNull(node.asText());
    }

    private static String firstNonBlank(String first, String second) {
        return first != null ? first : second;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String truncate(String value) {
        return value.length() <= MAX_ERROR_CHARS ? value : value.substring(0, MAX_ERROR_CHARS);
    }

    private static final class Collector {
        private final Map<String, ShellInfo> shells = new LinkedHashMap<>();
        private final Map<String, SubmodelInfo> submodels = new LinkedHashMap<>();
        private final TreeSet<String> semanticIds = new TreeSet<>();

        void shell(ShellInfo shell) {
            shells.putIfAbsent(shell.id(), shell);
        }

        void submodel(SubmodelInfo submodel) {
            submodels.putIfAbsent(submodel.id(), submodel);
            semanticId(submodel.semanticId());
        }

        void semanticId(String value) {
            if (value != null && !value.isBlank()) {
                semanticIds.add(value.trim());
            }
        }

        ExtractionResult result() {
            return new ExtractionResult(true, new ArrayList<>(shells.values()), new ArrayList<>(submodels.values()),
                List.copyOf(semanticIds), null);
        }
    }
}
