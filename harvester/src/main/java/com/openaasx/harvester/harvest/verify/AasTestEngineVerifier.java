package com.openaasx.harvester.harvest.verify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.openaasx.harvester.config.HarvesterProperties;
import com.openaasx.harvester.harvest.model.LocalEnvironmentException;
import com.openaasx.harvester.harvest.model.VerificationOutcome;
import com.openaasx.harvester.harvest.model.VerificationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs the aas-test-engines compliance checker as a subprocess and maps its exit code and JSON
 * output to a verification outcome.
 */
@Component
public class AasTestEngineVerifier implements FileVerifier {
    private static final Logger log = LoggerFactory.getLogger(AasTestEngineVerifier.class);
    private static final String FILE_PLACEHOLDER = "{file}";
    private static final int MAX_ERRORS = 10;
    private static final int MAX_STDERR_CHARS = 500;

    private final HarvesterProperties properties;
    private final ObjectMapper objectMapper;

    public AasTestEngineVerifier(HarvesterProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public VerificationReport verify(Path file, String sha256) {
        HarvesterProperties.Verify config = properties.getVerify();
        String engine = config.getEngine();
        if (file == null || !Files.exists(file)) {
            return VerificationReport.of(VerificationOutcome.failed(engine, "File not found",
                List.of("File does not exist: " + file)));
        }

        Path stdout = null;
        Path stderr = null;
        try {
            stdout = Files.createTempFile("aas-verify-", ".out");
            stderr = Files.createTempFile("aas-verify-", ".err");
            return run(file, sha256, engine, config, stdout, stderr);
        } catch (IOException e) {
            throw new LocalEnvironmentException("Cannot create verifier output files", e);
        } finally {
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    private VerificationReport run(
        Path file,
        String sha256,
        String engine,
        HarvesterProperties.Verify config,
        Path stdout,
        Path stderr
    ) throws IOException {
        List<String> command = buildCommand(config.getCommand(), file);
        Process process;
        try {
            process = new ProcessBuilder(command)
                .redirectOutput(stdout.toFile())
                .redirectError(stderr.toFile())
                .start();
        } catch (IOException e) {
            log.warn("Verifier could not be started command={} error={}", command, e.getMessage());
            return VerificationReport.of(VerificationOutcome.failed(engine, "aas-test-engines not found",
                List.of("aas-test-engines is not installed")));
        }

        int exitCode;
        try {
            if (!process.waitFor(config.getTimeoutSeconds(), TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return VerificationReport.of(VerificationOutcome.failed(engine, "Verification timed out",
                    List.of("Verification exceeded " + config.getTimeoutSeconds() + " second timeout")));
            }
            exitCode = process.exitValue();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return VerificationReport.of(VerificationOutcome.failed(engine, "Verification interrupted", List.of()));
        }

        JsonNode tree = parseTree(Files.readString(stdout, StandardCharsets.UTF_8));
        String reportPath = tree != null && config.isSaveReports() ? saveReport(tree, sha256, file) : null;

        if (exitCode == 0) {
            return new VerificationReport(new VerificationOutcome(
                VerificationStatus.VERIFIED, engine, exitCode, "All compliance checks passed", List.of(), reportPath), tree);
        }
        if (tree != null) {
            List<String> errors = new ArrayList<>();
            collectFailures(tree, "", errors);
            return new VerificationReport(new VerificationOutcome(
                VerificationStatus.PARSEABLE,
                engine,
                exitCode,
                "File parseable but " + errors.size() + " compliance check(s) failed",
                errors.subList(0, Math.min(MAX_ERRORS, errors.size())),
                reportPath
            ), tree);
        }
        String stderrText = Files.readString(stderr, StandardCharsets.UTF_8).trim();
        if (stderrText.isEmpty()) {
            stderrText = "Unknown error";
        }
        return VerificationReport.of(new VerificationOutcome(
            VerificationStatus.FAILED,
            engine,
            exitCode,
            "File could not be parsed",
            List.of(stderrText.substring(0, Math.min(MAX_STDERR_CHARS, stderrText.length()))),
            null
        ));
    }

    static List<String> buildCommand(List<String> template, Path file) {
        List<String> command = new ArrayList<>();
        boolean placed = false;
        for (String part : template) {
            if (part.contains(FILE_PLACEHOLDER)) {
                command.add(part.replace(FILE_PLACEHOLDER, file.toString()));
                placed = true;
            } else {
                command.add(part);
            }
        }
        if (!placed) {
            command.add(file.toString());
        }
        return command;
    }

    /**
     * Collects every {@code ok: false} node, named by the path of {@code sub_checks} names
     * leading to it.
     */
    static void collectFailures(JsonNode node, String path, List<String> errors) {
        if (node == null) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                collectFailures(item, path, errors);
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }
        JsonNode ok = node.get("ok");
        if (ok != null && ok.isBoolean() && !ok.asBoolean()) {
            String message = node.path("message").asText("Unknown error");
            errors.add(path.isEmpty() ? message : path + ": " + message);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (field.getKey().equals("sub_checks") && value.isArray()) {
                int index = 0;
                for (JsonNode sub : value) {
                    String name = sub.path("name").asText("check_" + index);
                    collectFailures(sub, path.isEmpty() ? name : path + "/" + name, errors);
                    index++;
                }
            } else if (value.isContainerNode()) {
                collectFailures(value, path, errors);
            }
        }
    }

    private JsonNode parseTree(String output) {
        if (output == null || output.isBlank()) {
            return null;
        }
        try {
            JsonNode tree = objectMapper.readTree(output);
            return tree != null && tree.isContainerNode() ? tree : null;
        } catch (JsonProcessingException e) {
            log.debug("Verifier output is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private String saveReport(JsonNode tree, String sha256, Path file) {
        Path reportsDir = properties.getStorage().reportsPath();
        String name = sha256 != null && !sha256.isBlank() ? sha256 : stem(file);
        Path report = reportsDir.resolve(name + ".json");
        try {
            Files.createDirectories(reportsDir);
            Files.writeString(report, objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(tree),
                StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LocalEnvironmentException("Cannot write verification report " + report, e);
        }
        return report.toString().replace('\\', '/');
    }

    private static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Failed to delete {}: {}", path, e.getMessage());
        }
    }
}
