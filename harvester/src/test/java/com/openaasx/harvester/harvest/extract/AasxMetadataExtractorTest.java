package com.openaasx.harvester.harvest.extract;

import com.openaasx.harvester.harvest.HarvestFixtures;
import com.openaasx.harvester.harvest.model.ShellInfo;
import com.openaasx.harvester.harvest.model.SubmodelInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AasxMetadataExtractorTest {

    @TempDir
    Path tempDir;

    private final AasxMetadataExtractor extractor = new AasxMetadataExtractor(HarvestFixtures.objectMapper());

    @Test
    void readsShellsSubmodelsAndSemanticIdsFromXmlEnvironment() throws Exception {
        Path file = write("pump.aasx", HarvestFixtures.aasxPackage(HarvestFixtures.AAS_V3_XML));

        ExtractionResult result = extractor.extract(file);

        assertThat(result.success()).isTrue();
        assertThat(result.shells()).containsExactly(
            new ShellInfo("urn:example:aas:pump:1", "PumpShell", "urn:example:asset:pump:1"));
        assertThat(result.submodels()).containsExactly(
            new SubmodelInfo("urn:example:sm:nameplate:1", "Nameplate",
                "https://admin-shell.io/zvei/nameplate/2/0/Nameplate"));
        assertThat(result.semanticIds()).containsExactly(
            "0173-1#02-AAO677#002", "https://admin-shell.io/zvei/nameplate/2/0/Nameplate");
    }

    @Test
    void readsJsonEnvironment() throws Exception {
        String json = """
            {
              "assetAdministrationShells": [
                {"id": "urn:example:aas:valve", "idShort": "Valve",
                 "assetInformation": {"globalAssetId": "urn:example:asset:valve"}}
              ],
              "submodels": [
                {"id": "urn:example:sm:tech", "idShort": "TechnicalData",
                 "semanticId": {"keys": [{"type": "GlobalReference", "value": "https://admin-shell.io/ZVEI/TechnicalData/1/2"}]},
                 "submodelElements": [
                   {"idShort": "MaxPressure",
                    "semanticId": {"keys": [{"type": "GlobalReference", "value": "0173-1#02-BAA120#008"}]}}
                 ]}
              ]
            }
            """;
        Path file = write("valve.aasx", HarvestFixtures.zip(Map.of(
            "aasx/model.json", json.getBytes(StandardCharsets.UTF_8))));

        ExtractionResult result = extractor.extract(file);

        assertThat(result.success()).isTrue();
        assertThat(result.shells()).extracting(ShellInfo::globalAssetId).containsExactly("urn:example:asset:valve");
        assertThat(result.submodels()).extracting(SubmodelInfo::idShort).containsExactly("TechnicalData");
        assertThat(result.semanticIds())
            .containsExactly("0173-1#02-BAA120#008", "https://admin-shell.io/ZVEI/TechnicalData/1/2");
    }

    @Test
    void packageWithoutEnvironmentIsAFailure() throws Exception {
        Path file = write("empty.aasx", HarvestFixtures.zip(Map.of(
            "[Content_Types].xml", "<Types/>".getBytes(StandardCharsets.UTF_8),
            "docs/readme.txt", "hello".getBytes(StandardCharsets.UTF_8))));

        ExtractionResult result = extractor.extract(file);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("No AAS environment found in package");
        assertThat(result.toMetadata().shells()).isEmpty();
    }

    @Test
    void corruptArchiveIsReportedNotThrown() throws Exception {
        Path file = write("broken.aasx", "PK but not really".getBytes(StandardCharsets.UTF_8));

        ExtractionResult result = extractor.extract(file);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).startsWith("Extraction failed:");
    }

    private Path write(String name, byte[] bytes) throws Exception {
        Path file = tempDir.resolve(name);
        Files.write(file, bytes);
        return file;
    }
}
