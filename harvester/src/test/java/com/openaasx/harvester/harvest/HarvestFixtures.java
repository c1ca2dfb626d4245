package com.openaasx.harvester.harvest;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.openaasx.harvester.config.HarvesterProperties;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

public final class HarvestFixtures {
    public static final String AAS_V3_XML = """
        <?xml version="1.0" encoding="UTF-8"?>
        <environment xmlns="https://admin-shell.io/aas/3/0">
          <assetAdministrationShells>
            <assetAdministrationShell>
              <idShort>PumpShell</idShort>
              <id>urn:example:aas:pump:1</id>
              <assetInformation>
                <assetKind>Instance</assetKind>
                <globalAssetId>urn:example:asset:pump:1</globalAssetId>
              </assetInformation>
            </assetAdministrationShell>
          </assetAdministrationShells>
          <submodels>
            <submodel>
              <idShort>Nameplate</idShort>
              <id>urn:example:sm:nameplate:1</id>
              <semanticId>
                <type>ExternalReference</type>
                <keys>
                  <key>
                    <type>GlobalReference</type>
                    <value>https://admin-shell.io/zvei/nameplate/2/0/Nameplate</value>
                  </key>
                </keys>
              </semanticId>
              <submodelElements>
                <property>
                  <idShort>ManufacturerName</idShort>
                  <semanticId>
                    <type>ExternalReference</type>
                    <keys>
                      <key>
                        <type>GlobalReference</type>
                        <value>0173-1#02-AAO677#002</value>
                      </key>
                    </keys>
                  </semanticId>
                  <valueType>xs:string</valueType>
                  <value>ACME</value>
                </property>
              </submodelElements>
            </submodel>
          </submodels>
        </environment>
        """;

    private HarvestFixtures() {
    }

    /**
     * Properties with limits loose enough that tests never wait on the rate limiter.
     */
    public static HarvesterProperties fastProperties(Path root) {
        HarvesterProperties properties = new HarvesterProperties();
        properties.setRequestTimeoutSeconds(5);
        properties.setRequestMaxRetries(1);
        HarvesterProperties.RateLimits limits = properties.getRateLimits();
        limits.setGithubRequestsPerMinute(60_000);
        limits.setGithubBurst(1000);
        limits.setWebRequestsPerSecond(1000);
        limits.setWebBurst(1000);
        limits.setBackoffBaseMs(1);
        limits.setBackoffMaxMs(5);
        if (root != null) {
            HarvesterProperties.Storage storage = properties.getStorage();
            storage.setDataDir(root.resolve("data").toString());
            storage.setReportsDir(root.resolve("data/reports").toString());
            storage.setPublicDir(root.resolve("public").toString());
            storage.setWorkDir(root.resolve("work").toString());
        }
        return properties;
    }

    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public static byte[] zip(Map<String, byte[]> entries) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
            for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(entry.getKey()));
                zip.write(entry.getValue());
                zip.closeEntry();
            }
        }
        return bytes.toByteArray();
    }

    public static byte[] aasxPackage(String environmentXml) throws IOException {
        return zip(Map.of(
            "[Content_Types].xml", "<Types/>".getBytes(StandardCharsets.UTF_8),
            "aasx/aasx-origin", new byte[0],
            "aasx/environment/environment.aas.xml", environmentXml.getBytes(StandardCharsets.UTF_8)
        ));
    }

    public static byte[] zerosZip(int uncompressedBytes) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
            zip.putNextEntry(new ZipEntry("zeros.bin"));
            byte[] chunk = new byte[64 * 1024];
            int remaining = uncompressedBytes;
            while (remaining > 0) {
                int n = Math.min(chunk.length, remaining);
                zip.write(chunk, 0, n);
                remaining -= n;
            }
            zip.closeEntry();
        }
        return bytes.toByteArray();
    }
}
