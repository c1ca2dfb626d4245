package com.openaasx.harvester.harvest.download;

import com.openaasx.harvester.config.HarvesterProperties;
import com.openaasx.harvester.harvest.HarvestFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class ArchiveInspectorTest {

    @TempDir
    Path tempDir;

    private final ArchiveInspector inspector = new ArchiveInspector(new HarvesterProperties());

    @Test
    void zerosCompressedFarBeyondRatioLimitAreRejected() throws Exception {
        Path bomb = tempDir.resolve("bomb.aasx");
        Files.write(bomb, HarvestFixtures.zerosZip(10 * 1024 * 1024));

        ArchiveInspection inspection = inspector.inspect(bomb);

        assertThat(inspection.safe()).isFalse();
        assertThat(inspection.readable()).isTrue();
        assertThat(inspection.ratio()).isGreaterThan(100.0);
        assertThat(inspection.reason()).startsWith("Suspicious compression ratio:");
    }

    @Test
    void tooManyEntriesIsRejected() throws Exception {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        for (int i = 0; i < 501; i++) {
            entries.put("part-" + i + ".txt", ("entry " + i).getBytes(StandardCharsets.UTF_8));
        }
        Path archive = tempDir.resolve("many.aasx");
        Files.write(archive, HarvestFixtures.zip(entries));

        ArchiveInspection inspection = inspector.inspect(archive);

        assertThat(inspection.safe()).isFalse();
        assertThat(inspection.entryCount()).isEqualTo(501);
        assertThat(inspection.reason()).contains("Too many entries: 501 > 500");
    }

    @Test
    void ordinaryPackageIsSafe() throws Exception {
        Path archive = tempDir.resolve("ok.aasx");
        Files.write(archive, HarvestFixtures.aasxPackage(HarvestFixtures.AAS_V3_XML));

        ArchiveInspection inspection = inspector.inspect(archive);

        assertThat(inspection.safe()).isTrue();
        assertThat(inspection.reason()).isNull();
        assertThat(inspection.entryCount()).isEqualTo(3);
    }

    @Test
    void nonZipPayloadIsReportedUnreadable() throws Exception {
        Path archive = tempDir.resolve("broken.aasx");
        Files.writeString(archive, "this is not a zip file at all");

        ArchiveInspection inspection = inspector.inspect(archive);

        assertThat(inspection.safe()).isFalse();
        assertThat(inspection.readable()).isFalse();
        assertThat(inspection.reason()).startsWith("Invalid ZIP file:");
    }

    @Test
    void uncompressedBytesWithoutCompressedBytesIsUnsafe() {
        ArchiveInspection inspection = ArchiveInspector.evaluate(1, 0, 4096, 0, new HarvesterProperties.Download());

        assertThat(inspection.safe()).isFalse();
        assertThat(inspection.reason()).contains("zero compressed size");
    }

    @Test
    void zeroCompressedEntryIsNotMaskedByOrdinaryEntries() {
        ArchiveInspection inspection = ArchiveInspector.evaluate(2, 1000, 51_000, 1, new HarvesterProperties.Download());

        assertThat(inspection.ratio()).isLessThan(100.0);
        assertThat(inspection.safe()).isFalse();
        assertThat(inspection.reason()).isEqualTo("1 entries with content but zero compressed size");
    }

    @Test
    void centralDirectoryEntryClaimingZeroCompressedBytesIsRejected() throws Exception {
        byte[] noise = new byte[1000];
        new Random(42).nextBytes(noise);
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("noise.bin", noise);
        entries.put("hidden.bin", new byte[50_000]);
        byte[] zip = HarvestFixtures.zip(entries);
        zeroCentralDirectoryCompressedSize(zip, "hidden.bin");
        Path archive = tempDir.resolve("hidden.aasx");
        Files.write(archive, zip);

        ArchiveInspection inspection = inspector.inspect(archive);

        assertThat(inspection.readable()).isTrue();
        assertThat(inspection.ratio()).isLessThan(100.0);
        assertThat(inspection.safe()).isFalse();
        assertThat(inspection.reason()).contains("zero compressed size");
    }

    @Test
    void allViolationsAreReportedTogether() {
        HarvesterProperties.Download limits = new HarvesterProperties.Download();

        ArchiveInspection inspection = ArchiveInspector.evaluate(600, 1024 * 1024, 200L * 1024 * 1024, 0, limits);

        assertThat(inspection.reason()).isEqualTo(
            "Too many entries: 600 > 500; "
                + "Uncompressed size too large: 200.0MB > 100.0MB; "
                + "Suspicious compression ratio: 200.0x > 100x");
    }

    private static void zeroCentralDirectoryCompressedSize(byte[] zip, String name) {
        byte[] nameBytes = name.getBytes(StandardCharsets.UTF_8);
        for (int i = 0; i + 46 < zip.length; i++) {
            // central directory file header: PK\1\2
            if (zip[i] != 0x50 || zip[i + 1] != 0x4b || zip[i + 2] != 0x01 || zip[i + 3] != 0x02) {
                continue;
            }
            int nameLength = (zip[i + 28] & 0xff) | (zip[i + 29] & 0xff) << 8;
            if (nameLength == nameBytes.length
                && Arrays.equals(Arrays.copyOfRange(zip, i + 46, i + 46 + nameLength), nameBytes)) {
                Arrays.fill(zip, i + 20, i + 24, (byte) 0);
                return;
            }
        }
        throw new IllegalStateException("No central directory entry for " + name);
    }
}
