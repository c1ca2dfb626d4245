package com.openaasx.harvester.harvest.download;

import com.openaasx.harvester.config.HarvesterProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Checks a ZIP container for bomb characteristics from its central directory, without
 * decompressing any entry.
 */
@Component
public class ArchiveInspector {
    private static final double MIB = 1024.0 * 1024.0;

    private final HarvesterProperties.Download limits;

    public ArchiveInspector(HarvesterProperties properties) {
        this.limits = properties.getDownload();
    }

    public ArchiveInspection inspect(Path path) {
        int entries = 0;
        long compressed = 0;
        long uncompressed = 0;
        int hiddenEntries = 0;
        try (ZipFile zip = new ZipFile(path.toFile())) {
            Enumeration<? extends ZipEntry> it = zip.entries();
            while (it.hasMoreElements()) {
                ZipEntry entry = it.nextElement();
                entries++;
                compressed += Math.max(0, entry.getCompressedSize());
                uncompressed += Math.max(0, entry.getSize());
                if (entry.getCompressedSize() == 0 && entry.getSize() > 0) {
                    hiddenEntries++;
                }
            }
        } catch (IOException | RuntimeException e) {
            return ArchiveInspection.unreadable(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
        return evaluate(entries, compressed, uncompressed, hiddenEntries, limits);
    }

    /**
     * {@code hiddenEntries} counts entries declaring content with a compressed size of zero; any
     * such entry makes the archive unsafe regardless of the totals.
     */
    static ArchiveInspection evaluate(
        int entries,
        long compressed,
        long uncompressed,
        int hiddenEntries,
        HarvesterProperties.Download limits
    ) {
        double ratio = compressed > 0 ? (double) uncompressed / compressed : 0.0;
        List<String> reasons = new ArrayList<>();
        if (entries > limits.getMaxEntries()) {
            reasons.add("Too many entries: " + entries + " > " + limits.getMaxEntries());
        }
        if (uncompressed > limits.getMaxUncompressedBytes()) {
            reasons.add(String.format(Locale.ROOT, "Uncompressed size too large: %.1fMB > %.1fMB",
                uncompressed / MIB, limits.getMaxUncompressedBytes() / MIB));
        }
        if (ratio > limits.getMaxCompressionRatio()) {
            reasons.add(String.format(Locale.ROOT, "Suspicious compression ratio: %.1fx > %.0fx",
                ratio, limits.getMaxCompressionRatio()));
        }
        if (hiddenEntries > 0) {
            reasons.add(hiddenEntries + " entries with content but zero compressed size");
        } else if (compressed == 0 && uncompressed > 0) {
            reasons.add("Uncompressed size " + uncompressed + " bytes with zero compressed size");
        }
        return new ArchiveInspection(
            entries,
            compressed,
            uncompressed,
            ratio,
            reasons.isEmpty(),
            true,
            reasons.isEmpty() ? null : String.join("; ", reasons)
        );
    }
}
