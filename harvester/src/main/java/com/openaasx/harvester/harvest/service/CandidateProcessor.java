package com.openaasx.harvester.harvest.service;

import com.openaasx.harvester.config.HarvesterProperties;
import com.openaasx.harvester.harvest.download.DownloadException;
import com.openaasx.harvester.harvest.download.DownloadResult;
import com.openaasx.harvester.harvest.download.SafeDownloader;
import com.openaasx.harvester.harvest.extract.ExtractionResult;
import com.openaasx.harvester.harvest.extract.MetadataExtractor;
import com.openaasx.harvester.harvest.model.Candidate;
import com.openaasx.harvester.harvest.model.CatalogEntry;
import com.openaasx.harvester.harvest.model.ExtractedMetadata;
import com.openaasx.harvester.harvest.model.FailureKind;
import com.openaasx.harvester.harvest.model.FileFacts;
import com.openaasx.harvester.harvest.model.LocalEnvironmentException;
import com.openaasx.harvester.harvest.model.Provenance;
import com.openaasx.harvester.harvest.model.VerificationOutcome;
import com.openaasx.harvester.harvest.model.VerificationStatus;
import com.openaasx.harvester.harvest.util.HashUtils;
import com.openaasx.harvester.harvest.verify.FileVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Turns one candidate into one catalog entry: download, verify, extract. Retrieval failures become
 * a failed entry keyed by the URL.
 */
@Service
public class CandidateProcessor {
    private static final Logger log = LoggerFactory.getLogger(CandidateProcessor.class);

    private final HarvesterProperties properties;
    private final SafeDownloader downloader;
    private final FileVerifier verifier;
    private final MetadataExtractor extractor;

    public CandidateProcessor(
        HarvesterProperties properties,
        SafeDownloader downloader,
        FileVerifier verifier,
        MetadataExtractor extractor
    ) {
        this.properties = properties;
        this.downloader = downloader;
        this.verifier = verifier;
        this.extractor = extractor;
    }

    public CatalogEntry process(Candidate candidate) {
        Path workDir = createWorkDir();
        try {
            DownloadResult download;
            try {
                download = downloader.download(candidate.url(), workDir);
            } catch (DownloadException e) {
                log.warn("Download failed url={} kind={} reason={}", candidate.url(), e.kind().code(), e.getMessage());
                return failedEntry(candidate, e.kind(), e.getMessage());
            }

            VerificationOutcome verification = verifier.verify(download.path(), download.sha256()).outcome();
            ExtractionResult extraction = extractor.extract(download.path());
            if (!extraction.success()) {
                log.debug("Metadata extraction failed url={} error={}", candidate.url(), extraction.error());
            }
            Instant now = Instant.now();
            log.info("Processed url={} sha256={} status={}", candidate.url(), download.sha256(), verification.status().id());
            return new CatalogEntry(
                CatalogEntry.CONTENT_ID_PREFIX + download.sha256(),
                new FileFacts(candidate.url(), download.sizeBytes(), download.sha256(), download.filename()),
                provenance(candidate, now),
                verification,
                extraction.toMetadata()
            );
        } finally {
            deleteWorkDir(workDir);
        }
    }

    public CatalogEntry failedEntry(Candidate candidate, FailureKind kind, String reason) {
        Instant now = Instant.now();
        VerificationOutcome verification = new VerificationOutcome(
            VerificationStatus.FAILED,
            null,
            null,
            "Download failed: " + reason,
            List.of(kind.code() + ": " + reason),
            null
        );
        return new CatalogEntry(
            placeholderId(candidate.url()),
            new FileFacts(candidate.url(), null, null, candidate.filename()),
            provenance(candidate, now),
            verification,
            ExtractedMetadata.empty()
        );
    }

    static String placeholderId(String url) {
        return CatalogEntry.FAILED_ID_PREFIX + HashUtils.sha256Hex(url == null ? "" : url);
    }

    private Provenance provenance(Candidate candidate, Instant now) {
        return new Provenance(candidate.sourceType(), candidate.sourceRef(), candidate.license(), now, now);
    }

    private Path createWorkDir() {
        Path base = properties.getStorage().workPath();
        try {
            Files.createDirectories(base);
            return Files.createTempDirectory(base, "aasx_");
        } catch (IOException e) {
            throw new LocalEnvironmentException("Cannot create work directory under " + base, e);
        }
    }

    private void deleteWorkDir(Path workDir) {
        try {
            FileSystemUtils.deleteRecursively(workDir);
        } catch (IOException e) {
            log.warn("Failed to clean work directory {}: {}", workDir, e.getMessage());
        }
    }
}
