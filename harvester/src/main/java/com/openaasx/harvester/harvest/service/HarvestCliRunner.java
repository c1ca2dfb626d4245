package com.openaasx.harvester.harvest.service;

import com.openaasx.harvester.config.HarvesterProperties;
import com.openaasx.harvester.harvest.model.HarvestRunRequest;
import com.openaasx.harvester.harvest.model.HarvestRunSummary;
import com.openaasx.harvester.harvest.model.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class HarvestCliRunner implements ApplicationRunner {
    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_INTERRUPTED = 130;
    private static final Logger log = LoggerFactory.getLogger(HarvestCliRunner.class);

    private final HarvesterProperties properties;
    private final HarvestOrchestratorService orchestrator;
    private final ConfigurableApplicationContext applicationContext;

    public HarvestCliRunner(
        HarvesterProperties properties,
        HarvestOrchestratorService orchestrator,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestrator = orchestrator;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }
        int exitCode = execute(args);
        if (properties.getCli().isExitAfterRun()) {
            int code = SpringApplication.exit(applicationContext, () -> exitCode);
            System.exit(code);
        }
    }

    int execute(ApplicationArguments args) {
        try {
            if (args.containsOption("verbose") || args.getNonOptionArgs().contains("-v")) {
                LoggingSystem.get(getClass().getClassLoader()).setLogLevel("com.openaasx.harvester", LogLevel.DEBUG);
            }
            HarvestRunRequest request = toRequest(args);
            HarvestRunSummary summary = orchestrator.run(request);
            log.info(
                "Summary: dry_run={}, discovered={}, new={}, processed={}, by_status={}, by_source={}, catalog_size={}",
                summary.dryRun(),
                summary.discoveredCount(),
                summary.newCandidateCount(),
                summary.processedCount(),
                summary.byStatus(),
                summary.candidatesBySource(),
                summary.catalogSize()
            );
            summary.sourceErrors().forEach((kind, errors) -> log.info("Source {} errors: {}", kind.id(), errors));
            if (Thread.currentThread().isInterrupted()) {
                return EXIT_INTERRUPTED;
            }
            return EXIT_OK;
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            return EXIT_ERROR;
        } catch (RuntimeException e) {
            log.error("Harvest failed", e);
            return EXIT_ERROR;
        }
    }

    static HarvestRunRequest toRequest(ApplicationArguments args) {
        String source = single(args, "source");
        return new HarvestRunRequest(
            intOption(args, "max-validate"),
            intOption(args, "max-github"),
            intOption(args, "max-web"),
            args.containsOption("dry-run"),
            source == null ? null : SourceKind.fromId(source)
        );
    }

    private static Integer intOption(ApplicationArguments args, String name) {
        String value = single(args, name);
        if (value == null) {
            return null;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 0) {
                throw new IllegalArgumentException("--" + name + " must not be negative");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " expects a number, got " + value);
        }
    }

    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }
}
