package com.openaasx.harvester;

import com.openaasx.harvester.config.HarvesterProperties;
import com.openaasx.harvester.harvest.model.HarvestPhase;
import com.openaasx.harvester.harvest.model.SourceKind;
import com.openaasx.harvester.harvest.service.HarvestOrchestratorService;
import com.openaasx.harvester.harvest.sources.DiscoverySource;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class AasxHarvesterApplicationTest {

    @Autowired
    private HarvestOrchestratorService orchestrator;

    @Autowired
    private List<DiscoverySource> sources;

    @Autowired
    private HarvesterProperties properties;

    @Test
    void contextWiresAllDiscoverySourcesWithoutRunningHarvest() {
        assertThat(sources).extracting(DiscoverySource::kind)
            .containsExactlyInAnyOrder(SourceKind.values());
        assertThat(orchestrator.currentPhase()).isEqualTo(HarvestPhase.IDLE);
        assertThat(properties.getCli().isRun()).isFalse();
        assertThat(properties.getAllowedDomains()).contains("admin-shell-io.com");
    }
}
