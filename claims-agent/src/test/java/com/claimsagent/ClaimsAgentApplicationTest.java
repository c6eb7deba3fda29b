package com.claimsagent;

import com.claimsagent.application.claim.ClaimProcessingAppService;
import com.claimsagent.domain.claim.model.ClaimProcessingResult;
import com.claimsagent.domain.claim.model.MandatoryFieldChecklist;
import com.claimsagent.domain.claim.model.Route;
import com.claimsagent.infrastructure.output.ClaimResultWriter;
import com.claimsagent.infrastructure.routing.RoutingPolicy;
import com.claimsagent.interfaces.cli.ClaimsCliRunner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "claims.cli.enabled=false")
class ClaimsAgentApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private ClaimProcessingAppService processingService;

    @Autowired
    private ClaimResultWriter resultWriter;

    @Test
    @DisplayName("Configuration from application.yml is bound and wired")
    void configuration_bound() {
        assertThat(context.getBean(MandatoryFieldChecklist.class)).isEqualTo(MandatoryFieldChecklist.DEFAULT);
        assertThat(context.getBean(RoutingPolicy.class).fastTrackThreshold()).isEqualByComparingTo(new BigDecimal("25000"));
        assertThat(context.getBeansOfType(ClaimsCliRunner.class)).isEmpty();
    }

    @Test
    @DisplayName("A document goes through the wired pipeline")
    void wired_pipeline() {
        ClaimProcessingResult result = processingService.processDocument(Fixtures.path("auto_fast_track.txt"));

        assertThat(result.recommendedRoute()).isEqualTo(Route.FAST_TRACK);
        assertThat(resultWriter.toJson(result)).contains("\"recommendedRoute\" : \"Fast-track\"");
    }
}
