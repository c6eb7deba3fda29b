package com.claimsagent.infrastructure.config;

import com.claimsagent.domain.claim.model.MandatoryFieldChecklist;
import com.claimsagent.infrastructure.routing.RoutingPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class ClaimsConfig {

    @Bean
    public MandatoryFieldChecklist mandatoryFieldChecklist(ClaimsProperties properties) {
        MandatoryFieldChecklist checklist =
                MandatoryFieldChecklist.fromPaths(properties.getExtraction().getMandatoryFields());
        log.info("[Config] Mandatory fields: {}", checklist.fields());
        return checklist;
    }

    @Bean
    public RoutingPolicy routingPolicy(ClaimsProperties properties) {
        ClaimsProperties.Routing routing = properties.getRouting();
        RoutingPolicy policy = RoutingPolicy.of(
                routing.getFastTrackThreshold(), routing.getFraudKeywords(), routing.getFraudScanFields());
        log.info("[Config] Routing policy: threshold={}, keywords={}, scanFields={}",
                policy.fastTrackThreshold(), policy.fraudKeywords(), policy.fraudScanFields());
        return policy;
    }
}
