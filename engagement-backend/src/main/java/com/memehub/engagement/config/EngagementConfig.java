package com.memehub.engagement.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties(EngagementProperties.class)
public class EngagementConfig {

    /**
     * All "now" values in the engine come from this clock, so calendar days
     * for daily logins follow engagement.zone.
     */
    @Bean
    public Clock engagementClock(EngagementProperties properties) {
        return Clock.system(ZoneId.of(properties.getZone()));
    }

    /**
     * Separate transaction per badge award, so a unique-key collision only
     * rolls back that one insert.
     */
    @Bean
    public TransactionTemplate awardTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        return template;
    }
}
