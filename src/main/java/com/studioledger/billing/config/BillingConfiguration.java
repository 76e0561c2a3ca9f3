package com.studioledger.billing.config;

import com.studioledger.billing.service.ClientDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class BillingConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Accepts every client and project. Host applications register their own directory backed by
     * the client records they own.
     */
    @Bean
    @ConditionalOnMissingBean
    public ClientDirectory clientDirectory() {
        log.info("No ClientDirectory registered, accepting all client and project references");
        return new ClientDirectory() {
            @Override
            public boolean clientExists(Long clientId) {
                return clientId != null;
            }

            @Override
            public boolean projectBelongsTo(Long projectId, Long clientId) {
                return projectId != null && clientId != null;
            }
        };
    }
}
