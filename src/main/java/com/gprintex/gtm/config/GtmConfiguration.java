package com.gprintex.gtm.config;

import com.gprintex.gtm.service.FixedRateTable;
import com.gprintex.gtm.service.RateTable;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(GtmProperties.class)
public class GtmConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public RateTable rateTable() {
        return new FixedRateTable();
    }
}
