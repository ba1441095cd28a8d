package com.gt.dailyprep.conf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneId;
import java.util.Random;

@Configuration
public class BeanConfig {

    private static final Logger log = LoggerFactory.getLogger(BeanConfig.class);

    @Bean
    public Clock getClock(@Value("${dailyprep.zone:}") String zone) {
        if (zone == null || zone.isBlank()) {
            return Clock.systemDefaultZone();
        }

        log.info("Using zone {} to determine the current date", zone);
        return Clock.system(ZoneId.of(zone));
    }

    @Bean
    public Random getSelectionRandom() {
        return new SecureRandom();
    }
}
