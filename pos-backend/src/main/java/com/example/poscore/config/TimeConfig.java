package com.example.poscore.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class TimeConfig {

    @Bean
    public ZoneId storeZone(AppProperties props) {
        return ZoneId.of(props.getZone());
    }

    @Bean
    public Clock clock(ZoneId storeZone) {
        return Clock.system(storeZone);
    }
}
