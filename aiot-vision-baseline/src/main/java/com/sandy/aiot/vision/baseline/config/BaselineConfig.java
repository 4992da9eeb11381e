package com.sandy.aiot.vision.baseline.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

@Configuration
@Slf4j
public class BaselineConfig {

    @Bean
    public Clock baselineClock(BaselineProperties properties) {
        ZoneId zone = StringUtils.hasText(properties.getZoneId())
                ? ZoneId.of(properties.getZoneId())
                : ZoneId.systemDefault();
        log.info("Baseline clock zone: {}", zone);
        return Clock.system(zone);
    }

    /**
     * Client for the metrics backend. Basic auth is only applied when both username and password are set.
     */
    @Bean
    public RestTemplate backendRestTemplate(RestTemplateBuilder builder, BaselineProperties properties) {
        BaselineProperties.Server server = properties.getServer();
        RestTemplateBuilder b = builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofMinutes(1));
        if (StringUtils.hasText(server.getUsername()) && StringUtils.hasText(server.getPassword())) {
            b = b.basicAuthentication(server.getUsername(), server.getPassword());
        }
        return b.build();
    }
}
