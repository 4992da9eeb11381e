package com.sandy.aiot.vision.baseline.predict.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.aiot.vision.baseline.config.BaselineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Selects the forecast model with {@code baseline.predict.model.type}.
 */
@Configuration
@Slf4j
public class ForecastModelConfig {

    @Bean
    @ConditionalOnProperty(name = "baseline.predict.model.type", havingValue = "seasonal", matchIfMissing = true)
    public ForecastModel seasonalForecastModel(BaselineProperties properties) {
        double sigma = properties.getPredict().getModel().getSigmaMultiplier();
        log.info("Using seasonal forecast model, sigmaMultiplier={}", sigma);
        return new SeasonalForecastModel(sigma);
    }

    @Bean
    @ConditionalOnProperty(name = "baseline.predict.model.type", havingValue = "remote")
    public ForecastModel remoteForecastModel(BaselineProperties properties, RestTemplateBuilder builder, ObjectMapper objectMapper) {
        String url = properties.getPredict().getModel().getUrl();
        log.info("Using remote forecast model at {}", url);
        return new RemoteForecastModel(builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofMinutes(5))
                .build(), objectMapper, url);
    }
}
