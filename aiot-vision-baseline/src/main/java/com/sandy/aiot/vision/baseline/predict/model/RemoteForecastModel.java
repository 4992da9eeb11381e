package com.sandy.aiot.vision.baseline.predict.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.aiot.vision.baseline.exception.ForecastException;
import com.sandy.aiot.vision.baseline.model.ForecastPoint;
import com.sandy.aiot.vision.baseline.model.TimeSeriesPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Delegates fitting and forecasting to an external forecasting service.
 * Request: {@code {timestamps, values, horizon, frequency}}; response: {@code {points:[{timestamp, value, upperValue, lowerValue}]}}.
 */
@Slf4j
public class RemoteForecastModel implements ForecastModel {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String forecastApiUrl;

    public RemoteForecastModel(RestTemplate restTemplate, ObjectMapper objectMapper, String forecastApiUrl) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.forecastApiUrl = forecastApiUrl;
    }

    @Override
    public List<ForecastPoint> fitAndForecast(List<TimeSeriesPoint> training, int horizon, ForecastFrequency frequency) {
        if (training == null || training.isEmpty()) {
            throw new ForecastException("Training series is empty");
        }
        List<String> timestamps = new ArrayList<>(training.size());
        List<Double> values = new ArrayList<>(training.size());
        for (TimeSeriesPoint p : training) {
            timestamps.add(p.timestamp().toString());
            values.add(p.value());
        }
        Map<String, Object> body = new HashMap<>();
        body.put("timestamps", timestamps);
        body.put("values", values);
        body.put("horizon", horizon);
        body.put("frequency", frequency.code());
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            String json = objectMapper.writeValueAsString(body);
            long start = System.currentTimeMillis();
            ResponseEntity<String> resp = restTemplate.postForEntity(forecastApiUrl, new HttpEntity<>(json, headers), String.class);
            long cost = System.currentTimeMillis() - start;
            if (!resp.getStatusCode().is2xxSuccessful() || resp.getBody() == null) {
                throw new ForecastException("Forecast service returned non-success status: status=" + resp.getStatusCode() + " body=" + resp.getBody());
            }
            List<ForecastPoint> points = parsePoints(objectMapper.readTree(resp.getBody()));
            log.debug("Forecast service call succeeded, cost={}ms, histSize={}, predSize={}", cost, training.size(), points.size());
            return points;
        } catch (RestClientException e) {
            throw new ForecastException("Failed to call forecast service: " + e.getMessage(), e);
        } catch (ForecastException e) {
            throw e;
        } catch (Exception e) {
            throw new ForecastException("Failed to parse forecast results: " + e.getMessage(), e);
        }
    }

    private List<ForecastPoint> parsePoints(JsonNode root) {
        JsonNode points = root.path("points");
        if (!points.isArray()) {
            throw new ForecastException("Forecast response has no points array");
        }
        List<ForecastPoint> result = new ArrayList<>(points.size());
        LocalDateTime previous = null;
        for (JsonNode p : points) {
            LocalDateTime ts;
            try {
                ts = LocalDateTime.parse(p.path("timestamp").asText());
            } catch (DateTimeParseException e) {
                throw new ForecastException("Invalid forecast timestamp: " + p.path("timestamp").asText(), e);
            }
            if (previous != null && !ts.isAfter(previous)) {
                throw new ForecastException("Forecast timestamps are not strictly increasing at " + ts);
            }
            previous = ts;
            result.add(new ForecastPoint(ts,
                    p.path("value").asDouble(),
                    p.path("upperValue").asDouble(),
                    p.path("lowerValue").asDouble()));
        }
        return result;
    }
}
