package com.sandy.aiot.vision.baseline.fetcher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.aiot.vision.baseline.config.BaselineProperties;
import com.sandy.aiot.vision.baseline.exception.FetchException;
import com.sandy.aiot.vision.baseline.model.LabelKeyValue;
import com.sandy.aiot.vision.baseline.model.LabelSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fetches metric series from the OAP GraphQL API.
 * Every service is queried window by window, each window holding at most {@link #MAX_FETCH_DATA_PERIOD} buckets.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GraphQLFetcher implements Fetcher {

    static final int MAX_FETCH_DATA_PERIOD = 80;

    private static final String LIST_SERVICES_QUERY = """
            query queryServices($layer: String!) {
                services: listServices(layer: $layer) {
                    label: name
                    normal
                }
            }""";

    private static final String METRICS_QUERY = """
            query MetricsQuery($expression: String!, $entity: Entity!, $duration: Duration!) {
                result: execExpression(expression: $expression, entity: $entity, duration: $duration) {
                    error
                    results {
                        metric {
                            labels { key value }
                        }
                        values { id value }
                    }
                }
            }""";

    private final BaselineProperties properties;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public List<String> metricNames() {
        List<String> names = new ArrayList<>();
        for (BaselineProperties.Metric metric : properties.getMetrics()) {
            if (metric.isEnabled()) names.add(metric.getName());
        }
        return names;
    }

    @Override
    public FetchReadiness readyFetch() {
        DownSampling downSampling = DownSampling.of(properties.getServer().getDownSampling());
        Set<ServiceEntity> services = new LinkedHashSet<>();
        for (String layer : properties.getServer().getLayers()) {
            services.addAll(fetchLayerServices(layer));
        }
        long totalPeriod = downSampling.periodOfDays(queryTtlDays());
        log.info("Ready to fetch: services={} totalPeriod={} downSampling={}", services.size(), totalPeriod, downSampling);
        return new FetchReadiness(new ArrayList<>(services), totalPeriod, downSampling);
    }

    @Override
    public Optional<FetchedData> fetch(String metricName, FetchReadiness readiness) {
        if (readiness == null || readiness.services().isEmpty()) {
            return Optional.empty();
        }
        BaselineProperties.Metric metric = findMetric(metricName);
        if (metric == null || !metric.isEnabled()) {
            log.info("Metric {} is not configured or disabled, skip fetching", metricName);
            return Optional.empty();
        }
        List<TimeWindow> windows = generateTimeWindows(readiness);
        DatasetAssembler assembler = new DatasetAssembler(readiness.downSampling());
        for (ServiceEntity service : readiness.services()) {
            int count = 0;
            for (TimeWindow window : windows) {
                count += assembler.fold(service.name(), queryWindow(service, metricName, window, readiness.downSampling()));
            }
            log.info("Total fetched {} data points for {}(service: {})", count, metricName, service.name());
        }
        return Optional.ofNullable(assembler.data);
    }

    List<TimeWindow> generateTimeWindows(FetchReadiness readiness) {
        DownSampling downSampling = readiness.downSampling();
        LocalDateTime end = LocalDateTime.now(clock).truncatedTo(downSampling.unit());
        LocalDateTime start = end.minus(readiness.totalPeriod(), downSampling.unit());
        return TimeWindow.split(start, end, downSampling.unit(), MAX_FETCH_DATA_PERIOD);
    }

    private BaselineProperties.Metric findMetric(String metricName) {
        for (BaselineProperties.Metric metric : properties.getMetrics()) {
            if (metric.getName().equals(metricName)) return metric;
        }
        return null;
    }

    private JsonNode queryWindow(ServiceEntity service, String metricName, TimeWindow window, DownSampling downSampling) {
        DateTimeFormatter fmt = downSampling.durationFormatter();
        Map<String, Object> entity = new LinkedHashMap<>();
        entity.put("serviceName", service.name());
        entity.put("normal", service.normal());
        Map<String, Object> duration = new LinkedHashMap<>();
        duration.put("start", fmt.format(window.start()));
        duration.put("end", fmt.format(window.end()));
        duration.put("step", downSampling.step());
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("expression", "view_as_seq(" + metricName + ")");
        variables.put("entity", entity);
        variables.put("duration", duration);

        JsonNode result = postGraphQL(METRICS_QUERY, variables).path("result");
        String error = result.path("error").asText(null);
        if (error != null && !error.isEmpty()) {
            throw new FetchException("Expression error for " + metricName + "(service: " + service.name() + "): " + error);
        }
        return result.path("results");
    }

    List<ServiceEntity> fetchLayerServices(String layer) {
        JsonNode services = postGraphQL(LIST_SERVICES_QUERY, Map.of("layer", layer)).path("services");
        List<ServiceEntity> result = new ArrayList<>();
        for (JsonNode service : services) {
            result.add(new ServiceEntity(service.path("label").asText(), service.path("normal").asBoolean()));
        }
        log.info("Layer {} has {} services", layer, result.size());
        return result;
    }

    long queryTtlDays() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        JsonNode body = exchange(baseAddress() + "/status/config/ttl", HttpMethod.GET, new HttpEntity<>(headers));
        JsonNode day = body.path("metrics").path("day");
        if (!day.canConvertToLong() && !day.isTextual()) {
            throw new FetchException("TTL response does not contain metrics.day: " + body);
        }
        try {
            return day.isTextual() ? Long.parseLong(day.asText().trim()) : day.asLong();
        } catch (NumberFormatException e) {
            throw new FetchException("Invalid metrics TTL: " + day.asText(), e);
        }
    }

    private JsonNode postGraphQL(String query, Map<String, Object> variables) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", query);
        payload.put("variables", variables);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new FetchException("Failed to build GraphQL payload", e);
        }
        JsonNode body = exchange(baseAddress() + "/graphql", HttpMethod.POST, new HttpEntity<>(json, headers));
        JsonNode errors = body.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            throw new FetchException("GraphQL returned errors: " + errors);
        }
        JsonNode data = body.path("data");
        if (data.isMissingNode() || data.isNull()) {
            throw new FetchException("GraphQL response has no data: " + body);
        }
        return data;
    }

    private JsonNode exchange(String url, HttpMethod method, HttpEntity<?> entity) {
        ResponseEntity<String> resp;
        try {
            resp = restTemplate.exchange(url, method, entity, String.class);
        } catch (RestClientException e) {
            throw new FetchException("Failed to fetch data from " + url + ": " + e.getMessage(), e);
        }
        if (resp.getStatusCode().value() != 200 || resp.getBody() == null) {
            throw new FetchException("Failed to fetch data from " + url + ": status=" + resp.getStatusCode() + " body=" + resp.getBody());
        }
        try {
            return objectMapper.readTree(resp.getBody());
        } catch (JsonProcessingException e) {
            throw new FetchException("Failed to parse response from " + url, e);
        }
    }

    private String baseAddress() {
        String address = properties.getServer().getAddress();
        return address.endsWith("/") ? address.substring(0, address.length() - 1) : address;
    }

    /**
     * Folds window responses into one dataset. The first non-empty response decides the shape.
     */
    private final class DatasetAssembler {
        private final DownSampling downSampling;
        private final DateTimeFormatter timeFormatter;
        private FetchedData data;

        DatasetAssembler(DownSampling downSampling) {
            this.downSampling = downSampling;
            this.timeFormatter = DateTimeFormatter.ofPattern(downSampling.metricTimeFormat());
        }

        int fold(String serviceName, JsonNode results) {
            if (!results.isArray() || results.isEmpty()) return 0;
            if (data == null) {
                boolean single = results.size() == 1 && parseLabels(results.get(0)).isEmpty();
                data = new FetchedData(single ? FetchedData.Shape.SINGLE : FetchedData.Shape.MULTIPLE,
                        downSampling.metricTimeFormat());
            }
            int count = 0;
            String minTime = null;
            String maxTime = null;
            for (JsonNode result : results) {
                LabelSet label = null;
                if (data.getShape() == FetchedData.Shape.MULTIPLE) {
                    label = parseLabels(result);
                    data.declareLabel(label);
                }
                for (JsonNode value : result.path("values")) {
                    Double v = parseValue(value.get("value"));
                    if (v == null) continue;
                    String time = convertMetricTime(value.path("id").asText());
                    if (time == null) continue;
                    data.addRow(new FetchedRow(serviceName, time, label, v));
                    if (minTime == null || time.compareTo(minTime) < 0) minTime = time;
                    if (maxTime == null || time.compareTo(maxTime) > 0) maxTime = time;
                    count++;
                }
            }
            log.debug("Fetched {} data points for service {} from {} to {}", count, serviceName, minTime, maxTime);
            return count;
        }

        private LabelSet parseLabels(JsonNode result) {
            List<LabelKeyValue> labels = new ArrayList<>();
            for (JsonNode label : result.path("metric").path("labels")) {
                labels.add(new LabelKeyValue(label.path("key").asText(), label.path("value").asText()));
            }
            return LabelSet.of(labels);
        }

        private Double parseValue(JsonNode node) {
            if (node == null || node.isNull()) return null;
            if (node.isNumber()) return node.asDouble();
            String text = node.asText().trim();
            if (text.isEmpty()) return null;
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                log.debug("Skip non numeric value '{}'", text);
                return null;
            }
        }

        private String convertMetricTime(String id) {
            try {
                long millis = Long.parseLong(id.trim());
                return timeFormatter.format(Instant.ofEpochMilli(millis).atZone(clock.getZone()).toLocalDateTime());
            } catch (NumberFormatException e) {
                log.debug("Skip value with invalid id '{}'", id);
                return null;
            }
        }
    }
}
