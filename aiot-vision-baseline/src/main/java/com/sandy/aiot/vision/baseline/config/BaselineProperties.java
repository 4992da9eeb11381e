package com.sandy.aiot.vision.baseline.config;

import com.sandy.aiot.vision.baseline.result.MeterNameResultManager;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed binding for the {@code baseline.*} configuration tree.
 * Loaded from application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "baseline")
public class BaselineProperties {

    /**
     * Zone used to render backend timestamps and to compute "now". Empty means the system zone.
     */
    private String zoneId;

    @Valid
    private Server server = new Server();

    /**
     * Metrics to calculate baselines for.
     */
    @Valid
    private List<Metric> metrics = new ArrayList<>();

    @Valid
    private Predict predict = new Predict();

    @Valid
    private Result result = new Result();

    /**
     * Connection to the metrics backend (OAP GraphQL endpoint).
     */
    @Data
    public static class Server {

        /**
         * Base address, e.g. http://localhost:12800
         */
        @NotBlank(message = "Backend address is required")
        private String address = "http://localhost:12800";

        private String username;

        private String password;

        /**
         * Layers whose services are enumerated on every run.
         */
        @NotEmpty(message = "At least one layer must be configured")
        private List<String> layers = new ArrayList<>(List.of("GENERAL"));

        /**
         * Down sampling of the fetched series: hour or minute.
         */
        @NotBlank
        private String downSampling = "hour";
    }

    @Data
    public static class Metric {

        @NotBlank(message = "Metric name is required")
        @Pattern(regexp = MeterNameResultManager.METRIC_NAME_PATTERN,
                message = "Metric name may only contain letters, digits, '_', '.' and '-'")
        private String name;

        private boolean enabled = true;
    }

    @Data
    public static class Predict {

        /**
         * Minimum days of history a series needs before it is forecasted.
         */
        @Min(1)
        private int minDays = 3;

        /**
         * Points expected per day when converting minDays to a point count.
         */
        @Min(1)
        private int pointsPerDay = 24;

        /**
         * Forecast frequency code: s, t/m/min, h, d, w.
         */
        @NotBlank
        private String frequency = "h";

        /**
         * Number of frequency units to forecast ahead of now.
         */
        @Min(1)
        private int period = 24;

        /**
         * Thread pool size for the per series forecasts of one metric. 0 means available processors.
         */
        @Min(0)
        private int threads = 0;

        @Valid
        private Model model = new Model();
    }

    @Data
    public static class Model {

        /**
         * seasonal (built in) or remote (HTTP forecasting endpoint).
         */
        @NotBlank
        private String type = "seasonal";

        /**
         * Width of the upper/lower band in standard deviations, seasonal model only.
         */
        private double sigmaMultiplier = 1.2816;

        /**
         * Endpoint of the remote forecasting service, remote model only.
         */
        private String url = "http://localhost:50000/forecast";
    }

    @Data
    public static class Result {

        /**
         * Directory holding one JSON file per metric.
         */
        @NotBlank
        private String dir = "data/baseline";
    }
}
