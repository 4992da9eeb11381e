package com.sandy.aiot.vision.baseline.predict;

import com.sandy.aiot.vision.baseline.config.BaselineProperties;
import com.sandy.aiot.vision.baseline.fetcher.FetchReadiness;
import com.sandy.aiot.vision.baseline.fetcher.FetchedData;
import com.sandy.aiot.vision.baseline.fetcher.Fetcher;
import com.sandy.aiot.vision.baseline.model.ForecastPoint;
import com.sandy.aiot.vision.baseline.model.PredictLabeledValue;
import com.sandy.aiot.vision.baseline.model.PredictMeterResult;
import com.sandy.aiot.vision.baseline.model.PredictTimestampValue;
import com.sandy.aiot.vision.baseline.model.PredictValue;
import com.sandy.aiot.vision.baseline.model.SubSeries;
import com.sandy.aiot.vision.baseline.predict.model.ForecastFrequency;
import com.sandy.aiot.vision.baseline.predict.model.ForecastModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Calculates the baseline of one metric: fetch, split into sub-series, forecast every sub-series
 * on its own thread and merge the results per service.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PredictService {

    private final Fetcher fetcher;
    private final SubSeriesPartitioner partitioner;
    private final ForecastModel forecastModel;
    private final BaselineProperties properties;
    private final Clock clock;

    /**
     * A failing sub-series is logged and left out; the other sub-series are still returned.
     *
     * @throws com.sandy.aiot.vision.baseline.exception.FetchException if the metric cannot be fetched
     */
    public List<PredictMeterResult> predict(String metricName, FetchReadiness readiness) {
        BaselineProperties.Predict conf = properties.getPredict();
        ForecastFrequency frequency = ForecastFrequency.of(conf.getFrequency());
        LocalDateTime futureMaxTime = ForecastHorizon.calcMaxPredictTime(LocalDateTime.now(clock), frequency, conf.getPeriod());

        Optional<FetchedData> data = fetcher.fetch(metricName, readiness);
        if (data.isEmpty()) {
            log.info("no data fetched for {}", metricName);
            return List.of();
        }
        List<SubSeries> series = partitioner.split(metricName, data.get());
        log.info("total {} sub-series in the {} is available to calc baseline", series.size(), metricName);
        if (series.isEmpty()) {
            return List.of();
        }

        long start = System.currentTimeMillis();
        List<SubSeriesForecast> forecasts = new ArrayList<>(series.size());
        ExecutorService executor = Executors.newFixedThreadPool(poolSize(series.size()),
                new CustomizableThreadFactory("predict-" + metricName + "-"));
        try {
            List<Future<SubSeriesForecast>> futures = new ArrayList<>(series.size());
            for (SubSeries s : series) {
                futures.add(executor.submit(() -> forecast(metricName, s, frequency, futureMaxTime)));
            }
            for (int i = 0; i < futures.size(); i++) {
                try {
                    forecasts.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("Error processing {} of {}: {}", series.get(i).describe(), metricName, cause.getMessage(), cause);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while forecasting " + metricName, e);
        } finally {
            executor.shutdownNow();
        }
        log.info("process {} metrics total use time {}ms, forecasted {}/{} sub-series",
                metricName, System.currentTimeMillis() - start, forecasts.size(), series.size());
        return merge(forecasts);
    }

    SubSeriesForecast forecast(String metricName, SubSeries series, ForecastFrequency frequency, LocalDateTime futureMaxTime) {
        LocalDateTime maxTime = series.maxTimestamp();
        int horizon = ForecastHorizon.calcFuturePeriod(maxTime, futureMaxTime, frequency, properties.getPredict().getPeriod());
        List<ForecastPoint> forecast = forecastModel.fitAndForecast(series.points(), horizon, frequency);
        List<PredictTimestampValue> values = new ArrayList<>();
        for (ForecastPoint p : forecast) {
            // in-sample points reproduce history, only the future is kept
            if (!p.timestamp().isAfter(maxTime)) continue;
            values.add(toValue(p, series.isLabeled()));
        }
        log.debug("Predicted for {} of {} to {}", series.describe(), metricName,
                values.isEmpty() ? maxTime : values.get(values.size() - 1).getTimestamp());
        return new SubSeriesForecast(series, values);
    }

    /**
     * Labeled values are clamped at zero, single values are stored as forecasted.
     */
    static PredictTimestampValue toValue(ForecastPoint p, boolean labeled) {
        PredictValue value = labeled
                ? new PredictValue(ignoreNegativeValue(p.value()), ignoreNegativeValue(p.upperValue()), ignoreNegativeValue(p.lowerValue()))
                : new PredictValue(p.value(), p.upperValue(), p.lowerValue());
        return new PredictTimestampValue(p.timestamp(), value);
    }

    static double ignoreNegativeValue(double value) {
        return value > 0 ? value : 0;
    }

    private List<PredictMeterResult> merge(List<SubSeriesForecast> forecasts) {
        Map<String, PredictMeterResult> byService = new LinkedHashMap<>();
        for (SubSeriesForecast f : forecasts) {
            PredictMeterResult result = byService.computeIfAbsent(f.series().serviceName(),
                    name -> PredictMeterResult.builder().serviceName(name).build());
            if (f.series().isLabeled()) {
                if (result.getLabeled() == null) result.setLabeled(new ArrayList<>());
                result.getLabeled().add(new PredictLabeledValue(f.series().label(), f.values()));
            } else {
                result.setSingle(f.values());
            }
        }
        return new ArrayList<>(byService.values());
    }

    private int poolSize(int tasks) {
        int threads = properties.getPredict().getThreads();
        if (threads <= 0) threads = Runtime.getRuntime().availableProcessors();
        return Math.max(1, Math.min(threads, tasks));
    }

    record SubSeriesForecast(SubSeries series, List<PredictTimestampValue> values) {
    }
}
