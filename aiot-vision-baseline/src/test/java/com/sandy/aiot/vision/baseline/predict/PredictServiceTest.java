package com.sandy.aiot.vision.baseline.predict;

import com.sandy.aiot.vision.baseline.config.BaselineProperties;
import com.sandy.aiot.vision.baseline.exception.FetchException;
import com.sandy.aiot.vision.baseline.exception.ForecastException;
import com.sandy.aiot.vision.baseline.fetcher.DownSampling;
import com.sandy.aiot.vision.baseline.fetcher.FetchReadiness;
import com.sandy.aiot.vision.baseline.fetcher.FetchedData;
import com.sandy.aiot.vision.baseline.fetcher.FetchedRow;
import com.sandy.aiot.vision.baseline.fetcher.Fetcher;
import com.sandy.aiot.vision.baseline.fetcher.ServiceEntity;
import com.sandy.aiot.vision.baseline.model.ForecastPoint;
import com.sandy.aiot.vision.baseline.model.LabelKeyValue;
import com.sandy.aiot.vision.baseline.model.LabelSet;
import com.sandy.aiot.vision.baseline.model.PredictLabeledValue;
import com.sandy.aiot.vision.baseline.model.PredictMeterResult;
import com.sandy.aiot.vision.baseline.model.PredictTimestampValue;
import com.sandy.aiot.vision.baseline.model.TimeSeriesPoint;
import com.sandy.aiot.vision.baseline.predict.model.ForecastFrequency;
import com.sandy.aiot.vision.baseline.predict.model.ForecastModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PredictServiceTest {

    private static final LocalDateTime T8 = LocalDateTime.of(2024, 1, 4, 8, 0);
    private static final LabelSet P50 = LabelSet.of(new LabelKeyValue("p", "50"));
    private static final LabelSet P99 = LabelSet.of(new LabelKeyValue("p", "99"));
    private static final FetchReadiness READINESS = new FetchReadiness(
            List.of(new ServiceEntity("svc-a", true)), 72, DownSampling.HOUR);

    @Mock
    Fetcher fetcher;
    @Mock
    ForecastModel forecastModel;

    private PredictService predictService;

    @BeforeEach
    void setUp() {
        BaselineProperties properties = new BaselineProperties();
        properties.getPredict().setMinDays(1);
        properties.getPredict().setPointsPerDay(3);
        properties.getPredict().setThreads(2);
        Clock clock = Clock.fixed(Instant.parse("2024-01-04T10:30:00Z"), ZoneOffset.UTC);
        predictService = new PredictService(fetcher, new SubSeriesPartitioner(properties), forecastModel, properties, clock);
    }

    @Test
    void singleResultKeepsOnlyFuturePointsUnclamped() {
        FetchedData data = new FetchedData(FetchedData.Shape.SINGLE, "yyyyMMddHH");
        addRows(data, "svc-a", null, 1);
        when(fetcher.fetch("service_cpm", READINESS)).thenReturn(Optional.of(data));
        when(forecastModel.fitAndForecast(anyList(), anyInt(), eq(ForecastFrequency.HOUR)))
                .thenAnswer(inv -> echoWithFuture(inv.getArgument(0), -5));

        List<PredictMeterResult> results = predictService.predict("service_cpm", READINESS);

        // 10:00 is the last point, 2024-01-05T10:30 the target: 10:00..2024-01-05T10:00 is 25 points
        verify(forecastModel).fitAndForecast(anyList(), eq(25), eq(ForecastFrequency.HOUR));
        assertEquals(1, results.size());
        PredictMeterResult result = results.get(0);
        assertEquals("svc-a", result.getServiceName());
        assertNull(result.getLabeled());
        assertEquals(2, result.getSingle().size());
        PredictTimestampValue first = result.getSingle().get(0);
        assertEquals(T8.plusHours(3), first.getTimestamp());
        assertEquals(-5d, first.getValue().getValue());
        assertEquals(-4d, first.getValue().getUpperValue());
        assertEquals(-6d, first.getValue().getLowerValue());
    }

    @Test
    void labeledResultsAreClampedAndFailingLabelsExcluded() {
        FetchedData data = new FetchedData(FetchedData.Shape.MULTIPLE, "yyyyMMddHH");
        addRows(data, "svc-a", P50, 50);
        addRows(data, "svc-a", P99, 99);
        when(fetcher.fetch("service_percentile", READINESS)).thenReturn(Optional.of(data));
        when(forecastModel.fitAndForecast(anyList(), anyInt(), eq(ForecastFrequency.HOUR))).thenAnswer(inv -> {
            List<TimeSeriesPoint> training = inv.getArgument(0);
            if (training.get(0).value() == 99) throw new ForecastException("does not converge");
            return echoWithFuture(training, -5);
        });

        List<PredictMeterResult> results = predictService.predict("service_percentile", READINESS);

        assertEquals(1, results.size());
        assertNull(results.get(0).getSingle());
        List<PredictLabeledValue> labeled = results.get(0).getLabeled();
        assertEquals(1, labeled.size());
        assertEquals(P50, labeled.get(0).getLabel());
        for (PredictTimestampValue v : labeled.get(0).getTimeWithValues()) {
            assertTrue(v.getTimestamp().isAfter(T8.plusHours(2)));
            assertEquals(0d, v.getValue().getValue());
            assertEquals(0d, v.getValue().getUpperValue());
            assertEquals(0d, v.getValue().getLowerValue());
        }
    }

    @Test
    void serviceWithoutSuccessfulSeriesIsOmitted() {
        FetchedData data = new FetchedData(FetchedData.Shape.SINGLE, "yyyyMMddHH");
        addRows(data, "svc-a", null, 1);
        addRows(data, "svc-b", null, 2);
        when(fetcher.fetch("service_cpm", READINESS)).thenReturn(Optional.of(data));
        when(forecastModel.fitAndForecast(anyList(), anyInt(), eq(ForecastFrequency.HOUR))).thenAnswer(inv -> {
            List<TimeSeriesPoint> training = inv.getArgument(0);
            if (training.get(0).value() == 1) throw new IllegalStateException("boom");
            return echoWithFuture(training, 3);
        });

        List<PredictMeterResult> results = predictService.predict("service_cpm", READINESS);

        assertEquals(1, results.size());
        assertEquals("svc-b", results.get(0).getServiceName());
    }

    @Test
    void nothingFetchedMeansNoResults() {
        when(fetcher.fetch("service_cpm", READINESS)).thenReturn(Optional.empty());
        assertTrue(predictService.predict("service_cpm", READINESS).isEmpty());
        verifyNoInteractions(forecastModel);
    }

    @Test
    void fetchFailurePropagates() {
        when(fetcher.fetch("service_cpm", READINESS)).thenThrow(new FetchException("backend down"));
        assertThrows(FetchException.class, () -> predictService.predict("service_cpm", READINESS));
    }

    @Test
    void clampOnlyTouchesNegatives() {
        assertEquals(0d, PredictService.ignoreNegativeValue(-0.1));
        assertEquals(2.5d, PredictService.ignoreNegativeValue(2.5));
    }

    private static void addRows(FetchedData data, String service, LabelSet label, double value) {
        for (int i = 0; i < 3; i++) {
            data.addRow(new FetchedRow(service, String.format("20240104%02d", 8 + i), label, value));
        }
    }

    /**
     * Reproduces the training points, then two future points with the given value and a band of 1.
     */
    private static List<ForecastPoint> echoWithFuture(List<TimeSeriesPoint> training, double futureValue) {
        List<ForecastPoint> points = new ArrayList<>();
        for (TimeSeriesPoint p : training) {
            points.add(new ForecastPoint(p.timestamp(), p.value(), p.value(), p.value()));
        }
        LocalDateTime last = training.get(training.size() - 1).timestamp();
        points.add(new ForecastPoint(last.plusHours(1), futureValue, futureValue + 1, futureValue - 1));
        points.add(new ForecastPoint(last.plusHours(2), futureValue, futureValue + 1, futureValue - 1));
        return points;
    }
}
