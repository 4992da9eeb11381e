package com.sandy.aiot.vision.baseline.predict.model;

import com.sandy.aiot.vision.baseline.exception.ForecastException;
import com.sandy.aiot.vision.baseline.model.ForecastPoint;
import com.sandy.aiot.vision.baseline.model.TimeSeriesPoint;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Daily seasonal profile. Every timestamp maps to a slot of the day (one slot per frequency step,
 * a single slot for daily or weekly frequencies); the estimate is the slot mean and the band is
 * mean +/- sigmaMultiplier * slot standard deviation. Slots without history use the global profile.
 */
public class SeasonalForecastModel implements ForecastModel {

    private static final long SECONDS_PER_DAY = 86_400L;

    private final double sigmaMultiplier;

    public SeasonalForecastModel(double sigmaMultiplier) {
        if (sigmaMultiplier < 0 || Double.isNaN(sigmaMultiplier)) {
            throw new IllegalArgumentException("sigmaMultiplier must be >= 0: " + sigmaMultiplier);
        }
        this.sigmaMultiplier = sigmaMultiplier;
    }

    @Override
    public List<ForecastPoint> fitAndForecast(List<TimeSeriesPoint> training, int horizon, ForecastFrequency frequency) {
        if (training == null || training.isEmpty()) {
            throw new ForecastException("Training series is empty");
        }
        if (horizon < 0) {
            throw new IllegalArgumentException("horizon must be >= 0: " + horizon);
        }
        long stepSeconds = frequency.step().getSeconds();
        int slots = stepSeconds >= SECONDS_PER_DAY ? 1 : (int) (SECONDS_PER_DAY / stepSeconds);
        double[] sum = new double[slots];
        double[] sumSq = new double[slots];
        long[] count = new long[slots];
        double globalSum = 0;
        double globalSumSq = 0;
        TreeSet<LocalDateTime> observed = new TreeSet<>();
        for (TimeSeriesPoint p : training) {
            double v = p.value();
            if (Double.isNaN(v) || Double.isInfinite(v)) {
                throw new ForecastException("Training series contains a non finite value at " + p.timestamp());
            }
            int slot = slotOf(p.timestamp(), stepSeconds, slots);
            sum[slot] += v;
            sumSq[slot] += v * v;
            count[slot]++;
            globalSum += v;
            globalSumSq += v * v;
            observed.add(p.timestamp());
        }
        double globalMean = globalSum / training.size();
        double globalStd = std(globalSum, globalSumSq, training.size());

        List<ForecastPoint> result = new ArrayList<>(observed.size() + horizon);
        for (LocalDateTime ts : observed) {
            result.add(point(ts, stepSeconds, slots, sum, sumSq, count, globalMean, globalStd));
        }
        LocalDateTime last = observed.last();
        for (int i = 1; i <= horizon; i++) {
            result.add(point(frequency.plus(last, i), stepSeconds, slots, sum, sumSq, count, globalMean, globalStd));
        }
        return result;
    }

    private ForecastPoint point(LocalDateTime ts, long stepSeconds, int slots, double[] sum, double[] sumSq,
                                long[] count, double globalMean, double globalStd) {
        int slot = slotOf(ts, stepSeconds, slots);
        double mean = globalMean;
        double std = globalStd;
        if (count[slot] > 0) {
            mean = sum[slot] / count[slot];
            std = std(sum[slot], sumSq[slot], count[slot]);
        }
        double band = sigmaMultiplier * std;
        return new ForecastPoint(ts, mean, mean + band, mean - band);
    }

    private static int slotOf(LocalDateTime ts, long stepSeconds, int slots) {
        if (slots == 1) return 0;
        return (int) ((ts.toLocalTime().toSecondOfDay() / stepSeconds) % slots);
    }

    private static double std(double sum, double sumSq, long n) {
        if (n < 2) return 0d;
        double mean = sum / n;
        double variance = sumSq / n - mean * mean;
        return variance > 0 ? Math.sqrt(variance) : 0d;
    }
}
