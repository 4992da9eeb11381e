package com.sandy.aiot.vision.baseline.predict;

import com.sandy.aiot.vision.baseline.predict.model.ForecastFrequency;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * How far ahead a sub-series is forecasted.
 */
public final class ForecastHorizon {

    private ForecastHorizon() {
    }

    /**
     * now + period frequency steps.
     */
    public static LocalDateTime calcMaxPredictTime(LocalDateTime now, ForecastFrequency frequency, int period) {
        return frequency.plus(now, period);
    }

    /**
     * Number of points from the series' last timestamp up to {@code futureMaxTime}, both ends included.
     * Falls back to {@code period} when the series already reaches {@code futureMaxTime}.
     */
    public static int calcFuturePeriod(LocalDateTime seriesMaxTime, LocalDateTime futureMaxTime,
                                       ForecastFrequency frequency, int period) {
        if (seriesMaxTime == null || !seriesMaxTime.isBefore(futureMaxTime)) {
            return period;
        }
        long steps = Duration.between(seriesMaxTime, futureMaxTime).toMillis() / frequency.step().toMillis();
        return (int) Math.min(Integer.MAX_VALUE, steps + 1);
    }
}
