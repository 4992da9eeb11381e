package com.sandy.aiot.vision.baseline.predict.model;

import com.sandy.aiot.vision.baseline.model.ForecastPoint;
import com.sandy.aiot.vision.baseline.model.TimeSeriesPoint;

import java.util.List;

/**
 * Statistical engine fitting one training series and forecasting it.
 * Implementations must keep no state between calls; the pipeline invokes them concurrently.
 */
public interface ForecastModel {

    /**
     * @param training  observed points sorted by timestamp, never empty
     * @param horizon   number of points to forecast after the last training timestamp
     * @param frequency spacing of the forecasted points
     * @return points sorted by strictly increasing timestamp, covering the training range plus the horizon
     * @throws com.sandy.aiot.vision.baseline.exception.ForecastException if the series cannot be forecasted
     */
    List<ForecastPoint> fitAndForecast(List<TimeSeriesPoint> training, int horizon, ForecastFrequency frequency);
}
