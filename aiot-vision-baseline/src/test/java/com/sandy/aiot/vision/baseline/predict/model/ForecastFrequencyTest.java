package com.sandy.aiot.vision.baseline.predict.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ForecastFrequencyTest {

    @Test
    void parsesPandasStyleCodes() {
        assertEquals(ForecastFrequency.SECOND, ForecastFrequency.of("s"));
        assertEquals(ForecastFrequency.MINUTE, ForecastFrequency.of("t"));
        assertEquals(ForecastFrequency.MINUTE, ForecastFrequency.of("m"));
        assertEquals(ForecastFrequency.MINUTE, ForecastFrequency.of("min"));
        assertEquals(ForecastFrequency.HOUR, ForecastFrequency.of("H"));
        assertEquals(ForecastFrequency.DAY, ForecastFrequency.of("d"));
        assertEquals(ForecastFrequency.WEEK, ForecastFrequency.of("w"));
        assertEquals(Duration.ofDays(7), ForecastFrequency.WEEK.step());
    }

    @Test
    void unknownCodeIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> ForecastFrequency.of("y"));
        assertTrue(e.getMessage().startsWith("Unknown frequency type"));
        assertThrows(IllegalArgumentException.class, () -> ForecastFrequency.of(null));
    }
}
