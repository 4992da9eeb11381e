package com.sandy.aiot.vision.baseline.calculate;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Triggers a baseline run once the application is ready and then on every cron firing.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BaselineScheduler {

    private final BaselineCalculator calculator;
    private final AtomicBoolean running = new AtomicBoolean(false);

    @Value("${baseline.scheduler.enabled:true}")
    private boolean enabled;

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (!enabled) {
            log.info("Baseline scheduler disabled");
            return;
        }
        trigger();
    }

    @Scheduled(cron = "${baseline.cron:0 0 * * * *}")
    public void scheduledRun() {
        if (!enabled) return;
        trigger();
    }

    private void trigger() {
        try { runOnce(); } catch (Exception e) { log.error("Scheduled baseline run failed: {}", e.getMessage(), e); }
    }

    /**
     * Public entry point for tests / manual trigger. Skipped when another run is still in progress.
     */
    public RunSummary runOnce() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Previous baseline run is still in progress, skip this one");
            return RunSummary.skipped();
        }
        try {
            return calculator.start();
        } finally {
            running.set(false);
        }
    }
}
