package com.noteshub.gamification.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Progress reporting for long batch jobs. Logs a line each time another
 * {@code updateInterval} percent of the steps is done, with an estimate of the time left.
 */
public class ProgressBar {
    private static final Logger log = LoggerFactory.getLogger(ProgressBar.class);

    private final String taskName;
    private final int totalSteps;
    private final int updateInterval;
    private final Clock clock;
    private final Instant startTime;
    private int currentStep;
    private int lastReportedPercentage = -1;

    /**
     * @param updateInterval report granularity in percent
     */
    public ProgressBar(String taskName, int totalSteps, int updateInterval, Clock clock) {
        this.taskName = taskName;
        this.totalSteps = totalSteps > 0 ? totalSteps : 1;
        this.updateInterval = Math.max(1, updateInterval);
        this.clock = clock;
        this.startTime = clock.instant();
        log.info("[{}] started, {} steps", taskName, totalSteps);
    }

    public void step() {
        increment(1);
    }

    public void increment(int steps) {
        currentStep = Math.min(totalSteps, currentStep + steps);
        report();
    }

    public void complete() {
        currentStep = totalSteps;
        long duration = Duration.between(startTime, clock.instant()).toMillis();
        log.info("[{}] finished {}/{} in {} ms", taskName, currentStep, totalSteps, duration);
    }

    public int getCurrentStep() {
        return currentStep;
    }

    public int getPercentage() {
        return Math.min(100, (int) ((currentStep * 100.0) / totalSteps));
    }

    private void report() {
        int percentage = getPercentage();
        if (percentage != lastReportedPercentage && (percentage % updateInterval == 0 || percentage == 100)) {
            log.info("[{}] {}/{} ({}%) | remaining: {}", taskName, currentStep, totalSteps, percentage,
                    estimateRemaining(percentage));
            lastReportedPercentage = percentage;
        }
    }

    private String estimateRemaining(int percentage) {
        if (percentage == 0) {
            return "estimating...";
        }
        long elapsedMs = Duration.between(startTime, clock.instant()).toMillis();
        long remainingMs = (elapsedMs * 100) / percentage - elapsedMs;

        if (remainingMs < 1000) {
            return "<1s";
        } else if (remainingMs < 60000) {
            return (remainingMs / 1000) + "s";
        } else {
            return (remainingMs / 60000) + "m " + ((remainingMs % 60000) / 1000) + "s";
        }
    }
}
