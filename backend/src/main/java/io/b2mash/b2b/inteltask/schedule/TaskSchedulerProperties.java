package io.b2mash.b2b.inteltask.schedule;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration properties for the task distribution scheduler.
 *
 * @param enabled whether the periodic tick fires; manual ticks and template execution still work
 * @param intervalMs delay between the end of one tick and the start of the next
 * @param zoneId wall-clock zone used for period and next-run math
 * @param overdueSweepIntervalMs delay between overdue sweeps
 * @param initialDelayMs delay before the first tick after startup
 */
@ConfigurationProperties(prefix = "intel.task-scheduler")
public record TaskSchedulerProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("300000") long intervalMs,
    @DefaultValue("UTC") String zoneId,
    @DefaultValue("600000") long overdueSweepIntervalMs,
    @DefaultValue("0") long initialDelayMs) {}
