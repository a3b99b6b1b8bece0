package com.forgeloop.core.engine;

import java.time.Duration;

/**
 * Totals for one {@link KernelRunner#runUntilIdle(boolean)} run.
 */
public record RunStats(int cycles, int completed, int failed, int escalated, Duration elapsed) {
}
