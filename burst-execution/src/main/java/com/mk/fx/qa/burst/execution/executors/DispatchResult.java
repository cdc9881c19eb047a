package com.mk.fx.qa.burst.execution.executors;

/**
 * Result of a dispatcher run.
 *
 * @param ticks number of ticks that launched a burst
 * @param burstsCompleted number of bursts whose workers all finished
 * @param cancelled true if bursts were still in flight after the drain grace and had to be
 *     cancelled
 */
public record DispatchResult(long ticks, long burstsCompleted, boolean cancelled) {}
