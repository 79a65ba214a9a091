package com.tpgsweep.orchestrator.service;

import com.tpgsweep.orchestrator.model.SweepState;

/**
 * Answer to a cancel request.
 *
 * @param state         the sweep's state after the request
 * @param cancelled     false when the sweep had already finished
 * @param jobsCancelled jobs the scheduler accepted a cancel for
 */
public record CancelResult(SweepState state, boolean cancelled, int jobsCancelled) {}
