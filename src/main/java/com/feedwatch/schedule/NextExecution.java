package com.feedwatch.schedule;

import java.time.Instant;

/** Upcoming fire time of one slot. */
public record NextExecution(Instant at, String slot, int credentialIndex) {}
