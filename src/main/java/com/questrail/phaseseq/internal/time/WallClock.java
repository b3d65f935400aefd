package com.questrail.phaseseq.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used strictly for event timestamps. It MUST NOT drive
 * timeouts.
 */
public interface WallClock
{
    Instant now();
}
