package com.questrail.spooltag.bridge.internal.time;

import java.time.Instant;

/**
 * Wall-clock source for event timestamps. Never used for deadlines.
 */
public interface WallClock
{
    Instant now();
}
