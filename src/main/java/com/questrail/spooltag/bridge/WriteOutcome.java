package com.questrail.spooltag.bridge;

/**
 * Outcome of a successful write.
 *
 * @param blocksWritten data blocks the agent wrote; sectors it could not
 *                      authenticate are skipped and not counted
 */
public record WriteOutcome(int blocksWritten)
{
    public WriteOutcome {
        if (blocksWritten < 0) {
            throw new IllegalArgumentException("blocksWritten must be non-negative");
        }
    }
}
