package com.flagship.split_escrow.payout;

/**
 * What happens to the share of a split entry that has no resolvable recipient yet.
 */
public enum PlaceholderPolicy {
    /**
     * Calculate over the full split set and keep the placeholder shares on
     * the platform; the withheld amount is recorded on the batch.
     */
    WITHHOLD,
    /**
     * Scale the resolved recipients' percentages back to 100 and pay out the
     * whole net pool.
     */
    RENORMALIZE
}
