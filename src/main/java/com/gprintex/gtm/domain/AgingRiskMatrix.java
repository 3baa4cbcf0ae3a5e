package com.gprintex.gtm.domain;

import java.util.Map;

/**
 * Counts of post-signature agreements by aging bucket label, then risk flag label.
 */
public record AgingRiskMatrix(Map<String, Map<String, Long>> cells) {

    public long count(AgingBucket bucket, RiskFlag flag) {
        return cells.getOrDefault(bucket.label(), Map.of()).getOrDefault(flag.label(), 0L);
    }
}
