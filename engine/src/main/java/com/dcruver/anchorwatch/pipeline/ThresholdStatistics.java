package com.dcruver.anchorwatch.pipeline;

import com.dcruver.anchorwatch.domain.SourceTier;
import lombok.Builder;
import lombok.Data;

/**
 * Rolling score statistics for one anchor and one source tier.
 */
@Data
@Builder
public class ThresholdStatistics {
    private final long anchorId;
    private final SourceTier tier;
    private final int sampleCount;
    private final double mean;
    private final double stddev;

    // Too few samples: the default threshold applies instead of mean/stddev
    private final boolean fallback;
}
