package com.dcruver.anchorwatch.pipeline;

import com.dcruver.anchorwatch.config.EngineProperties;
import com.dcruver.anchorwatch.domain.SourceTier;
import com.dcruver.anchorwatch.store.LinkStore;
import com.dcruver.anchorwatch.store.LinkStore.ScoreSample;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Maintains per-anchor, per-tier mean and standard deviation of link scores over a
 * trailing window. Refreshed on a fixed cadence, independently of matcher and
 * classifier runs.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ThresholdStatisticsService {

    private final LinkStore linkStore;
    private final EngineProperties properties;

    private final AtomicReference<ThresholdSnapshot> current = new AtomicReference<>();

    @Scheduled(cron = "${anchorwatch.statistics.refresh-cron:0 0 * * * *}")
    public void scheduledRefresh() {
        try {
            refresh();
        } catch (DataAccessException e) {
            log.error("Statistics refresh failed, keeping the previous snapshot", e);
        }
    }

    public ThresholdSnapshot refresh() {
        return refresh(Instant.now());
    }

    /**
     * Recompute statistics from links created in the window ending at {@code asOf}
     */
    public ThresholdSnapshot refresh(Instant asOf) {
        EngineProperties.Statistics config = properties.getStatistics();
        Instant windowStart = asOf.minus(Duration.ofDays(config.getWindowDays()));

        List<ScoreSample> samples = linkStore.scoreSamplesSince(windowStart);

        Map<ThresholdSnapshot.Key, List<Double>> grouped = new HashMap<>();
        for (ScoreSample sample : samples) {
            ThresholdSnapshot.Key key = new ThresholdSnapshot.Key(sample.anchorId(), SourceTier.forCategory(sample.category()));
            grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(sample.score());
        }

        Map<ThresholdSnapshot.Key, ThresholdStatistics> statistics = new HashMap<>();
        int fallbacks = 0;
        for (Map.Entry<ThresholdSnapshot.Key, List<Double>> entry : grouped.entrySet()) {
            ThresholdStatistics stats = summarize(entry.getKey(), entry.getValue(), config.getMinSamples());
            if (stats.isFallback()) {
                fallbacks++;
            }
            statistics.put(entry.getKey(), stats);
        }

        ThresholdSnapshot snapshot = ThresholdSnapshot.builder()
            .computedAt(asOf)
            .windowStart(windowStart)
            .statistics(Map.copyOf(statistics))
            .tier1FixedThreshold(properties.getEnrichment().getTier1FixedThreshold())
            .defaultThreshold(config.getDefaultThreshold())
            .build();
        current.set(snapshot);

        log.info("Refreshed threshold statistics from {} scores: {} anchor/tier groups ({} below {} samples)",
            samples.size(), statistics.size(), fallbacks, config.getMinSamples());
        return snapshot;
    }

    /**
     * Latest snapshot, computing one if none exists yet
     */
    public ThresholdSnapshot current() {
        ThresholdSnapshot snapshot = current.get();
        return snapshot != null ? snapshot : refresh();
    }

    static ThresholdStatistics summarize(ThresholdSnapshot.Key key, List<Double> scores, int minSamples) {
        int n = scores.size();
        double mean = scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);

        // Sample standard deviation; a single score has no spread
        double stddev = 0.0;
        if (n > 1) {
            double squares = 0.0;
            for (double score : scores) {
                squares += (score - mean) * (score - mean);
            }
            stddev = Math.sqrt(squares / (n - 1));
        }

        return ThresholdStatistics.builder()
            .anchorId(key.anchorId())
            .tier(key.tier())
            .sampleCount(n)
            .mean(mean)
            .stddev(stddev)
            .fallback(n < minSamples)
            .build();
    }
}
