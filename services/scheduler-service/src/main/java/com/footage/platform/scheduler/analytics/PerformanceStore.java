package com.footage.platform.scheduler.analytics;

import com.footage.platform.scheduler.entity.PerformanceSample;
import com.footage.platform.scheduler.entity.PlatformTimeSlotStats;
import com.footage.platform.scheduler.model.Platform;
import com.footage.platform.scheduler.repository.PerformanceSampleRepository;
import com.footage.platform.scheduler.repository.PlatformTimeSlotStatsRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Durable performance history: append-only samples and the time-slot aggregate derived from them.
 */
@Service
@RequiredArgsConstructor
public class PerformanceStore {

    private final PerformanceSampleRepository sampleRepository;
    private final PlatformTimeSlotStatsRepository statsRepository;

    @Transactional
    public PerformanceSample appendSample(PerformanceSample sample) {
        if (sample.getId() != null) {
            throw new IllegalArgumentException("Performance samples are append-only");
        }
        return sampleRepository.save(sample);
    }

    @Transactional(readOnly = true)
    public List<PerformanceSample> samplesSince(Platform platform, OffsetDateTime since) {
        return sampleRepository.findByPlatformAndFetchedAtGreaterThanEqual(platform, since);
    }

    @Transactional(readOnly = true)
    public List<PerformanceSample> samplesSince(OffsetDateTime since) {
        return sampleRepository.findByFetchedAtGreaterThanEqual(since);
    }

    @Transactional(readOnly = true)
    public List<PlatformTimeSlotStats> statsFor(Platform platform) {
        return statsRepository.findByPlatform(platform);
    }

    /**
     * Replace every stats row of a platform with a freshly computed set.
     */
    @Transactional
    public int replaceStats(Platform platform, List<PlatformTimeSlotStats> rows) {
        statsRepository.deleteByPlatform(platform);
        statsRepository.saveAll(rows);
        return rows.size();
    }
}
