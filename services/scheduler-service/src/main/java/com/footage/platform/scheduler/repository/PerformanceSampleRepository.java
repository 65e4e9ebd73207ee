package com.footage.platform.scheduler.repository;

import com.footage.platform.scheduler.entity.PerformanceSample;
import com.footage.platform.scheduler.model.Platform;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.OffsetDateTime;
import java.util.List;

public interface PerformanceSampleRepository extends JpaRepository<PerformanceSample, Long> {

    List<PerformanceSample> findByPlatformAndFetchedAtGreaterThanEqual(Platform platform, OffsetDateTime since);

    List<PerformanceSample> findByFetchedAtGreaterThanEqual(OffsetDateTime since);
}
