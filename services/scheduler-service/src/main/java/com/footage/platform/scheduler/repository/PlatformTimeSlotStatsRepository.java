package com.footage.platform.scheduler.repository;

import com.footage.platform.scheduler.entity.PlatformTimeSlotStats;
import com.footage.platform.scheduler.model.Platform;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface PlatformTimeSlotStatsRepository extends JpaRepository<PlatformTimeSlotStats, Long> {

    List<PlatformTimeSlotStats> findByPlatform(Platform platform);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM PlatformTimeSlotStats s WHERE s.platform = :platform")
    int deleteByPlatform(@Param("platform") Platform platform);
}
