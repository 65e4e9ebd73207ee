package com.footage.platform.scheduler.repository;

import com.footage.platform.scheduler.entity.PublishJob;
import com.footage.platform.scheduler.entity.PublishJobState;
import com.footage.platform.scheduler.model.Platform;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;

public interface PublishJobRepository extends JpaRepository<PublishJob, Long> {

    List<PublishJob> findByStateAndScheduledAtLessThanEqual(PublishJobState state, OffsetDateTime now);

    List<PublishJob> findByState(PublishJobState state);

    List<PublishJob> findByStateAndPublishedAtGreaterThanEqual(PublishJobState state, OffsetDateTime since);

    long countByState(PublishJobState state);

    @Query("SELECT j.state, COUNT(j) FROM PublishJob j GROUP BY j.state")
    List<Object[]> countGroupedByState();

    @Query("SELECT j FROM PublishJob j WHERE (:state IS NULL OR j.state = :state) " +
           "AND (:platform IS NULL OR j.platform = :platform) ORDER BY j.id DESC")
    List<PublishJob> search(@Param("state") PublishJobState state, @Param("platform") Platform platform);
}
