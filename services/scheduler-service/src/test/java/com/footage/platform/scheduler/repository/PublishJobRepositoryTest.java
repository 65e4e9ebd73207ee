package com.footage.platform.scheduler.repository;

import com.footage.platform.scheduler.dto.PublishPayload;
import com.footage.platform.scheduler.entity.PublishJob;
import com.footage.platform.scheduler.entity.PublishJobState;
import com.footage.platform.scheduler.model.Platform;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@DisplayName("PublishJobRepository Tests")
class PublishJobRepositoryTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2024-03-05T10:00:00Z");

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private PublishJobRepository jobRepository;

    private PublishJob persist(Platform platform, PublishJobState state, OffsetDateTime scheduledAt) {
        return entityManager.persistAndFlush(PublishJob.builder()
                .contentId(1L)
                .platform(platform)
                .payload(PublishPayload.builder().title("Run " + platform).description("desc").tags(List.of("ski", "alps")).build())
                .scheduledAt(scheduledAt)
                .state(state)
                .build());
    }

    @Test
    @DisplayName("payload survives a round trip through the JSON column")
    void payloadIsStoredAsJson() {
        PublishJob saved = persist(Platform.YOUTUBE, PublishJobState.PENDING, NOW);
        entityManager.clear();

        PublishJob loaded = jobRepository.findById(saved.getId()).orElseThrow();

        assertThat(loaded.getPayload().getTitle()).isEqualTo("Run YOUTUBE");
        assertThat(loaded.getPayload().getTags()).containsExactly("ski", "alps");
        assertThat(loaded.getCreatedAt()).isNotNull();
    }

    @Test
    @DisplayName("findByStateAndScheduledAtLessThanEqual: only due jobs in the given state")
    void findsDueJobs() {
        persist(Platform.YOUTUBE, PublishJobState.PENDING, NOW.minusMinutes(1));
        persist(Platform.YOUTUBE, PublishJobState.PENDING, NOW);
        persist(Platform.YOUTUBE, PublishJobState.PENDING, NOW.plusMinutes(1));
        persist(Platform.YOUTUBE, PublishJobState.SUCCEEDED, NOW.minusDays(1));

        assertThat(jobRepository.findByStateAndScheduledAtLessThanEqual(PublishJobState.PENDING, NOW)).hasSize(2);
    }

    @Test
    @DisplayName("countGroupedByState: one row per populated state")
    void countsByState() {
        persist(Platform.YOUTUBE, PublishJobState.PENDING, NOW);
        persist(Platform.TIKTOK, PublishJobState.PENDING, NOW);
        persist(Platform.TIKTOK, PublishJobState.ABANDONED, NOW);

        Map<PublishJobState, Long> counts = new HashMap<>();
        for (Object[] row : jobRepository.countGroupedByState()) {
            counts.put((PublishJobState) row[0], ((Number) row[1]).longValue());
        }

        assertThat(counts).containsEntry(PublishJobState.PENDING, 2L)
                .containsEntry(PublishJobState.ABANDONED, 1L)
                .hasSize(2);
        assertThat(jobRepository.countByState(PublishJobState.SUCCEEDED)).isZero();
    }

    @Test
    @DisplayName("search: null filters match everything, newest first")
    void searchWithOptionalFilters() {
        PublishJob first = persist(Platform.YOUTUBE, PublishJobState.PENDING, NOW);
        PublishJob second = persist(Platform.TIKTOK, PublishJobState.ABANDONED, NOW);

        assertThat(jobRepository.search(null, null)).extracting(PublishJob::getId)
                .containsExactly(second.getId(), first.getId());
        assertThat(jobRepository.search(PublishJobState.ABANDONED, null)).extracting(PublishJob::getId)
                .containsExactly(second.getId());
        assertThat(jobRepository.search(null, Platform.YOUTUBE)).extracting(PublishJob::getId)
                .containsExactly(first.getId());
        assertThat(jobRepository.search(PublishJobState.PENDING, Platform.TIKTOK)).isEmpty();
    }
}
