package com.footage.platform.scheduler.enrichment;

import com.footage.platform.scheduler.config.SchedulerProperties;
import com.footage.platform.scheduler.dto.ContentAdaptation;
import com.footage.platform.scheduler.dto.PublishPayload;
import com.footage.platform.scheduler.exception.ContentEnrichmentException;
import com.footage.platform.scheduler.model.Platform;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class ConnectorContentEnricher implements ContentEnricher {

    private final WebClient.Builder webClientBuilder;
    private final SchedulerProperties properties;

    @Override
    public PublishPayload enrich(Long contentId, Platform platform) {
        ContentAdaptation adaptation;
        try {
            WebClient client = webClientBuilder.baseUrl(properties.getPlatformConnectorUrl()).build();

            adaptation = client.post()
                    .uri("/api/v1/content/adapt")
                    .bodyValue(Map.of(
                            "contentId", contentId,
                            "platform", platform.name()
                    ))
                    .retrieve()
                    .bodyToMono(ContentAdaptation.class)
                    .timeout(Duration.ofSeconds(10))
                    .block();
        } catch (RuntimeException e) {
            throw new ContentEnrichmentException(
                    "Failed to adapt content " + contentId + " for " + platform + ": " + e.getMessage(), e);
        }

        if (adaptation == null) {
            throw new ContentEnrichmentException("No adaptation returned for content " + contentId, null);
        }

        log.debug("Adapted content {} for {}", contentId, platform);
        return toPayload(adaptation);
    }

    static PublishPayload toPayload(ContentAdaptation adaptation) {
        String description = adaptation.getDescription() != null
                ? adaptation.getDescription()
                : adaptation.getCaption();
        List<String> tags = adaptation.getTags() != null && !adaptation.getTags().isEmpty()
                ? adaptation.getTags()
                : adaptation.getHashtags();

        return PublishPayload.builder()
                .title(adaptation.getTitle())
                .description(description)
                .tags(tags != null ? tags : List.of())
                .build();
    }
}
