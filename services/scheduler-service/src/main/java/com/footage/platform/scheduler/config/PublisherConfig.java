package com.footage.platform.scheduler.config;

import com.footage.platform.scheduler.model.Platform;
import com.footage.platform.scheduler.publisher.ConnectorPlatformPublisher;
import com.footage.platform.scheduler.publisher.PlatformPublisher;
import com.footage.platform.scheduler.publisher.PlatformPublisherRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Configuration
@Slf4j
public class PublisherConfig {

    /**
     * One connector-backed publisher per enabled platform that has a connector URL.
     */
    @Bean
    public PlatformPublisherRegistry platformPublisherRegistry(SchedulerProperties properties,
                                                               WebClient.Builder webClientBuilder) {
        List<PlatformPublisher> publishers = new ArrayList<>();

        for (Map.Entry<Platform, SchedulerProperties.PlatformSettings> entry : properties.getPlatforms().entrySet()) {
            Platform platform = entry.getKey();
            SchedulerProperties.PlatformSettings settings = entry.getValue();

            if (!settings.isEnabled() || settings.getConnectorUrl() == null || settings.getConnectorUrl().isBlank()) {
                log.info("No publisher registered for {}", platform);
                continue;
            }

            WebClient client = webClientBuilder.clone().baseUrl(settings.getConnectorUrl()).build();
            publishers.add(new ConnectorPlatformPublisher(
                    platform, client, settings.getRequestTimeout(), settings.defaultSlot()));
            log.info("Registered {} publisher at {}", platform, settings.getConnectorUrl());
        }

        return new PlatformPublisherRegistry(publishers);
    }
}
