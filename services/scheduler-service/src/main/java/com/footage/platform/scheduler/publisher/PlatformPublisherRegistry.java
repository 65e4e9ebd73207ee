package com.footage.platform.scheduler.publisher;

import com.footage.platform.scheduler.exception.InvalidJobException;
import com.footage.platform.scheduler.model.Platform;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Platforms that can actually be published to. A platform without a publisher is never scheduled.
 */
public class PlatformPublisherRegistry {

    private final Map<Platform, PlatformPublisher> publishers = new EnumMap<>(Platform.class);

    public PlatformPublisherRegistry(Collection<? extends PlatformPublisher> publishers) {
        for (PlatformPublisher publisher : publishers) {
            PlatformPublisher previous = this.publishers.put(publisher.getPlatform(), publisher);
            if (previous != null) {
                throw new IllegalStateException("Duplicate publisher for platform " + publisher.getPlatform());
            }
        }
    }

    public Optional<PlatformPublisher> find(Platform platform) {
        return Optional.ofNullable(publishers.get(platform));
    }

    public PlatformPublisher require(Platform platform) {
        return find(platform).orElseThrow(() ->
                new InvalidJobException("No publisher registered for platform " + platform));
    }

    public boolean isRegistered(Platform platform) {
        return platform != null && publishers.containsKey(platform);
    }

    public Set<Platform> registeredPlatforms() {
        return publishers.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(publishers.keySet()));
    }
}
