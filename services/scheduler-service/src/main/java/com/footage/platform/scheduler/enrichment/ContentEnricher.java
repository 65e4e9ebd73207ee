package com.footage.platform.scheduler.enrichment;

import com.footage.platform.scheduler.dto.PublishPayload;
import com.footage.platform.scheduler.model.Platform;

/**
 * Supplies the title, description and tags a piece of content should carry on a given platform.
 */
public interface ContentEnricher {

    /**
     * @throws com.footage.platform.scheduler.exception.ContentEnrichmentException if no payload can be produced
     */
    PublishPayload enrich(Long contentId, Platform platform);
}
