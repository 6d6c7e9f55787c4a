package com.example.campaign.shared.segment;

import com.example.campaign.shared.config.AppProperties;
import com.example.campaign.shared.exception.UnknownDimensionException;
import com.example.campaign.shared.repository.SubscriberRepository;
import com.github.benmanes.caffeine.cache.Cache;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Registry of the dimensions campaigns can be segmented on, in display order.
 */
@Component
public class SegmentCatalog {

    private final Map<String, SegmentDimension> dimensions;

    public SegmentCatalog(SubscriberRepository subscriberRepository,
                          Cache<String, Set<String>> segmentValuesCache,
                          AppProperties appProperties) {
        AppProperties.Segments config = appProperties.getSegments();

        Map<String, SegmentDimension> registry = new LinkedHashMap<>();
        register(registry, new AttributeDimension("country", "Country", "Country of the subscriber", "country",
                subscriberRepository, segmentValuesCache));
        register(registry, new AttributeDimension("browser", "Browser", "Browser the subscription was made with", "browser",
                subscriberRepository, segmentValuesCache));
        register(registry, new AttributeDimension("os", "Operating system", "Operating system of the subscriber's device", "os",
                subscriberRepository, segmentValuesCache));
        register(registry, new AttributeDimension("device", "Device type", "Desktop, mobile or tablet", "device_type",
                subscriberRepository, segmentValuesCache));
        register(registry, new AttributeDimension("language", "Language", "Preferred language of the subscriber", "language",
                subscriberRepository, segmentValuesCache));
        register(registry, new EngagementDimension(config.getEngagementWindowDays()));
        register(registry, new SubscriptionAgeDimension(config.getNewSubscriberDays(), config.getRecentSubscriberDays()));
        this.dimensions = Collections.unmodifiableMap(registry);
    }

    private static void register(Map<String, SegmentDimension> registry, SegmentDimension dimension) {
        registry.put(dimension.id(), dimension);
    }

    public List<SegmentDimension> listDimensions() {
        return List.copyOf(dimensions.values());
    }

    public SegmentDimension dimension(String id) {
        SegmentDimension dimension = id != null ? dimensions.get(id) : null;
        if (dimension == null) {
            throw new UnknownDimensionException(id);
        }
        return dimension;
    }

    public Set<String> listValues(String dimensionId) {
        return dimension(dimensionId).values();
    }
}
