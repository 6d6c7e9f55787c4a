package com.example.campaign.shared.segment;

import com.example.campaign.shared.config.AppProperties;
import com.example.campaign.shared.exception.UnknownDimensionException;
import com.example.campaign.shared.repository.SubscriberRepository;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SegmentCatalogTest {

    @Mock
    private SubscriberRepository subscriberRepository;

    private final AtomicLong ticker = new AtomicLong();

    private SegmentCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = new SegmentCatalog(subscriberRepository,
                Caffeine.newBuilder().expireAfterWrite(Duration.ofMinutes(5)).ticker(ticker::get).build(),
                new AppProperties());
    }

    @Test
    void dimensionsAreListedInRegistrationOrder() {
        List<String> ids = catalog.listDimensions().stream().map(SegmentDimension::id).toList();

        assertThat(ids).containsExactly("country", "browser", "os", "device", "language", "engagement", "subscription_age");
    }

    @Test
    void dataDerivedValuesAreCachedUntilTheyExpire() {
        // Given
        when(subscriberRepository.findDistinctActiveValues("country"))
                .thenReturn(List.of("CA", "US"))
                .thenReturn(List.of("CA", "GB", "US"));

        // When
        Set<String> first = catalog.listValues("country");
        Set<String> second = catalog.listValues("country");
        ticker.addAndGet(Duration.ofMinutes(6).toNanos());
        Set<String> third = catalog.listValues("country");

        // Then
        assertThat(first).containsExactly("CA", "US");
        assertThat(second).isEqualTo(first);
        assertThat(third).containsExactly("CA", "GB", "US");
        verify(subscriberRepository, times(2)).findDistinctActiveValues("country");
    }

    @Test
    void deviceDimensionReadsDeviceTypeColumn() {
        when(subscriberRepository.findDistinctActiveValues("device_type")).thenReturn(List.of("desktop", "mobile"));

        assertThat(catalog.listValues("device")).containsExactly("desktop", "mobile");
    }

    @Test
    void fixedDimensionsNeverQueryTheDatabase() {
        assertThat(catalog.listValues("engagement")).containsExactly("active", "inactive");
        assertThat(catalog.listValues("subscription_age")).containsExactly("new", "recent", "established");
        verifyNoInteractions(subscriberRepository);
    }

    @Test
    void unknownDimensionFails() {
        assertThatThrownBy(() -> catalog.listValues("planet"))
                .isInstanceOf(UnknownDimensionException.class)
                .extracting("dimensionId").isEqualTo("planet");
    }

    @Test
    void unknownBucketValuesMatchNothing() {
        OffsetDateTime now = OffsetDateTime.of(2026, 3, 1, 0, 0, 0, 0, ZoneOffset.UTC);

        SqlPredicate predicate = catalog.dimension("engagement").predicate(Set.of("dormant"), now, "f0_");

        assertThat(predicate).isEqualTo(SqlPredicate.MATCH_NONE);
    }

    @Test
    void bucketPredicateUsesPrefixedParameters() {
        OffsetDateTime now = OffsetDateTime.of(2026, 3, 1, 0, 0, 0, 0, ZoneOffset.UTC);

        SqlPredicate predicate = catalog.dimension("engagement").predicate(Set.of("active", "inactive"), now, "f1_");

        assertThat(predicate.sql()).contains(" OR ");
        assertThat(predicate.params()).containsEntry("f1_active_cutoff", now.minusDays(30))
                .containsEntry("f1_inactive_cutoff", now.minusDays(30));
    }
}
