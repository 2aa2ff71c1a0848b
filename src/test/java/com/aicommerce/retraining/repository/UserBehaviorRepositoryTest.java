package com.aicommerce.retraining.repository;

import com.aicommerce.retraining.domain.model.UserBehavior;
import com.aicommerce.retraining.repository.UserBehaviorRepository.UserAggregate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.aicommerce.retraining.testutil.TestDataBuilder.NOW;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Repository tests for the behavior aggregation queries on H2.
 */
@DataJpaTest
@DisplayName("UserBehaviorRepository Tests")
class UserBehaviorRepositoryTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private UserBehaviorRepository userBehaviorRepository;

    @BeforeEach
    void setUp() {
        // User 1: two views, a cart add and a purchase
        persist(1L, UserBehavior.ACTION_VIEW, 30.0, 2, NOW.minus(Duration.ofHours(5)));
        persist(1L, UserBehavior.ACTION_VIEW, 50.0, 1, NOW.minus(Duration.ofHours(4)));
        persist(1L, UserBehavior.ACTION_CART_ADD, 10.0, 1, NOW.minus(Duration.ofHours(3)));
        persist(1L, UserBehavior.ACTION_PURCHASE, 30.0, 1, NOW.minus(Duration.ofHours(2)));
        // User 2: a single view without session data
        persist(2L, UserBehavior.ACTION_VIEW, null, 3, NOW.minus(Duration.ofHours(1)));
        // After the snapshot marker
        persist(2L, UserBehavior.ACTION_PURCHASE, 5.0, 1, NOW.plusSeconds(1));
        entityManager.flush();
    }

    private void persist(Long userId, String action, Double sessionDuration, int pageViews, Instant createdAt) {
        entityManager.persist(UserBehavior.builder()
                .userId(userId)
                .productId(100L)
                .action(action)
                .sessionDuration(sessionDuration)
                .pageViews(pageViews)
                .createdAt(createdAt)
                .build());
    }

    @Test
    @DisplayName("aggregateByUser - Builds one row per user up to the marker")
    void aggregateByUser() {
        // When
        List<UserAggregate> aggregates = userBehaviorRepository.aggregateByUser(NOW);

        // Then
        assertThat(aggregates).hasSize(2);

        UserAggregate buyer = aggregates.get(0);
        assertThat(buyer.getUserId()).isEqualTo(1L);
        assertThat(buyer.getEventCount().longValue()).isEqualTo(4L);
        assertThat(buyer.getPageViews().longValue()).isEqualTo(5L);
        assertThat(buyer.getCartAdds().longValue()).isEqualTo(1L);
        assertThat(buyer.getPurchaseCount().longValue()).isEqualTo(1L);
        assertThat(buyer.getTotalSessionDuration().doubleValue()).isEqualTo(120.0);
        assertThat(buyer.getAvgSessionDuration().doubleValue()).isEqualTo(30.0);

        // The later purchase of user 2 belongs to the next snapshot
        UserAggregate viewer = aggregates.get(1);
        assertThat(viewer.getUserId()).isEqualTo(2L);
        assertThat(viewer.getEventCount().longValue()).isEqualTo(1L);
        assertThat(viewer.getPurchaseCount().longValue()).isZero();
        assertThat(viewer.getTotalSessionDuration().doubleValue()).isZero();
    }

    @Test
    @DisplayName("count queries - Split records around a marker")
    void countAroundMarker() {
        Instant marker = NOW.minus(Duration.ofMinutes(150));

        assertThat(userBehaviorRepository.countByCreatedAtLessThanEqual(NOW)).isEqualTo(5L);
        assertThat(userBehaviorRepository.countByCreatedAtLessThanEqual(marker)).isEqualTo(3L);
        assertThat(userBehaviorRepository.countByCreatedAtAfter(marker)).isEqualTo(3L);
    }
}
