package com.aicommerce.retraining.repository;

import com.aicommerce.retraining.domain.model.UserBehavior;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Read access to the storefront's behavioral event log.
 *
 * @author Retraining Team
 */
@Repository
public interface UserBehaviorRepository extends JpaRepository<UserBehavior, Long> {

    /**
     * Count events recorded after the given instant.
     *
     * @param since exclusive lower bound
     * @return number of newer events
     */
    long countByCreatedAtAfter(Instant since);

    /**
     * Count events recorded up to and including the given instant.
     *
     * @param until inclusive upper bound
     * @return number of events
     */
    long countByCreatedAtLessThanEqual(Instant until);

    /**
     * Aggregate all events up to {@code until} into one row per user.
     * Events newer than {@code until} are left for the next snapshot.
     *
     * @param until inclusive upper bound on created_at
     * @return per-user aggregates ordered by user id
     */
    @Query("""
            SELECT b.userId AS userId,
                   COUNT(b) AS eventCount,
                   COALESCE(SUM(b.pageViews), 0) AS pageViews,
                   SUM(CASE WHEN b.action = 'add_to_cart' THEN 1 ELSE 0 END) AS cartAdds,
                   SUM(CASE WHEN b.action = 'purchase' THEN 1 ELSE 0 END) AS purchaseCount,
                   COALESCE(SUM(b.sessionDuration), 0.0) AS totalSessionDuration,
                   COALESCE(AVG(b.sessionDuration), 0.0) AS avgSessionDuration
            FROM UserBehavior b
            WHERE b.createdAt <= :until
            GROUP BY b.userId
            ORDER BY b.userId
            """)
    List<UserAggregate> aggregateByUser(@Param("until") Instant until);

    /**
     * Projection for {@link #aggregateByUser(Instant)}.
     * Numeric columns are exposed as {@link Number} since the JPA provider decides
     * the concrete type of SUM and AVG results.
     */
    interface UserAggregate {

        Long getUserId();

        Number getEventCount();

        Number getPageViews();

        Number getCartAdds();

        Number getPurchaseCount();

        Number getTotalSessionDuration();

        Number getAvgSessionDuration();
    }
}
