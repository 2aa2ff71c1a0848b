package com.aicommerce.retraining.infrastructure.dataset;

import com.aicommerce.retraining.domain.model.BehaviorFeatures;
import com.aicommerce.retraining.domain.model.DatasetSnapshot;
import com.aicommerce.retraining.exception.DataUnavailableException;
import com.aicommerce.retraining.repository.UserBehaviorRepository;
import com.aicommerce.retraining.repository.UserBehaviorRepository.UserAggregate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds dataset snapshots from the storefront's {@code user_behaviors} table.
 *
 * Each snapshot is cut at the current instant: events up to the marker are
 * aggregated into one feature row per user, and events after {@code since}
 * (up to the marker) are counted as new samples. Events arriving while the
 * snapshot is taken fall into the next one.
 *
 * @author Retraining Team
 */
public class BehaviorDatasetProvider implements DatasetSnapshotProvider {

    private static final Logger logger = LoggerFactory.getLogger(BehaviorDatasetProvider.class);

    private final UserBehaviorRepository userBehaviorRepository;
    private final Clock clock;

    public BehaviorDatasetProvider(UserBehaviorRepository userBehaviorRepository, Clock clock) {
        this.userBehaviorRepository = userBehaviorRepository;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public DatasetSnapshot snapshot(Instant since) {
        Instant marker = clock.instant();
        try {
            long total = userBehaviorRepository.countByCreatedAtLessThanEqual(marker);
            long newSamples = since == null
                    ? total
                    : total - userBehaviorRepository.countByCreatedAtLessThanEqual(since);

            List<UserAggregate> aggregates = userBehaviorRepository.aggregateByUser(marker);
            List<BehaviorFeatures> rows = new ArrayList<>(aggregates.size());
            for (UserAggregate aggregate : aggregates) {
                rows.add(toFeatures(aggregate));
            }

            logger.debug("Snapshot at {}: {} events, {} new since {}, {} users",
                    marker, total, newSamples, since, rows.size());

            return new DatasetSnapshot(marker, since, total, Math.max(0L, newSamples), rows);

        } catch (DataAccessException e) {
            throw new DataUnavailableException("Failed to read user behavior data", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public long countNewSamples(Instant since) {
        try {
            return since == null
                    ? userBehaviorRepository.count()
                    : userBehaviorRepository.countByCreatedAtAfter(since);
        } catch (DataAccessException e) {
            throw new DataUnavailableException("Failed to count new user behavior records", e);
        }
    }

    private static BehaviorFeatures toFeatures(UserAggregate aggregate) {
        return new BehaviorFeatures(
                aggregate.getUserId(),
                longValue(aggregate.getEventCount()),
                longValue(aggregate.getPageViews()),
                longValue(aggregate.getCartAdds()),
                longValue(aggregate.getPurchaseCount()),
                doubleValue(aggregate.getTotalSessionDuration()),
                doubleValue(aggregate.getAvgSessionDuration())
        );
    }

    private static long longValue(Number number) {
        return number == null ? 0L : number.longValue();
    }

    private static double doubleValue(Number number) {
        return number == null ? 0.0 : number.doubleValue();
    }
}
