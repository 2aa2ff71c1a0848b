package com.aicommerce.retraining.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable view of the behavioral dataset taken for a single retrain attempt.
 *
 * @author Retraining Team
 */
public final class DatasetSnapshot {

    private final Instant marker;
    private final Instant since;
    private final long sampleCount;
    private final long newSampleCount;
    private final List<BehaviorFeatures> rows;

    /**
     * @param marker point in time the snapshot was taken; becomes the task's next
     *               dataset marker when a retrain on this snapshot succeeds
     * @param since previous marker new samples were counted from, null if never trained
     * @param sampleCount total behavioral records in the dataset
     * @param newSampleCount records created after {@code since}
     * @param rows per-user training rows
     */
    public DatasetSnapshot(Instant marker, Instant since, long sampleCount, long newSampleCount,
                           List<BehaviorFeatures> rows) {
        this.marker = Objects.requireNonNull(marker, "marker");
        this.since = since;
        if (sampleCount < 0 || newSampleCount < 0) {
            throw new IllegalArgumentException("Sample counts must not be negative");
        }
        this.sampleCount = sampleCount;
        this.newSampleCount = newSampleCount;
        this.rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public Instant getMarker() {
        return marker;
    }

    public Instant getSince() {
        return since;
    }

    public long getSampleCount() {
        return sampleCount;
    }

    public long getNewSampleCount() {
        return newSampleCount;
    }

    public List<BehaviorFeatures> getRows() {
        return rows;
    }

    @Override
    public String toString() {
        return "DatasetSnapshot{marker=" + marker + ", since=" + since + ", sampleCount=" + sampleCount
                + ", newSampleCount=" + newSampleCount + ", rows=" + rows.size() + '}';
    }
}
