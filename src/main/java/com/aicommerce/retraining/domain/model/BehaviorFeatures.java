package com.aicommerce.retraining.domain.model;

/**
 * Per-user aggregate of behavioral events, one training row for both tasks.
 * The purchase count is the label source and is never used as an input feature.
 *
 * @author Retraining Team
 */
public record BehaviorFeatures(
        long userId,
        long eventCount,
        long pageViews,
        long cartAdds,
        long purchaseCount,
        double totalSessionDuration,
        double avgSessionDuration
) {

    public static final double MAX_SPENDING_SCORE = 1000.0;

    /**
     * Users without a single purchase are labelled as churned.
     */
    public boolean churned() {
        return purchaseCount == 0;
    }

    /**
     * Spending score in [0, 1000], 100 points per purchase.
     */
    public double spendingScore() {
        return Math.min(MAX_SPENDING_SCORE, Math.max(0.0, purchaseCount * 100.0));
    }
}
