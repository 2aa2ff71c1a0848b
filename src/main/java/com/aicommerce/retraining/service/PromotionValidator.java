package com.aicommerce.retraining.service;

import com.aicommerce.retraining.domain.model.ModelTask;
import org.springframework.stereotype.Component;

/**
 * Compares a candidate's primary metric with production using a relative-improvement rule.
 *
 * - higher is better (churn accuracy):  (candidate - production) / max(|production|, eps) >= threshold
 * - lower is better (spending mse):     (production - candidate) / max(|production|, eps) >= threshold
 *
 * No production model means the candidate is promoted unconditionally. With a positive
 * threshold, ties and regressions never promote.
 *
 * @author Retraining Team
 */
@Component
public class PromotionValidator {

    static final double EPSILON = 1e-9;

    public boolean shouldPromote(ModelTask task, double candidate, Double production, double threshold) {
        if (production == null) {
            return true;
        }
        return relativeImprovement(task, candidate, production) >= threshold;
    }

    /**
     * Relative improvement of the candidate over production, positive when better.
     */
    public double relativeImprovement(ModelTask task, double candidate, double production) {
        double delta = task.isHigherBetter() ? candidate - production : production - candidate;
        return delta / Math.max(Math.abs(production), EPSILON);
    }

    /**
     * Check that a metric reported by the trainer can be compared at all.
     *
     * @return null if usable, otherwise the reason it is not
     */
    public String checkUsable(ModelTask task, double metric) {
        if (Double.isNaN(metric) || Double.isInfinite(metric)) {
            return "Candidate " + task.getPrimaryMetric() + " is not a finite number: " + metric;
        }
        if (task.isHigherBetter() && (metric < 0.0 || metric > 1.0)) {
            return "Candidate " + task.getPrimaryMetric() + " out of range [0, 1]: " + metric;
        }
        if (!task.isHigherBetter() && metric < 0.0) {
            return "Candidate " + task.getPrimaryMetric() + " must not be negative: " + metric;
        }
        return null;
    }
}
