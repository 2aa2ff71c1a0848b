package com.aicommerce.retraining.domain.model;

/**
 * Score produced by a production model.
 *
 * @param task Model task
 * @param version Version of the production artifact that produced the score
 * @param score churn probability for CHURN, predicted spending score for SPENDING
 * @author Retraining Team
 */
public record Prediction(ModelTask task, long version, double score) {
}
