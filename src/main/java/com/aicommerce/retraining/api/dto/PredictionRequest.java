package com.aicommerce.retraining.api.dto;

import com.aicommerce.retraining.domain.model.BehaviorFeatures;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request DTO carrying a user's aggregated behavior for scoring.
 *
 * @author Retraining Team
 */
public class PredictionRequest {

    private Long userId;

    @NotNull(message = "Event count is required")
    @Min(value = 0, message = "Event count must not be negative")
    private Long eventCount;

    @NotNull(message = "Page views are required")
    @Min(value = 0, message = "Page views must not be negative")
    private Long pageViews;

    @NotNull(message = "Cart adds are required")
    @Min(value = 0, message = "Cart adds must not be negative")
    private Long cartAdds;

    @NotNull(message = "Total session duration is required")
    @PositiveOrZero(message = "Total session duration must not be negative")
    private Double totalSessionDuration;

    @NotNull(message = "Average session duration is required")
    @PositiveOrZero(message = "Average session duration must not be negative")
    private Double avgSessionDuration;

    public PredictionRequest() {
    }

    /**
     * Convert to a feature row. The purchase count is unknown at scoring time.
     */
    public BehaviorFeatures toFeatures() {
        return new BehaviorFeatures(
                userId == null ? 0L : userId,
                eventCount,
                pageViews,
                cartAdds,
                0L,
                totalSessionDuration,
                avgSessionDuration
        );
    }

    // Getters and setters
    public Long getUserId() {
        return userId;
    }

    public void setUserId(Long userId) {
        this.userId = userId;
    }

    public Long getEventCount() {
        return eventCount;
    }

    public void setEventCount(Long eventCount) {
        this.eventCount = eventCount;
    }

    public Long getPageViews() {
        return pageViews;
    }

    public void setPageViews(Long pageViews) {
        this.pageViews = pageViews;
    }

    public Long getCartAdds() {
        return cartAdds;
    }

    public void setCartAdds(Long cartAdds) {
        this.cartAdds = cartAdds;
    }

    public Double getTotalSessionDuration() {
        return totalSessionDuration;
    }

    public void setTotalSessionDuration(Double totalSessionDuration) {
        this.totalSessionDuration = totalSessionDuration;
    }

    public Double getAvgSessionDuration() {
        return avgSessionDuration;
    }

    public void setAvgSessionDuration(Double avgSessionDuration) {
        this.avgSessionDuration = avgSessionDuration;
    }
}
