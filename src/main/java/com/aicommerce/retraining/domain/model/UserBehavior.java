package com.aicommerce.retraining.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Behavioral event recorded by the storefront (view, cart add, purchase, ...).
 * The storefront owns this table; the retraining service only reads it.
 *
 * @author Retraining Team
 */
@Entity
@Table(name = "user_behaviors", indexes = {
    @Index(name = "idx_behavior_user", columnList = "user_id"),
    @Index(name = "idx_behavior_created", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserBehavior {

    public static final String ACTION_VIEW = "view";
    public static final String ACTION_CART_ADD = "add_to_cart";
    public static final String ACTION_PURCHASE = "purchase";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "product_id")
    private Long productId;

    /**
     * Action name: view, add_to_cart, purchase, ...
     */
    @Column(name = "action", nullable = false, length = 50)
    private String action;

    @Column(name = "session_duration")
    private Double sessionDuration;

    @Column(name = "page_views", nullable = false)
    @Builder.Default
    private Integer pageViews = 1;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
