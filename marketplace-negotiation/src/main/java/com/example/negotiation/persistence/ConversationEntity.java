package com.example.negotiation.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "negotiation_conversations",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_conversation_product_buyer", columnNames = {"product_id", "buyer_id"}),
        indexes = {
            @Index(name = "idx_conversation_buyer", columnList = "buyer_id, last_activity_at"),
            @Index(name = "idx_conversation_seller", columnList = "seller_id, last_activity_at")
        })
public class ConversationEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "product_id", nullable = false, updatable = false, length = 128)
    private String productId;

    @Column(name = "buyer_id", nullable = false, updatable = false, length = 128)
    private String buyerId;

    @Column(name = "seller_id", nullable = false, updatable = false, length = 128)
    private String sellerId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "last_activity_at", nullable = false)
    private Instant lastActivityAt;

    @Column(name = "last_seq_no", nullable = false)
    private long lastSequence;

    @Column(name = "buyer_archived_at")
    private Instant buyerArchivedAt;

    @Column(name = "seller_archived_at")
    private Instant sellerArchivedAt;

    @Version
    @Column(name = "version")
    private Long version;
}
