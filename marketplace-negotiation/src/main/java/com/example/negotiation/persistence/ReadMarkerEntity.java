package com.example.negotiation.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@IdClass(ReadMarkerId.class)
@Table(name = "negotiation_read_markers")
public class ReadMarkerEntity {

    @Id
    @Column(name = "conversation_id", nullable = false, updatable = false, length = 64)
    private String conversationId;

    @Id
    @Column(name = "user_id", nullable = false, updatable = false, length = 128)
    private String userId;

    @Column(name = "last_read_seq_no", nullable = false)
    private long lastReadSequence;

    @Column(name = "last_delivered_seq_no", nullable = false)
    private long lastDeliveredSequence;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
