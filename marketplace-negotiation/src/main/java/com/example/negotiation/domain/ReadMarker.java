package com.example.negotiation.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReadMarker implements Serializable {

    private String conversationId;
    private String userId;
    private long lastReadSequence;
    private long lastDeliveredSequence;
    private Instant updatedAt;
}
