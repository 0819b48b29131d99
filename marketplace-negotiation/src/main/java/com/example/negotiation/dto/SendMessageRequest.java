package com.example.negotiation.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SendMessageRequest {

    /**
     * One of {@code text}, {@code contact_share}, {@code offer}; {@code text} when omitted.
     */
    @JsonAlias("message_type")
    private String type;

    @JsonAlias("message")
    private String body;

    @JsonAlias("offer_price")
    private BigDecimal offerAmount;
}
