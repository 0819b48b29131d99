package com.example.negotiation.dto;

import com.example.negotiation.domain.ChatMessage;
import com.example.negotiation.domain.ReadMarker;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ConversationDetail {

    ConversationSummary conversation;
    List<ChatMessage> messages;
    ReadMarker readMarker;
}
