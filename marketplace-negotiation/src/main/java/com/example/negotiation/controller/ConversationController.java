package com.example.negotiation.controller;

import com.example.negotiation.domain.AuthenticatedUser;
import com.example.negotiation.domain.ChatMessage;
import com.example.negotiation.domain.ConversationMetadata;
import com.example.negotiation.domain.MessageType;
import com.example.negotiation.domain.NegotiationState;
import com.example.negotiation.domain.ReadMarker;
import com.example.negotiation.dto.ConversationDetail;
import com.example.negotiation.dto.ConversationSummary;
import com.example.negotiation.dto.CreateConversationRequest;
import com.example.negotiation.dto.MarkReadRequest;
import com.example.negotiation.dto.SendMessageRequest;
import com.example.negotiation.service.ConversationService;
import com.example.negotiation.service.PrincipalResolver;
import com.example.negotiation.service.exception.InvalidPayloadException;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/conversations")
public class ConversationController {

    private final ConversationService conversationService;
    private final PrincipalResolver principalResolver;

    public ConversationController(ConversationService conversationService, PrincipalResolver principalResolver) {
        this.conversationService = conversationService;
        this.principalResolver = principalResolver;
    }

    @PostMapping
    public ResponseEntity<ConversationMetadata> createConversation(
            @Valid @RequestBody CreateConversationRequest request,
            @RequestHeader(name = PrincipalResolver.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(name = PrincipalResolver.USER_VERIFIED_HEADER, required = false) String verified) {
        AuthenticatedUser buyer = principalResolver.resolve(userId, verified);
        return ResponseEntity.ok(conversationService.getOrCreateConversation(buyer, request.getProductId()));
    }

    @GetMapping
    public ResponseEntity<List<ConversationSummary>> listConversations(
            @RequestParam(name = "includeArchived", defaultValue = "false") boolean includeArchived,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size,
            @RequestHeader(name = PrincipalResolver.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(name = PrincipalResolver.USER_VERIFIED_HEADER, required = false) String verified) {
        AuthenticatedUser user = principalResolver.resolve(userId, verified);
        return ResponseEntity.ok(conversationService.listConversations(user, includeArchived, page, size));
    }

    @GetMapping("/{conversationId}")
    public ResponseEntity<ConversationDetail> getConversation(
            @PathVariable String conversationId,
            @RequestHeader(name = PrincipalResolver.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(name = PrincipalResolver.USER_VERIFIED_HEADER, required = false) String verified) {
        AuthenticatedUser user = principalResolver.resolve(userId, verified);
        return ResponseEntity.ok(conversationService.openConversation(user, conversationId));
    }

    @PostMapping("/{conversationId}/messages")
    public ResponseEntity<ChatMessage> sendMessage(
            @PathVariable String conversationId,
            @RequestBody SendMessageRequest request,
            @RequestHeader(name = PrincipalResolver.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(name = PrincipalResolver.USER_VERIFIED_HEADER, required = false) String verified) {
        AuthenticatedUser sender = principalResolver.resolve(userId, verified);
        ChatMessage message = conversationService.postMessage(
                sender, conversationId, parseType(request.getType()), request.getBody(), request.getOfferAmount());
        return ResponseEntity.ok(message);
    }

    @GetMapping("/{conversationId}/messages")
    public ResponseEntity<List<ChatMessage>> getMessages(
            @PathVariable String conversationId,
            @RequestParam(name = "after", defaultValue = "0") long after,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestHeader(name = PrincipalResolver.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(name = PrincipalResolver.USER_VERIFIED_HEADER, required = false) String verified) {
        AuthenticatedUser user = principalResolver.resolve(userId, verified);
        return ResponseEntity.ok(conversationService.getMessages(user, conversationId, after, limit));
    }

    @PostMapping("/{conversationId}/read")
    public ResponseEntity<ReadMarker> markRead(
            @PathVariable String conversationId,
            @Valid @RequestBody MarkReadRequest request,
            @RequestHeader(name = PrincipalResolver.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(name = PrincipalResolver.USER_VERIFIED_HEADER, required = false) String verified) {
        AuthenticatedUser user = principalResolver.resolve(userId, verified);
        return ResponseEntity.ok(conversationService.markRead(user, conversationId, request.getUptoSequence()));
    }

    @PostMapping("/{conversationId}/archive")
    public ResponseEntity<ConversationSummary> archive(
            @PathVariable String conversationId,
            @RequestHeader(name = PrincipalResolver.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(name = PrincipalResolver.USER_VERIFIED_HEADER, required = false) String verified) {
        AuthenticatedUser user = principalResolver.resolve(userId, verified);
        return ResponseEntity.ok(conversationService.archive(user, conversationId));
    }

    @DeleteMapping("/{conversationId}/archive")
    public ResponseEntity<ConversationSummary> unarchive(
            @PathVariable String conversationId,
            @RequestHeader(name = PrincipalResolver.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(name = PrincipalResolver.USER_VERIFIED_HEADER, required = false) String verified) {
        AuthenticatedUser user = principalResolver.resolve(userId, verified);
        return ResponseEntity.ok(conversationService.unarchive(user, conversationId));
    }

    @GetMapping("/{conversationId}/negotiation")
    public ResponseEntity<NegotiationState> getNegotiationState(
            @PathVariable String conversationId,
            @RequestHeader(name = PrincipalResolver.USER_ID_HEADER, required = false) String userId,
            @RequestHeader(name = PrincipalResolver.USER_VERIFIED_HEADER, required = false) String verified) {
        AuthenticatedUser user = principalResolver.resolve(userId, verified);
        return ResponseEntity.ok(conversationService.getNegotiationState(user, conversationId));
    }

    private MessageType parseType(String type) {
        if (type == null || type.isBlank()) {
            return MessageType.TEXT;
        }
        try {
            return MessageType.fromWireName(type);
        } catch (IllegalArgumentException ex) {
            throw new InvalidPayloadException("Unsupported message type " + type);
        }
    }
}
