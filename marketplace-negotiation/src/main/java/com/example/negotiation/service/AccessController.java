package com.example.negotiation.service;

import com.example.negotiation.config.NegotiationSecurityProperties;
import com.example.negotiation.domain.AuthenticatedUser;
import com.example.negotiation.domain.ConversationMetadata;
import com.example.negotiation.domain.ParticipantRole;
import com.example.negotiation.service.exception.ForbiddenException;
import com.example.negotiation.service.exception.NotParticipantException;
import com.example.negotiation.service.exception.ServiceException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Participant-set checks. Only the buyer and the seller of a conversation may see or touch it; there is no
 * elevated role.
 */
@Component
@RequiredArgsConstructor
public class AccessController {

    public enum Action {
        READ,
        WRITE
    }

    private final NegotiationSecurityProperties securityProperties;

    public void requireAuthenticated(AuthenticatedUser principal) {
        if (principal == null || !StringUtils.hasText(principal.userId())) {
            throw new ServiceException(HttpStatus.UNAUTHORIZED, "Authenticated user is required", "unauthenticated");
        }
    }

    public void requireVerified(AuthenticatedUser principal) {
        requireAuthenticated(principal);
        if (securityProperties.isRequireVerifiedForWrites() && !principal.verified()) {
            throw new ForbiddenException("User %s must be verified to perform this operation"
                    .formatted(principal.userId()));
        }
    }

    public ParticipantRole authorize(String userId, ConversationMetadata conversation, Action action) {
        return conversation.roleOf(userId).orElseThrow(() -> denial(userId, conversation, action));
    }

    private ServiceException denial(String userId, ConversationMetadata conversation, Action action) {
        if (action == Action.WRITE) {
            return new NotParticipantException(userId, conversation.getId());
        }
        return new ForbiddenException("User %s cannot access conversation %s".formatted(userId, conversation.getId()));
    }
}
