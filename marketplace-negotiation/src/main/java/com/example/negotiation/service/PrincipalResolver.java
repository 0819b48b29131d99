package com.example.negotiation.service;

import com.example.negotiation.domain.AuthenticatedUser;
import com.example.negotiation.service.exception.ServiceException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Identity gate adapter. The upstream gateway validates tokens and forwards the caller as
 * {@value #USER_ID_HEADER} and {@value #USER_VERIFIED_HEADER}; {@link #resolve} lifts those header values into an
 * {@link AuthenticatedUser}.
 */
@Component
public class PrincipalResolver {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_VERIFIED_HEADER = "X-User-Verified";

    public AuthenticatedUser resolve(String userId, String verified) {
        if (!StringUtils.hasText(userId)) {
            throw new ServiceException(HttpStatus.UNAUTHORIZED, "Authenticated user is required", "unauthenticated");
        }
        return new AuthenticatedUser(userId.trim(), Boolean.parseBoolean(StringUtils.trimWhitespace(verified)));
    }
}
