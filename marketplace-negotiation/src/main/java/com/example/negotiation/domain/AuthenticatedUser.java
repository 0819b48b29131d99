package com.example.negotiation.domain;

/**
 * Principal handed to the core by the identity gate. The core never computes {@code verified}.
 */
public record AuthenticatedUser(String userId, boolean verified) {}
