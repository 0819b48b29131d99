package com.example.negotiation.domain;

public enum ParticipantRole {
    BUYER,
    SELLER
}
