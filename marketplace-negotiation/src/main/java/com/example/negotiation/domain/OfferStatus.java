package com.example.negotiation.domain;

public enum OfferStatus {
    OPENED,
    OFFER_PENDING,
    COUNTERED
}
