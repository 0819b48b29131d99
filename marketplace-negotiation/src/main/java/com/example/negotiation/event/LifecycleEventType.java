package com.example.negotiation.event;

public enum LifecycleEventType {
    CONVERSATION_STARTED,
    CONVERSATION_ARCHIVED,
    CONVERSATION_UNARCHIVED,
    MESSAGES_READ
}
