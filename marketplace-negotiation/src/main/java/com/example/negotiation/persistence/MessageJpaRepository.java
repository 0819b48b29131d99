package com.example.negotiation.persistence;

import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MessageJpaRepository extends JpaRepository<MessageEntity, String> {

    List<MessageEntity> findByConversationIdAndSequenceGreaterThanOrderBySequenceAsc(
            String conversationId, long afterSequence, Pageable pageable);

    List<MessageEntity> findByConversationIdOrderBySequenceAsc(String conversationId);

    List<MessageEntity> findByConversationIdOrderBySequenceDesc(String conversationId, Pageable pageable);

    long countByConversationIdAndSequenceGreaterThanAndSenderIdNot(
            String conversationId, long afterSequence, String senderId);
}
