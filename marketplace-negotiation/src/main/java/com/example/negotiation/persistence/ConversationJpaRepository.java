package com.example.negotiation.persistence;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ConversationJpaRepository extends JpaRepository<ConversationEntity, String> {

    Optional<ConversationEntity> findByProductIdAndBuyerId(String productId, String buyerId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from ConversationEntity c where c.id = :id")
    Optional<ConversationEntity> findByIdForUpdate(@Param("id") String id);

    @Query(
            "select c from ConversationEntity c "
                    + "where (c.buyerId = :userId and (:includeArchived = true or c.buyerArchivedAt is null)) "
                    + "or (c.sellerId = :userId and (:includeArchived = true or c.sellerArchivedAt is null)) "
                    + "order by c.lastActivityAt desc, c.id asc")
    List<ConversationEntity> findForParticipant(
            @Param("userId") String userId,
            @Param("includeArchived") boolean includeArchived,
            Pageable pageable);
}
