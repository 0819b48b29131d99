package com.example.negotiation.persistence;

import jakarta.persistence.LockModeType;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ReadMarkerJpaRepository extends JpaRepository<ReadMarkerEntity, ReadMarkerId> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select m from ReadMarkerEntity m where m.conversationId = :conversationId and m.userId = :userId")
    Optional<ReadMarkerEntity> findForUpdate(
            @Param("conversationId") String conversationId, @Param("userId") String userId);
}
