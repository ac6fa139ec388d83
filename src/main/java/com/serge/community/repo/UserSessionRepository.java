package com.serge.community.repo;

import com.serge.community.domain.UserSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    @Query("""
        SELECT s FROM UserSession s JOIN FETCH s.account
        WHERE s.id = :id AND s.revokedAt IS NULL AND s.expiresAt > :now
        """)
    Optional<UserSession> findActive(@Param("id") UUID id, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
        UPDATE UserSession s SET s.revokedAt = :now, s.revokedReason = :reason
        WHERE s.id = :id AND s.revokedAt IS NULL
        """)
    int revoke(@Param("id") UUID id, @Param("now") OffsetDateTime now, @Param("reason") String reason);
}
