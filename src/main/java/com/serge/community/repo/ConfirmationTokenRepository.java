package com.serge.community.repo;

import com.serge.community.domain.ConfirmationToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface ConfirmationTokenRepository extends JpaRepository<ConfirmationToken, UUID> {

    @Query("SELECT t FROM ConfirmationToken t JOIN FETCH t.account WHERE t.code = :code")
    Optional<ConfirmationToken> findByCode(@Param("code") String code);

    /**
     * Deletes the token row by its code. Returns the number of rows removed: 1 for the caller
     * that consumed the token, 0 for anyone who lost the race (the row lock serializes them).
     */
    @Modifying
    @Query("DELETE FROM ConfirmationToken t WHERE t.code = :code")
    int deleteByCode(@Param("code") String code);
}
