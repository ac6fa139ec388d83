package com.serge.community.repo;

import com.serge.community.domain.Account;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AccountRepository extends JpaRepository<Account, UUID> {

    Optional<Account> findByEmailIgnoreCase(String email);

    Optional<Account> findByUsername(String username);

    boolean existsByEmailIgnoreCase(String email);

    boolean existsByUsernameIgnoreCase(String username);

    @Query("""
        SELECT a FROM Account a
        WHERE LOWER(a.username) LIKE LOWER(CONCAT('%', :text, '%')) ESCAPE '!'
        ORDER BY a.username
        """)
    List<Account> searchByUsernamePattern(@Param("text") String escapedText, Pageable page);

    /** Case-insensitive substring search on usernames; '%' and '_' in the text match literally. */
    default List<Account> searchByUsername(String text, Pageable page) {
        return searchByUsernamePattern(escapeLike(text), page);
    }

    static String escapeLike(String text) {
        return text.replace("!", "!!").replace("%", "!%").replace("_", "!_");
    }

    /** Accounts whose last activity is at or after the threshold. */
    @Query("""
        SELECT a FROM Account a
        WHERE a.lastActivityAt >= :threshold
        ORDER BY a.lastActivityAt DESC
        """)
    List<Account> findOnline(@Param("threshold") OffsetDateTime threshold, Pageable page);

    @Query("""
        SELECT a FROM Account a
        WHERE a.lastActivityAt IS NULL OR a.lastActivityAt < :threshold
        ORDER BY a.username
        """)
    List<Account> findOffline(@Param("threshold") OffsetDateTime threshold, Pageable page);

    /**
     * Conditional activity update: only writes when the stored timestamp is older than the
     * threshold, so concurrent requests from the same account produce at most one write.
     */
    @Modifying
    @Query("""
        UPDATE Account a SET a.lastActivityAt = :now
        WHERE a.id = :id AND (a.lastActivityAt IS NULL OR a.lastActivityAt < :threshold)
        """)
    int touchActivity(@Param("id") UUID id,
                      @Param("now") OffsetDateTime now,
                      @Param("threshold") OffsetDateTime threshold);

    @Modifying
    @Query("UPDATE Account a SET a.lastLoginAt = :now, a.lastActivityAt = :now WHERE a.id = :id")
    int touchLogin(@Param("id") UUID id, @Param("now") OffsetDateTime now);
}
