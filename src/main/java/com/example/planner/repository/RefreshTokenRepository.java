package com.example.planner.repository;

import com.example.planner.domain.entity.RefreshToken;
import java.time.Instant;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface RefreshTokenRepository extends JpaRepository<RefreshToken, Long> {

  Optional<RefreshToken> findByTokenHash(String tokenHash);

  /**
   * Marks a usable token as consumed. Returns 1 for exactly one caller per token, 0 for everyone else.
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("UPDATE RefreshToken rt SET rt.consumedAt = :now WHERE rt.tokenHash = :hash "
      + "AND rt.consumedAt IS NULL AND rt.revoked = false AND rt.expiresAt > :now")
  int consume(@Param("hash") String tokenHash, @Param("now") Instant now);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("UPDATE RefreshToken rt SET rt.revoked = true WHERE rt.sessionId = :sessionId AND rt.revoked = false")
  int revokeBySessionId(@Param("sessionId") String sessionId);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("UPDATE RefreshToken rt SET rt.revoked = true WHERE rt.principalId = :principalId AND rt.revoked = false")
  int revokeByPrincipalId(@Param("principalId") String principalId);

  @Modifying
  @Query("DELETE FROM RefreshToken rt WHERE rt.expiresAt < :cutoff OR rt.consumedAt < :cutoff")
  int deleteStale(@Param("cutoff") Instant cutoff);
}
