package com.example.planner.repository;

import com.example.planner.domain.entity.PrincipalRole;
import com.example.planner.domain.entity.SessionRecord;
import com.example.planner.domain.entity.SessionStatus;
import com.example.planner.domain.entity.TerminationReason;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * Session persistence. Every state change is a conditional update on {@code status = ACTIVE},
 * so a terminated session can never be touched back to life by a concurrent request.
 */
@Repository
public interface SessionRecordRepository extends JpaRepository<SessionRecord, String> {

  Optional<SessionRecord> findByAccessTokenHash(String accessTokenHash);

  List<SessionRecord> findByPrincipalIdAndStatusOrderByIssuedAtDesc(String principalId, SessionStatus status);

  List<SessionRecord> findByPrincipalIdAndIssuedAtAfterOrderByIssuedAtDesc(
      String principalId, Instant since, Pageable pageable);

  Optional<SessionRecord> findFirstByPrincipalIdOrderByIssuedAtDesc(String principalId);

  long countByPrincipalIdAndIssuedAtAfter(String principalId, Instant since);

  /**
   * Active sessions of one policy that passed that policy's idle or absolute cutoff, least recently used first.
   */
  @Query("SELECT s FROM SessionRecord s WHERE s.status = com.example.planner.domain.entity.SessionStatus.ACTIVE "
      + "AND s.policy = :policy AND (s.lastActivityAt < :idleCutoff OR s.issuedAt < :absoluteCutoff) "
      + "ORDER BY s.lastActivityAt ASC")
  List<SessionRecord> findExpiryCandidates(
      @Param("policy") PrincipalRole policy,
      @Param("idleCutoff") Instant idleCutoff,
      @Param("absoluteCutoff") Instant absoluteCutoff,
      Pageable pageable);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("UPDATE SessionRecord s SET s.lastActivityAt = :now WHERE s.id = :id "
      + "AND s.status = com.example.planner.domain.entity.SessionStatus.ACTIVE AND s.lastActivityAt < :now")
  int touch(@Param("id") String id, @Param("now") Instant now);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("UPDATE SessionRecord s SET s.accessTokenHash = :hash, s.lastActivityAt = :now WHERE s.id = :id "
      + "AND s.status = com.example.planner.domain.entity.SessionStatus.ACTIVE")
  int rotateAccessToken(@Param("id") String id, @Param("hash") String accessTokenHash, @Param("now") Instant now);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("UPDATE SessionRecord s SET s.status = com.example.planner.domain.entity.SessionStatus.TERMINATED, "
      + "s.revoked = :revoked, s.terminatedAt = :now, s.terminationReason = :reason "
      + "WHERE s.id = :id AND s.status = com.example.planner.domain.entity.SessionStatus.ACTIVE")
  int terminate(
      @Param("id") String id,
      @Param("reason") TerminationReason reason,
      @Param("revoked") boolean revoked,
      @Param("now") Instant now);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("UPDATE SessionRecord s SET s.status = com.example.planner.domain.entity.SessionStatus.TERMINATED, "
      + "s.revoked = true, s.terminatedAt = :now, s.terminationReason = :reason "
      + "WHERE s.principalId = :principalId AND s.status = com.example.planner.domain.entity.SessionStatus.ACTIVE")
  int terminateAllForPrincipal(
      @Param("principalId") String principalId,
      @Param("reason") TerminationReason reason,
      @Param("now") Instant now);
}
