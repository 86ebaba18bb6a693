package com.example.planner.repository;

import com.example.planner.domain.entity.StreakCounter;
import jakarta.persistence.LockModeType;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface StreakCounterRepository extends JpaRepository<StreakCounter, Long> {

  List<StreakCounter> findByChildId(String childId);

  /**
   * Row-locks every counter of the child for the rest of the surrounding transaction.
   */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT sc FROM StreakCounter sc WHERE sc.childId = :childId ORDER BY sc.kind")
  List<StreakCounter> findByChildIdForUpdate(@Param("childId") String childId);
}
