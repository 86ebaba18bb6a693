package com.example.planner.repository;

import com.example.planner.domain.entity.ActivityEvent;
import com.example.planner.domain.entity.ActivityKind;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ActivityEventRepository extends JpaRepository<ActivityEvent, Long> {

  List<ActivityEvent> findByChildIdAndKindOrderByIdAsc(String childId, ActivityKind kind);

  List<ActivityEvent> findByChildIdAndKindAndOccurredAtAfterOrderByIdAsc(
      String childId, ActivityKind kind, Instant since);
}
