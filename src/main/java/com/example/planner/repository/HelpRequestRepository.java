package com.example.planner.repository;

import com.example.planner.domain.entity.HelpRequest;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface HelpRequestRepository extends JpaRepository<HelpRequest, Long> {

  List<HelpRequest> findByChildIdOrderByCreatedAtDesc(String childId);

  List<HelpRequest> findByChildIdAndCreatedAtAfterOrderByCreatedAtAsc(String childId, Instant since);

  long countByChildId(String childId);
}
