package com.example.planner.repository;

import com.example.planner.domain.entity.Principal;
import com.example.planner.domain.entity.PrincipalRole;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PrincipalRepository extends JpaRepository<Principal, String> {

  Optional<Principal> findByLoginNameAndRole(String loginName, PrincipalRole role);

  List<Principal> findByGuardianId(String guardianId);
}
