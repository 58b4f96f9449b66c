package com.example.agentdeployer.repository;

import com.example.agentdeployer.domain.Agent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AgentRepository extends JpaRepository<Agent, String> {

    List<Agent> findByDeletedAtIsNullOrderByCreatedAtDesc();

    Optional<Agent> findByIdAndDeletedAtIsNull(String id);

    boolean existsByNameIgnoreCaseAndDeletedAtIsNull(String name);
}
