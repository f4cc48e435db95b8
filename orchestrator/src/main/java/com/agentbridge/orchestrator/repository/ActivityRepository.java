package com.agentbridge.orchestrator.repository;

import com.agentbridge.orchestrator.model.Activity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ActivityRepository extends JpaRepository<Activity, UUID> {

    List<Activity> findByAgentIdOrderByOccurredAtAsc(String agentId);
}
