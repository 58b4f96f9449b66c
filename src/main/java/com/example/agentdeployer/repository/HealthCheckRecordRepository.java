package com.example.agentdeployer.repository;

import com.example.agentdeployer.domain.HealthCheckRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface HealthCheckRecordRepository extends JpaRepository<HealthCheckRecord, String> {

    List<HealthCheckRecord> findByDeploymentIdOrderByTimestampDesc(String deploymentId, Pageable pageable);
}
