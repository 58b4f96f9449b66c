package com.example.agentdeployer.repository;

import com.example.agentdeployer.domain.DeploymentAlert;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DeploymentAlertRepository extends JpaRepository<DeploymentAlert, String> {

    List<DeploymentAlert> findByDeploymentIdOrderByTimestampDesc(String deploymentId);

    List<DeploymentAlert> findByAcknowledgedFalseOrderByTimestampDesc();
}
