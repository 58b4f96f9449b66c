package com.example.agentdeployer.repository;

import com.example.agentdeployer.domain.Deployment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DeploymentRepository extends JpaRepository<Deployment, String> {

    List<Deployment> findAllByOrderByDeployedAtDesc();

    List<Deployment> findByStatus(Deployment.DeploymentStatus status);

    List<Deployment> findByClientIdOrderByDeployedAtDesc(String clientId);

    List<Deployment> findByClientIdAndAgentIdAndStatusNot(String clientId, String agentId,
                                                         Deployment.DeploymentStatus status);
}
