package com.example.agentdeployer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Agent Deployer
 *
 * Provisions reusable n8n workflow templates ("agents") into client
 * n8n instances and keeps watching the deployed workflows.
 *
 * Architecture:
 * - Credential Schema Extractor → discovers the secrets a template needs
 * - Deployment Engine → credentials, workflow, activation, with rollback and retry
 * - Health Monitor → liveness, activity and failure-rate checks with alerting
 * - Event Gateway → WebSocket broadcast of progress and health events
 */
@SpringBootApplication
@EnableScheduling
@EnableAsync
public class AgentDeployerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentDeployerApplication.class, args);
    }
}
