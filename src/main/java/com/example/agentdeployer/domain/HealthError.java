package com.example.agentdeployer.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** One failed health check remembered on the deployment. */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthError {

    @Column(name = "error_timestamp")
    private Instant timestamp;

    @Column(name = "error_message", length = 2048)
    private String message;

    @Column(name = "error_type")
    private String type;

    @Column(name = "error_severity")
    private String severity;
}
