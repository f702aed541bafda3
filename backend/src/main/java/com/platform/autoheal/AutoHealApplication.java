package com.platform.autoheal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Auto-Heal Control Plane Application
 *
 * Watches managed Kubernetes Deployments, predicts their failure risk from runtime signals
 * and escalates remediation one tier at a time:
 * - Tier 1: rolling restart
 * - Tier 2: in-pod cache clear, then restart
 * - Tier 3: rollback to the previous revision
 */
@SpringBootApplication
@EnableAsync
@EnableScheduling
public class AutoHealApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutoHealApplication.class, args);
    }
}
