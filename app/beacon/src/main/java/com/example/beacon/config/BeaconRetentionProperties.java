/*
 * Where: Beacon application configuration binding
 * What: Holds retention cleanup settings
 * Why: Keep audit retention and schedule tunable per environment
 */
package com.example.beacon.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "beacon.retention")
public record BeaconRetentionProperties(
    boolean enabled, int retentionDays, Duration cleanupInterval) {}
