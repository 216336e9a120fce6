package com.omkar.case_sync.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "sync")
public class SyncConfig {
    private boolean enabled = true;
    private Duration interval = Duration.ofSeconds(5);
    private Duration initialDelay = Duration.ofSeconds(5);
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    // Local rows held in memory per keyset read
    private int localBatchSize = 500;
}
