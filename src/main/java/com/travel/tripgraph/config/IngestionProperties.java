package com.travel.tripgraph.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "travel.ingestion")
public class IngestionProperties {
    private int workerThreads = 1;
    private long limit = 0; // 0 = whole dataset
    private int progressLogInterval = 100;
}
