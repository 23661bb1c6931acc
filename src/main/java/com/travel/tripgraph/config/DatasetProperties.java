package com.travel.tripgraph.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "travel.dataset")
public class DatasetProperties {

    /**
     * Ingest the configured source once the application has started
     */
    private boolean loadOnStartup = false;

    /**
     * Source used by the startup load and by the admin endpoint when none is given: "huggingface" or "file"
     */
    private String source = "huggingface";

    /**
     * JSON Lines file read by the "file" source
     */
    private String filePath = "data/travelplanner-train.jsonl";

    private HuggingFace huggingFace = new HuggingFace();

    @Data
    public static class HuggingFace {
        private String baseUrl = "https://datasets-server.huggingface.co";
        private String dataset = "osunlp/TravelPlanner";
        private String config = "train";
        private String split = "train";
        private int pageSize = 100;
        private int connectTimeoutSeconds = 30;
        private int readTimeoutSeconds = 60;
    }
}
