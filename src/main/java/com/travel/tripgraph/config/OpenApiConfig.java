package com.travel.tripgraph.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI tripGraphOpenAPI(@Value("${server.port:8080}") int port,
                                    DatasetProperties datasetProperties) {
        String dataset = datasetProperties.getHuggingFace().getDataset();

        Info info = new Info()
                .title("Trip Graph API")
                .version("0.0.1")
                .description("Trip lookups over the " + dataset + " itineraries loaded into Neo4j, " +
                        "plus admin endpoints to run and cancel dataset ingestion.");

        return new OpenAPI()
                .info(info)
                .externalDocs(new ExternalDocumentation()
                        .description("Source dataset: " + dataset)
                        .url("https://huggingface.co/datasets/" + dataset))
                .servers(List.of(new Server()
                        .url("http://localhost:" + port)
                        .description("Local trip-graph instance")));
    }
}
