package com.example.catalogsync.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Configuration for OpenAPI/Swagger documentation.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Catalog Sync API")
                        .version("1.0.0")
                        .description("REST API for reconciling external entity lists into the metadata catalog. " +
                                "Org units, dataset compositions and laws are read from the open-data portal and " +
                                "matched against the catalog through a persisted identity mapping.\n\n" +
                                "**Key Features:**\n" +
                                "- Idempotent create / update / delete reconciliation per entity family\n" +
                                "- Stable catalog identities across renames and moves\n" +
                                "- Duplicate natural keys abort a run before anything is changed\n" +
                                "- Non-empty structures are flagged for review instead of deleted\n" +
                                "- Run history with per-item field changes")
                        .contact(new Contact()
                                .name("API Support")
                                .email("support@example.com"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")
                ));
    }
}
