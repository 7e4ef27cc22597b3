package com.example.catalogsync;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.info.License;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main Spring Boot Application class for Catalog Sync.
 *
 * Reconciles entity lists from external sources into the metadata catalog:
 * - Org units of the staff directory as nested collections
 * - Dataset compositions (datasets and their columns) of the open-data portal
 * - Laws of the systematic law collection with their paragraphs
 *
 * Catalog identities are tracked per family in an identity mapping file, so renames and moves
 * keep the same catalog asset. Runs are recorded in an H2 (local) or MariaDB (production) database.
 */
@SpringBootApplication
@EnableScheduling
@OpenAPIDefinition(
    info = @Info(
        title = "Catalog Sync API",
        version = "1.0.0",
        description = "REST API for reconciling external entity lists into the metadata catalog.",
        contact = @Contact(
            name = "API Support",
            email = "support@example.com"
        ),
        license = @License(
            name = "Apache 2.0",
            url = "https://www.apache.org/licenses/LICENSE-2.0"
        )
    )
)
public class CatalogSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(CatalogSyncApplication.class, args);
    }
}
