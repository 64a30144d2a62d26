package com.cnab.importer.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Configures the global SpringDoc OpenAPI metadata for Swagger UI.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI cnabImporterOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("CNAB Importer API")
                        .description("""
                                Imports fixed-width CNAB card transaction files.

                                **Exposed resources:**
                                - `/api/v1/transactions/upload-from-file`: upload and import a CNAB file
                                - `/api/v1/batch`: import a server-side file as a Spring Batch job and track it
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")
                ));
    }
}
