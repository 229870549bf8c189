package com.logistics.reconciliation.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI orderReconciliationOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Order Reconciliation Service API")
                        .description("REST API for comparing order lines between the Source and Target stores, "
                                + "building normalized order payloads and validating bulk transfers.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Logistics Data Team")
                                .email("logistics-data@example.com")))
                .servers(List.of(
                        new Server().url("http://localhost:8000").description("Development server")
                ));
    }
}
