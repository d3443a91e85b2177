package com.expensesnap.core.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI expenseSnapOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("ExpenseSnap API")
                        .description("""
                                Receipt capture and expense ledger for multiple isolated companies.

                                ## Authentication
                                Register the first account (it becomes the super admin) or register with an
                                invite code, then call `/auth/login` and send the token as a Bearer header.

                                ## Uploads
                                `POST /expenses/upload` accepts JPEG, PNG, WebP, GIF, HEIC and PDF receipts
                                (PDFs up to 10 pages are read in one pass).
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")))
                .addSecurityItem(new SecurityRequirement().addList("Bearer Authentication"))
                .components(new Components()
                        .addSecuritySchemes("Bearer Authentication",
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")
                                        .description("Enter JWT Bearer token")));
    }
}
