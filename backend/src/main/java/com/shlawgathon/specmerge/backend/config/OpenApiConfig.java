package com.shlawgathon.specmerge.backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI specMergeOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("SpecMerge API")
                        .description("Reconciles engineering spec values extracted from documents, "
                                + "applies user overrides and classifies field defects against the master spec")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("SpecMerge Team")
                                .email("team@specmerge.dev"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .components(new Components()
                        .addSecuritySchemes("ingestionApiKey", new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name(IngestionApiKeyAuthFilter.INGESTION_API_KEY_HEADER)))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Development Server")));
    }
}
