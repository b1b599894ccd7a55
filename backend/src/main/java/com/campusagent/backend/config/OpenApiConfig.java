package com.campusagent.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI campusAgentOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Campus Agent API")
                        .description("Campus resource assistant: Assistant (ask questions routed by intent), "
                                + "Search (direct vector search and index status), Resources (catalog management "
                                + "and categorized import) and Analytics (question history and statistics)")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Campus Agent Team"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Development Server")));
    }
}
