package com.guardian.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI guardianOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Portfolio Guardian API")
                        .description("Portfolio risk assessment and alert-driven rebalancing")
                        .version("1.0"));
    }
}
