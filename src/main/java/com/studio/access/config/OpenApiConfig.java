package com.studio.access.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI doorAccessOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Door Access API")
                .description("Verifies single-use QR secrets from the door scanner against room "
                    + "reservations and temporary access grants, then records the door-open event.")
                .version("1.0.0"));
    }
}
