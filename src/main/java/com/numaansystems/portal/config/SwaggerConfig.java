package com.numaansystems.portal.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI metadata for the login, logout and health endpoints.
 *
 * <p>The document is served at {@code /v3/api-docs}. Access is limited by
 * {@link ApiDocsAccessFilter} to portal sessions of the admin department.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI portalOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Employee Portal Gateway API")
                .description("Two-factor employee login and role-based routing to department dashboards")
                .version("0.1.0")
                .contact(new Contact()
                    .name("Numaan Systems")
                    .email("support@numaansystems.com")));
    }
}
