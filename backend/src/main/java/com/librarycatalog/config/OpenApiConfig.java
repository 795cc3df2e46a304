package com.librarycatalog.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    public static final String SESSION_AUTH = "sessionAuth";

    @Bean
    public OpenAPI libraryCatalogOpenApi(
            @Value("${server.servlet.session.cookie.name:JSESSIONID}") String sessionCookie) {
        return new OpenAPI()
                .info(new Info()
                        .title("Library Catalog API")
                        .description("Books and authors catalog with Google OAuth login. "
                                + "POST, PUT and DELETE operations require an authenticated session.")
                        .version("0.1.0"))
                .components(new Components()
                        .addSecuritySchemes(SESSION_AUTH, new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.COOKIE)
                                .name(sessionCookie)
                                .description("Session cookie issued after logging in at /auth/google")));
    }
}
