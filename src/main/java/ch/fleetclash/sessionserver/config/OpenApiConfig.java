package ch.fleetclash.sessionserver.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the OpenAPI / Swagger documentation.
 *
 * <p>Provides basic API metadata (title, description, version) that is displayed
 * in Swagger UI.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI fleetClashOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("FleetClash Session API")
                        .description("Two-player grid battle sessions with realtime push over SSE and STOMP")
                        .version("v1.0.0"));
    }
}
