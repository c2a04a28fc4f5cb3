package com.tracking.engine.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation, served at /swagger-ui.html and /v3/api-docs.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI trackingEngineOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Tracking Engine API")
                        .description("Motion-aware location tracking for mobile devices.\n\n" +
                                "## Session\n\n" +
                                "1. `POST /api/tracking/config` with a tracking configuration\n" +
                                "2. `POST /api/tracking/start` (or `/start-geofences`)\n" +
                                "3. Device bridge streams fixes and sensor events over STOMP\n" +
                                "4. `POST /api/tracking/stop`\n\n" +
                                "## WebSocket\n\n" +
                                "Connect to `ws://localhost:" + serverPort + "/ws/tracking`.\n\n" +
                                "**Device streams:** `/app/device/location`, `/app/device/activity`, " +
                                "`/app/device/accelerometer`, `/app/device/geofence`, `/app/device/connectivity`, " +
                                "`/app/device/provider-error`, `/app/device/authorization`\n\n" +
                                "**Device commands:** `/topic/device/commands`\n\n" +
                                "**Events:** `/topic/location`, `/topic/motionchange`, `/topic/geofence`, " +
                                "`/topic/geofenceschange`, `/topic/http`, `/topic/activitychange`, `/topic/error`, " +
                                "`/topic/connectivitychange`, `/topic/enabledchange`, `/topic/heartbeat`")
                        .version("1.0.0")
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")
                ));
    }
}
