package com.tiktimer.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "tiktimer.security")
@Data
public class SecurityProperties {

    private Cors cors = new Cors();
    private int passwordStrength = 10;
    private boolean publicHealthEndpoint = true;

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>();
        private List<String> allowedMethods = List.of("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS");
    }
}
