package com.tiktimer.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tiktok")
@Data
public class TikTokProperties {

    private String clientKey = "";
    private String clientSecret = "";
    private String redirectUri = "http://localhost:8080/api/v1/auth/tiktok/callback";
    private String authorizeUrl = "https://www.tiktok.com/v2/auth/authorize/";
    private String tokenUrl = "https://open.tiktokapis.com/v2/oauth/token/";
    private String scope = "user.info.basic,video.upload";
    private Http http = new Http();

    @Data
    public static class Http {
        private int connectTimeoutSeconds = 5;
        private int readTimeoutSeconds = 10;
        private int writeTimeoutSeconds = 10;
    }
}
