package com.tiktimer.backend.config;

import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class TikTokHttpConfig {

    @Bean
    public OkHttpClient tiktokHttpClient(TikTokProperties properties) {
        TikTokProperties.Http http = properties.getHttp();
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(http.getConnectTimeoutSeconds()))
                .readTimeout(Duration.ofSeconds(http.getReadTimeoutSeconds()))
                .writeTimeout(Duration.ofSeconds(http.getWriteTimeoutSeconds()))
                .retryOnConnectionFailure(true)
                .build();
    }
}
