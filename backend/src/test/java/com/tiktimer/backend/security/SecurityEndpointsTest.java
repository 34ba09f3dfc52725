package com.tiktimer.backend.security;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class SecurityEndpointsTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void actuatorHealthIsPublic() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk());
    }

    @Test
    void apiDocsArePublic() throws Exception {
        mockMvc.perform(get("/v3/api-docs"))
                .andExpect(status().isOk());
    }

    @Test
    void healthAllowsCorsForConfiguredOrigin() throws Exception {
        mockMvc.perform(get("/actuator/health")
                        .header("Origin", "https://app.example.com"))
                .andExpect(status().isOk())
                .andExpect(header().string("Access-Control-Allow-Origin", "https://app.example.com"));
    }

    @Test
    void protectedEndpointsRequireJwt() throws Exception {
        mockMvc.perform(get("/users/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"))
                .andExpect(jsonPath("$.errorCode").value("UNAUTHORIZED"))
                .andExpect(jsonPath("$.message").value("Could not validate credentials"));
        mockMvc.perform(get("/admin/users"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(post("/auth/logout"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void nonBearerSchemeIsUnauthorized() throws Exception {
        mockMvc.perform(get("/users/me").header(HttpHeaders.AUTHORIZATION, "Basic YWxpY2U6c2VjcmV0"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void tiktokAuthorizeIsPublic() throws Exception {
        mockMvc.perform(get("/api/v1/auth/tiktok/authorize"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authorization_url", containsString("client_key=test-client-key")))
                .andExpect(jsonPath("$.state").isNotEmpty());
    }

    @Test
    void tiktokCallbackRequiresJwt() throws Exception {
        mockMvc.perform(get("/api/v1/auth/tiktok/callback").param("code", "c").param("state", "s"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void requestIdIsEchoed() throws Exception {
        mockMvc.perform(get("/actuator/health").header("X-Request-Id", "req-123"))
                .andExpect(header().string("X-Request-Id", "req-123"))
                .andExpect(header().exists("X-Correlation-Id"));
    }

    @Test
    void unsafeRequestIdIsReplaced() throws Exception {
        mockMvc.perform(get("/actuator/health").header("X-Request-Id", "bad id\nwith newline"))
                .andExpect(header().string("X-Request-Id", org.hamcrest.Matchers.not("bad id\nwith newline")));
    }
}
