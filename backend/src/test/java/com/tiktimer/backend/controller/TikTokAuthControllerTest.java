package com.tiktimer.backend.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "tiktok.client-key=",
        "tiktok.client-secret="
})
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TikTokAuthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void missingTikTokConfigReturnsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/auth/tiktok/authorize"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.message").value("Missing TikTok config: TIKTOK_CLIENT_KEY, TIKTOK_CLIENT_SECRET"));
    }
}
