package com.tiktimer.backend.service;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.tiktimer.backend.config.TikTokProperties;
import com.tiktimer.backend.exception.BadRequestException;
import com.tiktimer.backend.exception.ExternalPlatformException;
import com.tiktimer.backend.exception.NotFoundException;
import com.tiktimer.backend.model.User;
import com.tiktimer.backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Attaches a TikTok account to a local user: builds the consent URL, exchanges the authorization code
 * for platform tokens and stores them on the user record. The platform tokens are never returned to
 * clients.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TikTokAuthService {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final TikTokProperties properties;
    private final OkHttpClient tiktokHttpClient;
    private final UserRepository userRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final Gson gson = new Gson();

    public void ensureConfig() {
        List<String> missing = new ArrayList<>();
        if (isBlank(properties.getClientKey())) {
            missing.add("TIKTOK_CLIENT_KEY");
        }
        if (isBlank(properties.getClientSecret())) {
            missing.add("TIKTOK_CLIENT_SECRET");
        }
        if (isBlank(properties.getRedirectUri())) {
            missing.add("TIKTOK_REDIRECT_URI");
        }
        if (!missing.isEmpty()) {
            log.warn("Missing TikTok config keys: {}", String.join(", ", missing));
            throw new BadRequestException("Missing TikTok config: " + String.join(", ", missing));
        }
    }

    public String newState() {
        byte[] bytes = new byte[16];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    public String buildAuthorizationUrl(String state) {
        ensureConfig();
        return UriComponentsBuilder.fromHttpUrl(properties.getAuthorizeUrl())
                .queryParam("client_key", properties.getClientKey())
                .queryParam("scope", properties.getScope())
                .queryParam("response_type", "code")
                .queryParam("redirect_uri", properties.getRedirectUri())
                .queryParam("state", state == null ? "" : state)
                .encode(StandardCharsets.UTF_8)
                .toUriString();
    }

    public TikTokTokens exchangeCode(String code) {
        ensureConfig();
        if (isBlank(code)) {
            throw new BadRequestException("Authorization code is required");
        }
        FormBody body = new FormBody.Builder()
                .add("client_key", properties.getClientKey())
                .add("client_secret", properties.getClientSecret())
                .add("code", code)
                .add("grant_type", "authorization_code")
                .add("redirect_uri", properties.getRedirectUri())
                .build();
        Request request = new Request.Builder()
                .url(properties.getTokenUrl())
                .header("Cache-Control", "no-cache")
                .post(body)
                .build();

        try (Response response = tiktokHttpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String payload = responseBody == null ? "" : responseBody.string();
            if (!response.isSuccessful()) {
                log.warn("TikTok token exchange failed with HTTP {}", response.code());
                throw new ExternalPlatformException("TikTok token exchange failed (" + response.code() + ")");
            }
            return parseTokens(payload);
        } catch (IOException e) {
            throw new ExternalPlatformException("TikTok token endpoint unreachable", e);
        }
    }

    /**
     * Exchanges {@code code} and stores the resulting tokens on the user. The HTTP call runs outside the
     * database transaction; only the final write locks the row.
     */
    public User connect(Long userId, String code) {
        TikTokTokens tokens = exchangeCode(code);
        Instant expiresAt = clock.instant().plusSeconds(tokens.expiresIn());
        User saved = transactionTemplate.execute(status -> {
            User user = userRepository.findByIdForUpdate(userId)
                    .orElseThrow(() -> new NotFoundException("User not found"));
            user.setTiktokAccessToken(tokens.accessToken());
            user.setTiktokRefreshToken(tokens.refreshToken());
            user.setTiktokOpenId(tokens.openId());
            user.setTiktokTokenExpiresAt(expiresAt);
            return userRepository.save(user);
        });
        log.info("User {} connected TikTok account", saved.getUsername());
        return saved;
    }

    public User disconnect(Long userId) {
        User saved = transactionTemplate.execute(status -> {
            User user = userRepository.findByIdForUpdate(userId)
                    .orElseThrow(() -> new NotFoundException("User not found"));
            user.clearTiktokConnection();
            return userRepository.save(user);
        });
        log.info("User {} disconnected TikTok account", saved.getUsername());
        return saved;
    }

    private TikTokTokens parseTokens(String payload) {
        JsonObject json;
        try {
            json = gson.fromJson(payload, JsonObject.class);
        } catch (JsonParseException e) {
            throw new ExternalPlatformException("TikTok returned an unreadable token response", e);
        }
        try {
            String accessToken = json == null ? null : optionalString(json, "access_token");
            if (accessToken == null) {
                String error = json == null ? null : optionalString(json, "error");
                log.warn("TikTok token exchange rejected: {}", error == null ? "unknown" : error);
                throw new ExternalPlatformException("TikTok rejected the authorization code: "
                        + (error == null ? "unknown" : error));
            }
            String refreshToken = optionalString(json, "refresh_token");
            String openId = optionalString(json, "open_id");
            JsonElement expiresIn = json.get("expires_in");
            long expiresInSeconds = expiresIn == null || expiresIn.isJsonNull() ? 0L : expiresIn.getAsLong();
            return new TikTokTokens(accessToken, refreshToken, openId, expiresInSeconds);
        } catch (IllegalStateException | UnsupportedOperationException | NumberFormatException e) {
            throw new ExternalPlatformException("TikTok returned a malformed token response", e);
        }
    }

    private String optionalString(JsonObject json, String name) {
        JsonElement value = json.get(name);
        if (value == null || value.isJsonNull()) {
            return null;
        }
        if (!value.isJsonPrimitive()) {
            throw new IllegalStateException("Expected a scalar for " + name);
        }
        return value.getAsString();
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record TikTokTokens(String accessToken, String refreshToken, String openId, long expiresIn) {

        @Override
        public String toString() {
            return "TikTokTokens[openId=" + openId + ", expiresIn=" + expiresIn + "]";
        }
    }
}
