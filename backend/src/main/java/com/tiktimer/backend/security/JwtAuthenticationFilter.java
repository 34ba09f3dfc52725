package com.tiktimer.backend.security;

import com.tiktimer.backend.exception.InvalidCredentialsException;
import com.tiktimer.backend.exception.StoreUnavailableException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

/**
 * JWT Authentication Filter
 * Runs the identity chain of the {@link AuthenticationGate} for requests carrying a bearer token
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final List<String> PUBLIC_PATHS = List.of(
            "/register",
            "/token",
            "/auth/refresh",
            "/actuator/health",
            "/actuator/health/**",
            "/actuator/info",
            "/v3/api-docs",
            "/v3/api-docs/**",
            "/swagger-ui.html",
            "/swagger-ui/**",
            "/api/v1/auth/tiktok/authorize"
    );

    private final AuthenticationGate authenticationGate;
    private final ApiErrorWriter apiErrorWriter;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null) {
            try {
                AuthenticationContext context = authenticationGate.authenticate(header);
                UserPrincipal principal = UserPrincipal.from(context);
                UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                        principal,
                        null,
                        Collections.singletonList(new SimpleGrantedAuthority("ROLE_" + principal.getRole().name()))
                );
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);

                log.debug("Authenticated user: {} at token version {}", principal.getUsername(), principal.getTokenVersion());
            } catch (InvalidCredentialsException e) {
                // Left unauthenticated; protected routes answer 401 through the entry point.
                SecurityContextHolder.clearContext();
                log.debug("Bearer token rejected on {}: {}", request.getRequestURI(), e.getMessage());
            } catch (StoreUnavailableException e) {
                SecurityContextHolder.clearContext();
                log.error("User store unavailable while authenticating {}", request.getRequestURI(), e);
                response.setHeader(HttpHeaders.RETRY_AFTER, "5");
                apiErrorWriter.write(request, response, HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable");
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getServletPath();
        return PUBLIC_PATHS.stream().anyMatch(pattern -> pathMatcher.match(pattern, path));
    }
}
