package org.octofleet.orchestrator.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.octofleet.orchestrator.config.AppProps;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.security.MessageDigest;
import java.nio.charset.StandardCharsets;

/**
 * Guards /api/**. Accepts a bearer token from app.auth.tokens, the legacy X-API-Key header,
 * or ?token= on GET requests (SSE and WebSocket handshakes cannot set headers from a browser).
 * The authenticated caller is exposed to controllers as the {@link #ACTOR} request attribute.
 */
@Component
@RequiredArgsConstructor
public class ApiKeyFilter extends OncePerRequestFilter {

    public static final String ACTOR = "octofleet.actor";

    private final AppProps props;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest req) {
        return !req.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String actor = authenticate(req);
        if (actor == null) {
            res.setStatus(HttpStatus.UNAUTHORIZED.value());
            res.setContentType(MediaType.APPLICATION_JSON_VALUE);
            res.getWriter().write("{\"code\":\"AUTH_REQUIRED\",\"message\":\"Missing or invalid credentials\"}");
            return;
        }
        req.setAttribute(ACTOR, actor);
        chain.doFilter(req, res);
    }

    private String authenticate(HttpServletRequest req) {
        var auth = props.auth();
        if (auth == null) return null;

        String header = req.getHeader("Authorization");
        if (header != null && header.regionMatches(true, 0, "Bearer ", 0, 7)) {
            return tokenActor(header.substring(7).trim());
        }

        String key = req.getHeader("X-API-Key");
        if (key != null) {
            return matches(key, auth.apiKey()) ? "api-key" : null;
        }

        String query = req.getParameter("token");
        if (query != null && "GET".equalsIgnoreCase(req.getMethod())) {
            return tokenActor(query);
        }
        return null;
    }

    private String tokenActor(String token) {
        var tokens = props.auth().tokens();
        if (tokens != null) {
            for (int i = 0; i < tokens.size(); i++) {
                if (matches(token, tokens.get(i))) return "token-" + (i + 1);
            }
        }
        // the api key is accepted as a bearer token as well
        return matches(token, props.auth().apiKey()) ? "api-key" : null;
    }

    private static boolean matches(String given, String expected) {
        if (given == null || expected == null || expected.isBlank()) return false;
        return MessageDigest.isEqual(given.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8));
    }

    public static String actor(HttpServletRequest req) {
        var a = req.getAttribute(ACTOR);
        return a == null ? "anonymous" : a.toString();
    }
}
