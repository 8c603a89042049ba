package org.caureq.caureqspeedboard.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqspeedboard.config.AppProps;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Shared-token check for node-facing routes. Accepts "Authorization: Bearer &lt;token&gt;"
 * or "X-API-KEY: &lt;token&gt;". The rejection never says which part was wrong.
 */
@Slf4j
@Component
public class TokenFilter extends OncePerRequestFilter {
    static final String BEARER = "Bearer ";
    static final String[] PROTECTED = {"/api/v1/report", "/api/v1/nodes"};

    // decoded and cleaned the same way handler mapping sees the path
    private static final UrlPathHelper PATHS = UrlPathHelper.defaultInstance;

    private final byte[] expected;

    public TokenFilter(AppProps props) {
        this.expected = props.apiToken().getBytes(StandardCharsets.UTF_8);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest req) {
        var path = PATHS.getPathWithinApplication(req);
        for (var prefix : PROTECTED) {
            if (path.startsWith(prefix)) return false;
        }
        return true;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        if (!matches(presentedToken(req))) {
            log.warn("rejected {} {} from {}: missing or invalid token",
                    req.getMethod(), req.getRequestURI(), req.getRemoteAddr());
            res.setStatus(HttpStatus.UNAUTHORIZED.value());
            res.setContentType(MediaType.APPLICATION_JSON_VALUE);
            res.setHeader("WWW-Authenticate", "Bearer");
            res.getWriter().write("{\"error\":\"unauthorized\",\"message\":\"Missing or invalid token\"}");
            return;
        }

        chain.doFilter(req, res);
    }

    private static String presentedToken(HttpServletRequest req) {
        var auth = req.getHeader("Authorization");
        if (auth != null && auth.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            return auth.substring(BEARER.length()).trim();
        }
        return req.getHeader("X-API-KEY");
    }

    /** Constant-time for equal lengths. */
    boolean matches(String presented) {
        if (presented == null || presented.isEmpty()) return false;
        return MessageDigest.isEqual(presented.getBytes(StandardCharsets.UTF_8), expected);
    }
}
