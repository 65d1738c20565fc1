package com.yoursp.botdetection.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.botdetection.modules.linktoken.LinkTokenService;
import com.yoursp.botdetection.modules.network.ClientNetwork;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the link-token suspicion check in front of the protected paths.
 * <p>
 * The verdict is published as request attribute {@value #SUSPICIOUS_ATTRIBUTE}.
 * With {@code botdetection.reject-suspicious=true} a suspicious request is
 * answered 429 instead of being passed on.
 * </p>
 */
@Slf4j
@Component
public class LinkTokenFilter extends OncePerRequestFilter {

    public static final String SUSPICIOUS_ATTRIBUTE = "botdetection.suspicious";

    private final LinkTokenService linkTokenService;
    private final BotDetectionProperties properties;
    private final ObjectMapper objectMapper;

    public LinkTokenFilter(LinkTokenService linkTokenService,
            BotDetectionProperties properties,
            ObjectMapper objectMapper) {
        this.linkTokenService = linkTokenService;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return properties.getProtectedPaths().stream().noneMatch(protectedPath -> covers(protectedPath, path));
    }

    // whole path segments only: /search covers /search/images, not /searchable
    static boolean covers(String protectedPath, String path) {
        String base = protectedPath.endsWith("/") ? protectedPath.substring(0, protectedPath.length() - 1) : protectedPath;
        return path.equals(base) || path.startsWith(base + "/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
            HttpServletResponse response,
            FilterChain chain) throws ServletException, IOException {
        if (!properties.isEnabled()) {
            chain.doFilter(request, response);
            return;
        }

        Optional<ClientNetwork> network = linkTokenService.resolveNetwork(request);
        if (network.isEmpty()) {
            chain.doFilter(request, response);
            return;
        }

        boolean suspicious = linkTokenService.isSuspicious(network.get(), request, properties.isRenewPing());
        request.setAttribute(SUSPICIOUS_ATTRIBUTE, suspicious);

        if (suspicious && properties.isRejectSuspicious()) {
            log.warn("Rejected suspicious request: network={}, path={}",
                    network.get().compressed(), request.getRequestURI());
            response.setStatus(429);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.getWriter().write(objectMapper.writeValueAsString(Map.of(
                    "error", "BOT_SUSPECTED",
                    "message", "Too many requests. Try again later.")));
            return;
        }

        chain.doFilter(request, response);
    }
}
