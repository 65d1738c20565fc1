package com.yoursp.botdetection.modules.network;

import com.yoursp.botdetection.config.BotDetectionProperties;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Default {@link RealIpExtractor}.
 * <ol>
 * <li>{@code X-Forwarded-For}: the entry {@code botdetection.forwarded-hops}
 * positions from the right (clamped to the first entry)</li>
 * <li>{@code X-Real-IP}</li>
 * <li>the socket peer address</li>
 * </ol>
 * The first source holding a valid IP literal wins.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ForwardedHeaderRealIpExtractor implements RealIpExtractor {

    static final String X_FORWARDED_FOR = "X-Forwarded-For";
    static final String X_REAL_IP = "X-Real-IP";

    private final BotDetectionProperties properties;

    @Override
    public Optional<InetAddress> extract(HttpServletRequest request) {
        String forwardedFor = forwardedEntry(request.getHeader(X_FORWARDED_FOR));
        String realIp = request.getHeader(X_REAL_IP);

        if (forwardedFor != null && realIp != null && !forwardedFor.equals(realIp.trim())) {
            log.debug("{} ({}) and {} ({}) disagree", X_FORWARDED_FOR, forwardedFor, X_REAL_IP, realIp);
        }

        Optional<InetAddress> address = IpLiteral.parse(forwardedFor);
        if (address.isEmpty()) {
            address = IpLiteral.parse(realIp);
        }
        if (address.isEmpty()) {
            address = IpLiteral.parse(request.getRemoteAddr());
        }
        if (address.isEmpty()) {
            log.debug("No usable client address (remoteAddr={})", request.getRemoteAddr());
        }
        return address;
    }

    private String forwardedEntry(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        List<String> hops = Arrays.stream(header.split(","))
                .map(String::trim)
                .filter(hop -> !hop.isEmpty())
                .toList();
        if (hops.isEmpty()) {
            return null;
        }
        int index = hops.size() - Math.min(hops.size(), properties.getForwardedHops());
        return hops.get(index);
    }
}
