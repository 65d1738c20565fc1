package com.yoursp.botdetection.modules.linktoken;

import com.yoursp.botdetection.modules.network.ClientNetwork;
import com.yoursp.botdetection.modules.network.NetworkResolver;
import com.yoursp.botdetection.modules.network.RealIpExtractor;
import com.yoursp.botdetection.service.store.KeyValueStore;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

import java.net.InetAddress;
import java.util.Optional;

/**
 * The link-token method: a request is rated suspicious if its client never
 * fetched {@code /client<token>.css}. A bot cannot ping by requesting a static
 * URL, since the token in it rotates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LinkTokenService {

    private final KeyValueStore store;
    private final TokenService tokenService;
    private final PingService pingService;
    private final RealIpExtractor realIpExtractor;
    private final NetworkResolver networkResolver;

    /**
     * Called by a request to {@code /client<token>.css}. If {@code token} is
     * valid a ping is stored for the client. Every failure is a silent no-op.
     */
    public void ping(HttpServletRequest request, String token) {
        if (!store.isAvailable()) {
            return;
        }
        if (!tokenService.tokenIsValid(token)) {
            return;
        }
        Optional<InetAddress> realIp = realIpExtractor.extract(request);
        if (realIp.isEmpty()) {
            return;
        }
        ClientNetwork network = networkResolver.resolve(realIp.get());
        log.debug("ping from (client) network {} (IP {})", network.compressed(), realIp.get().getHostAddress());
        pingService.recordPing(network,
                request.getHeader(HttpHeaders.ACCEPT_LANGUAGE),
                request.getHeader(HttpHeaders.USER_AGENT));
    }

    /**
     * Checks whether a valid ping exists for this (client) network and header
     * fingerprint.
     * <ul>
     * <li>store unreachable → {@code false}: the whole method is off</li>
     * <li>no ping → {@code true}</li>
     * <li>ping found → {@code false}; with {@code renew} its TTL is reset</li>
     * </ul>
     */
    public boolean isSuspicious(ClientNetwork network, HttpServletRequest request, boolean renew) {
        if (!store.isAvailable()) {
            return false;
        }

        String acceptLanguage = request.getHeader(HttpHeaders.ACCEPT_LANGUAGE);
        String userAgent = request.getHeader(HttpHeaders.USER_AGENT);
        if (!pingService.hasPing(network, acceptLanguage, userAgent, renew)) {
            log.warn("missing ping (IP: {}) / request: {}", network.compressed(),
                    pingService.pingKey(network, acceptLanguage, userAgent));
            return true;
        }

        log.debug("found ping for (client) network {}", network.compressed());
        return false;
    }

    /**
     * @return the network of the request's real client, or empty if no client
     *         address can be determined
     */
    public Optional<ClientNetwork> resolveNetwork(HttpServletRequest request) {
        return realIpExtractor.extract(request).map(networkResolver::resolve);
    }
}
