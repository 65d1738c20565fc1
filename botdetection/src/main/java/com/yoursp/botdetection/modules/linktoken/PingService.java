package com.yoursp.botdetection.modules.linktoken;

import com.yoursp.botdetection.modules.network.ClientNetwork;
import com.yoursp.botdetection.service.store.KeyValueStore;
import com.yoursp.botdetection.service.store.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Ping ledger: one presence marker per (network, Accept-Language, User-Agent)
 * with a 3600s TTL.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PingService {

    static final Duration PING_TTL = Duration.ofSeconds(3600);
    static final String PING_MARKER = "1";

    private final KeyValueStore store;
    private final PingKeys pingKeys;

    /**
     * Store (or refresh) the ping of this fingerprint. A store failure is
     * logged and otherwise ignored.
     */
    public void recordPing(ClientNetwork network, String acceptLanguage, String userAgent) {
        String key = pingKeys.derive(network, acceptLanguage, userAgent);
        try {
            store.set(key, PING_MARKER, PING_TTL);
            log.debug("store ping for (client) network {} -> {}", network.compressed(), key);
        } catch (StoreUnavailableException e) {
            log.warn("Could not store ping for network {}: {}", network.compressed(), e.getMessage());
        }
    }

    /**
     * @param renew reset the TTL to the full window if the ping exists
     * @return {@code true} if a live ping exists; {@code false} when absent or
     *         when the store is unreachable
     */
    public boolean hasPing(ClientNetwork network, String acceptLanguage, String userAgent, boolean renew) {
        String key = pingKeys.derive(network, acceptLanguage, userAgent);
        try {
            if (store.get(key).isEmpty()) {
                return false;
            }
            if (renew) {
                store.set(key, PING_MARKER, PING_TTL);
            }
            return true;
        } catch (StoreUnavailableException e) {
            log.warn("Could not read ping for network {}: {}", network.compressed(), e.getMessage());
            return false;
        }
    }

    public String pingKey(ClientNetwork network, String acceptLanguage, String userAgent) {
        return pingKeys.derive(network, acceptLanguage, userAgent);
    }
}
