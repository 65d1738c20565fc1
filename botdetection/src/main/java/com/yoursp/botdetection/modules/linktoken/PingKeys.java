package com.yoursp.botdetection.modules.linktoken;

import com.yoursp.botdetection.config.BotDetectionProperties;
import com.yoursp.botdetection.modules.network.ClientNetwork;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Derives the store key of a ping record.
 * <p>
 * The key fits, more or less, one browser session within a network: it hashes
 * the compressed network together with the {@code Accept-Language} and
 * {@code User-Agent} headers. The client address itself is not part of the
 * key, so every address of the network shares it.
 * </p>
 */
@Component
public class PingKeys {

    static final String PING_KEY_PREFIX = "link_token:ping";

    private final String secretKey;

    @Autowired
    public PingKeys(BotDetectionProperties properties) {
        this(properties.getSecretKey());
    }

    PingKeys(String secretKey) {
        this.secretKey = secretKey;
    }

    /**
     * @param acceptLanguage raw header value, {@code null} if absent
     * @param userAgent      raw header value, {@code null} if absent
     * @return {@code link_token:ping[<hmac-hex>]}
     */
    public String derive(ClientNetwork network, String acceptLanguage, String userAgent) {
        String fingerprint = network.compressed()
                + (acceptLanguage != null ? acceptLanguage : "")
                + (userAgent != null ? userAgent : "");
        return PING_KEY_PREFIX + "[" + SecretHash.hmacSha256Hex(secretKey, fingerprint) + "]";
    }
}
