package com.yoursp.botdetection.modules.linktoken;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

/**
 * HMAC-SHA256 keyed hashing.
 * <ul>
 * <li>Key and message are UTF-8 encoded</li>
 * <li>Output: 64 lowercase hex characters</li>
 * </ul>
 * Used to derive store keys that cannot be recomputed without the server
 * secret.
 */
public final class SecretHash {

    private static final String ALGORITHM = "HmacSHA256";

    private SecretHash() {
        // utility class
    }

    /**
     * @param secret  the server secret
     * @param message the value to hash
     * @return lowercase hex HMAC-SHA256 of {@code message}
     */
    public static String hmacSha256Hex(String secret, String message) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] digest = mac.doFinal(message.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (Exception e) {
            throw new RuntimeException("HMAC-SHA256 hashing failed", e);
        }
    }
}
