package com.yoursp.botdetection.modules.linktoken;

import com.yoursp.botdetection.service.store.KeyValueStore;
import com.yoursp.botdetection.service.store.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.Optional;

/**
 * Holds the rotating link token in the key-value store.
 * <ul>
 * <li>One current token, 16 chars of {@code [a-z0-9]}, 600s TTL</li>
 * <li>Regenerated lazily by the first reader after expiry</li>
 * <li>Regeneration is a {@code SET NX EX}: concurrent readers converge on the
 * winner's value</li>
 * <li>Store failure ({@link StoreUnavailableException}) → {@link #FALLBACK_TOKEN},
 * so page rendering never breaks</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenService {

    static final String TOKEN_KEY = "link_token:token";
    static final Duration TOKEN_TTL = Duration.ofSeconds(600);
    static final int TOKEN_LENGTH = 16;

    /** Returned while the store is unreachable. Not a secret. */
    public static final String FALLBACK_TOKEN = "12345678";

    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final KeyValueStore store;

    /**
     * Returns the current token, generating and storing a new one when none is
     * active.
     */
    public String currentToken() {
        try {
            Optional<String> token = store.get(TOKEN_KEY);
            if (token.isPresent()) {
                return token.get();
            }

            String candidate = generateToken();
            if (store.setIfAbsent(TOKEN_KEY, candidate, TOKEN_TTL)) {
                log.debug("Rotated link token (valid for {}s)", TOKEN_TTL.toSeconds());
                return candidate;
            }
            // another instance won the race
            return store.get(TOKEN_KEY).orElse(candidate);
        } catch (StoreUnavailableException e) {
            log.warn("Token lookup failed, using fallback token: {}", e.getMessage());
            return FALLBACK_TOKEN;
        }
    }

    public boolean tokenIsValid(String token) {
        boolean valid = token != null && token.equals(currentToken());
        log.debug("token is valid --> {}", valid);
        return valid;
    }

    static String generateToken() {
        StringBuilder sb = new StringBuilder(TOKEN_LENGTH);
        for (int i = 0; i < TOKEN_LENGTH; i++) {
            sb.append(ALPHABET.charAt(SECURE_RANDOM.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
