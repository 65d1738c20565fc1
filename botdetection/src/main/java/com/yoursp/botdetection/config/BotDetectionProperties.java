package com.yoursp.botdetection.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Binds the {@code botdetection.*} YAML properties into a typed bean.
 */
@Getter
@Setter
@Validated
@Configuration
@ConfigurationProperties(prefix = "botdetection")
public class BotDetectionProperties {

    /** Master switch for the suspicion filter. The probe route stays mounted. */
    private boolean enabled = true;

    /** HMAC key used to hash ping keys. */
    @NotBlank
    private String secretKey;

    /** {@code redis} or {@code memory} */
    @NotBlank
    private String store = "redis";

    @Min(0)
    @Max(32)
    private int ipv4Prefix = 32;

    @Min(0)
    @Max(128)
    private int ipv6Prefix = 48;

    /** Which X-Forwarded-For entry to trust, counted from the right. */
    @Min(1)
    private int forwardedHops = 1;

    /** Reset the ping TTL every time a check finds it. */
    private boolean renewPing = false;

    /** Answer 429 instead of only flagging the request. */
    private boolean rejectSuspicious = false;

    @NotNull
    private List<String> protectedPaths = List.of("/search");
}
