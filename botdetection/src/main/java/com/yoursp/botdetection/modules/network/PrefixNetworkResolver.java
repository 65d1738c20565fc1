package com.yoursp.botdetection.modules.network;

import com.yoursp.botdetection.config.BotDetectionProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.net.InetAddress;

/**
 * Default {@link NetworkResolver}: masks the address to
 * {@code botdetection.ipv4-prefix} or {@code botdetection.ipv6-prefix}.
 */
@Component
@RequiredArgsConstructor
public class PrefixNetworkResolver implements NetworkResolver {

    private final BotDetectionProperties properties;

    @Override
    public ClientNetwork resolve(InetAddress clientAddress) {
        int prefix = clientAddress.getAddress().length == 16
                ? properties.getIpv6Prefix()
                : properties.getIpv4Prefix();
        return ClientNetwork.of(clientAddress, prefix);
    }
}
