package com.yoursp.botdetection.modules.network;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses textual IP addresses without ever falling back to a DNS lookup.
 */
public final class IpLiteral {

    private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})$");
    private static final Pattern IPV6 = Pattern.compile("^[0-9A-Fa-f:.]+$");

    private IpLiteral() {
        // utility class
    }

    /**
     * @param text an IPv4 dotted quad or an IPv6 literal, optionally in
     *             brackets
     * @return the address, or empty if {@code text} is not an IP literal
     */
    public static Optional<InetAddress> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String candidate = text.trim();
        if (candidate.startsWith("[") && candidate.endsWith("]")) {
            candidate = candidate.substring(1, candidate.length() - 1);
        }
        if (candidate.isEmpty()) {
            return Optional.empty();
        }

        Matcher v4 = IPV4.matcher(candidate);
        if (v4.matches()) {
            for (int group = 1; group <= 4; group++) {
                if (Integer.parseInt(v4.group(group)) > 255) {
                    return Optional.empty();
                }
            }
        } else if (!candidate.contains(":") || !IPV6.matcher(candidate).matches()) {
            return Optional.empty();
        }

        try {
            return Optional.of(InetAddress.getByName(candidate));
        } catch (UnknownHostException e) {
            return Optional.empty();
        }
    }
}
