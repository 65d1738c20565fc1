package com.yoursp.botdetection.modules.network;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.Objects;

/**
 * An IPv4 or IPv6 network: a base address with all host bits cleared, plus a
 * prefix length.
 * <p>
 * {@link #compressed()} is the canonical string used to key ping records,
 * e.g. {@code 203.0.113.0/24} or {@code 2001:db8::/48}.
 * </p>
 */
public final class ClientNetwork {

    private final byte[] network;
    private final int prefixLength;

    private ClientNetwork(byte[] network, int prefixLength) {
        this.network = network;
        this.prefixLength = prefixLength;
    }

    /**
     * Build the network of {@code address} for the given prefix length.
     * Host bits are masked off, so any address inside the network yields the
     * same result.
     *
     * @throws IllegalArgumentException if the prefix is out of range for the
     *                                  address family
     */
    public static ClientNetwork of(InetAddress address, int prefixLength) {
        Objects.requireNonNull(address, "address");
        byte[] bytes = address.getAddress();
        int maxPrefix = bytes.length * 8;
        if (prefixLength < 0 || prefixLength > maxPrefix) {
            throw new IllegalArgumentException(
                    "Prefix /" + prefixLength + " out of range for " + address.getHostAddress());
        }
        return new ClientNetwork(mask(bytes, prefixLength), prefixLength);
    }

    /**
     * Parse {@code address/prefix}. Only IP literals are accepted.
     */
    public static ClientNetwork parse(String cidr) {
        int slash = cidr.indexOf('/');
        if (slash < 0) {
            throw new IllegalArgumentException("Missing prefix length: " + cidr);
        }
        InetAddress address = IpLiteral.parse(cidr.substring(0, slash))
                .orElseThrow(() -> new IllegalArgumentException("Not an IP literal: " + cidr));
        int prefix;
        try {
            prefix = Integer.parseInt(cidr.substring(slash + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Bad prefix length: " + cidr, e);
        }
        return of(address, prefix);
    }

    public boolean isIpv6() {
        return network.length == 16;
    }

    public int prefixLength() {
        return prefixLength;
    }

    public InetAddress networkAddress() {
        try {
            return InetAddress.getByAddress(network.clone());
        } catch (UnknownHostException e) {
            // only thrown for illegal lengths, which the constructor rules out
            throw new IllegalStateException(e);
        }
    }

    public boolean contains(InetAddress address) {
        byte[] bytes = address.getAddress();
        return bytes.length == network.length && Arrays.equals(mask(bytes, prefixLength), network);
    }

    /**
     * @return {@code address/prefix}; IPv6 uses RFC 5952 compressed lowercase
     *         hex
     */
    public String compressed() {
        return (isIpv6() ? compressIpv6(network) : ((Inet4Address) networkAddress()).getHostAddress())
                + "/" + prefixLength;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ClientNetwork other)) {
            return false;
        }
        return prefixLength == other.prefixLength && Arrays.equals(network, other.network);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(network) + prefixLength;
    }

    @Override
    public String toString() {
        return compressed();
    }

    private static byte[] mask(byte[] address, int prefixLength) {
        byte[] masked = address.clone();
        for (int i = 0; i < masked.length; i++) {
            int bitsInByte = Math.max(0, Math.min(8, prefixLength - i * 8));
            masked[i] &= (byte) (0xFF << (8 - bitsInByte));
        }
        return masked;
    }

    private static String compressIpv6(byte[] bytes) {
        int[] hextets = new int[8];
        for (int i = 0; i < 8; i++) {
            hextets[i] = ((bytes[2 * i] & 0xFF) << 8) | (bytes[2 * i + 1] & 0xFF);
        }

        // longest run of zero hextets; the first one wins a tie
        int bestStart = -1;
        int bestLength = 0;
        int runStart = -1;
        for (int i = 0; i <= 8; i++) {
            if (i < 8 && hextets[i] == 0) {
                if (runStart < 0) {
                    runStart = i;
                }
            } else if (runStart >= 0) {
                int runLength = i - runStart;
                if (runLength > bestLength) {
                    bestStart = runStart;
                    bestLength = runLength;
                }
                runStart = -1;
            }
        }
        if (bestLength < 2) {
            bestStart = -1;
        }

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 8; i++) {
            if (i == bestStart) {
                sb.append("::");
                i += bestLength - 1;
                continue;
            }
            if (sb.length() > 0 && sb.charAt(sb.length() - 1) != ':') {
                sb.append(':');
            }
            sb.append(Integer.toHexString(hextets[i]));
        }
        return sb.toString();
    }
}
