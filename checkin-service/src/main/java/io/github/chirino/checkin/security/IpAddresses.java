package io.github.chirino.checkin.security;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Optional;

/**
 * Parses IP address literals without ever touching DNS. Anything that is not a literal IPv4 or
 * IPv6 address is rejected.
 */
public final class IpAddresses {

    private IpAddresses() {}

    public static Optional<InetAddress> parseLiteral(String ip) {
        if (ip == null) {
            return Optional.empty();
        }
        String value = ip.trim();
        if (value.isEmpty() || value.length() > 45) {
            return Optional.empty();
        }
        if (value.indexOf(':') >= 0) {
            return parseIpv6(value);
        }
        long v4 = ipv4ToLong(value);
        if (v4 < 0) {
            return Optional.empty();
        }
        byte[] bytes = {
            (byte) (v4 >>> 24), (byte) (v4 >>> 16), (byte) (v4 >>> 8), (byte) v4
        };
        try {
            return Optional.of(InetAddress.getByAddress(bytes));
        } catch (UnknownHostException e) {
            return Optional.empty();
        }
    }

    /** Dotted-quad to unsigned 32-bit value, or {@code -1} when malformed. */
    public static long ipv4ToLong(String ip) {
        if (ip == null) {
            return -1;
        }
        String[] parts = ip.trim().split("\\.", -1);
        if (parts.length != 4) {
            return -1;
        }
        long result = 0;
        for (String part : parts) {
            if (part.isEmpty() || part.length() > 3) {
                return -1;
            }
            int octet = 0;
            for (int i = 0; i < part.length(); i++) {
                char c = part.charAt(i);
                if (c < '0' || c > '9') {
                    return -1;
                }
                octet = octet * 10 + (c - '0');
            }
            if (octet > 255) {
                return -1;
            }
            result = (result << 8) | octet;
        }
        return result;
    }

    public static long toLong(Inet4Address address) {
        byte[] b = address.getAddress();
        return ((b[0] & 0xFFL) << 24)
                | ((b[1] & 0xFFL) << 16)
                | ((b[2] & 0xFFL) << 8)
                | (b[3] & 0xFFL);
    }

    /** Loopback, private, link-local, unspecified and IPv6 unique-local addresses. */
    public static boolean isLocal(InetAddress address) {
        if (address.isLoopbackAddress()
                || address.isSiteLocalAddress()
                || address.isLinkLocalAddress()
                || address.isAnyLocalAddress()) {
            return true;
        }
        if (address instanceof Inet6Address) {
            // fc00::/7
            return (address.getAddress()[0] & 0xFE) == 0xFC;
        }
        return false;
    }

    private static Optional<InetAddress> parseIpv6(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            boolean allowed =
                    (c >= '0' && c <= '9')
                            || (c >= 'a' && c <= 'f')
                            || (c >= 'A' && c <= 'F')
                            || c == ':'
                            || c == '.';
            if (!allowed) {
                return Optional.empty();
            }
        }
        try {
            // A string containing ':' is always treated as a literal, so no lookup happens.
            InetAddress address = InetAddress.getByName(value);
            if (address instanceof Inet6Address || address instanceof Inet4Address) {
                return Optional.of(address);
            }
            return Optional.empty();
        } catch (UnknownHostException e) {
            return Optional.empty();
        }
    }
}
