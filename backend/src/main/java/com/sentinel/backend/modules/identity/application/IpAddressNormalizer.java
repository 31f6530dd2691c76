package com.sentinel.backend.modules.identity.application;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reduces the textual forms a client address can arrive in to one key.
 * <p>
 * Brackets, ports and IPv6 zone ids are removed; IPv4 literals lose leading zeros, IPv6 literals are
 * written in compressed lower-case form and IPv4-mapped IPv6 addresses become plain IPv4. Values that
 * are not IP literals are only trimmed and lower-cased.
 * </p>
 */
public final class IpAddressNormalizer {

    static final int MAX_LENGTH = 64;

    private static final Pattern IPV4 = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");
    private static final Pattern IPV6_CHARS = Pattern.compile("^[0-9a-fA-F:.]+$");

    private IpAddressNormalizer() {
    }

    /**
     * Returns the normalized key, or {@code null} when nothing usable is left.
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return null;
        }
        String host = stripPortAndBrackets(raw.trim());
        if (host == null || host.isEmpty()) {
            return null;
        }
        int zone = host.indexOf('%');
        if (zone >= 0) {
            host = host.substring(0, zone);
        }

        if (IPV4.matcher(host).matches()) {
            String canonical = canonicalIpv4(host);
            if (canonical != null) {
                return canonical;
            }
        } else if (host.indexOf(':') >= 0 && IPV6_CHARS.matcher(host).matches()) {
            String canonical = canonicalIpv6(host);
            if (canonical != null) {
                return canonical;
            }
        }

        String fallback = host.toLowerCase(Locale.ROOT);
        return fallback.length() <= MAX_LENGTH ? fallback : null;
    }

    private static String stripPortAndBrackets(String value) {
        if (value.startsWith("[")) {
            int close = value.indexOf(']');
            return close > 0 ? value.substring(1, close) : null;
        }
        int firstColon = value.indexOf(':');
        if (firstColon >= 0 && firstColon == value.lastIndexOf(':')) {
            return value.substring(0, firstColon);
        }
        return value;
    }

    private static String canonicalIpv4(String host) {
        String[] parts = host.split("\\.");
        StringBuilder out = new StringBuilder();
        for (String part : parts) {
            int octet = Integer.parseInt(part);
            if (octet > 255) {
                return null;
            }
            if (out.length() > 0) {
                out.append('.');
            }
            out.append(octet);
        }
        return out.toString();
    }

    private static String canonicalIpv6(String host) {
        InetAddress address;
        try {
            // bracketed form makes the resolver reject non-literals instead of doing a name lookup
            address = InetAddress.getByName("[" + host + "]");
        } catch (UnknownHostException ex) {
            return null;
        }
        if (address instanceof Inet4Address) {
            return address.getHostAddress();
        }
        if (address instanceof Inet6Address) {
            return compress(address.getAddress());
        }
        return null;
    }

    /**
     * RFC 5952 text form: lower-case hex, no leading zeros, longest run of two or more zero groups as "::".
     */
    static String compress(byte[] bytes) {
        int[] groups = new int[8];
        for (int i = 0; i < 8; i++) {
            groups[i] = ((bytes[2 * i] & 0xff) << 8) | (bytes[2 * i + 1] & 0xff);
        }

        int bestStart = -1;
        int bestLength = 0;
        for (int i = 0; i < 8; ) {
            if (groups[i] != 0) {
                i++;
                continue;
            }
            int start = i;
            while (i < 8 && groups[i] == 0) {
                i++;
            }
            if (i - start > bestLength) {
                bestStart = start;
                bestLength = i - start;
            }
        }
        if (bestLength < 2) {
            bestStart = -1;
        }

        StringBuilder out = new StringBuilder();
        for (int i = 0; i < 8; i++) {
            if (i == bestStart) {
                out.append("::");
                i += bestLength - 1;
                continue;
            }
            if (out.length() > 0 && out.charAt(out.length() - 1) != ':') {
                out.append(':');
            }
            out.append(Integer.toHexString(groups[i]));
        }
        return out.toString();
    }
}
