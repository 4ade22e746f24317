package com.meshnet.linkwatch.model;

import com.google.common.net.InetAddresses;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Kinds of address used to identify endpoints in topology documents.
 *
 * Addresses are compared in canonical form only: IPv6 compressed as in
 * RFC 5952 and MACs as six lower case, colon separated octets.
 */
public enum AddressKind {
    IPV4,
    IPV6,
    MAC;

    private static final Pattern IPV4_PATTERN = Pattern.compile(
            "^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$");

    // 00:27:22:00:50:71, 0:27:22:0:50:71, 00-27-22-00-50-71
    private static final Pattern MAC_OCTETS = Pattern.compile(
            "^[0-9A-Fa-f]{1,2}([:-])[0-9A-Fa-f]{1,2}(\\1[0-9A-Fa-f]{1,2}){4}$");

    // 0027.2200.5071
    private static final Pattern MAC_CISCO = Pattern.compile("^[0-9A-Fa-f]{1,4}(\\.[0-9A-Fa-f]{1,4}){2}$");

    // 002722:005071
    private static final Pattern MAC_PGSQL = Pattern.compile("^[0-9A-Fa-f]{6}:[0-9A-Fa-f]{6}$");

    // 002722005071
    private static final Pattern MAC_BARE = Pattern.compile("^[0-9A-Fa-f]{12}$");

    public boolean isIp() {
        return this != MAC;
    }

    /**
     * Canonical form of an address of this kind.
     */
    public String normalize(String address) {
        String value = address.trim();
        switch (this) {
            case IPV6:
                return InetAddresses.toAddrString(InetAddresses.forString(value));
            case MAC:
                return canonicalMac(value);
            default:
                return value;
        }
    }

    public boolean matches(String address) {
        return classify(address).orElse(null) == this;
    }

    public static Optional<AddressKind> classify(String address) {
        if (address == null) {
            return Optional.empty();
        }
        String value = address.trim();
        if (IPV4_PATTERN.matcher(value).matches()) {
            return Optional.of(IPV4);
        }
        if (isMac(value)) {
            return Optional.of(MAC);
        }
        if (value.indexOf(':') >= 0 && InetAddresses.isInetAddress(value)) {
            return Optional.of(IPV6);
        }
        return Optional.empty();
    }

    /**
     * Canonical form of any address, or the trimmed input when it is not an
     * IP or MAC address.
     */
    public static String canonicalize(String address) {
        if (address == null) {
            return null;
        }
        return classify(address)
                .map(kind -> kind.normalize(address))
                .orElse(address.trim());
    }

    private static boolean isMac(String value) {
        return MAC_OCTETS.matcher(value).matches()
                || MAC_CISCO.matcher(value).matches()
                || MAC_PGSQL.matcher(value).matches()
                || MAC_BARE.matcher(value).matches();
    }

    private static String canonicalMac(String value) {
        String[] groups = value.split("[:.-]");
        int width = 12 / groups.length;
        StringBuilder hex = new StringBuilder(12);
        for (String group : groups) {
            hex.append("0".repeat(width - group.length())).append(group);
        }
        StringBuilder mac = new StringBuilder(17);
        for (int i = 0; i < 12; i += 2) {
            if (i > 0) {
                mac.append(':');
            }
            mac.append(hex, i, i + 2);
        }
        return mac.toString().toLowerCase(Locale.ROOT);
    }
}
