package com.github.dimitryivaniuta.cmdb.support;

/**
 * IPv4 helpers for the resource business rules. Inputs are expected to have passed the format
 * patterns below; malformed values throw {@link IllegalArgumentException}.
 */
public final class NetworkAddressSupport {
    private NetworkAddressSupport() {}

    private static final String OCTET = "(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)";

    public static final String IPV4_PATTERN = "^(" + OCTET + "\\.){3}" + OCTET + "$";
    public static final String CIDR_PATTERN = "^(" + OCTET + "\\.){3}" + OCTET + "/(3[0-2]|[12]?\\d)$";

    public static boolean isCidr(String value) {
        return value != null && value.matches(CIDR_PATTERN);
    }

    public static int prefixLength(String cidr) {
        int slash = cidr.indexOf('/');
        if (slash < 0) {
            throw new IllegalArgumentException("Not a CIDR block: " + cidr);
        }
        return Integer.parseInt(cidr.substring(slash + 1));
    }

    /** RFC1918, loopback, link-local, CGNAT, multicast and reserved ranges. */
    public static boolean isNonPublic(String ip) {
        long v = toLong(ip);
        return inRange(v, "10.0.0.0", 8)
                || inRange(v, "172.16.0.0", 12)
                || inRange(v, "192.168.0.0", 16)
                || inRange(v, "127.0.0.0", 8)
                || inRange(v, "169.254.0.0", 16)
                || inRange(v, "100.64.0.0", 10)
                || inRange(v, "0.0.0.0", 8)
                || inRange(v, "224.0.0.0", 4)
                || inRange(v, "240.0.0.0", 4);
    }

    private static boolean inRange(long ip, String base, int prefix) {
        long mask = prefix == 0 ? 0 : (0xFFFFFFFFL << (32 - prefix)) & 0xFFFFFFFFL;
        return (ip & mask) == (toLong(base) & mask);
    }

    private static long toLong(String ip) {
        String[] parts = ip.split("\\.");
        if (parts.length != 4) {
            throw new IllegalArgumentException("Not an IPv4 address: " + ip);
        }
        long v = 0;
        for (String p : parts) {
            v = (v << 8) | Integer.parseInt(p);
        }
        return v;
    }
}
