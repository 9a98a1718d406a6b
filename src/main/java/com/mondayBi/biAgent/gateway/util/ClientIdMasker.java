package com.mondayBi.biAgent.gateway.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks client ids before they reach the logs. Without an X-Client-ID header the
 * id is the caller's IP address, so addresses get their own masking.
 */
public final class ClientIdMasker {

    private static final String HIDDEN = "****";
    private static final Pattern IPV4 = Pattern.compile("(\\d{1,3})\\.(\\d{1,3})\\.\\d{1,3}\\.\\d{1,3}");

    private ClientIdMasker() {}

    /**
     * IPv4 addresses keep their first two octets, IPv6 addresses their first group,
     * and any other id its first two characters plus its length.
     *
     * @param clientId Client id or remote address, may be null
     * @return Masked id, e.g. "10.12.*.*" or "we****(12)"
     */
    public static String mask(String clientId) {
        if (clientId == null || clientId.isBlank()) {
            return HIDDEN;
        }
        String id = clientId.trim();

        Matcher ipv4 = IPV4.matcher(id);
        if (ipv4.matches()) {
            return ipv4.group(1) + "." + ipv4.group(2) + ".*.*";
        }

        int colon = id.indexOf(':');
        if (colon > 0 && id.indexOf(':', colon + 1) > colon) {
            return id.substring(0, colon) + ":" + HIDDEN;
        }

        if (id.length() <= 4) {
            return HIDDEN;
        }
        return id.substring(0, 2) + HIDDEN + "(" + id.length() + ")";
    }
}
