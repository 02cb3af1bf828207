package com.platform.coverage.normalization;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Builds the hostname key both inventories are joined on.
 */
public final class HostnameNormalizer {
    
    private static final Pattern DISALLOWED = Pattern.compile("[^\\w\\-]", Pattern.UNICODE_CHARACTER_CLASS);
    
    private HostnameNormalizer() {
    }
    
    /**
     * Trim, keep the short name before the first dot, drop anything but word characters and
     * hyphens, then fold the case.
     *
     * @return the key, or an empty string for a null or blank hostname
     */
    public static String normalize(String hostname, boolean uppercase) {
        if (hostname == null) {
            return "";
        }
        String value = hostname.trim();
        if (value.isEmpty()) {
            return "";
        }
        int dot = value.indexOf('.');
        if (dot >= 0) {
            value = value.substring(0, dot);
        }
        value = DISALLOWED.matcher(value).replaceAll("");
        return uppercase ? value.toUpperCase(Locale.ROOT) : value.toLowerCase(Locale.ROOT);
    }
    
    /**
     * First address of a comma separated list, trimmed.
     */
    public static String normalizeIp(String ip) {
        if (ip == null) {
            return "";
        }
        String value = ip.trim();
        int comma = value.indexOf(',');
        if (comma >= 0) {
            value = value.substring(0, comma).trim();
        }
        return value;
    }
}
