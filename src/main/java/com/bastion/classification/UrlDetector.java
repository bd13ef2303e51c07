package com.bastion.classification;

import com.bastion.domain.IndicatorType;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Absolute URLs: a scheme, "://" and a non-empty host.
 *
 * Matched structurally rather than parsed with java.net.URI, which rejects
 * the pipes and braces that show up in feed URLs. The value is kept exactly
 * as published; paths are case-sensitive.
 */
public class UrlDetector implements TypeDetector {

    private static final Pattern URL = Pattern.compile("^([a-zA-Z][a-zA-Z0-9+.-]*)://([^/?#\\s]+)([/?#]\\S*)?$");

    @Override
    public Optional<Classification> detect(String value) {
        Matcher matcher = URL.matcher(value);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        if (host(matcher.group(2)).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Classification.of(value, IndicatorType.URL));
    }

    @Override
    public IndicatorType family() {
        return IndicatorType.URL;
    }

    /**
     * Authority without userinfo and port.
     */
    static String host(String authority) {
        String host = authority;
        int at = host.lastIndexOf('@');
        if (at >= 0) {
            host = host.substring(at + 1);
        }
        if (host.startsWith("[")) {
            int close = host.indexOf(']');
            return close > 1 ? host.substring(1, close) : "";
        }
        int colon = host.indexOf(':');
        if (colon >= 0) {
            host = host.substring(0, colon);
        }
        return host;
    }
}
