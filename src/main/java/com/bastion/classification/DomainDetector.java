package com.bastion.classification;

import com.bastion.domain.IndicatorType;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * DNS names: dot-separated labels ending in an alphabetic TLD, at most 253
 * characters. A trailing root dot is dropped; values are lower-cased.
 */
public class DomainDetector implements TypeDetector {

    static final int MAX_LENGTH = 253;

    private static final Pattern DOMAIN = Pattern.compile(
        "^(?:[a-z0-9_](?:[a-z0-9_-]{0,61}[a-z0-9])?\\.)+[a-z]{2,63}$");

    @Override
    public Optional<Classification> detect(String value) {
        String candidate = value.toLowerCase(Locale.ROOT);
        if (candidate.endsWith(".")) {
            candidate = candidate.substring(0, candidate.length() - 1);
        }
        if (candidate.isEmpty() || candidate.length() > MAX_LENGTH || !DOMAIN.matcher(candidate).matches()) {
            return Optional.empty();
        }
        return Optional.of(Classification.of(candidate, IndicatorType.DOMAIN));
    }

    @Override
    public IndicatorType family() {
        return IndicatorType.DOMAIN;
    }
}
