package com.bastion.classification;

import com.bastion.domain.HashType;
import com.bastion.domain.IndicatorType;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Hex digests: md5 (32), sha1 (40), sha256 (64) and sha512 (128).
 */
public class HashDetector implements TypeDetector {

    private static final Pattern HEX = Pattern.compile("^[0-9a-fA-F]+$");

    @Override
    public Optional<Classification> detect(String value) {
        HashType hashType = HashType.forHexLength(value.length());
        if (hashType == null || !HEX.matcher(value).matches()) {
            return Optional.empty();
        }
        return Optional.of(new Classification(value.toLowerCase(Locale.ROOT), IndicatorType.HASH, hashType));
    }

    @Override
    public IndicatorType family() {
        return IndicatorType.HASH;
    }
}
