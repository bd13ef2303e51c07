package com.bastion.classification;

import com.bastion.domain.IndicatorType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns raw feed lines into typed indicator candidates.
 *
 * Detectors run in a fixed order: IP, hash, URL, domain. The first detector
 * that recognises a value decides its type. If the owning source did not
 * declare that type the value is unrecognised; later detectors are not
 * consulted.
 *
 * URLs become soar-url when the source declares soar-url and the feature is
 * enabled system-wide; otherwise they stay url (if declared).
 */
@Component
public class IndicatorClassifier {

    private final List<TypeDetector> detectors;

    public IndicatorClassifier() {
        this(List.of(new IpDetector(), new HashDetector(), new UrlDetector(), new DomainDetector()));
    }

    IndicatorClassifier(List<TypeDetector> detectors) {
        this.detectors = List.copyOf(detectors);
    }

    /**
     * Classify one line of a feed body.
     *
     * @param rawLine        the line as published, untrimmed
     * @param declared       the types the source declares
     * @param soarUrlEnabled the system-wide soar-url toggle
     * @return the classification, or empty for blank, comment and unrecognised lines
     */
    public Optional<Classification> classifyLine(String rawLine, Set<IndicatorType> declared,
                                                 boolean soarUrlEnabled) {
        String token = extractToken(rawLine);
        if (token == null) {
            return Optional.empty();
        }
        return classify(token, declared, soarUrlEnabled);
    }

    /**
     * Classify a single token restricted to the declared types.
     */
    public Optional<Classification> classify(String token, Set<IndicatorType> declared, boolean soarUrlEnabled) {
        Optional<Classification> detected = detect(token);
        if (detected.isEmpty()) {
            return Optional.empty();
        }

        Classification classification = detected.get();
        if (classification.getType() == IndicatorType.URL) {
            if (soarUrlEnabled && declared.contains(IndicatorType.SOAR_URL)) {
                return Optional.of(classification.withType(IndicatorType.SOAR_URL));
            }
            return declared.contains(IndicatorType.URL) ? detected : Optional.empty();
        }
        return declared.contains(classification.getType()) ? detected : Optional.empty();
    }

    /**
     * Validate and normalise a value entered by hand for a known type.
     *
     * @throws IllegalArgumentException if the value is not a valid {@code type}
     */
    public Classification normalize(String value, IndicatorType type) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Value must not be empty");
        }
        String token = value.trim();
        IndicatorType family = type.isUrlFamily() ? IndicatorType.URL : type;

        for (TypeDetector detector : detectors) {
            if (detector.family() == family) {
                return detector.detect(token)
                    .map(c -> c.withType(type))
                    .orElseThrow(() -> new IllegalArgumentException(
                        "Invalid " + type.getValue() + " value: " + token));
            }
        }
        throw new IllegalArgumentException("Unsupported indicator type: " + type);
    }

    private Optional<Classification> detect(String token) {
        for (TypeDetector detector : detectors) {
            Optional<Classification> result = detector.detect(token);
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }

    /**
     * Strip whitespace and comments from a feed line.
     *
     * @return the indicator token, or null if nothing is left
     */
    static String extractToken(String rawLine) {
        if (rawLine == null) {
            return null;
        }
        String line = rawLine.trim();
        if (line.isEmpty() || line.startsWith("#") || line.startsWith("//") || line.startsWith(";")) {
            return null;
        }

        int inlineComment = indexOfInlineComment(line);
        if (inlineComment >= 0) {
            line = line.substring(0, inlineComment).trim();
        }
        return line.isEmpty() ? null : line;
    }

    private static int indexOfInlineComment(String line) {
        for (int i = 1; i < line.length(); i++) {
            if (line.charAt(i) == '#' && Character.isWhitespace(line.charAt(i - 1))) {
                return i;
            }
        }
        return -1;
    }
}
