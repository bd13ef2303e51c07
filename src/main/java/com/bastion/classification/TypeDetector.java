package com.bastion.classification;

import com.bastion.domain.IndicatorType;

import java.util.Optional;

/**
 * Recogniser for one indicator family.
 *
 * Detectors are independent of each other; precedence between them is
 * decided by the order {@link IndicatorClassifier} evaluates them in.
 */
public interface TypeDetector {

    /**
     * @param value a trimmed, non-empty, comment-free token
     * @return the classification if the value belongs to this family
     */
    Optional<Classification> detect(String value);

    /**
     * The indicator family this detector recognises. The URL detector
     * reports {@link IndicatorType#URL}; the soar-url variant is applied by the
     * classifier.
     */
    IndicatorType family();
}
