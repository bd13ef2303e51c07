package com.bastion.classification;

import com.bastion.domain.HashType;
import com.bastion.domain.IndicatorType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@DisplayName("IndicatorClassifier Tests")
class IndicatorClassifierTest {

    private static final Set<IndicatorType> ALL = EnumSet.allOf(IndicatorType.class);

    private final IndicatorClassifier classifier = new IndicatorClassifier();

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "# comment", "// comment", "; comment", "  # indented comment"})
    @DisplayName("Should drop blank and comment lines")
    void shouldDropBlankAndCommentLines(String line) {
        assertThat(classifier.classifyLine(line, ALL, false)).isEmpty();
    }

    @Test
    @DisplayName("Should strip inline comments and surrounding whitespace")
    void shouldStripInlineComment() {
        // When
        Optional<Classification> result = classifier.classifyLine("  1.2.3.4   # scanner  ", ALL, false);

        // Then
        assertThat(result).contains(Classification.of("1.2.3.4", IndicatorType.IP));
    }

    @Test
    @DisplayName("Should classify IPv4, IPv6 and CIDR values as ip")
    void shouldClassifyIps() {
        assertThat(classifier.classifyLine("192.168.1.10", ALL, false).orElseThrow().getType())
            .isEqualTo(IndicatorType.IP);
        assertThat(classifier.classifyLine("10.0.0.0/8", ALL, false).orElseThrow().getValue())
            .isEqualTo("10.0.0.0/8");
        assertThat(classifier.classifyLine("2001:DB8:0:0::1", ALL, false).orElseThrow().getValue())
            .isEqualTo("2001:db8::1");
    }

    @Test
    @DisplayName("Should classify hex digests by length and lower-case them")
    void shouldClassifyHashes() {
        // When
        Classification md5 = classifier.classifyLine("D41D8CD98F00B204E9800998ECF8427E", ALL, false).orElseThrow();
        Classification sha256 = classifier.classifyLine(
            "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", ALL, false).orElseThrow();

        // Then
        assertThat(md5.getType()).isEqualTo(IndicatorType.HASH);
        assertThat(md5.getValue()).isEqualTo("d41d8cd98f00b204e9800998ecf8427e");
        assertThat(md5.getHashType()).isEqualTo(HashType.MD5);
        assertThat(sha256.getHashType()).isEqualTo(HashType.SHA256);
    }

    @Test
    @DisplayName("Should classify domains and lower-case them")
    void shouldClassifyDomains() {
        Classification domain = classifier.classifyLine("Malware.Example.COM.", ALL, false).orElseThrow();

        assertThat(domain.getType()).isEqualTo(IndicatorType.DOMAIN);
        assertThat(domain.getValue()).isEqualTo("malware.example.com");
    }

    @Test
    @DisplayName("Should classify URLs as url unless soar-url is declared and enabled")
    void shouldClassifyUrls() {
        String url = "http://bad.example.com/payload.exe";
        Set<IndicatorType> urlAndSoar = EnumSet.of(IndicatorType.URL, IndicatorType.SOAR_URL);

        assertThat(classifier.classifyLine(url, urlAndSoar, false).orElseThrow().getType())
            .isEqualTo(IndicatorType.URL);
        assertThat(classifier.classifyLine(url, urlAndSoar, true).orElseThrow().getType())
            .isEqualTo(IndicatorType.SOAR_URL);
        assertThat(classifier.classifyLine(url, EnumSet.of(IndicatorType.SOAR_URL), false)).isEmpty();
    }

    @Test
    @DisplayName("Should not fall through to a later detector when the detected type is not declared")
    void shouldNotFallThrough() {
        // An IP literal never becomes a domain, even when only domain is declared
        Set<IndicatorType> domainOnly = EnumSet.of(IndicatorType.DOMAIN);

        assertThat(classifier.classifyLine("1.2.3.4", domainOnly, false)).isEmpty();
        assertThat(classifier.classifyLine("http://bad.example.com/", domainOnly, false)).isEmpty();
        assertThat(classifier.classifyLine("bad.example.com", domainOnly, false)).isPresent();
    }

    @Test
    @DisplayName("Should treat unrecognised tokens as unclassified")
    void shouldRejectGarbage() {
        assertThat(classifier.classifyLine("badline", ALL, false)).isEmpty();
        assertThat(classifier.classifyLine("999.1.1.1", EnumSet.of(IndicatorType.IP), false)).isEmpty();
        assertThat(classifier.classifyLine("1.2.3.4/33", EnumSet.of(IndicatorType.IP), false)).isEmpty();
    }

    @Test
    @DisplayName("Should normalise a manual value for its declared type")
    void shouldNormalizeManualValue() {
        assertThat(classifier.normalize(" Evil.Example.org ", IndicatorType.DOMAIN).getValue())
            .isEqualTo("evil.example.org");
        assertThat(classifier.normalize("https://x.example/a", IndicatorType.SOAR_URL).getType())
            .isEqualTo(IndicatorType.SOAR_URL);
        assertThatThrownBy(() -> classifier.normalize("not a domain", IndicatorType.DOMAIN))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Invalid domain value");
        assertThatThrownBy(() -> classifier.normalize("  ", IndicatorType.IP))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
