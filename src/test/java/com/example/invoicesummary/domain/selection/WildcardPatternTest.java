package com.example.invoicesummary.domain.selection;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WildcardPatternTest {

    @Test
    void trailingStarIsAPrefixMatch() {
        WildcardPattern pattern = WildcardPattern.compile("ACME*");

        assertThat(pattern.matches("ACME Corp SRL")).isTrue();
        assertThat(pattern.matches("Other ACME")).isFalse();
    }

    @Test
    void surroundingStarsMakeASubstringMatch() {
        WildcardPattern pattern = WildcardPattern.compile("*ACME*");

        assertThat(pattern.matches("ACME Corp SRL")).isTrue();
        assertThat(pattern.matches("Other ACME")).isTrue();
        assertThat(pattern.matches("Globex")).isFalse();
    }

    @Test
    void matchIsCaseInsensitiveAndCoversTheWholeField() {
        assertThat(WildcardPattern.compile("acme corp srl").matches("ACME Corp SRL")).isTrue();
        assertThat(WildcardPattern.compile("acme").matches("ACME Corp SRL")).isFalse();
    }

    @Test
    void questionMarkMatchesExactlyOneCharacter() {
        WildcardPattern pattern = WildcardPattern.compile("INV-00?");

        assertThat(pattern.matches("INV-001")).isTrue();
        assertThat(pattern.matches("INV-00")).isFalse();
        assertThat(pattern.matches("INV-0010")).isFalse();
    }

    @Test
    void regexCharactersAreLiteral() {
        WildcardPattern pattern = WildcardPattern.compile("A.B (RO)*");

        assertThat(pattern.matches("A.B (RO) SRL")).isTrue();
        assertThat(pattern.matches("AxB (RO) SRL")).isFalse();
    }

    @Test
    void nullNeverMatches() {
        assertThat(WildcardPattern.compile("*").matches(null)).isFalse();
    }
}
