package com.github.wikicite.cite;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AnchorFormatter Tests")
class AnchorFormatterTest {
    private AnchorFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = new AnchorFormatter();
    }

    @Test
    @DisplayName("Should build back-link ids with and without occurrence numbers")
    void shouldBuildBackLinks() {
        assertThat(formatter.backLinkTarget("1", null)).isEqualTo("cite_ref-1");
        assertThat(formatter.backLinkTarget("a b", "2-0")).isEqualTo("cite_ref-a_b_2-0");
        assertThat(formatter.backLink("a b", "2-0")).isEqualTo("cite_ref-a_b_2-0");
    }

    @Test
    @DisplayName("Should escape only the link form of an id")
    void shouldEscapeLinksOnly() {
        assertThat(formatter.jumpLinkTarget("x\"y")).isEqualTo("cite_note-x\"y");
        assertThat(formatter.jumpLink("x\"y")).isEqualTo("cite_note-x%22y");
        assertThat(formatter.jumpLink("[x]")).isEqualTo("cite_note-%5Bx%5D");
        assertThat(formatter.jumpLink("é")).isEqualTo("cite_note-é");
    }

    @Test
    @DisplayName("Should normalize ref names")
    void shouldNormalizeKey() {
        assertThat(formatter.normalizeKey("a  b__c")).isEqualTo("a_b_c");
        assertThat(formatter.normalizeKey("50%")).isEqualTo("50%25");
        assertThat(formatter.normalizeKey("Smith 2001")).isEqualTo("Smith_2001");
    }
}
