package com.github.wikicite.cite;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.ibm.icu.util.ULocale;

@DisplayName("ReferenceMessageLocalizer Tests")
class ReferenceMessageLocalizerTest {
    @ParameterizedTest(name = "{0}: {1} -> {2}")
    @CsvSource({
        "en, '1,234.5', '1,234.5'",
        "de, '1,234.5', '1.234,5'",
    })
    @DisplayName("Should localize separators")
    void shouldLocalizeSeparators(String language, String input, String expected) {
        var localizer = new ReferenceMessageLocalizer(new ULocale(language));
        assertThat(localizer.localizeSeparators(input)).isEqualTo(expected);
    }

    @ParameterizedTest(name = "{0}: {1} -> {2}")
    @CsvSource({
        "en, 1234, 1234",
        "fa, 1234, ۱۲۳۴",
        "fa, 1.2, ۱.۲",
    })
    @DisplayName("Should localize digits")
    void shouldLocalizeDigits(String language, String input, String expected) {
        var localizer = new ReferenceMessageLocalizer(new ULocale(language));
        assertThat(localizer.localizeDigits(input)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should format shipped messages with parameters")
    void shouldFormatShippedMessages() {
        var localizer = new ReferenceMessageLocalizer(ULocale.ENGLISH);
        var msg = localizer.msg("cite_error", "details");

        assertThat(msg.exists()).isTrue();
        assertThat(msg.plain()).isEqualTo("Cite error: details");
    }

    @Test
    @DisplayName("Should fall back to the root bundle for untranslated messages")
    void shouldFallBackToRootBundle() {
        var localizer = new ReferenceMessageLocalizer(new ULocale("pl"));

        assertThat(localizer.msg("cite_error", "x").plain()).isEqualTo("Błąd w przypisach: x");
        assertThat(localizer.msg("cite_warning", "x").inLanguage(ULocale.ENGLISH).plain()).isEqualTo("Cite warning: x");
        assertThat(localizer.msg("cite_link_label_group-lower-roman").plain()).startsWith("i ii iii");
    }

    @Test
    @DisplayName("Should render keys and parameters in qqx")
    void shouldRenderQqx() {
        var localizer = new ReferenceMessageLocalizer(ReferenceMessageLocalizer.QQX);

        assertThat(localizer.msg("cite_error", "a", "b").plain()).isEqualTo("(cite_error|a|b)");
        assertThat(localizer.msg("cite_error_ref_no_key").plain()).isEqualTo("(cite_error_ref_no_key)");
        assertThat(localizer.msg("cite_no_such_message").isDisabled()).isTrue();
    }

    @Test
    @DisplayName("Should prefer site overrides")
    void shouldPreferOverrides() {
        var localizer = new ReferenceMessageLocalizer(ReferenceMessageLocalizer.QQX, Map.of("cite_error", "Oops: {0}"));

        assertThat(localizer.msg("cite_error", "x").plain()).isEqualTo("Oops: x");
    }

    @Test
    @DisplayName("Should mark missing messages")
    void shouldMarkMissingMessages() {
        var msg = new ReferenceMessageLocalizer(ULocale.ENGLISH).msg("cite_no_such_message");

        assertThat(msg.exists()).isFalse();
        assertThat(msg.isDisabled()).isTrue();
        assertThat(msg.plain()).isEqualTo("⧼cite_no_such_message⧽");
    }
}
