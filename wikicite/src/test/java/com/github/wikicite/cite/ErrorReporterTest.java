package com.github.wikicite.cite;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.jsoup.nodes.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.github.wikicite.parsing.DataMwError;
import com.github.wikicite.parsing.DocumentEnvironment;
import com.github.wikicite.parsing.DomDataUtils;
import com.github.wikicite.parsing.DomUtils;
import com.ibm.icu.util.ULocale;

@ExtendWith(MockitoExtension.class)
@DisplayName("ErrorReporter Tests")
class ErrorReporterTest {
    @Mock
    private ParserContext parser;

    private ErrorReporter reporter;

    @BeforeEach
    void setUp() {
        reporter = new ErrorReporter(new ReferenceMessageLocalizer(ULocale.ENGLISH));
    }

    @Test
    @DisplayName("Should wrap errors in the content language and track them")
    void shouldRenderPlainError() {
        when(parser.getContentLanguage()).thenReturn(ReferenceMessageLocalizer.QQX);

        var output = reporter.plain(parser, "cite_error_example", "first param");

        assertThat(output).isEqualTo(
            "<span class=\"error mw-ext-cite-error\" lang=\"qqx\" dir=\"ltr\">(cite_error|(cite_error_example|first param))</span>");
        verify(parser).addTrackingCategory(Cite.TRACKING_CATEGORY_ERROR);
    }

    @Test
    @DisplayName("Should not track warnings")
    void shouldRenderPlainWarning() {
        when(parser.getContentLanguage()).thenReturn(ReferenceMessageLocalizer.QQX);

        var output = reporter.plain(parser, "cite_warning_example", "first param");

        assertThat(output).isEqualTo(
            "<span class=\"warning mw-ext-cite-warning mw-ext-cite-warning-example\" lang=\"qqx\" dir=\"ltr\">"
            + "(cite_warning|(cite_warning_example|first param))</span>");
        verify(parser, never()).addTrackingCategory(anyString());
    }

    @Test
    @DisplayName("Should pass half-parsed messages through the markup renderer")
    void shouldRenderHalfParsed() {
        when(parser.getContentLanguage()).thenReturn(ReferenceMessageLocalizer.QQX);
        when(parser.recursiveTagParse(anyString())).thenAnswer(inv -> "<i>" + inv.getArgument(0) + "</i>");

        var output = reporter.halfParsed(parser, "cite_error_example", "first param");

        assertThat(output).isEqualTo(
            "<span class=\"error mw-ext-cite-error\" lang=\"qqx\" dir=\"ltr\"><i>(cite_error|(cite_error_example|first param))</i></span>");
        verify(parser).recursiveTagParse("(cite_error|(cite_error_example|first param))");
    }

    @Test
    @DisplayName("Should mark right-to-left content languages")
    void shouldUseContentLanguageDirection() {
        when(parser.getContentLanguage()).thenReturn(new ULocale("he"));

        var output = reporter.plain(parser, "cite_error_ref_no_key");

        assertThat(output).startsWith("<span class=\"error mw-ext-cite-error\" lang=\"he\" dir=\"rtl\">");
    }

    @Test
    @DisplayName("Should render a structured error span")
    void shouldRenderParsoidErrorSpan() {
        var env = new DocumentEnvironment("./Page", "", ReferenceMessageLocalizer.QQX);

        var span = reporter.renderParsoidErrorSpan(env, "cite_error_references_invalid_parameters");

        assertThat(span.attr("typeof")).isEqualTo(ErrorReporter.ERROR_TYPEOF);
        assertThat(span.attr("class")).isEqualTo("error mw-ext-cite-error");
        assertThat(span.attr("lang")).isEqualTo("qqx");
        assertThat(span.text()).isEqualTo("(cite_error|(cite_error_references_invalid_parameters))");
        assertThat(DomDataUtils.getDataMw(span).getErrors())
            .containsExactly(new DataMwError("cite_error_references_invalid_parameters"));
        assertThat(env.getTrackingCategories().getCount(Cite.TRACKING_CATEGORY_ERROR)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should append errors to those already on a node")
    void shouldAppendErrorsToNode() {
        var env = new DocumentEnvironment("./Page", "", ULocale.ENGLISH);
        var sup = new Element("sup");
        DomUtils.addTypeOf(sup, "mw:Extension/ref");

        reporter.addErrorsToNode(env, sup, List.of(new DataMwError("cite_error_ref_no_key")));
        reporter.addErrorsToNode(env, sup, List.of(new DataMwError("cite_warning_example", "x")));

        assertThat(sup.attr("typeof")).isEqualTo("mw:Extension/ref mw:Error");
        assertThat(DomDataUtils.getDataMw(sup).getErrors()).containsExactly(
            new DataMwError("cite_error_ref_no_key"), new DataMwError("cite_warning_example", "x"));
        assertThat(env.getTrackingCategories().getCount(Cite.TRACKING_CATEGORY_ERROR)).isEqualTo(1);
    }
}
