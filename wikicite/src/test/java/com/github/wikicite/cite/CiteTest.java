package com.github.wikicite.cite;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.ibm.icu.util.ULocale;

@ExtendWith(MockitoExtension.class)
@DisplayName("Cite Tests")
class CiteTest {
    @Mock
    private ParserContext parser;

    @Test
    @DisplayName("Should wire components for a content language")
    void shouldWireForLanguage() {
        var cite = Cite.forLanguage(new ULocale("pl"));

        assertThat(cite.getConfig().isResponsiveReferences()).isTrue();
        assertThat(cite.getMessageLocalizer().getLanguage()).isEqualTo(new ULocale("pl"));
        assertThat(cite.getMarkSymbolRenderer().makeLabel("lower-roman", 4)).isEqualTo("iv");
        assertThat(cite.getAnchorFormatter().jumpLinkTarget("1")).isEqualTo("cite_note-1");
    }

    @Test
    @DisplayName("Should render legacy marks of collected refs")
    void shouldRenderLegacyMark() {
        when(parser.recursiveTagParse(anyString())).then(returnsFirstArg());
        var f = new CiteFixture();
        f.body().appendChild(f.paragraph(f.ref("Note", "name", "a b")));
        var refsData = new ReferencesData(f.cite.getAnchorFormatter());

        f.cite.getReferences().processRefs(f.env, refsData, f.body());

        var ref = refsData.getRefGroup("").getByName("a b");
        assertThat(ref.getNodes()).hasSize(1);
        assertThat(ref.getEmbeddedNodes()).isEmpty();
        assertThat(ref.getContentId()).isEqualTo("mwf1");
        assertThat(ref.getLinkbacks()).containsExactly("cite_ref-a_b_1-0");
        assertThat(f.cite.getFootnoteMarkFormatter().linkRef(parser, ref)).isEqualTo(
            "<sup id=\"cite_ref-a_b_1-0\" class=\"reference\"><a href=\"#cite_note-a_b-1\">"
            + "<span class=\"cite-bracket\">[</span>1<span class=\"cite-bracket\">]</span></a></sup>");
    }
}
