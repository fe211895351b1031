package com.github.wikicite.parsing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;

import org.jsoup.nodes.Element;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DomDataUtils Tests")
class DomDataUtilsTest {
    @Test
    @DisplayName("Should read blank data from elements without attributes")
    void shouldReadBlankData() {
        var el = new Element("span");

        assertThat(DomDataUtils.getDataParsoid(el).getDsr()).isNull();
        assertThat(DomDataUtils.getDataMw(el).getName()).isNull();
        assertThat(DomDataUtils.getDataMw(el).getErrors()).isEmpty();
        assertThat(DomDataUtils.hasDataMw(el)).isFalse();
    }

    @Test
    @DisplayName("Should store data-parsoid and keep unknown keys")
    void shouldRoundTripDataParsoid() {
        var el = new Element("span").attr("data-parsoid", "{\"stx\":\"html\"}");
        var dp = DomDataUtils.getDataParsoid(el);
        dp.setDsr(new DomSourceRange(3, 10, null, null));
        dp.setMisnested(true);
        DomDataUtils.setDataParsoid(el, dp);

        var read = DomDataUtils.getDataParsoid(el);
        assertThat(read.getDsr()).isEqualTo(new DomSourceRange(3, 10, null, null));
        assertThat(read.isMisnested()).isTrue();
        assertThat(el.attr("data-parsoid")).contains("\"stx\":\"html\"");
    }

    @Test
    @DisplayName("Should remove attributes of blank data")
    void shouldRemoveBlankData() {
        var el = new Element("span").attr("data-mw", "{}").attr("data-parsoid", "{\"empty\":true}");
        var dp = DomDataUtils.getDataParsoid(el);
        dp.setEmpty(false);

        DomDataUtils.setDataParsoid(el, dp);
        DomDataUtils.setDataMw(el, null);

        assertThat(el.hasAttr("data-parsoid")).isFalse();
        assertThat(el.hasAttr("data-mw")).isFalse();
    }

    @Test
    @DisplayName("Should store extension data and errors")
    void shouldRoundTripDataMw() {
        var el = new Element("sup");
        var dataMw = new DataMw("ref");
        dataMw.setAttrs(Map.of("name", "a"));
        dataMw.setBodyId("mw-reference-text-cite_note-a-1");
        dataMw.addErrors(List.of(new DataMwError("cite_error_references_no_text", "a")));
        DomDataUtils.setDataMw(el, dataMw);

        var read = DomDataUtils.getDataMw(el);
        assertThat(read.getName()).isEqualTo("ref");
        assertThat(read.getAttr("name")).isEqualTo("a");
        assertThat(read.getBodyId()).isEqualTo("mw-reference-text-cite_note-a-1");
        assertThat(read.getBodyHtml()).isNull();
        assertThat(read.getErrors()).containsExactly(new DataMwError("cite_error_references_no_text", "a"));
    }

    @Test
    @DisplayName("Should fail on malformed JSON")
    void shouldFailOnMalformedJson() {
        var el = new Element("sup").attr("data-mw", "{name:");

        assertThatThrownBy(() -> DomDataUtils.getDataMw(el))
            .isInstanceOf(ParsingException.class)
            .hasMessageContaining("data-mw");
    }
}
