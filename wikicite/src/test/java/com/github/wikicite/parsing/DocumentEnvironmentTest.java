package com.github.wikicite.parsing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.json.JSONArray;
import org.json.JSONObject;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.ibm.icu.util.ULocale;

@DisplayName("DocumentEnvironment Tests")
class DocumentEnvironmentTest {
    private DocumentEnvironment env;

    @BeforeEach
    void setUp() {
        env = new DocumentEnvironment("./Page", "żółw", ULocale.ENGLISH);
    }

    @Test
    @DisplayName("Should store and forget content fragments")
    void shouldStoreContent() {
        var fragment = DomUtils.parseFragment("<sup>x</sup>");

        var id = env.registerContentDom(fragment);

        assertThat(id).isEqualTo("mwf1");
        assertThat(env.registerContentDom(DomUtils.createFragment())).isEqualTo("mwf2");
        assertThat(env.getContentDom(id)).isSameAs(fragment);

        env.clearContentDom(id);

        assertThat(env.hasContentDom(id)).isFalse();
        assertThatThrownBy(() -> env.getContentDom(id)).isInstanceOf(ParsingException.class);
    }

    @Test
    @DisplayName("Should hand out sequential about ids")
    void shouldCreateAboutIds() {
        assertThat(env.newAboutId()).isEqualTo("#mwt1");
        assertThat(env.newAboutId()).isEqualTo("#mwt2");
    }

    @Test
    @DisplayName("Should measure the source in UTF-8 bytes")
    void shouldMeasureContentLength() {
        assertThat(env.getContentLength()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should rewrite the body html of extension wrappers")
    void shouldProcessExtensionBody() {
        var el = new Element("div").attr("typeof", "mw:Extension/gallery");
        var dataMw = new DataMw("gallery");
        dataMw.setBodyHtml("a");
        DomDataUtils.setDataMw(el, dataMw);

        env.processAttributeEmbeddedHtml(el, html -> html + "!");

        assertThat(DomDataUtils.getDataMw(el).getBodyHtml()).isEqualTo("a!");
    }

    @Test
    @DisplayName("Should leave the body of other elements alone")
    void shouldIgnoreBodyOfNonExtensions() {
        var el = new Element("div");
        var dataMw = new DataMw();
        dataMw.setBodyHtml("a");
        DomDataUtils.setDataMw(el, dataMw);

        env.processAttributeEmbeddedHtml(el, html -> html + "!");

        assertThat(DomDataUtils.getDataMw(el).getBodyHtml()).isEqualTo("a");
    }

    @Test
    @DisplayName("Should rewrite captions and template parameters")
    void shouldProcessCaptionAndParts() {
        var params = new JSONObject().put("1", new JSONObject().put("wt", "x").put("html", "p"));
        var parts = new JSONArray().put("text").put(new JSONObject().put("template", new JSONObject().put("params", params)));
        var el = new Element("figure").attr("data-mw", new JSONObject().put("caption", "c").put("parts", parts).toString());

        env.processAttributeEmbeddedHtml(el, html -> html + "!");

        var dataMw = DomDataUtils.getDataMw(el);
        assertThat(dataMw.getCaption()).isEqualTo("c!");
        assertThat(dataMw.getParts().getJSONObject(1).getJSONObject("template").getJSONObject("params")
            .getJSONObject("1").getString("html")).isEqualTo("p!");
        assertThat(dataMw.getParts().getJSONObject(1).getJSONObject("template").getJSONObject("params")
            .getJSONObject("1").getString("wt")).isEqualTo("x");
    }

    @Test
    @DisplayName("Should collect page metadata")
    void shouldCollectMetadata() {
        env.addTrackingCategory("a");
        env.addTrackingCategory("a");
        env.addModules("m1", "m2", "m1");
        env.addModuleStyles("s");
        env.pushError("cite_error_ref_no_key");

        assertThat(env.getTrackingCategories().getCount("a")).isEqualTo(2);
        assertThat(env.getModules()).containsExactly("m1", "m2");
        assertThat(env.getModuleStyles()).containsExactly("s");
        assertThat(env.getErrors()).containsExactly(new DataMwError("cite_error_ref_no_key"));
    }

    @Test
    @DisplayName("Should require a serializer for wikitext output")
    void shouldRequireSerializer() {
        assertThatThrownBy(() -> env.htmlToWikitext("ref", "x")).isInstanceOf(UnsupportedOperationException.class);
    }
}
