package com.github.wikicite.cite;

import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Element;

import com.github.wikicite.parsing.DataMw;
import com.github.wikicite.parsing.DataParsoid;
import com.github.wikicite.parsing.DomDataUtils;
import com.github.wikicite.parsing.DomUtils;
import com.github.wikicite.parsing.ExtensionApi;
import com.github.wikicite.parsing.ExtensionTag;

/**
 * Converts single {@code <ref>} tags between source and tree form.
 */
public class RefTagHandler {
    public static final String TAG_NAME = "ref";
    public static final String EXTENSION_TYPEOF = "mw:Extension/ref";

    private final Logger logger = Logger.getLogger("cite");

    /**
     * Seals a tokenized {@code <ref>}: its body is stored out of line as a
     * {@code sup} wrapper and the returned placeholder takes its place in the
     * tree until the post-processor replaces it with a footnote mark.
     *
     * @param bodyHtml parsed body, {@code null} for self-closed tags
     */
    public Element sourceToDom(ExtensionApi extApi, ExtensionTag extTag, String bodyHtml) {
        var sup = new Element("sup");
        DomUtils.addTypeOf(sup, EXTENSION_TYPEOF);

        if (bodyHtml != null) {
            var body = extApi.htmlToDom(bodyHtml);
            DomUtils.migrateChildren(body, sup);
        }

        var dataMw = new DataMw(TAG_NAME);
        dataMw.setAttrs(extTag.attrs());

        if (!extTag.isSelfClosed()) {
            dataMw.setBodyExtsrc(extTag.body());
        }

        DomDataUtils.setDataMw(sup, dataMw);

        var supDp = new DataParsoid();
        supDp.setSelfClose(extTag.isSelfClosed());
        supDp.setEmpty(StringUtils.isBlank(extTag.body()));
        DomDataUtils.setDataParsoid(sup, supDp);

        var fragment = DomUtils.createFragment();
        fragment.appendChild(sup);
        var contentId = extApi.registerContentDom(fragment);

        var placeholder = new Element("span");
        DomUtils.addTypeOf(placeholder, DomUtils.sealedFragmentType(TAG_NAME));
        placeholder.attr("about", extApi.newAboutId());

        var dp = new DataParsoid();
        dp.setHtml(contentId);
        dp.setSrc(extTag.source());
        dp.setDsr(extTag.dsr());
        DomDataUtils.setDataParsoid(placeholder, dp);
        return placeholder;
    }

    /**
     * Serializes a footnote mark back to a {@code <ref>} tag. The body comes
     * from {@code data-mw.body.html} when the occurrence kept its own copy,
     * otherwise from the footnote text it points at by id.
     */
    public String domToWikitext(ExtensionApi extApi, Element node) {
        var startTagSrc = extApi.extStartTagToWikitext(node);
        var dataMw = DomDataUtils.getDataMw(node);

        if (!dataMw.hasBody()) {
            return startTagSrc;
        }

        String src;

        if (dataMw.getBodyHtml() != null) {
            src = extApi.htmlToWikitext(dataMw.getName(), dataMw.getBodyHtml());
        } else if (dataMw.getBodyId() != null) {
            var doc = node.ownerDocument();
            var bodyElt = doc != null ? doc.getElementById(dataMw.getBodyId()) : null;

            if (bodyElt == null) {
                logger.logp(Level.WARNING, "RefTagHandler", "domToWikitext",
                    String.format("Body id %s points to a missing element for: %s", dataMw.getBodyId(), node.outerHtml()));
                return "";
            }

            src = extApi.htmlToWikitext(dataMw.getName(), extApi.domToHtml(bodyElt, true));
        } else {
            logger.logp(Level.WARNING, "RefTagHandler", "domToWikitext", "Ref body unavailable for: " + node.outerHtml());
            return "";
        }

        return startTagSrc + src + "</" + dataMw.getName() + ">";
    }
}
