package com.github.wikicite.parsing;

import org.json.JSONException;
import org.json.JSONObject;
import org.jsoup.nodes.Element;

/**
 * Reads and writes the JSON-valued {@code data-parsoid} and {@code data-mw}
 * attributes. The returned views are detached copies: changes only reach the
 * element once they are stored back with the matching setter.
 */
public final class DomDataUtils {
    public static final String DATA_PARSOID = "data-parsoid";
    public static final String DATA_MW = "data-mw";

    private DomDataUtils() {}

    public static DataParsoid getDataParsoid(Element el) {
        return new DataParsoid(readJson(el, DATA_PARSOID));
    }

    public static void setDataParsoid(Element el, DataParsoid dp) {
        writeJson(el, DATA_PARSOID, dp.isBlank() ? null : dp.toJson());
    }

    public static DataMw getDataMw(Element el) {
        return new DataMw(readJson(el, DATA_MW));
    }

    /**
     * Stores the view on the element; {@code null} removes the attribute.
     */
    public static void setDataMw(Element el, DataMw dataMw) {
        writeJson(el, DATA_MW, dataMw == null || dataMw.isBlank() ? null : dataMw.toJson());
    }

    public static boolean hasDataMw(Element el) {
        return el.hasAttr(DATA_MW);
    }

    private static JSONObject readJson(Element el, String attr) {
        var value = el.attr(attr);

        if (value.isEmpty()) {
            return new JSONObject();
        }

        try {
            return new JSONObject(value);
        } catch (JSONException e) {
            throw new ParsingException(String.format("Malformed %s on <%s>: %s", attr, el.tagName(), value), e);
        }
    }

    private static void writeJson(Element el, String attr, JSONObject json) {
        if (json == null) {
            el.removeAttr(attr);
        } else {
            el.attr(attr, json.toString());
        }
    }
}
