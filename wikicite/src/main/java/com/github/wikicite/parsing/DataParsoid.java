package com.github.wikicite.parsing;

import org.json.JSONObject;

/**
 * Typed view over the {@code data-parsoid} attribute of an element. Keys this
 * class does not know about are preserved untouched.
 *
 * @see DomDataUtils#getDataParsoid(org.jsoup.nodes.Element)
 */
public final class DataParsoid {
    private final JSONObject json;

    public DataParsoid() {
        this(new JSONObject());
    }

    DataParsoid(JSONObject json) {
        this.json = json;
    }

    /** Content store id of a sealed fragment. */
    public String getHtml() {
        return json.optString("html", null);
    }

    public void setHtml(String html) {
        json.put("html", html);
    }

    public DomSourceRange getDsr() {
        var arr = json.optJSONArray("dsr");
        return arr != null ? DomSourceRange.fromJson(arr) : null;
    }

    public void setDsr(DomSourceRange dsr) {
        json.put("dsr", dsr != null ? dsr.toJson() : null);
    }

    public String getSrc() {
        return json.optString("src", null);
    }

    public void setSrc(String src) {
        json.put("src", src);
    }

    /** Opaque parameter info of template wrappers; only ever copied around. */
    public Object getPi() {
        return json.opt("pi");
    }

    public void setPi(Object pi) {
        json.put("pi", pi);
    }

    public String getGroup() {
        return json.optString("group", null);
    }

    public void setGroup(String group) {
        json.put("group", group);
    }

    public boolean isEmpty() {
        return json.optBoolean("empty", false);
    }

    public void setEmpty(boolean empty) {
        putFlag("empty", empty);
    }

    public boolean isSelfClose() {
        return json.optBoolean("selfClose", false);
    }

    public void setSelfClose(boolean selfClose) {
        putFlag("selfClose", selfClose);
    }

    public boolean isMisnested() {
        return json.optBoolean("misnested", false);
    }

    public void setMisnested(boolean misnested) {
        putFlag("misnested", misnested);
    }

    private void putFlag(String key, boolean value) {
        if (value) {
            json.put(key, true);
        } else {
            json.remove(key);
        }
    }

    boolean isBlank() {
        return json.isEmpty();
    }

    JSONObject toJson() {
        return json;
    }

    @Override
    public String toString() {
        return json.toString();
    }
}
