package com.github.wikicite.parsing;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Typed view over the {@code data-mw} attribute of an element: the extension
 * name, its attributes, its body and the errors attached to it. Unknown keys
 * (template {@code parts}, media {@code caption}, ...) are preserved.
 *
 * <p>The body is one of three shapes: {@code {extsrc}} straight out of the
 * tokenizer, {@code {html}} holding serialized content, or {@code {id}}
 * pointing at an element elsewhere in the document.</p>
 */
public final class DataMw {
    private final JSONObject json;

    public DataMw() {
        this(new JSONObject());
    }

    public DataMw(String name) {
        this();
        setName(name);
    }

    DataMw(JSONObject json) {
        this.json = json;
    }

    public String getName() {
        return json.optString("name", null);
    }

    public void setName(String name) {
        json.put("name", name);
    }

    /**
     * Attribute values that are not plain strings are returned in their JSON
     * form.
     */
    public Map<String, String> getAttrs() {
        var map = new LinkedHashMap<String, String>();
        var attrs = json.optJSONObject("attrs");

        if (attrs != null) {
            for (var key : attrs.keySet()) {
                map.put(key, attrs.isNull(key) ? "" : String.valueOf(attrs.get(key)));
            }
        }

        return map;
    }

    public boolean hasAttr(String key) {
        var attrs = json.optJSONObject("attrs");
        return attrs != null && attrs.has(key);
    }

    public String getAttr(String key) {
        var attrs = json.optJSONObject("attrs");
        return attrs != null && attrs.has(key) ? String.valueOf(attrs.get(key)) : null;
    }

    public void setAttrs(Map<String, String> attrs) {
        var obj = new JSONObject();

        for (var entry : attrs.entrySet()) {
            obj.put(entry.getKey(), entry.getValue());
        }

        json.put("attrs", obj);
    }

    public void setAttr(String key, String value) {
        var attrs = json.optJSONObject("attrs");

        if (attrs == null) {
            attrs = new JSONObject();
            json.put("attrs", attrs);
        }

        attrs.put(key, value);
    }

    public boolean hasBody() {
        return json.has("body") && !json.isNull("body");
    }

    public String getBodyExtsrc() {
        return bodyField("extsrc");
    }

    public String getBodyHtml() {
        return bodyField("html");
    }

    public String getBodyId() {
        return bodyField("id");
    }

    public void setBodyExtsrc(String extsrc) {
        json.put("body", new JSONObject().put("extsrc", extsrc));
    }

    public void setBodyHtml(String html) {
        json.put("body", new JSONObject().put("html", html));
    }

    public void setBodyId(String id) {
        json.put("body", new JSONObject().put("id", id));
    }

    public void removeBody() {
        json.remove("body");
    }

    private String bodyField(String key) {
        var body = json.optJSONObject("body");
        return body != null ? body.optString(key, null) : null;
    }

    public List<DataMwError> getErrors() {
        var list = new ArrayList<DataMwError>();
        var arr = json.optJSONArray("errors");

        if (arr != null) {
            for (int i = 0; i < arr.length(); i++) {
                list.add(DataMwError.fromJson(arr.getJSONObject(i)));
            }
        }

        return list;
    }

    /**
     * Appends to any errors already present.
     */
    public void addErrors(List<DataMwError> errors) {
        var arr = json.optJSONArray("errors");

        if (arr == null) {
            arr = new JSONArray();
            json.put("errors", arr);
        }

        for (var error : errors) {
            arr.put(error.toJson());
        }
    }

    public boolean isAutoGenerated() {
        return json.optBoolean("autoGenerated", false);
    }

    public void setAutoGenerated(boolean autoGenerated) {
        if (autoGenerated) {
            json.put("autoGenerated", true);
        } else {
            json.remove("autoGenerated");
        }
    }

    /** Serialized HTML of a media caption, if any. */
    public String getCaption() {
        return json.optString("caption", null);
    }

    public void setCaption(String caption) {
        json.put("caption", caption);
    }

    /**
     * Template parts of a transclusion wrapper, exposed raw so that embedded
     * parameter HTML can be rewritten in place.
     */
    public JSONArray getParts() {
        return json.optJSONArray("parts");
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
