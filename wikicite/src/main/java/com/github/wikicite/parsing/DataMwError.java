package com.github.wikicite.parsing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * One structured error stored in the {@code errors} list of a node's
 * {@code data-mw}: a message key and its parameters.
 */
public final class DataMwError {
    private final String key;
    private final List<String> params;

    public DataMwError(String key, String... params) {
        this(key, List.of(params));
    }

    public DataMwError(String key, List<String> params) {
        this.key = Objects.requireNonNull(key);
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
    }

    public String getKey() {
        return key;
    }

    public List<String> getParams() {
        return params;
    }

    JSONObject toJson() {
        var json = new JSONObject();
        json.put("key", key);

        if (!params.isEmpty()) {
            json.put("params", new JSONArray(params));
        }

        return json;
    }

    static DataMwError fromJson(JSONObject json) {
        var params = new ArrayList<String>();
        var arr = json.optJSONArray("params");

        if (arr != null) {
            for (int i = 0; i < arr.length(); i++) {
                params.add(arr.isNull(i) ? "" : String.valueOf(arr.get(i)));
            }
        }

        return new DataMwError(json.getString("key"), params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, params);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        } else if (obj instanceof DataMwError err) {
            return key.equals(err.key) && params.equals(err.params);
        } else {
            return false;
        }
    }

    @Override
    public String toString() {
        return params.isEmpty() ? key : String.format("%s%s", key, params);
    }
}
