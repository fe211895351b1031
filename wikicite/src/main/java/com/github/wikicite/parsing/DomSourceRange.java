package com.github.wikicite.parsing;

import java.util.Objects;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Source offsets of a node: start and end of the whole node plus the widths of
 * its opening and closing tags. Any of them may be unknown ({@code null}).
 */
public final class DomSourceRange {
    private final Integer start;
    private final Integer end;
    private final Integer openWidth;
    private final Integer closeWidth;

    public DomSourceRange(Integer start, Integer end, Integer openWidth, Integer closeWidth) {
        this.start = start;
        this.end = end;
        this.openWidth = openWidth;
        this.closeWidth = closeWidth;
    }

    /**
     * A zero-width range at the given offset, used for nodes that have no
     * counterpart in the source text.
     */
    public static DomSourceRange zeroWidth(Integer offset) {
        return new DomSourceRange(offset, offset, null, null);
    }

    public Integer getStart() {
        return start;
    }

    public Integer getEnd() {
        return end;
    }

    public Integer getOpenWidth() {
        return openWidth;
    }

    public Integer getCloseWidth() {
        return closeWidth;
    }

    JSONArray toJson() {
        var arr = new JSONArray();
        arr.put(start != null ? start : JSONObject.NULL);
        arr.put(end != null ? end : JSONObject.NULL);
        arr.put(openWidth != null ? openWidth : JSONObject.NULL);
        arr.put(closeWidth != null ? closeWidth : JSONObject.NULL);
        return arr;
    }

    static DomSourceRange fromJson(JSONArray arr) {
        return new DomSourceRange(optInt(arr, 0), optInt(arr, 1), optInt(arr, 2), optInt(arr, 3));
    }

    private static Integer optInt(JSONArray arr, int index) {
        if (index >= arr.length() || arr.isNull(index)) {
            return null;
        }

        return arr.getInt(index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, openWidth, closeWidth);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        } else if (obj instanceof DomSourceRange dsr) {
            return Objects.equals(start, dsr.start) && Objects.equals(end, dsr.end) &&
                Objects.equals(openWidth, dsr.openWidth) && Objects.equals(closeWidth, dsr.closeWidth);
        } else {
            return false;
        }
    }

    @Override
    public String toString() {
        return String.format("[%s,%s,%s,%s]", start, end, openWidth, closeWidth);
    }
}
