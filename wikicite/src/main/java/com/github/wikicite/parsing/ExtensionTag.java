package com.github.wikicite.parsing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A tokenized extension tag as handed over by the host tokenizer, e.g.
 * {@code <ref name="a">text</ref>}.
 *
 * @param name tag name
 * @param attrs attributes in source order, values already trimmed
 * @param body raw source between the tags, {@code null} if self-closed
 * @param source full source text of the tag
 * @param dsr source range of the tag, may be {@code null}
 */
public record ExtensionTag(String name, Map<String, String> attrs, String body, String source, DomSourceRange dsr) {
    public ExtensionTag {
        Objects.requireNonNull(name);
        attrs = Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
        source = Objects.requireNonNullElse(source, "");
    }

    public boolean isSelfClosed() {
        return body == null;
    }
}
