package com.github.wikicite.cite;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import com.ibm.icu.text.MessageFormat;
import com.ibm.icu.util.ULocale;

/**
 * A localized message resolved against one language. Parameters are inserted
 * verbatim, no escaping is applied.
 */
public class Message {
    private final ReferenceMessageLocalizer localizer;
    private final String key;
    private final String text;
    private final Object[] params;
    private final boolean debug;

    Message(ReferenceMessageLocalizer localizer, String key, String text, Object[] params, boolean debug) {
        this.localizer = localizer;
        this.key = key;
        this.text = text;
        this.params = params;
        this.debug = debug;
    }

    public String getKey() {
        return key;
    }

    public List<Object> getParams() {
        return Arrays.asList(params);
    }

    public ULocale getLanguage() {
        return localizer.getLanguage();
    }

    public boolean exists() {
        return text != null;
    }

    /**
     * Missing, blank and "-" messages are disabled, the latter being the
     * conventional way for a site to switch a message off.
     */
    public boolean isDisabled() {
        return text == null || text.isBlank() || text.equals("-");
    }

    public String plain() {
        if (debug) {
            var args = Arrays.stream(params).map(String::valueOf).collect(Collectors.joining("|"));
            return args.isEmpty() ? String.format("(%s)", key) : String.format("(%s|%s)", key, args);
        }

        if (text == null) {
            return String.format("⧼%s⧽", key);
        }

        return new MessageFormat(text, getLanguage()).format(params);
    }

    public Message inLanguage(ULocale language) {
        if (language.equals(getLanguage())) {
            return this;
        }

        return localizer.withLanguage(language).msg(key, params);
    }

    @Override
    public String toString() {
        return plain();
    }
}
