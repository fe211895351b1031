package com.github.wikicite.cite;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.Objects;
import java.util.ResourceBundle;

import com.ibm.icu.text.DecimalFormatSymbols;
import com.ibm.icu.text.NumberingSystem;
import com.ibm.icu.util.ULocale;

/**
 * Message lookup for the citation code, bound to one language. Site overrides
 * win over the shipped bundles; the {@code qqx} pseudo-language renders every
 * non-overridden message as {@code (key|param1|param2)}.
 */
public class ReferenceMessageLocalizer {
    public static final ULocale QQX = new ULocale("qqx");
    private static final String BUNDLE = "com.github.wikicite.cite.CiteMessages";
    private static final ResourceBundle.Control NO_FALLBACK =
        ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);

    private final ULocale language;
    private final Map<String, String> overrides;
    private final ResourceBundle bundle;

    public ReferenceMessageLocalizer(ULocale language) {
        this(language, Map.of());
    }

    public ReferenceMessageLocalizer(ULocale language, Map<String, String> overrides) {
        this.language = Objects.requireNonNull(language);
        this.overrides = Collections.unmodifiableMap(new HashMap<>(overrides));
        this.bundle = ResourceBundle.getBundle(BUNDLE, isQqx() ? ULocale.ROOT.toLocale() : language.toLocale(), NO_FALLBACK);
    }

    public ULocale getLanguage() {
        return language;
    }

    public ReferenceMessageLocalizer withLanguage(ULocale language) {
        return new ReferenceMessageLocalizer(language, overrides);
    }

    public Message msg(String key, Object... params) {
        if (overrides.containsKey(key)) {
            return new Message(this, key, overrides.get(key), params, false);
        }

        String text;

        try {
            text = bundle.getString(key);
        } catch (MissingResourceException e) {
            text = null;
        }

        return new Message(this, key, text, params, isQqx());
    }

    /**
     * Transforms ASCII digits into the digits of the language's default
     * numbering system. Algorithmic systems (e.g. roman numerals) are left
     * alone.
     */
    public String localizeDigits(String number) {
        var ns = NumberingSystem.getInstance(language);

        if (ns.isAlgorithmic() || ns.getRadix() != 10) {
            return number;
        }

        var digits = ns.getDescription().codePoints().toArray();

        if (digits.length != 10) {
            return number;
        }

        var sb = new StringBuilder(number.length());

        number.codePoints().forEach(cp -> {
            if (cp >= '0' && cp <= '9') {
                sb.appendCodePoint(digits[cp - '0']);
            } else {
                sb.appendCodePoint(cp);
            }
        });

        return sb.toString();
    }

    /**
     * Swaps the ASCII decimal point and comma for the language's decimal and
     * grouping separators.
     */
    public String localizeSeparators(String number) {
        var symbols = DecimalFormatSymbols.getInstance(language);
        var sb = new StringBuilder(number.length());

        for (var ch : number.toCharArray()) {
            if (ch == '.') {
                sb.append(symbols.getDecimalSeparatorString());
            } else if (ch == ',') {
                sb.append(symbols.getGroupingSeparatorString());
            } else {
                sb.append(ch);
            }
        }

        return sb.toString();
    }

    private boolean isQqx() {
        return QQX.getLanguage().equals(language.getLanguage());
    }
}
