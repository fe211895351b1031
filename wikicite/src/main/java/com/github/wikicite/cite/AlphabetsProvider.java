package com.github.wikicite.cite;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.MissingResourceException;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.util.LocaleData;
import com.ibm.icu.util.ULocale;

/**
 * Index alphabets (the letters a dictionary of the language is sorted under)
 * from CLDR, lower-cased.
 */
public class AlphabetsProvider {
    private final Map<ULocale, List<String>> cache = new HashMap<>();

    /**
     * @return the alphabet in collation-independent code point order, or an
     * empty list if CLDR knows none for the locale
     */
    public List<String> getIndexCharacters(ULocale locale) {
        return cache.computeIfAbsent(locale, AlphabetsProvider::loadIndexCharacters);
    }

    private static List<String> loadIndexCharacters(ULocale locale) {
        try {
            var set = LocaleData.getInstance(locale).getExemplarSet(0, LocaleData.ES_INDEX);

            if (set == null || set.isEmpty()) {
                return List.of();
            }

            var letters = new LinkedHashSet<String>();

            for (var s : set) {
                letters.add(UCharacter.toLowerCase(locale, s));
            }

            return List.copyOf(new ArrayList<>(letters));
        } catch (MissingResourceException e) {
            return List.of();
        }
    }
}
