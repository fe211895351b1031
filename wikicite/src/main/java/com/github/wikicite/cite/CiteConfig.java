package com.github.wikicite.cite;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.MissingResourceException;
import java.util.Properties;

public final class CiteConfig {
    private static final String RESOURCE = "cite.properties";

    private boolean responsiveReferences = true;
    private int responsiveReferencesThreshold = 10;
    private boolean useLegacyBacklinkLabels = false;

    public CiteConfig() {}

    /**
     * Defaults shipped in {@code cite.properties} next to this class.
     */
    public static CiteConfig load() {
        try (InputStream in = CiteConfig.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new MissingResourceException("Error loading resource: " + RESOURCE, CiteConfig.class.getName(), RESOURCE);
            }

            var props = new Properties();
            props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            return fromProperties(props);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static CiteConfig fromProperties(Properties props) {
        var config = new CiteConfig();

        if (props.containsKey("responsiveReferences")) {
            config.responsive(Boolean.parseBoolean(props.getProperty("responsiveReferences").trim()));
        }

        if (props.containsKey("responsiveReferencesThreshold")) {
            config.responsiveThreshold(Integer.parseInt(props.getProperty("responsiveReferencesThreshold").trim()));
        }

        if (props.containsKey("useLegacyBacklinkLabels")) {
            config.legacyBacklinkLabels(Boolean.parseBoolean(props.getProperty("useLegacyBacklinkLabels").trim()));
        }

        return config;
    }

    public CiteConfig responsive(boolean responsiveReferences) {
        this.responsiveReferences = responsiveReferences;
        return this;
    }

    public CiteConfig responsiveThreshold(int threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("\"responsiveReferencesThreshold\" cannot be negative");
        }

        this.responsiveReferencesThreshold = threshold;
        return this;
    }

    public CiteConfig legacyBacklinkLabels(boolean useLegacyBacklinkLabels) {
        this.useLegacyBacklinkLabels = useLegacyBacklinkLabels;
        return this;
    }

    public boolean isResponsiveReferences() {
        return responsiveReferences;
    }

    public int getResponsiveReferencesThreshold() {
        return responsiveReferencesThreshold;
    }

    public boolean isUseLegacyBacklinkLabels() {
        return useLegacyBacklinkLabels;
    }

    @Override
    public String toString() {
        return String.format("CiteConfig[responsive=%s, threshold=%d, legacyBacklinkLabels=%s]",
            responsiveReferences, responsiveReferencesThreshold, useLegacyBacklinkLabels);
    }
}
