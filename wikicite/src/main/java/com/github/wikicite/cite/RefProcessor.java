package com.github.wikicite.cite;

import java.util.Objects;

import org.jsoup.nodes.Element;

import com.github.wikicite.parsing.ExtensionApi;

/**
 * Post-processes a converted document: rewrites every ref, renders every
 * group, synthesizes containers for groups left over and patches errors into
 * embedded content.
 */
public class RefProcessor {
    private final References references;
    private final AnchorFormatter anchorFormatter;

    public RefProcessor(References references, AnchorFormatter anchorFormatter) {
        this.references = Objects.requireNonNull(references);
        this.anchorFormatter = Objects.requireNonNull(anchorFormatter);
    }

    public ReferencesData process(ExtensionApi extApi, Element root) {
        var refsData = new ReferencesData(anchorFormatter);
        references.processRefs(extApi, refsData, root);
        references.insertMissingReferencesIntoDOM(extApi, refsData, root);

        if (refsData.hasEmbeddedErrors()) {
            references.addEmbeddedErrors(extApi, refsData, root);
        }

        return refsData;
    }
}
