package com.sommerph.didvault.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Bytes a holder signs for a presentation: the canonical JSON of the presentation
 * with its {@code proof} member removed.
 */
public class PresentationSigning {

    private PresentationSigning() {}

    public static String signingInput(JsonNode presentation) {
        if (presentation == null || !presentation.isObject()) {
            throw new IllegalArgumentException("Presentation must be a JSON object");
        }
        ObjectNode unsigned = ((ObjectNode) presentation).deepCopy();
        unsigned.remove("proof");
        return CanonicalJson.serialize(unsigned);
    }

}
