package org.dxworks.ouxml.converter.math;

import org.dxworks.ouxml.model.ContentNode;

import java.util.Optional;

/**
 * Translates a MathML element into TeX-style equation markup.
 * Implementations must be deterministic and free of side effects on the tree.
 */
public interface MathTranslator {

    static MathTranslator none() {
        return mathml -> Optional.empty();
    }

    /**
     * @return the equation markup, or empty when the element cannot be translated
     */
    Optional<String> translate(ContentNode mathml);
}
