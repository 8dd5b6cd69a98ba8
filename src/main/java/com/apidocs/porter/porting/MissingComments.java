package com.apidocs.porter.porting;

import com.apidocs.porter.markup.MarkupTranslator;

import lombok.Data;

/**
 * Candidate texts gathered for one API before they are written field by field.
 * Every field starts as the placeholder text.
 */
@Data
class MissingComments {
    private String summary = MarkupTranslator.TO_BE_ADDED;
    private String returns = MarkupTranslator.TO_BE_ADDED;
    private String remarks = MarkupTranslator.TO_BE_ADDED;
    private String property = MarkupTranslator.TO_BE_ADDED;

    /** Texts come from the implemented interface member. */
    private boolean eii;

    /**
     * Fills every field that is still empty from the given candidates.
     */
    void fillEmpty(String summaryCandidate, String returnsCandidate, String remarksCandidate, String propertyCandidate) {
        if (MarkupTranslator.isDocsEmpty(summary)) {
            summary = orPlaceholder(summaryCandidate);
        }
        if (MarkupTranslator.isDocsEmpty(returns)) {
            returns = orPlaceholder(returnsCandidate);
        }
        if (MarkupTranslator.isDocsEmpty(remarks)) {
            remarks = orPlaceholder(remarksCandidate);
        }
        if (MarkupTranslator.isDocsEmpty(property)) {
            property = orPlaceholder(propertyCandidate);
        }
    }

    /**
     * Property text may be documented under {@code value} or under {@code returns}.
     */
    static String propertyValue(String value, String returns) {
        if (!MarkupTranslator.isDocsEmpty(value)) {
            return value;
        }
        if (!MarkupTranslator.isDocsEmpty(returns)) {
            return returns;
        }
        return MarkupTranslator.TO_BE_ADDED;
    }

    private static String orPlaceholder(String candidate) {
        return MarkupTranslator.isDocsEmpty(candidate) ? MarkupTranslator.TO_BE_ADDED : candidate;
    }
}
