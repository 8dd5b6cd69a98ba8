package com.apidocs.porter.docs;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.w3c.dom.Element;

import com.apidocs.porter.markup.MarkupTranslator;
import com.apidocs.porter.xml.XmlElements;

/**
 * An {@code exception} element inside a {@code Docs} block.
 */
public class DocsException {

    private final DocsApi parentApi;
    private final Element xeException;

    DocsException(DocsApi parentApi, Element xeException) {
        this.parentApi = parentApi;
        this.xeException = xeException;
    }

    public DocsApi getParentApi() {
        return parentApi;
    }

    public String getCref() {
        return XmlElements.attribute(xeException, "cref");
    }

    public String getValue() {
        return XmlElements.innerXml(xeException);
    }

    /**
     * Adds another condition to the exception, separated by {@code -or-}. A
     * placeholder value is replaced instead.
     */
    public void appendException(String structuredXml) {
        String current = getValue();
        String merged = MarkupTranslator.isDocsEmpty(current)
                ? structuredXml
                : current + MarkupTranslator.EXCEPTION_SEPARATOR + structuredXml;
        parentApi.setElementText(xeException, merged);
    }

    /**
     * Whether {@code text} mostly repeats what the exception already says: the
     * percentage of its words found in the current value is at least
     * {@code thresholdPercentage}.
     */
    public boolean wordCountCollidesAboveThreshold(String text, int thresholdPercentage) {
        List<String> newWords = words(text);
        if (newWords.isEmpty()) {
            return true;
        }
        Set<String> existing = Set.copyOf(words(getValue()));
        long found = newWords.stream().filter(existing::contains).count();
        double percentage = 100.0 * found / newWords.size();
        return percentage >= thresholdPercentage;
    }

    private static List<String> words(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(text.split("[\\s.,;:()\"]+"))
                .filter(w -> !w.isEmpty())
                .map(w -> w.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
    }
}
