package com.apidocs.porter.docid;

/**
 * Kind of API element named by a DocId.
 */
public enum DocIdKind {
    TYPE("T:"),
    METHOD("M:"),
    CONSTRUCTOR("M:"),
    PROPERTY("P:"),
    FIELD("F:"),
    EVENT("E:");

    private final String prefix;

    DocIdKind(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }
}
