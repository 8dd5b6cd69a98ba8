package com.apidocs.porter.docid;

import java.util.ArrayList;
import java.util.List;

import lombok.experimental.UtilityClass;

/**
 * Rules for reading and composing DocId strings.
 *
 * A DocId is a kind prefix ({@code T:}, {@code M:}, {@code P:}, {@code F:},
 * {@code E:}) followed by the fully qualified API name. Generic types carry a
 * single backtick arity suffix ({@code List`1}), generic methods a double
 * backtick ({@code Convert``2}). Parameter lists are fully qualified type names
 * in parentheses, comma separated, with no spaces. Generic arguments inside a
 * parameter list are written in braces and may nest.
 */
@UtilityClass
public class DocIds {

    public static final String CTOR_MEMBER_NAME = ".ctor";
    public static final String CTOR_SEGMENT = "#ctor";

    private static final int PREFIX_LENGTH = 2;

    public static DocIdKind kindOf(String docId) {
        if (docId == null || docId.length() < PREFIX_LENGTH || docId.charAt(1) != ':') {
            throw new IllegalArgumentException("Not a DocId: " + docId);
        }
        switch (docId.charAt(0)) {
            case 'T':
                return DocIdKind.TYPE;
            case 'M':
                return memberName(docId).startsWith(CTOR_SEGMENT) ? DocIdKind.CONSTRUCTOR : DocIdKind.METHOD;
            case 'P':
                return DocIdKind.PROPERTY;
            case 'F':
                return DocIdKind.FIELD;
            case 'E':
                return DocIdKind.EVENT;
            default:
                throw new IllegalArgumentException("Unknown DocId prefix: " + docId);
        }
    }

    public static boolean hasPrefix(String docId) {
        return docId != null && docId.length() > PREFIX_LENGTH && docId.charAt(1) == ':'
                && "TMPFE".indexOf(docId.charAt(0)) >= 0;
    }

    public static String stripPrefix(String docId) {
        return hasPrefix(docId) ? docId.substring(PREFIX_LENGTH) : docId;
    }

    public static String withPrefix(DocIdKind kind, String unprefixed) {
        return kind.getPrefix() + unprefixed;
    }

    /**
     * DocId of a type as Docs files name it in {@code BaseTypeName} or
     * {@code InterfaceName}: {@code System.Collections.Generic.IList<T>}
     * becomes {@code T:System.Collections.Generic.IList`1}.
     */
    public static String typeDocIdOf(String typeName) {
        int open = typeName.indexOf('<');
        if (open < 0 || !typeName.endsWith(">")) {
            return withPrefix(DocIdKind.TYPE, typeName);
        }
        String arguments = typeName.substring(open + 1, typeName.length() - 1);
        int arity = 1;
        int depth = 0;
        for (int i = 0; i < arguments.length(); i++) {
            char c = arguments.charAt(i);
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
            } else if (c == ',' && depth == 0) {
                arity++;
            }
        }
        return withPrefix(DocIdKind.TYPE, typeName.substring(0, open) + "`" + arity);
    }

    /**
     * Returns the prefix of a DocId including the colon, e.g. {@code "M:"}.
     */
    public static String prefixOf(String docId) {
        return hasPrefix(docId) ? docId.substring(0, PREFIX_LENGTH) : "";
    }

    /**
     * Generic arity of a type name: the number after the last single backtick
     * of the type segment, or 0 for non generic types.
     */
    public static int arityOf(String typeName) {
        String name = withoutParameterList(stripPrefix(typeName));
        int tick = name.lastIndexOf('`');
        if (tick < 0) {
            return 0;
        }
        if (tick > 0 && name.charAt(tick - 1) == '`') {
            // double backtick belongs to a generic method, the type itself may still be generic
            return arityOf(name.substring(0, tick - 1));
        }
        return leadingNumber(name.substring(tick + 1));
    }

    /**
     * Generic arity of a method DocId, taken from the double backtick suffix.
     */
    public static int methodArityOf(String methodDocId) {
        String name = withoutParameterList(stripPrefix(methodDocId));
        int ticks = name.lastIndexOf("``");
        if (ticks < 0) {
            return 0;
        }
        return leadingNumber(name.substring(ticks + 2));
    }

    /**
     * Formats parameter types into the canonical {@code (A,B)} form. An empty
     * list yields an empty string, matching DocIds of parameterless methods.
     */
    public static String formatParameterList(List<String> parameterTypes) {
        if (parameterTypes == null || parameterTypes.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < parameterTypes.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(parameterTypes.get(i).replace(" ", ""));
        }
        return sb.append(')').toString();
    }

    /**
     * Splits the parameter list of a member DocId into its top level parameter
     * types. Commas nested inside generic braces or array brackets are kept.
     */
    public static List<String> parseParameterList(String memberDocId) {
        List<String> result = new ArrayList<>();
        int open = memberDocId.indexOf('(');
        if (open < 0) {
            return result;
        }
        int close = memberDocId.lastIndexOf(')');
        if (close <= open + 1) {
            return result;
        }
        String inner = memberDocId.substring(open + 1, close);
        int depth = 0;
        int start = 0;
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (c == '{' || c == '[') {
                depth++;
            } else if (c == '}' || c == ']') {
                depth--;
            } else if (c == ',' && depth == 0) {
                result.add(inner.substring(start, i));
                start = i + 1;
            }
        }
        result.add(inner.substring(start));
        return result;
    }

    /**
     * Returns the part of a member DocId that follows its declaring type, e.g.
     * {@code .MyMethod(System.Int32)} for {@code M:N.T.MyMethod(System.Int32)}
     * and type {@code T:N.T}. Empty if the member is not declared in the type.
     */
    public static String memberSuffix(String memberDocId, String typeDocId) {
        String member = stripPrefix(memberDocId);
        String type = stripPrefix(typeDocId);
        if (!member.startsWith(type) || member.length() == type.length() || member.charAt(type.length()) != '.') {
            return "";
        }
        return member.substring(type.length());
    }

    /**
     * Name of the member segment of a member DocId, without parameters, e.g.
     * {@code MyMethod``1} or {@code #ctor}.
     */
    public static String memberName(String memberDocId) {
        String name = withoutParameterList(stripPrefix(memberDocId));
        int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(dot + 1);
    }

    /**
     * Unprefixed full name of the type that declares an API: the name itself
     * for a type DocId, the part before the member name otherwise.
     */
    public static String declaringTypeNameOf(String docId) {
        String name = stripPrefix(docId);
        if (kindOf(docId) == DocIdKind.TYPE) {
            return name;
        }
        name = withoutParameterList(name);
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(0, dot);
    }

    private static String withoutParameterList(String name) {
        int paren = name.indexOf('(');
        return paren < 0 ? name : name.substring(0, paren);
    }

    // arities that do not fit an int are not arities
    private static int leadingNumber(String s) {
        int end = 0;
        while (end < s.length() && Character.isDigit(s.charAt(end))) {
            end++;
        }
        if (end == 0) {
            return 0;
        }
        try {
            return Integer.parseInt(s.substring(0, end));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
