package com.apidocs.porter.markup;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.apidocs.porter.docid.DocIds;

import lombok.experimental.UtilityClass;

/**
 * Rewrites inline markup of IntelliSense text into the Docs dialects.
 *
 * Structured output stays xml: references are kept, primitive aliases become
 * fully qualified type references and embedded elements are written
 * self-closing as {@code <x />}. Markdown output turns references into
 * {@code <xref:...>} directives and keyword or name references into code
 * literals. Nothing here checks that a referenced API exists.
 */
@UtilityClass
public class MarkupTranslator {

    /** Placeholder the Docs tooling writes into every undocumented field. */
    public static final String TO_BE_ADDED = "To be added.";

    public static final String REMARKS_HEADER = "## Remarks";

    /** Separates alternative conditions inside one exception element. */
    public static final String EXCEPTION_SEPARATOR = "\n\n-or-\n\n";

    private static final Map<String, String> PRIMITIVE_ALIASES = new LinkedHashMap<>();

    static {
        PRIMITIVE_ALIASES.put("bool", "System.Boolean");
        PRIMITIVE_ALIASES.put("byte", "System.Byte");
        PRIMITIVE_ALIASES.put("sbyte", "System.SByte");
        PRIMITIVE_ALIASES.put("char", "System.Char");
        PRIMITIVE_ALIASES.put("decimal", "System.Decimal");
        PRIMITIVE_ALIASES.put("double", "System.Double");
        PRIMITIVE_ALIASES.put("float", "System.Single");
        PRIMITIVE_ALIASES.put("int", "System.Int32");
        PRIMITIVE_ALIASES.put("uint", "System.UInt32");
        PRIMITIVE_ALIASES.put("nint", "System.IntPtr");
        PRIMITIVE_ALIASES.put("nuint", "System.UIntPtr");
        PRIMITIVE_ALIASES.put("long", "System.Int64");
        PRIMITIVE_ALIASES.put("ulong", "System.UInt64");
        PRIMITIVE_ALIASES.put("short", "System.Int16");
        PRIMITIVE_ALIASES.put("ushort", "System.UInt16");
        PRIMITIVE_ALIASES.put("object", "System.Object");
        PRIMITIVE_ALIASES.put("string", "System.String");
    }

    /** Alias with no underlying runtime type. */
    private static final String DYNAMIC = "dynamic";

    private static final Pattern SEE_CREF = Pattern.compile("<(see|seealso)\\s+cref\\s*=\\s*\"([^\"]*)\"\\s*/>");
    private static final Pattern SEE_CREF_WITH_TEXT = Pattern.compile("<see\\s+cref\\s*=\\s*\"([^\"]*)\"\\s*>(.*?)</see>", Pattern.DOTALL);
    private static final Pattern SEE_LANGWORD = Pattern.compile("<see\\s+langword\\s*=\\s*\"([^\"]*)\"\\s*/>");
    private static final Pattern NAME_REF = Pattern.compile("<(paramref|typeparamref)\\s+name\\s*=\\s*\"([^\"]*)\"\\s*/>");
    private static final Pattern CODE_INLINE = Pattern.compile("<c>(.*?)</c>", Pattern.DOTALL);
    private static final Pattern PARA = Pattern.compile("\\s*</?para\\s*>\\s*");
    private static final Pattern SELF_CLOSING = Pattern.compile("<([A-Za-z][^<>]*?)\\s*/>");
    private static final Pattern LINE_BREAK = Pattern.compile("\\s*\\r?\\n\\s*");
    private static final Pattern EXTRA_BLANK_LINES = Pattern.compile("\\n{3,}");
    private static final Pattern OR_PARAGRAPH = Pattern.compile("\\s*<para>\\s*-or-\\s*</para>\\s*");
    private static final Pattern MARKDOWN_FORMAT = Pattern.compile(
            "<format\\s+type\\s*=\\s*\"text/markdown\"\\s*>\\s*<!\\[CDATA\\[(.*?)]]>\\s*</format>", Pattern.DOTALL);
    private static final Pattern CDATA = Pattern.compile("<!\\[CDATA\\[(.*?)]]>", Pattern.DOTALL);
    private static final Pattern REMARKS_HEADING = Pattern.compile("\\A##\\s*Remarks\\s*");

    /** Stands in for a CDATA section while the text around it is rewritten. */
    private static final char KEPT_MARK = '\u0000';

    /**
     * A value is docs-empty when it is null, blank or the placeholder text.
     */
    public static boolean isDocsEmpty(String value) {
        return value == null || value.isBlank() || TO_BE_ADDED.equals(value.trim());
    }

    public static boolean isPrimitiveAlias(String cref) {
        return PRIMITIVE_ALIASES.containsKey(cref) || DYNAMIC.equals(cref);
    }

    /**
     * Translates text into the structured xml dialect. Running it again on its
     * own output changes nothing.
     */
    public static String toStructuredXml(String text) {
        if (text == null) {
            return "";
        }
        List<String> kept = new ArrayList<>();
        String result = replaceAll(CDATA, text, m -> {
            kept.add(m.group());
            return KEPT_MARK + String.valueOf(kept.size() - 1) + KEPT_MARK;
        });
        result = replaceAll(SEE_CREF, result, m -> {
            String tag = m.group(1);
            String cref = m.group(2);
            if (DYNAMIC.equals(cref)) {
                return "<see langword=\"dynamic\" />";
            }
            String fullName = PRIMITIVE_ALIASES.get(cref);
            if (fullName != null) {
                return "<" + tag + " cref=\"T:" + fullName + "\" />";
            }
            return "<" + tag + " cref=\"" + cref + "\" />";
        });
        result = SELF_CLOSING.matcher(result).replaceAll(m -> Matcher.quoteReplacement("<" + m.group(1).trim() + " />"));
        result = LINE_BREAK.matcher(result).replaceAll(" ");
        for (int i = 0; i < kept.size(); i++) {
            result = result.replace(KEPT_MARK + String.valueOf(i) + KEPT_MARK, kept.get(i));
        }
        return result.trim();
    }

    /**
     * Translates text into markdown prose. The result is the body of a remarks
     * block, without the header. Text that already is a markdown block is
     * unwrapped first, so its content is never nested in a second block.
     */
    public static String toMarkdown(String text) {
        if (text == null) {
            return "";
        }
        String result = replaceAll(MARKDOWN_FORMAT, text, m -> m.group(1));
        result = replaceAll(CDATA, result, m -> m.group(1));
        result = replaceAll(SEE_CREF, result, m -> crefToMarkdown(m.group(2)));
        result = replaceAll(SEE_CREF_WITH_TEXT, result,
                m -> "[" + m.group(2).trim() + "](xref:" + escapeXref(DocIds.stripPrefix(m.group(1))) + ")");
        result = replaceAll(SEE_LANGWORD, result, m -> codeLiteral(m.group(1)));
        result = replaceAll(NAME_REF, result, m -> codeLiteral(m.group(2)));
        result = replaceAll(CODE_INLINE, result, m -> codeLiteral(m.group(1)));
        result = PARA.matcher(result).replaceAll("\n\n");
        result = Arrays.stream(result.split("\\r?\\n", -1)).map(String::strip).collect(Collectors.joining("\n"));
        result = EXTRA_BLANK_LINES.matcher(result).replaceAll("\n\n");
        result = REMARKS_HEADING.matcher(result.trim()).replaceFirst("");
        return result.trim();
    }

    /**
     * Content of the CDATA section of a markdown remarks block. {@code indent}
     * is the indentation of the enclosing {@code format} element.
     */
    public static String markdownRemarksBlock(String markdownBody, String indent) {
        return "\n\n" + REMARKS_HEADER + "\n\n" + markdownBody + "\n\n" + indent;
    }

    /**
     * Escapes a DocId for use in an xref directive.
     */
    public static String escapeXref(String docIdWithoutPrefix) {
        return docIdWithoutPrefix.replace("`", "%60").replace("#", "%23");
    }

    /**
     * Strips markdown and CDATA scaffolding from remarks text so it can be embedded
     * after another sentence. Lines are trimmed and empty lines dropped.
     */
    public static String cleanRemarks(String remarks) {
        if (remarks == null) {
            return "";
        }
        String cleaned = remarks
                .replace("##Remarks", "")
                .replace(REMARKS_HEADER, "")
                .replace("<![CDATA[", "")
                .replace("]]>", "")
                .replaceAll("<format\\s+type=\"text/markdown\"\\s*>", "")
                .replace("</format>", "");
        return Arrays.stream(cleaned.split("\\r?\\n"))
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.joining("\n"));
    }

    /**
     * Structured translation of exception text, with {@code <para>-or-</para>}
     * separators turned into plain {@code -or-} paragraphs.
     */
    public static String exceptionText(String text) {
        String structured = toStructuredXml(text);
        return OR_PARAGRAPH.matcher(structured).replaceAll(Matcher.quoteReplacement(EXCEPTION_SEPARATOR));
    }

    private static String crefToMarkdown(String cref) {
        if (isPrimitiveAlias(cref)) {
            return codeLiteral(cref);
        }
        return "<xref:" + escapeXref(DocIds.stripPrefix(cref)) + ">";
    }

    private static String codeLiteral(String value) {
        return "`" + value + "`";
    }

    private interface Replacer {
        String replace(Matcher m);
    }

    private static String replaceAll(Pattern pattern, String input, Replacer replacer) {
        Matcher m = pattern.matcher(input);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(replacer.replace(m)));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
