package net.grammarc.util;

import java.util.Collection;
import java.util.Iterator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class Formats {

    /* Characters that are printed verbatim by escape(). */
    private static final Pattern ESCAPE = Pattern.compile(
        "[^ !#-&(-\\[\\]-~]");

    // Prevent construction.
    private Formats() {}

    private static String escapeCodePoint(int cp) {
        switch (cp) {
            case '\n': return "\\n";
            case '\r': return "\\r";
            case '\t': return "\\t";
            case '\f': return "\\f";
            case '\b': return "\\b";
            case '\\': return "\\\\";
            case '\'': return "\\'";
            case '"': return "\\\"";
        }
        if (cp < 0x10000) return String.format("\\u%04X", cp);
        return String.format("\\u{%X}", cp);
    }

    public static String escape(String s) {
        Matcher m = ESCAPE.matcher(s);
        StringBuffer sb = new StringBuffer();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(
                escapeCodePoint(m.group().codePointAt(0))));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    public static String formatString(String s) {
        if (s == null) return "null";
        return '"' + escape(s) + '"';
    }

    /* Grammar notation for a literal, e.g. 'else'. */
    public static String formatLiteral(String s) {
        return '\'' + escape(s) + '\'';
    }

    public static String formatCodePoint(int cp) {
        if (cp >= 0x20 && cp < 0x7F && cp != '\\' && cp != '\'' &&
                cp != ']' && cp != '-')
            return new String(Character.toChars(cp));
        switch (cp) {
            case '\\': return "\\\\";
            case ']': return "\\]";
            case '-': return "\\-";
            case '\'': return "\\'";
        }
        return escapeCodePoint(cp);
    }

    public static String formatRange(int lo, int hi) {
        if (lo == hi) return formatCodePoint(lo);
        return formatCodePoint(lo) + "-" + formatCodePoint(hi);
    }

    public static String join(Collection<?> items, String sep) {
        StringBuilder sb = new StringBuilder();
        Iterator<?> it = items.iterator();
        while (it.hasNext()) {
            sb.append(it.next());
            if (it.hasNext()) sb.append(sep);
        }
        return sb.toString();
    }

}
