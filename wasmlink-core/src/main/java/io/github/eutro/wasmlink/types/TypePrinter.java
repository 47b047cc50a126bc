package io.github.eutro.wasmlink.types;

import java.util.Map;
import java.util.TreeMap;

/**
 * Prints instance and module types in a canonical form, with entries sorted by name.
 */
final class TypePrinter {
    private TypePrinter() {
    }

    static void appendEntries(StringBuilder sb, String keyword, Map<String, DefType> entries) {
        for (Map.Entry<String, DefType> entry : new TreeMap<>(entries).entrySet()) {
            sb.append(" (").append(keyword).append(' ');
            quote(sb, entry.getKey());
            sb.append(' ').append(entry.getValue()).append(')');
        }
    }

    static String quote(String name) {
        StringBuilder sb = new StringBuilder();
        quote(sb, name);
        return sb.toString();
    }

    static void quote(StringBuilder sb, String name) {
        sb.append('"');
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '"' || c == '\\') sb.append('\\');
            sb.append(c);
        }
        sb.append('"');
    }
}
