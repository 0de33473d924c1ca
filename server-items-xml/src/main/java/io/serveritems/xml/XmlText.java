package io.serveritems.xml;

/**
 * Escaping for attribute values written to items.xml.
 */
public final class XmlText {
    private XmlText() {
    }

    /**
     * Escapes {@code & < > "}. Null becomes the empty string.
     */
    public static String escape(String s) {
        if (s == null || s.isEmpty()) return "";
        StringBuilder out = null;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            String rep;
            switch (c) {
                case '&': rep = "&amp;"; break;
                case '<': rep = "&lt;"; break;
                case '>': rep = "&gt;"; break;
                case '"': rep = "&quot;"; break;
                default: rep = null;
            }
            if (rep != null) {
                if (out == null) {
                    out = new StringBuilder(s.length() + 16);
                    out.append(s, 0, i);
                }
                out.append(rep);
            } else if (out != null) {
                out.append(c);
            }
        }
        return out == null ? s : out.toString();
    }
}
