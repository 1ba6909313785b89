package com.trellis.composition;

/** Marks rendered markup for out-of-band swapping. */
final class OobMarkup {

    static final String SWAP_ATTRIBUTE = "hx-swap-oob=\"true\"";

    private OobMarkup() {
    }

    /**
     * Marks a block for the given target. Markup whose own {@code <div>} already carries the target
     * id gets the swap attribute injected after that id, unless that tag already has it; anything
     * else is wrapped in a {@code <div>} with the id and the attribute. Swap attributes on other
     * elements do not count.
     */
    static String mark(String targetId, String html) {
        String idAttribute = "id=\"" + targetId + "\"";
        int idAt = html.indexOf(idAttribute);
        if (idAt >= 0 && insideDivTag(html, idAt)) {
            int tagStart = html.lastIndexOf("<div", idAt);
            String openingTag = html.substring(tagStart, html.indexOf('>', tagStart));
            if (openingTag.contains(SWAP_ATTRIBUTE)) {
                return html;
            }
            int insertAt = idAt + idAttribute.length();
            return html.substring(0, insertAt) + " " + SWAP_ATTRIBUTE + html.substring(insertAt);
        }
        return "<div " + idAttribute + " " + SWAP_ATTRIBUTE + ">" + html + "</div>";
    }

    private static boolean insideDivTag(String html, int position) {
        int tagStart = html.lastIndexOf("<div", position);
        return tagStart >= 0 && html.indexOf('>', tagStart) > position;
    }
}
