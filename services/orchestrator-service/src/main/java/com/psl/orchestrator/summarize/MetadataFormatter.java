package com.psl.orchestrator.summarize;

import com.psl.orchestrator.backend.Item;

/**
 * Markdown rendering of an item's bibliographic record.
 */
public final class MetadataFormatter {
    private MetadataFormatter() {
    }

    public static String format(Item item, boolean includeAbstract) {
        StringBuilder out = new StringBuilder();
        out.append("# ").append(item.getTitle() == null ? "Untitled" : item.getTitle()).append('\n');
        out.append("**Item ID:** ").append(item.getId()).append('\n');
        if (!item.getAuthors().isEmpty()) {
            out.append("**Authors:** ").append(String.join(", ", item.getAuthors())).append('\n');
        }
        if (item.getYear() != null) {
            out.append("**Year:** ").append(item.getYear()).append('\n');
        }
        Object venue = item.getMetadata().get("venue");
        if (venue != null) {
            out.append("**Venue:** ").append(venue).append('\n');
        }
        if (includeAbstract) {
            String abstractText = abstractOf(item);
            if (abstractText != null) {
                out.append("\n## Abstract\n").append(abstractText).append('\n');
            }
        }
        return out.toString();
    }

    public static String abstractOf(Item item) {
        Object value = item.getMetadata().get("abstract");
        if (value != null && !value.toString().isBlank()) {
            return value.toString();
        }
        return item.getSnippet();
    }
}
