package org.dxworks.mdsplit.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A Markdown header together with the text that follows it.
 * The header is stored without its leading '#' markers.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MarkdownContent {
    public String sectionHeader;
    public String sectionText;

    public MarkdownContent() {
    }

    public MarkdownContent(String sectionHeader, String sectionText) {
        setSectionHeader(sectionHeader);
        this.sectionText = sectionText;
    }

    // Also the deserialization path, so parsed headers are cleaned too
    public void setSectionHeader(String sectionHeader) {
        this.sectionHeader = cleanSectionHeader(sectionHeader);
    }

    /**
     * Strips a leading '#' run and the whitespace around it from a raw heading capture.
     * The run is only removed when whitespace or the end of the text follows it, so a
     * header that is already clean comes back unchanged.
     */
    public static String cleanSectionHeader(String raw) {
        if (raw == null) return null;

        String trimmed = raw.strip();
        int hashes = 0;
        while (hashes < trimmed.length() && trimmed.charAt(hashes) == '#') {
            hashes++;
        }
        if (hashes == 0) return trimmed;
        if (hashes < trimmed.length() && !Character.isWhitespace(trimmed.charAt(hashes))) {
            return trimmed;
        }
        return trimmed.substring(hashes).strip();
    }
}
