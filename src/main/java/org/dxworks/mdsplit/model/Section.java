package org.dxworks.mdsplit.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One heading of a Markdown document with the content up to the next heading.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"sectionHeader", "sectionText", "headerLevel", "metadata"})
public class Section extends MarkdownContent {
    public int headerLevel; // number of '#' characters, 1 for top level
    public SectionMetadata metadata = new SectionMetadata();

    public Section() {
    }

    public Section(String sectionHeader, String sectionText, int headerLevel) {
        super(sectionHeader, sectionText);
        this.headerLevel = headerLevel;
    }

    public String toMarkdown() {
        return "#".repeat(headerLevel) + " " + sectionHeader + "\n\n" + sectionText;
    }
}
