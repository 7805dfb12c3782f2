package org.dxworks.mdsplit.splitter;

import org.dxworks.mdsplit.model.Section;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Splits Markdown text into sections keyed by ATX heading level.
 *
 * <p>The split runs in two passes. {@link SectionScanner} cuts the text at heading lines found
 * outside fenced code blocks. {@link SectionRelations} then computes each section's parents and
 * siblings over the complete list.</p>
 *
 * <p>Instances hold no per-call state and can be shared between threads.</p>
 */
public class MarkdownSplitter {

    private static final Logger LOG = LoggerFactory.getLogger(MarkdownSplitter.class);

    private final SectionScanner scanner;
    private final SectionRelations relations;

    public MarkdownSplitter() {
        this(new SectionScanner(), new SectionRelations());
    }

    MarkdownSplitter(SectionScanner scanner, SectionRelations relations) {
        this.scanner = scanner;
        this.relations = relations;
    }

    /**
     * @param text Markdown source, possibly empty or without any heading
     * @return the sections in document order; empty when the text has no heading
     * @throws SplitterException if splitting fails unexpectedly
     */
    public List<Section> split(String text) {
        Objects.requireNonNull(text, "text");

        List<Section> sections;
        try {
            sections = scanner.scan(text);
            relations.apply(sections);
        } catch (RuntimeException e) {
            throw new SplitterException("Failed to split markdown text of " + text.length() + " characters", e);
        }

        LOG.debug("Split {} characters into {} sections", text.length(), sections.size());
        return Collections.unmodifiableList(sections);
    }
}
