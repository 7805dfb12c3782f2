package org.dxworks.mdsplit.splitter;

import org.dxworks.mdsplit.model.Section;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * First pass of the splitter: classifies lines as headings or content and cuts the text into
 * sections in document order. Metadata is left empty.
 */
class SectionScanner {

    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");

    List<Section> scan(String text) {
        List<Section> sections = new ArrayList<>();
        FenceTracker fences = new FenceTracker();

        String openHeading = null;
        int openLevel = 0;
        List<String> buffer = new ArrayList<>();

        for (String line : LINE_BREAK.split(text, -1)) {
            if (!fences.accept(line)) {
                int level = headingLevel(line);
                if (level > 0) {
                    if (openHeading != null) {
                        sections.add(new Section(openHeading, joinTrimmed(buffer), openLevel));
                    }
                    openHeading = line;
                    openLevel = level;
                    buffer.clear();
                    continue;
                }
            }
            // Preamble before the first heading is dropped
            if (openHeading != null) {
                buffer.add(line);
            }
        }

        if (openHeading != null) {
            sections.add(new Section(openHeading, joinTrimmed(buffer), openLevel));
        }
        return sections;
    }

    /**
     * Returns the ATX level of a heading line, or 0 when the line is not a heading.
     * The '#' run must start the line and be followed by whitespace or the end of the line.
     */
    static int headingLevel(String line) {
        int level = 0;
        while (level < line.length() && line.charAt(level) == '#') {
            level++;
        }
        if (level == 0) {
            return 0;
        }
        if (level == line.length() || Character.isWhitespace(line.charAt(level))) {
            return level;
        }
        return 0;
    }

    private static String joinTrimmed(List<String> lines) {
        int first = 0;
        int last = lines.size() - 1;
        while (first <= last && lines.get(first).isBlank()) {
            first++;
        }
        while (last >= first && lines.get(last).isBlank()) {
            last--;
        }
        if (first > last) {
            return "";
        }
        return String.join("\n", lines.subList(first, last + 1));
    }
}
