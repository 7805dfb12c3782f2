package org.dxworks.mdsplit;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

public class MarkdownFileDetector {

    private final List<String> extensions;

    public MarkdownFileDetector(List<String> extensions) {
        this.extensions = extensions;
    }

    public boolean isMarkdown(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        for (String extension : extensions) {
            if (name.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }
}
