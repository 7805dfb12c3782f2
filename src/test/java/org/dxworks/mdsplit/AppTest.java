package org.dxworks.mdsplit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.mdsplit.model.FileSplit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AppTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @Test
    void missingArgumentsPrintUsage() throws IOException {
        int status = run(new String[]{"only-one"}, emptyInput());

        assertEquals(2, status);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage"));
    }

    @Test
    void missingInputPathFails() throws IOException {
        int status = run(new String[]{tempDir.resolve("nope").toString(), "-"}, emptyInput());

        assertEquals(1, status);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("does not exist"));
    }

    @Test
    void directoryRunWritesJsonLines() throws IOException {
        Path docs = Files.createDirectories(tempDir.resolve("docs"));
        Files.writeString(docs.resolve("guide.md"), "# Guide\nHello\n## Part\nWorld\n");
        Files.writeString(docs.resolve("empty.markdown"), "no headings here\n");
        Files.writeString(docs.resolve("ignored.txt"), "# Not markdown\n");
        Path output = tempDir.resolve("out/result.jsonl");

        int status = run(new String[]{docs.toString(), output.toString()}, emptyInput());

        assertEquals(0, status);
        List<JsonNode> records = readJsonLines(Files.readString(output, StandardCharsets.UTF_8));
        assertEquals("run", records.get(0).get("kind").asText());
        assertEquals(2, records.get(0).get("total_files").asInt());
        JsonNode done = records.get(records.size() - 1);
        assertEquals("done", done.get("kind").asText());
        assertEquals(2, done.get("files_split").asInt());
        assertEquals(0, done.get("files_with_errors").asInt());

        Map<String, JsonNode> byFile = filesByName(records);
        assertEquals(2, byFile.size());

        JsonNode guide = byFile.get("guide.md").get("sections");
        assertEquals(2, guide.size());
        assertEquals("Guide", guide.get(0).get("section_header").asText());
        assertEquals("World", guide.get(1).get("section_text").asText());
        assertEquals("Guide", guide.get(1).at("/metadata/parents/h1").asText());

        JsonNode empty = byFile.get("empty.markdown").get("sections");
        assertTrue(empty.isArray());
        assertEquals(0, empty.size());

        assertTrue(out.toString(StandardCharsets.UTF_8).contains("Split complete!"));
    }

    @Test
    void singleFileToStandardOutput() throws IOException {
        Path file = tempDir.resolve("bom.md");
        Files.writeString(file, "\uFEFF# With BOM\ntext\n");

        int status = run(new String[]{file.toString(), "-"}, emptyInput());

        assertEquals(0, status);
        List<JsonNode> records = readJsonLines(out.toString(StandardCharsets.UTF_8));
        assertEquals(3, records.size());
        JsonNode split = records.get(1);
        assertEquals("file", split.get("kind").asText());
        assertEquals("With BOM", split.at("/sections/0/section_header").asText());
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Split complete!"));
    }

    @Test
    void filesOverLineLimitAreSkipped() throws IOException {
        Path file = tempDir.resolve("long.md");
        Files.writeString(file, "# One\n# Two\n# Three\n");
        Path output = tempDir.resolve("result.jsonl");

        int status = App.run(new String[]{file.toString(), output.toString()},
                MdsplitConfig.with(2, null), emptyInput(), printStream(out), printStream(err));

        assertEquals(0, status);
        List<JsonNode> records = readJsonLines(Files.readString(output, StandardCharsets.UTF_8));
        assertEquals(0, records.get(0).get("total_files").asInt());
        assertEquals(2, records.size());
    }

    @Test
    void standardInputWritesSectionArray() throws IOException {
        String markdown = "# Main\n## First\n## Second\n";

        int status = run(new String[]{"-", "-"}, input(markdown));

        assertEquals(0, status);
        JsonNode sections = MAPPER.readTree(out.toString(StandardCharsets.UTF_8));
        assertEquals(3, sections.size());
        assertEquals("Second", sections.at("/1/metadata/siblings/0").asText());
    }

    @Test
    void standardInputWithoutHeadingsWritesEmptyArray() throws IOException {
        int status = run(new String[]{"-", "-"}, input("plain text only"));

        assertEquals(0, status);
        assertEquals("[]", out.toString(StandardCharsets.UTF_8).trim());
    }

    @Test
    void standardInputToFile() throws IOException {
        Path output = tempDir.resolve("nested/sections.json");

        int status = run(new String[]{"-", output.toString()}, input("# Only\nbody"));

        assertEquals(0, status);
        JsonNode sections = MAPPER.readTree(Files.readString(output, StandardCharsets.UTF_8));
        assertEquals("body", sections.at("/0/section_text").asText());
    }

    @Test
    void splitFileReadsUtf8() throws IOException {
        Path file = tempDir.resolve("unicode.md");
        Files.writeString(file, "# Überblick\nInhalt ✓\n", StandardCharsets.UTF_8);

        FileSplit split = App.splitFile(file);

        assertEquals(file.toString(), split.filePath);
        assertEquals("Überblick", split.sections.get(0).sectionHeader);
        assertEquals("Inhalt ✓", split.sections.get(0).sectionText);
    }

    private int run(String[] args, InputStream stdin) throws IOException {
        return App.run(args, MdsplitConfig.defaults(), stdin, printStream(out), printStream(err));
    }

    private static PrintStream printStream(ByteArrayOutputStream buffer) {
        return new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    private static InputStream input(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    private static InputStream emptyInput() {
        return input("");
    }

    private static List<JsonNode> readJsonLines(String content) throws IOException {
        List<JsonNode> records = new ArrayList<>();
        for (String line : content.split("\\R")) {
            if (!line.isBlank()) {
                records.add(MAPPER.readTree(line));
            }
        }
        return records;
    }

    private static Map<String, JsonNode> filesByName(List<JsonNode> records) {
        Map<String, JsonNode> byFile = new HashMap<>();
        for (JsonNode record : records) {
            if ("file".equals(record.get("kind").asText())) {
                String path = record.get("file_path").asText();
                byFile.put(Path.of(path).getFileName().toString(), record);
            }
        }
        return byFile;
    }
}
