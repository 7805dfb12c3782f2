package org.dxworks.mdsplit;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.mdsplit.model.FileSplit;
import org.dxworks.mdsplit.model.Section;
import org.dxworks.mdsplit.splitter.MarkdownSplitter;
import org.dxworks.mdsplit.splitter.SplitterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final Logger LOG = LoggerFactory.getLogger(App.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    // Stateless, shared by every file of a run
    private static final MarkdownSplitter SPLITTER = new MarkdownSplitter();

    private static final String STANDARD_STREAM = "-";

    public static void main(String[] args) throws Exception {
        int status = run(args, MdsplitConfig.load(), System.in, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args, MdsplitConfig config, InputStream stdin, PrintStream out, PrintStream err)
            throws IOException {
        if (args.length < 2) {
            err.println("Usage: java -jar mdsplit.jar <input> <output>");
            err.println("  <input>:  Markdown file, directory of Markdown files, or - for standard input");
            err.println("  <output>: Path to output JSONL file, or - for standard output");
            return 2;
        }

        if (STANDARD_STREAM.equals(args[0])) {
            return splitStandardInput(stdin, args[1], out, err);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            err.println("Error: Input path does not exist: " + input);
            return 1;
        }

        boolean toStdout = STANDARD_STREAM.equals(args[1]);
        // JSONL owns stdout when it is the output, so progress moves to stderr
        PrintStream console = toStdout ? err : out;

        console.println("Starting markdown split...");
        console.println("Input: " + input.toAbsolutePath());

        List<Path> files = collectMarkdownFiles(input, config);
        console.println("Found " + files.size() + " markdown files");

        BufferedWriter writer;
        Path jsonlOutput = null;
        if (toStdout) {
            writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        } else {
            jsonlOutput = Paths.get(args[1]);
            if (jsonlOutput.getParent() != null) {
                Files.createDirectories(jsonlOutput.getParent());
            }
            writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8);
        }

        RunSummary summary;
        try {
            summary = splitFiles(input, files, writer, console);
        } finally {
            if (toStdout) {
                writer.flush();
            } else {
                writer.close();
            }
        }

        console.println("\n" + "=".repeat(60));
        console.println("Split complete!");
        console.println("Successfully split: " + summary.successCount + " files");
        if (summary.errorCount > 0) {
            console.println("Errors: " + summary.errorCount);
        }
        if (jsonlOutput != null) {
            console.println("Output written to: " + jsonlOutput.toAbsolutePath());
        }
        console.println("=".repeat(60));
        return 0;
    }

    private static RunSummary splitFiles(Path input, List<Path> files, BufferedWriter writer, PrintStream console)
            throws IOException {
        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        Map<String, Object> runInfo = new LinkedHashMap<>();
        runInfo.put("kind", "run");
        runInfo.put("started_at", startTime.toString());
        runInfo.put("input_path", input.toString());
        runInfo.put("total_files", files.size());
        writer.write(MAPPER.writeValueAsString(runInfo));
        writer.newLine();

        files.parallelStream().forEach(file -> {
            int current = progressCounter.incrementAndGet();
            synchronized (console) {
                console.println("[" + current + "/" + files.size() + "] Splitting " + file.getFileName());
            }

            try {
                FileSplit split = splitFile(file);

                synchronized (writer) {
                    writer.write(MAPPER.writeValueAsString(split));
                    writer.newLine();
                    writer.flush();
                }

                successCount.incrementAndGet();
            } catch (Exception e) {
                LOG.error("Failed to split {}", file, e);

                Map<String, String> error = new LinkedHashMap<>();
                error.put("kind", "error");
                error.put("file", file.toString());
                error.put("error", e.getMessage());

                try {
                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(error));
                        writer.newLine();
                        writer.flush();
                    }
                } catch (IOException ioException) {
                    LOG.error("Failed to write error record for {}", file, ioException);
                }

                errorCount.incrementAndGet();
            }
        });

        Instant endTime = Instant.now();
        Map<String, Object> doneInfo = new LinkedHashMap<>();
        doneInfo.put("kind", "done");
        doneInfo.put("ended_at", endTime.toString());
        doneInfo.put("files_split", successCount.get());
        doneInfo.put("files_with_errors", errorCount.get());
        doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
        writer.write(MAPPER.writeValueAsString(doneInfo));
        writer.newLine();

        return new RunSummary(successCount.get(), errorCount.get());
    }

    private static int splitStandardInput(InputStream stdin, String output, PrintStream out, PrintStream err)
            throws IOException {
        String text = stripByteOrderMark(new String(stdin.readAllBytes(), StandardCharsets.UTF_8));

        List<Section> sections;
        try {
            sections = SPLITTER.split(text);
        } catch (SplitterException e) {
            LOG.error("Failed to split standard input", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }

        String json = MAPPER.writeValueAsString(sections);
        if (STANDARD_STREAM.equals(output)) {
            out.println(json);
            out.flush();
        } else {
            Path outputPath = Paths.get(output);
            if (outputPath.getParent() != null) {
                Files.createDirectories(outputPath.getParent());
            }
            Files.writeString(outputPath, json + System.lineSeparator(), StandardCharsets.UTF_8);
        }
        return 0;
    }

    private static List<Path> collectMarkdownFiles(Path input, MdsplitConfig config) throws IOException {
        List<Path> files = new ArrayList<>();
        MarkdownFileDetector detector = new MarkdownFileDetector(config.getExtensions());
        int maxFileLines = config.getMaxFileLines();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(detector::isMarkdown)
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (detector.isMarkdown(input) && withinMaxLines(input, maxFileLines)) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            if (count > maxFileLines) {
                LOG.info("Skipping {}: more than {} lines", path, maxFileLines);
                return false;
            }
            return true;
        } catch (IOException | UncheckedIOException e) {
            // Let the split itself report the unreadable file
            LOG.warn("Could not count lines of {}: {}", path, e.getMessage());
            return true;
        }
    }

    public static FileSplit splitFile(Path filePath) throws IOException {
        String markdown = stripByteOrderMark(Files.readString(filePath, StandardCharsets.UTF_8));

        FileSplit split = new FileSplit();
        split.filePath = filePath.toString();
        split.sections = SPLITTER.split(markdown);
        return split;
    }

    private static String stripByteOrderMark(String text) {
        return text.startsWith("\uFEFF") ? text.substring(1) : text;
    }

    private static final class RunSummary {
        final int successCount;
        final int errorCount;

        RunSummary(int successCount, int errorCount) {
            this.successCount = successCount;
            this.errorCount = errorCount;
        }
    }
}
