package org.dxworks.ommltex;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.ommltex.converter.OmmlToLatexConverter;
import org.dxworks.ommltex.model.DocumentConversion;
import org.dxworks.ommltex.model.EquationResult;
import org.dxworks.ommltex.output.LatexDocumentWriter;
import org.dxworks.ommltex.output.MathDelimiters;
import org.dxworks.ommltex.reader.DocxEquationExtractor;
import org.dxworks.ommltex.reader.EquationSource;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final OmmlToLatexConverter CONVERTER = new OmmlToLatexConverter();
    private static final DocxEquationExtractor EXTRACTOR = new DocxEquationExtractor();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar ommltex.jar <input> <output-file>");
            System.err.println("  <input>:       Path to a .docx/.xml file or a folder containing them");
            System.err.println("  <output-file>: .jsonl for JSON Lines, anything else for a LaTeX document");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path output = Paths.get(args[1]);
        // Create parent directories if they don't exist
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }

        System.out.println("Starting equation conversion...");
        System.out.println("Input: " + input.toAbsolutePath());

        OmmlTexConfig config = OmmlTexConfig.load();
        List<Path> files = collectInputFiles(input);
        System.out.println("Found " + files.size() + " documents");

        Instant startTime = Instant.now();
        AtomicInteger equationCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);
        List<DocumentConversion> conversions = Collections.synchronizedList(new ArrayList<>());
        List<Map<String, String>> errors = Collections.synchronizedList(new ArrayList<>());

        // Documents are independent and the converter is stateless
        files.parallelStream().forEach(file -> {
            InputFormat format = InputFormatDetector.detectFormat(file).orElseThrow();
            int current = progressCounter.incrementAndGet();

            synchronized (System.out) {
                System.out.println("[" + current + "/" + files.size() + "] Converting " +
                                   format.getName() + ": " + file.getFileName());
            }

            try {
                DocumentConversion conversion = convertFile(file, format, config);
                conversions.add(conversion);
                equationCount.addAndGet(conversion.getEquationCount());
            } catch (Exception e) {
                Map<String, String> error = new HashMap<>();
                error.put("kind", "error");
                error.put("file", file.toString());
                error.put("format", format.getName());
                error.put("error", e.getMessage());
                errors.add(error);

                synchronized (System.err) {
                    System.err.println("  Error converting " + file.getFileName() + ": " + e.getMessage());
                }
            }
        });

        List<DocumentConversion> ordered = new ArrayList<>(conversions);
        ordered.sort(Comparator.comparing(c -> c.filePath));

        if (output.getFileName().toString().toLowerCase().endsWith(".jsonl")) {
            writeJsonLines(output, input, files.size(), startTime, ordered, errors);
        } else {
            try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
                new LatexDocumentWriter(config.getEquationEnvironment()).write(writer, ordered);
            }
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Conversion complete!");
        System.out.println("Documents converted: " + ordered.size());
        System.out.println("Equations converted: " + equationCount.get());
        if (!errors.isEmpty()) {
            System.out.println("Errors: " + errors.size());
        }
        System.out.println("Output written to: " + output.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    private static void writeJsonLines(Path output, Path input, int totalFiles, Instant startTime,
                                       List<DocumentConversion> conversions,
                                       List<Map<String, String>> errors) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", totalFiles);
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            int equations = 0;
            for (DocumentConversion conversion : conversions) {
                writer.write(MAPPER.writeValueAsString(conversion));
                writer.newLine();
                equations += conversion.getEquationCount();
            }
            for (Map<String, String> error : errors) {
                writer.write(MAPPER.writeValueAsString(error));
                writer.newLine();
            }

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_converted", conversions.size());
            doneInfo.put("files_with_errors", errors.size());
            doneInfo.put("equations", equations);
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }
    }

    private static List<Path> collectInputFiles(Path input) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(p -> InputFormatDetector.detectFormat(p).isPresent())
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input) && InputFormatDetector.detectFormat(input).isPresent()) {
            files.add(input);
        }

        return files;
    }

    public static DocumentConversion convertFile(Path filePath, OmmlTexConfig config) throws IOException {
        Optional<InputFormat> format = InputFormatDetector.detectFormat(filePath);
        if (format.isEmpty()) {
            throw new IllegalArgumentException("Unsupported input format: " + filePath);
        }
        return convertFile(filePath, format.get(), config);
    }

    public static DocumentConversion convertFile(Path filePath, InputFormat format, OmmlTexConfig config) throws IOException {
        DocumentConversion conversion = new DocumentConversion();
        conversion.filePath = filePath.toString();
        conversion.format = format.getName();

        for (EquationSource source : EXTRACTOR.extract(filePath, format)) {
            conversion.equations.add(convertEquation(source, config));
        }
        return conversion;
    }

    static EquationResult convertEquation(EquationSource source, OmmlTexConfig config) {
        String latex = CONVERTER.convertEquation(source.root()).strip();
        if (latex.isEmpty()) {
            latex = MathDelimiters.emptyPlaceholder(source.index());
        }

        EquationResult result = new EquationResult();
        result.index = source.index();
        result.text = source.text();
        result.latex = latex;
        result.inline = MathDelimiters.isInline(latex, config.getInlineMaxLength());
        result.delimited = MathDelimiters.wrap(latex, config.getInlineMaxLength());
        return result;
    }
}
