package com.claimsagent.interfaces.cli;

import com.claimsagent.application.claim.BatchItem;
import com.claimsagent.application.claim.ClaimProcessingAppService;
import com.claimsagent.application.claim.exception.DocumentDirectoryNotFoundException;
import com.claimsagent.domain.claim.model.ClaimProcessingResult;
import com.claimsagent.infrastructure.config.ClaimsProperties;
import com.claimsagent.infrastructure.document.DocumentLoadException;
import com.claimsagent.infrastructure.output.ClaimResultWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point.
 * <pre>
 *   --file=&lt;path&gt;            process one document
 *   --process-all[=&lt;dir&gt;]     process every document in a directory
 *   --output=&lt;path&gt;          also save the single-file result as JSON
 *   --json-only              print JSON instead of the readable summary
 * </pre>
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "claims.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ClaimsCliRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String USAGE = """
            Usage: claims-agent [options]
              --file=<path>           Process a single FNOL document (.txt or .pdf)
              --process-all[=<dir>]   Process every document in <dir> (default: %s)
              --output=<path>         Save the single-file result as JSON to <path>
              --json-only             Print JSON instead of the readable summary
            """;

    private static final String RULE = "=".repeat(60);

    private final ClaimProcessingAppService processingService;
    private final ClaimResultWriter resultWriter;
    private final ClaimsProperties properties;
    private final PrintStream out;

    private int exitCode;

    @Autowired
    public ClaimsCliRunner(ClaimProcessingAppService processingService,
                           ClaimResultWriter resultWriter,
                           ClaimsProperties properties) {
        this(processingService, resultWriter, properties, System.out);
    }

    ClaimsCliRunner(ClaimProcessingAppService processingService,
                    ClaimResultWriter resultWriter,
                    ClaimsProperties properties,
                    PrintStream out) {
        this.processingService = processingService;
        this.resultWriter = resultWriter;
        this.properties = properties;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean jsonOnly = args.containsOption("json-only");
        try {
            if (args.containsOption("process-all")) {
                exitCode = processAll(directoryOption(args), jsonOnly);
            } else if (args.containsOption("file")) {
                exitCode = processFile(Path.of(lastValue(args, "file")), optionalOutput(args), jsonOnly);
            } else {
                out.print(String.format(USAGE, properties.getCli().getSampleDir()));
                out.println();
                out.println("Error: Must specify either --file or --process-all");
                exitCode = 1;
            }
        } catch (RuntimeException e) {
            log.error("[CLI] Unexpected failure", e);
            out.println("Error: " + e.getMessage());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private int processFile(Path file, Path output, boolean jsonOnly) {
        ClaimProcessingResult result;
        try {
            result = processingService.processDocument(file);
        } catch (DocumentLoadException e) {
            out.println("Error: " + e.getMessage());
            return 1;
        }

        if (jsonOnly) {
            out.println(resultWriter.toJson(result));
        } else {
            out.print(resultWriter.summarize(result));
        }
        if (output != null) {
            resultWriter.write(result, output);
            if (!jsonOnly) {
                out.println("Result saved to: " + output);
            }
        }
        return 0;
    }

    private int processAll(Path directory, boolean jsonOnly) {
        List<BatchItem> items;
        try {
            items = processingService.processDirectory(directory);
        } catch (DocumentDirectoryNotFoundException e) {
            out.println("Error: " + e.getMessage());
            return 1;
        }
        if (items.isEmpty()) {
            out.println("Error: No FNOL documents found in " + directory);
            return 1;
        }

        Path outputDir = Path.of(properties.getCli().getOutputDir());
        out.println("Found " + items.size() + " documents to process");
        for (BatchItem item : items) {
            String name = item.document().getFileName().toString();
            if (item.result().isEmpty()) {
                out.println("Error processing " + name + ": " + item.error().orElse("unknown error"));
                continue;
            }
            ClaimProcessingResult result = item.result().get();
            resultWriter.write(result, outputDir.resolve(stem(name) + "_result.json"));
            if (jsonOnly) {
                out.println(resultWriter.toJson(result));
            } else {
                out.println(RULE);
                out.println("Processing: " + name);
                out.print(resultWriter.summarize(result));
            }
        }
        if (!jsonOnly) {
            out.println("Processing complete! Results saved to: " + outputDir);
        }
        return 0;
    }

    private Path directoryOption(ApplicationArguments args) {
        List<String> values = args.getOptionValues("process-all");
        if (values == null || values.isEmpty() || values.get(values.size() - 1).isBlank()) {
            return Path.of(properties.getCli().getSampleDir());
        }
        return Path.of(values.get(values.size() - 1));
    }

    private static Path optionalOutput(ApplicationArguments args) {
        if (!args.containsOption("output")) {
            return null;
        }
        return Path.of(lastValue(args, "output"));
    }

    private static String lastValue(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        if (values == null || values.isEmpty() || values.get(values.size() - 1).isBlank()) {
            throw new IllegalArgumentException("Option --" + option + " requires a value");
        }
        return values.get(values.size() - 1);
    }

    private static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
