package com.quillmind.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quillmind.core.model.ConflictResolution;
import com.quillmind.core.resolution.IntelligentConflictResolver;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * CLI command: quillmind resolve --input &lt;conflicts.json&gt;
 */
@Command(name = "resolve", mixinStandardHelpOptions = true, description = "Resolve a batch of inter-module conflicts")
@Component
public class ResolveCommand implements Runnable {

    @Option(names = {"--input", "-i"}, required = true, description = "JSON file with session and conflicts")
    private Path input;

    @Option(names = "--json", description = "Print the resolutions as JSON")
    private boolean json;

    private final IntelligentConflictResolver resolver;
    private final ObjectMapper objectMapper;

    public ResolveCommand(IntelligentConflictResolver resolver, ObjectMapper objectMapper) {
        this.resolver = resolver;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        BatchFiles.ConflictBatch batch;
        try {
            batch = BatchFiles.readConflictBatch(objectMapper, input);
        } catch (UncheckedIOException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }

        List<ConflictResolution> resolutions = resolver.resolveConflicts(batch.interModuleConflicts(), batch.context());

        if (json) {
            try {
                System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(resolutions));
            } catch (JsonProcessingException e) {
                ConsoleOutput.error("Cannot render JSON: " + e.getOriginalMessage());
            }
            return;
        }

        ConsoleOutput.printBanner();
        for (ConflictResolution resolution : resolutions) {
            ConsoleOutput.resolution(resolution);
        }
        System.out.println("──────────────────────────────────");
        ConsoleOutput.info(resolutions.size() + " conflict" + (resolutions.size() != 1 ? "s" : "") + " resolved");
    }
}
