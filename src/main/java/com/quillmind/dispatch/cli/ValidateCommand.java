package com.quillmind.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quillmind.core.model.ImprovementSuggestion;
import com.quillmind.core.model.QualityCheck;
import com.quillmind.core.model.QualityValidation;
import com.quillmind.core.quality.QualityAssuranceCoordinator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * CLI command: quillmind validate --input &lt;batch.json&gt;
 * <p>
 * Runs one validation batch and prints every check plus the ranked improvements.
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Validate a batch of module results")
@Component
public class ValidateCommand implements Runnable {

    @Option(names = {"--input", "-i"}, required = true, description = "JSON file with goal and module results")
    private Path input;

    @Option(names = "--json", description = "Print the validation as JSON")
    private boolean json;

    private final QualityAssuranceCoordinator coordinator;
    private final ObjectMapper objectMapper;

    public ValidateCommand(QualityAssuranceCoordinator coordinator, ObjectMapper objectMapper) {
        this.coordinator = coordinator;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        BatchFiles.ValidationBatch batch;
        try {
            batch = BatchFiles.readValidationBatch(objectMapper, input);
        } catch (UncheckedIOException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }

        QualityValidation validation = coordinator.validateResults(batch.moduleResults(), batch.goal());

        if (json) {
            printJson(validation);
            return;
        }

        ConsoleOutput.printBanner();
        for (QualityCheck check : validation.validationDetails()) {
            ConsoleOutput.check(check);
        }
        System.out.println("──────────────────────────────────");
        ConsoleOutput.verdict(validation.passed(), validation.overallScore(), validation.metadata());
        if (!validation.improvements().isEmpty()) {
            System.out.println();
            System.out.println("Improvements:");
            for (ImprovementSuggestion suggestion : validation.improvements()) {
                ConsoleOutput.improvement(suggestion);
            }
        }
    }

    private void printJson(Object value) {
        try {
            System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
        } catch (JsonProcessingException e) {
            ConsoleOutput.error("Cannot render JSON: " + e.getOriginalMessage());
        }
    }
}
