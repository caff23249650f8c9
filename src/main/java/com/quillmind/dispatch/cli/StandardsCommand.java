package com.quillmind.dispatch.cli;

import com.quillmind.core.model.QualityStandard;
import com.quillmind.core.quality.CrossModuleValidator;
import com.quillmind.core.quality.QualityAssuranceCoordinator;
import com.quillmind.core.standards.QualityMetricDefinition;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: quillmind standards
 * <p>
 * Lists the per-module quality standards, the cross-module validators and the
 * weighted quality axes.
 */
@Command(name = "standards", mixinStandardHelpOptions = true, description = "List quality standards and validators")
@Component
public class StandardsCommand implements Runnable {

    private final QualityAssuranceCoordinator coordinator;

    public StandardsCommand(QualityAssuranceCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        System.out.println("MODULE STANDARDS");
        for (QualityStandard standard : coordinator.getModuleStandards().values()) {
            ConsoleOutput.standard(standard);
        }

        System.out.println();
        System.out.println("CROSS-MODULE VALIDATORS");
        for (CrossModuleValidator validator : coordinator.getCrossModuleValidators()) {
            System.out.println("  " + validator.name() + " - " + validator.description());
        }

        System.out.println();
        System.out.println("QUALITY AXES");
        for (QualityMetricDefinition definition : coordinator.getQualityMetricCatalog().definitions()) {
            System.out.printf("  %-14s weight %.2f  %s%n",
                    definition.name(), definition.weight(), definition.description());
        }
    }
}
