package com.quillmind.dispatch.cli;

import com.quillmind.core.model.InterModuleConflict;
import com.quillmind.core.model.ResolutionStrategy;
import com.quillmind.core.model.WritingContext;
import com.quillmind.core.resolution.IntelligentConflictResolver;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: quillmind strategies
 * <p>
 * Lists the registered resolution strategies with the decision each one recommends.
 */
@Command(name = "strategies", mixinStandardHelpOptions = true, description = "List conflict resolution strategies")
@Component
public class StrategiesCommand implements Runnable {

    private final IntelligentConflictResolver resolver;

    public StrategiesCommand(IntelligentConflictResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        WritingContext context = new WritingContext("cli", "novel", List.of(), null, null, null, 0L, null);
        for (ResolutionStrategy strategy : resolver.getAvailableStrategies()) {
            var sample = new InterModuleConflict(strategy.type().id(), strategy.type(), null,
                    strategy.description(), List.of(), null, null, null, null);
            ConsoleOutput.strategy(strategy, strategy.recommend(sample, context));
        }
    }
}
