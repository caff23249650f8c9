package com.quillmind.dispatch.cli;

import com.quillmind.core.model.ConflictResolution;
import com.quillmind.core.model.ImprovementSuggestion;
import com.quillmind.core.model.QualityCheck;
import com.quillmind.core.model.QualityStandard;
import com.quillmind.core.model.QualityValidation;
import com.quillmind.core.model.ResolutionDecision;
import com.quillmind.core.model.ResolutionStep;
import com.quillmind.core.model.ResolutionStrategy;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for Quillmind CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) QUILLMIND v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [QUILLMIND]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void check(QualityCheck check) {
        String status = check.passed() ? "@|fg(green) PASS|@" : "@|fg(red) FAIL|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) [" + check.checkType() + "]|@ " + status + " " + check.moduleName()
                        + " " + score(check.score())));
        for (String issue : check.issues()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(red) -|@ " + issue));
        }
    }

    public static void verdict(boolean passed, double overallScore, QualityValidation.Metadata metadata) {
        String summary = "overall " + score(overallScore) + " (" + metadata.passedChecks() + "/"
                + metadata.totalChecks() + " checks passed, " + metadata.criticalIssues() + " critical)";
        if (passed) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(green),bold [PASSED]|@ " + summary));
        } else {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(red),bold [FAILED]|@ " + summary));
        }
    }

    public static void improvement(ImprovementSuggestion suggestion) {
        String color = switch (suggestion.priority()) {
            case HIGH -> "fg(red)";
            case MEDIUM -> "fg(yellow)";
            case LOW -> "fg(white)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + suggestion.priority().name() + "|@ " + suggestion.moduleName()
                        + ": " + suggestion.suggestion()));
    }

    public static void resolution(ConflictResolution resolution) {
        String tag = resolution.isFallback() ? "@|fg(red) [FALLBACK]|@" : "@|fg(blue) [RESOLVED]|@";
        ResolutionDecision decision = resolution.resolution();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                tag + " " + resolution.conflictId() + ": " + decision.decision()
                        + " (" + decision.type().id() + ", confidence " + score(resolution.confidence()) + ")"));
        System.out.println("    Strategy: " + resolution.metadata().strategyUsed()
                + " | narrative impact " + score(resolution.narrativeImpact())
                + (resolution.userAligned() ? " | user aligned" : ""));
        for (ResolutionStep step : resolution.implementation().steps()) {
            System.out.println("    " + step.step() + ". " + step.action() + " -> " + step.target());
        }
    }

    public static void standard(QualityStandard standard) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold " + standard.moduleName() + "|@ min " + score(standard.minimumScore())
                        + ", target " + score(standard.targetScore())));
        System.out.println("    Metrics: " + String.join(", ", standard.qualityMetrics()));
    }

    public static void strategy(ResolutionStrategy strategy, ResolutionDecision recommended) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold " + strategy.name() + "|@ [" + strategy.type().id() + ", priority " + strategy.priority() + "]"));
        System.out.println("    " + strategy.description());
        System.out.println("    Recommends: " + recommended.type().id() + " " + recommended.primaryModule()
                + " -> " + recommended.secondaryModules());
    }

    private static String score(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
