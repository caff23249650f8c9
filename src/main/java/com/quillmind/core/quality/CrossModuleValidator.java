package com.quillmind.core.quality;

import com.quillmind.core.model.ModuleName;
import com.quillmind.core.model.ModuleResult;
import com.quillmind.core.model.QualityCheck;
import com.quillmind.core.model.WritingGoal;

import java.util.List;

/**
 * Validates agreement across several module outputs.
 * <p>
 * Implementations must tolerate any subset of modules being present, including none.
 */
public interface CrossModuleValidator {

    String name();

    String description();

    List<ModuleName> applicableModules();

    List<String> validationRules();

    QualityCheck validate(List<ModuleResult> moduleResults, WritingGoal writingGoal);
}
