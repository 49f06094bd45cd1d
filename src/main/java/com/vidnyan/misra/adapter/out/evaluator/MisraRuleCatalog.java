package com.vidnyan.misra.adapter.out.evaluator;

import com.vidnyan.misra.adapter.out.evaluator.controlflow.BackwardGotoRule;
import com.vidnyan.misra.adapter.out.evaluator.controlflow.BooleanSwitchRule;
import com.vidnyan.misra.adapter.out.evaluator.controlflow.CaseLabelScopeRule;
import com.vidnyan.misra.adapter.out.evaluator.controlflow.CompoundBodyRule;
import com.vidnyan.misra.adapter.out.evaluator.controlflow.DefaultPositionRule;
import com.vidnyan.misra.adapter.out.evaluator.controlflow.ElseIfTerminationRule;
import com.vidnyan.misra.adapter.out.evaluator.controlflow.FloatLoopCounterRule;
import com.vidnyan.misra.adapter.out.evaluator.controlflow.ForLoopFormRule;
import com.vidnyan.misra.adapter.out.evaluator.controlflow.GotoIntoBlockRule;
import com.vidnyan.misra.adapter.out.evaluator.controlflow.NonBooleanConditionRule;
import com.vidnyan.misra.adapter.out.evaluator.controlflow.SingleExitRule;
import com.vidnyan.misra.adapter.out.evaluator.controlflow.SwitchClauseCountRule;
import com.vidnyan.misra.adapter.out.evaluator.controlflow.SwitchDefaultRule;
import com.vidnyan.misra.adapter.out.evaluator.controlflow.SwitchFallthroughRule;
import com.vidnyan.misra.adapter.out.evaluator.declarations.EnumeratorValueUniqueRule;
import com.vidnyan.misra.adapter.out.evaluator.declarations.ExternArraySizeRule;
import com.vidnyan.misra.adapter.out.evaluator.declarations.UnsizedDesignatedArrayRule;
import com.vidnyan.misra.adapter.out.evaluator.declarations.UnusedParameterRule;
import com.vidnyan.misra.adapter.out.evaluator.essentialtypes.CompositeAssignmentWideningRule;
import com.vidnyan.misra.adapter.out.evaluator.essentialtypes.CompositeCastRule;
import com.vidnyan.misra.adapter.out.evaluator.essentialtypes.NarrowingAssignmentRule;
import com.vidnyan.misra.adapter.out.evaluator.essentialtypes.OperandCategoryMismatchRule;
import com.vidnyan.misra.adapter.out.evaluator.essentialtypes.ShiftOperandTypeRule;
import com.vidnyan.misra.adapter.out.evaluator.expressions.AssignmentResultUsedRule;
import com.vidnyan.misra.adapter.out.evaluator.expressions.CommaOperatorRule;
import com.vidnyan.misra.adapter.out.evaluator.expressions.ImplicitPrecedenceRule;
import com.vidnyan.misra.adapter.out.evaluator.expressions.IncrementSideEffectsRule;
import com.vidnyan.misra.adapter.out.evaluator.expressions.InitializerSideEffectsRule;
import com.vidnyan.misra.adapter.out.evaluator.expressions.LogicalOperandSideEffectsRule;
import com.vidnyan.misra.adapter.out.evaluator.expressions.ShiftRangeRule;
import com.vidnyan.misra.adapter.out.evaluator.expressions.SizeofPrecedenceRule;
import com.vidnyan.misra.adapter.out.evaluator.expressions.SizeofSideEffectsRule;
import com.vidnyan.misra.adapter.out.evaluator.expressions.UnsignedWraparoundRule;
import com.vidnyan.misra.adapter.out.evaluator.functions.DiscardedReturnValueRule;
import com.vidnyan.misra.adapter.out.evaluator.functions.ParameterModificationRule;
import com.vidnyan.misra.adapter.out.evaluator.functions.RecursionRule;
import com.vidnyan.misra.adapter.out.evaluator.functions.StaticArrayParameterRule;
import com.vidnyan.misra.adapter.out.evaluator.functions.VariadicFacilitiesRule;
import com.vidnyan.misra.adapter.out.evaluator.identifiers.ExternalIdentifierDistinctRule;
import com.vidnyan.misra.adapter.out.evaluator.identifiers.IdentifierHidingRule;
import com.vidnyan.misra.adapter.out.evaluator.identifiers.MacroIdentifierDistinctRule;
import com.vidnyan.misra.adapter.out.evaluator.identifiers.MacroNameCollisionRule;
import com.vidnyan.misra.adapter.out.evaluator.identifiers.SameScopeIdentifierDistinctRule;
import com.vidnyan.misra.adapter.out.evaluator.lexical.LineSplicedCommentRule;
import com.vidnyan.misra.adapter.out.evaluator.lexical.NestedCommentRule;
import com.vidnyan.misra.adapter.out.evaluator.lexical.TrigraphRule;
import com.vidnyan.misra.adapter.out.evaluator.lexical.UnterminatedEscapeSequenceRule;
import com.vidnyan.misra.adapter.out.evaluator.literals.LowercaseLiteralSuffixRule;
import com.vidnyan.misra.adapter.out.evaluator.literals.OctalConstantRule;
import com.vidnyan.misra.adapter.out.evaluator.pointers.ConstQualifierRemovalRule;
import com.vidnyan.misra.adapter.out.evaluator.pointers.FlexibleArrayMemberRule;
import com.vidnyan.misra.adapter.out.evaluator.pointers.IncompatibleObjectPointerCastRule;
import com.vidnyan.misra.adapter.out.evaluator.pointers.NullPointerConstantRule;
import com.vidnyan.misra.adapter.out.evaluator.pointers.PointerArithmeticRule;
import com.vidnyan.misra.adapter.out.evaluator.pointers.PointerIntegerCastRule;
import com.vidnyan.misra.adapter.out.evaluator.pointers.PointerNestingRule;
import com.vidnyan.misra.adapter.out.evaluator.pointers.PointerNonIntegerCastRule;
import com.vidnyan.misra.adapter.out.evaluator.pointers.VariableLengthArrayRule;
import com.vidnyan.misra.adapter.out.evaluator.pointers.VoidPointerArithmeticCastRule;
import com.vidnyan.misra.adapter.out.evaluator.pointers.VoidPointerConversionRule;
import com.vidnyan.misra.adapter.out.evaluator.preprocessor.ConditionalDirectiveFileRule;
import com.vidnyan.misra.adapter.out.evaluator.preprocessor.HeaderNameCharactersRule;
import com.vidnyan.misra.adapter.out.evaluator.preprocessor.IncludeAfterCodeRule;
import com.vidnyan.misra.adapter.out.evaluator.preprocessor.IncludeSyntaxRule;
import com.vidnyan.misra.adapter.out.evaluator.preprocessor.KeywordMacroRule;
import com.vidnyan.misra.adapter.out.evaluator.preprocessor.MacroParameterParenthesesRule;
import com.vidnyan.misra.adapter.out.evaluator.preprocessor.StringizeOperatorRule;
import com.vidnyan.misra.adapter.out.evaluator.preprocessor.UndefRule;
import com.vidnyan.misra.adapter.out.evaluator.preprocessor.UnknownDirectiveRule;
import com.vidnyan.misra.adapter.out.evaluator.stdlib.FloatingPointExceptionRule;
import com.vidnyan.misra.adapter.out.evaluator.stdlib.ForbiddenFunctionCallRule;
import com.vidnyan.misra.adapter.out.evaluator.stdlib.ForbiddenIncludeRule;
import com.vidnyan.misra.adapter.out.evaluator.stdlib.ReservedIdentifierRule;
import com.vidnyan.misra.adapter.out.evaluator.stdlib.SearchSortRule;
import com.vidnyan.misra.adapter.out.evaluator.stdlib.TimeFacilitiesRule;
import com.vidnyan.misra.application.port.out.RuleCatalog;
import com.vidnyan.misra.domain.rule.RuleEvaluator;
import com.vidnyan.misra.domain.rule.RuleId;
import com.vidnyan.misra.domain.rule.RuleScope;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Static table of every rule the engine implements.
 * Evaluators are stateless and shared across units.
 */
@Component
public class MisraRuleCatalog implements RuleCatalog {

    /** Number of rules per MISRA C:2012 section, sections 1 to 22. */
    private static final int[] RULES_PER_SECTION = {
            3, 7, 2, 2, 9, 2, 4, 14, 5, 8, 9, 4, 6, 4, 7, 7, 8, 8, 2, 14, 12, 6
    };

    private static final Set<RuleId> ANALYZER_RULES = Stream.of(
                    "1.3", "2.1", "2.2", "2.4", "2.6", "8.3", "12.2", "13.2", "13.6",
                    "14.3", "17.5", "18.1", "18.2", "18.3", "18.6", "20.6",
                    "22.1", "22.2", "22.4", "22.6")
            .map(RuleId::parse)
            .collect(Collectors.toUnmodifiableSet());

    private final List<RuleEvaluator> evaluators = List.of(
            new UnusedParameterRule(),
            new NestedCommentRule(),
            new LineSplicedCommentRule(),
            new UnterminatedEscapeSequenceRule(),
            new TrigraphRule(),
            new ExternalIdentifierDistinctRule(),
            new SameScopeIdentifierDistinctRule(),
            new IdentifierHidingRule(),
            new MacroIdentifierDistinctRule(),
            new MacroNameCollisionRule(),
            new OctalConstantRule(),
            new LowercaseLiteralSuffixRule(),
            new ExternArraySizeRule(),
            new EnumeratorValueUniqueRule(),
            new ForbiddenTokenRule(8, 14, "restrict", RuleScope.RAW_TOKENS),
            new UnsizedDesignatedArrayRule(),
            new ShiftOperandTypeRule(),
            new NarrowingAssignmentRule(),
            new OperandCategoryMismatchRule(),
            new CompositeAssignmentWideningRule(),
            new CompositeCastRule(),
            new IncompatibleObjectPointerCastRule(),
            new PointerIntegerCastRule(),
            new VoidPointerConversionRule(),
            new VoidPointerArithmeticCastRule(),
            new PointerNonIntegerCastRule(),
            new ConstQualifierRemovalRule(),
            new NullPointerConstantRule(),
            new SizeofPrecedenceRule(),
            new ImplicitPrecedenceRule(),
            new ShiftRangeRule(),
            new CommaOperatorRule(),
            new UnsignedWraparoundRule(),
            new InitializerSideEffectsRule(),
            new IncrementSideEffectsRule(),
            new AssignmentResultUsedRule(),
            new LogicalOperandSideEffectsRule(),
            new SizeofSideEffectsRule(),
            new FloatLoopCounterRule(),
            new ForLoopFormRule(),
            new NonBooleanConditionRule(),
            new ForbiddenTokenRule(15, 1, "goto", RuleScope.CONFIGURATION),
            new BackwardGotoRule(),
            new GotoIntoBlockRule(),
            new SingleExitRule(),
            new CompoundBodyRule(),
            new ElseIfTerminationRule(),
            new CaseLabelScopeRule(),
            new SwitchFallthroughRule(),
            new SwitchDefaultRule(),
            new DefaultPositionRule(),
            new SwitchClauseCountRule(),
            new BooleanSwitchRule(),
            new VariadicFacilitiesRule(),
            new RecursionRule(),
            new StaticArrayParameterRule(),
            new DiscardedReturnValueRule(),
            new ParameterModificationRule(),
            new PointerArithmeticRule(),
            new PointerNestingRule(),
            new FlexibleArrayMemberRule(),
            new VariableLengthArrayRule(),
            new ForbiddenTokenRule(19, 2, "union", RuleScope.CONFIGURATION),
            new IncludeAfterCodeRule(),
            new HeaderNameCharactersRule(),
            new IncludeSyntaxRule(),
            new KeywordMacroRule(),
            new UndefRule(),
            new MacroParameterParenthesesRule(),
            new StringizeOperatorRule(),
            new UnknownDirectiveRule(),
            new ConditionalDirectiveFileRule(),
            new ReservedIdentifierRule(),
            new ForbiddenFunctionCallRule(21, 3, "malloc", "calloc", "realloc", "free"),
            new ForbiddenIncludeRule(21, 4, "<setjmp.h>"),
            new ForbiddenIncludeRule(21, 5, "<signal.h>"),
            new ForbiddenIncludeRule(21, 6, "<stdio.h>", "<wchar.h>"),
            new ForbiddenFunctionCallRule(21, 7, "atof", "atoi", "atol", "atoll"),
            new ForbiddenFunctionCallRule(21, 8, "abort", "exit", "getenv", "system"),
            new SearchSortRule(),
            new TimeFacilitiesRule(),
            new ForbiddenIncludeRule(21, 11, "<tgmath.h>"),
            new FloatingPointExceptionRule()
    );

    private final Set<RuleId> engineRules = Collections.unmodifiableSet(
            new TreeSet<>(evaluators.stream().map(RuleEvaluator::ruleId).toList()));

    @Override
    public List<RuleEvaluator> evaluators() {
        return evaluators;
    }

    @Override
    public Set<RuleId> engineRules() {
        return engineRules;
    }

    @Override
    public Set<RuleId> analyzerRules() {
        return ANALYZER_RULES;
    }

    @Override
    public List<String> coverageTable() {
        List<String> table = new ArrayList<>();
        for (int section = 1; section <= RULES_PER_SECTION.length; section++) {
            for (int rule = 1; rule <= RULES_PER_SECTION[section - 1]; rule++) {
                RuleId id = RuleId.of(section, rule);
                String coverage = "";
                if (engineRules.contains(id)) {
                    coverage = "X (Engine)";
                } else if (ANALYZER_RULES.contains(id)) {
                    coverage = "X (Analyzer)";
                }
                table.add(String.format("%-8s%s", id, coverage).stripTrailing());
            }
        }
        return table;
    }
}
