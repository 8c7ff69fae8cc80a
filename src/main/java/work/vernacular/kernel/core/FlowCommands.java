package work.vernacular.kernel.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import work.vernacular.kernel.flow.ControlSignal;
import work.vernacular.kernel.parse.Command;
import work.vernacular.kernel.parse.ScriptNode;
import work.vernacular.kernel.runtime.CommandContext;
import work.vernacular.kernel.runtime.FunctionDefinition;
import work.vernacular.kernel.runtime.LeafResult;
import work.vernacular.kernel.runtime.ScopeKind;

/**
 * Loop control, return, and the single-line forms of loops, functions and conditionals.
 * Nested command text is run back through the engine so signals from it propagate normally.
 */
public final class FlowCommands {
    static final String COUNTER_VARIABLE = "counter";
    static final String ITEM_VARIABLE = "item";

    private FlowCommands() {}

    public static CommandRegistry register(CommandRegistry registry) {
        registry.register("flow/break", "(?:break(?: from)?(?: the)?(?: loop)?|exit the loop|stop the loop)", (ctx, m) -> LeafResult.breakLoop());
        registry.register("flow/continue", "(?:continue(?: with)?(?: the)?(?: loop)?|skip to the next (?:iteration|item))", (ctx, m) -> LeafResult.continueLoop());
        registry.register("flow/return", "return(?:\\s+(.+))?", FlowCommands::returnValue);

        registry.register("flow/repeat-inline", "repeat (\\d+) times?\\s*:\\s*(.+)", FlowCommands::repeatInline);
        registry.register("flow/for-each-inline", "for each(?: (\\w+))? in list (\\w+) do (.+)", FlowCommands::forEachInline);
        registry.register("flow/count-inline", "count from (\\S+) to (\\S+) and (.+)", FlowCommands::countInline);
        registry.register("flow/while-inline", "while (\\w+) is less than (\\S+) do (.+)", FlowCommands::whileInline);
        registry.register("flow/define-inline", "define function (\\w+) as (.+)", FlowCommands::defineInline);
        registry.register("flow/if-inline", "if (.+?) then (.+)", FlowCommands::ifInline);
        return registry;
    }

    private static LeafResult returnValue(CommandContext ctx, Matcher m) {
        if (m.group(1) == null) {
            return LeafResult.returning(null);
        }
        return LeafResult.returning(Operands.value(ctx.scopes(), m.group(1)));
    }

    private static LeafResult repeatInline(CommandContext ctx, Matcher m) {
        int times = Integer.parseInt(m.group(1));
        return iterate(ctx, Collections.nCopies(times, null), null, m.group(2));
    }

    private static LeafResult forEachInline(CommandContext ctx, Matcher m) {
        var binding = m.group(1) == null ? ITEM_VARIABLE : m.group(1);
        var items = new ArrayList<Object>(Operands.list(ctx.scopes(), m.group(2)));
        return iterate(ctx, items, binding, m.group(3));
    }

    private static LeafResult countInline(CommandContext ctx, Matcher m) {
        long start = (long) Operands.number(ctx.scopes(), m.group(1));
        long end = (long) Operands.number(ctx.scopes(), m.group(2));
        if (end - start >= ctx.settings().maxWhileIterations()) {
            throw new CommandFailedException("count range " + start + ".." + end + " is too large");
        }
        var values = new ArrayList<Object>();
        for (long i = start; i <= end; i++) {
            values.add(i);
        }
        return iterate(ctx, values, COUNTER_VARIABLE, m.group(3));
    }

    private static LeafResult whileInline(CommandContext ctx, Matcher m) {
        var variable = m.group(1);
        var limit = ctx.settings().maxWhileIterations();
        var scopes = ctx.scopes();
        scopes.push(ScopeKind.LOOP);
        try {
            int iterations = 0;
            while (Operands.number(scopes, variable) < Operands.number(scopes, m.group(2))) {
                if (iterations++ >= limit) {
                    ctx.environment().log().warn("line %d: while loop stopped after %d iterations (safety limit)", ctx.lineNumber(), limit);
                    break;
                }
                var outcome = ctx.runNested(m.group(3));
                if (outcome.signal() == ControlSignal.BREAK) {
                    break;
                }
                if (outcome.signal() == ControlSignal.RETURN) {
                    return LeafResult.propagate(outcome);
                }
            }
            return LeafResult.done();
        } finally {
            scopes.pop();
        }
    }

    private static LeafResult defineInline(CommandContext ctx, Matcher m) {
        var name = m.group(1);
        var body = List.<ScriptNode>of(new Command(m.group(2).strip(), ctx.lineNumber(), 0));
        ctx.environment().defineFunction(new FunctionDefinition(name, List.of(), body, ctx.lineNumber()));
        return LeafResult.done();
    }

    private static LeafResult ifInline(CommandContext ctx, Matcher m) {
        var evaluator = new ConditionEvaluator();
        if (evaluator.evaluate(m.group(1), ctx.scopes())) {
            return LeafResult.propagate(ctx.runNested(m.group(2)));
        }
        return LeafResult.done();
    }

    private static LeafResult iterate(CommandContext ctx, List<Object> items, String binding, String body) {
        var scopes = ctx.scopes();
        scopes.push(ScopeKind.LOOP);
        try {
            for (var item : items) {
                if (binding != null) {
                    scopes.bind(binding, item);
                }
                var outcome = ctx.runNested(body);
                if (outcome.signal() == ControlSignal.BREAK) {
                    break;
                }
                if (outcome.signal() == ControlSignal.RETURN) {
                    return LeafResult.propagate(outcome);
                }
            }
            return LeafResult.done();
        } finally {
            scopes.pop();
        }
    }
}
