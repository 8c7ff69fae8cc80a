package work.vernacular.kernel.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.vernacular.kernel.flow.ArityException;
import work.vernacular.kernel.flow.ControlSignal;
import work.vernacular.kernel.flow.FlowOutcome;
import work.vernacular.kernel.flow.ScriptErrorException;
import work.vernacular.kernel.flow.ScriptSyntaxException;
import work.vernacular.kernel.flow.UnboundControlSignalException;
import work.vernacular.kernel.parse.BlockHeader;
import work.vernacular.kernel.parse.BlockNode;
import work.vernacular.kernel.parse.Command;
import work.vernacular.kernel.parse.FunctionCall;
import work.vernacular.kernel.parse.Program;
import work.vernacular.kernel.parse.ScriptNode;
import work.vernacular.kernel.shared.Values;

/**
 * Walks a block tree. Every body execution returns a {@link FlowOutcome}; the first non-normal outcome stops the
 * remaining siblings and travels upward until the loop or function that owns it consumes it.
 */
public final class ExecutionEngine {
    public static final String RESULT_VARIABLE = "result";
    static final int MAX_CALL_DEPTH = 200;

    private final Environment env;
    private final CommandExecutor executor;
    private final ExecutionStats stats = new ExecutionStats();
    private int callDepth;

    public ExecutionEngine(Environment env, CommandExecutor executor) {
        this.env = Objects.requireNonNull(env, "env");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public Environment environment() {
        return env;
    }

    public ExecutionStats stats() {
        return stats;
    }

    /**
     * Runs a whole program. A break, continue or return that reaches the top level is an error.
     */
    public void run(Program program) {
        var outcome = executeBody(program.items());
        if (outcome.signal().isLoopSignal()) {
            throw new UnboundControlSignalException(
                outcome.signal(),
                outcome.signal().name().toLowerCase() + " used outside of a loop",
                outcome.lineNumber()
            );
        }
        if (outcome.signal() == ControlSignal.RETURN) {
            throw new UnboundControlSignalException(outcome.signal(), "return used outside of a function", outcome.lineNumber());
        }
    }

    public FlowOutcome executeBody(List<ScriptNode> body) {
        for (int index = 0; index < body.size(); index++) {
            var node = body.get(index);
            FlowOutcome outcome;
            if (node instanceof BlockNode block && block.spec() instanceof BlockHeader.If) {
                var elseBranch = elseFollowing(body, index);
                outcome = executeIf(block, elseBranch);
                if (elseBranch != null) {
                    index++;
                }
            } else {
                outcome = execute(node);
            }
            if (!outcome.isNormal()) {
                return outcome;
            }
        }
        return FlowOutcome.NORMAL;
    }

    public FlowOutcome execute(ScriptNode node) {
        if (node instanceof Command command) {
            return executeCommand(command);
        }
        var block = (BlockNode) node;
        var spec = block.spec();
        if (spec instanceof BlockHeader.If) {
            return executeIf(block, null);
        }
        if (spec instanceof BlockHeader.Else) {
            throw new ScriptSyntaxException("else: without a matching if", block.lineNumber());
        }
        if (spec instanceof BlockHeader.Repeat repeat) {
            return executeRepeat(block, repeat.count());
        }
        if (spec instanceof BlockHeader.While loop) {
            return executeWhile(block, loop.condition());
        }
        if (spec instanceof BlockHeader.ForEach forEach) {
            return executeForEach(block, forEach);
        }
        if (spec instanceof BlockHeader.FunctionDef def) {
            env.defineFunction(new FunctionDefinition(def.name(), def.parameters(), block.body(), block.lineNumber()));
            env.log().debug("line %d: defined function '%s' %s", block.lineNumber(), def.name(), def.parameters());
            return FlowOutcome.NORMAL;
        }
        throw new IllegalStateException("Unsupported block kind: " + block.kind());
    }

    /**
     * Invokes a registered function with positional arguments and returns its return value (or null).
     */
    private Object callFunction(String name, List<Object> arguments, int lineNumber) {
        try {
            var function = env.function(name);
            if (arguments.size() != function.arity()) {
                throw new ArityException(name, function.arity(), arguments.size());
            }
            if (callDepth >= MAX_CALL_DEPTH) {
                throw new ScriptErrorException("recursion_error", "call depth exceeded " + MAX_CALL_DEPTH + " in '" + name + "'", lineNumber);
            }
            stats.functionCalled();
            var scopes = env.scopes();
            scopes.push(ScopeKind.FUNCTION);
            callDepth++;
            try {
                for (int i = 0; i < arguments.size(); i++) {
                    scopes.bind(function.parameters().get(i), arguments.get(i));
                }
                var outcome = executeBody(function.body());
                if (outcome.signal() == ControlSignal.RETURN) {
                    return outcome.value();
                }
                if (outcome.signal().isLoopSignal()) {
                    throw new UnboundControlSignalException(
                        outcome.signal(),
                        outcome.signal().name().toLowerCase() + " escaped function '" + name + "' without an enclosing loop",
                        outcome.lineNumber()
                    );
                }
                return null;
            } finally {
                callDepth--;
                scopes.pop();
            }
        } catch (ScriptErrorException ex) {
            throw ex.atLine(lineNumber);
        }
    }

    private FlowOutcome executeIf(BlockNode block, BlockNode elseBranch) {
        enter(block);
        var condition = ((BlockHeader.If) block.spec()).condition();
        if (evaluate(condition, block.lineNumber())) {
            return executeBody(block.body());
        }
        if (elseBranch != null) {
            enter(elseBranch);
            return executeBody(elseBranch.body());
        }
        return FlowOutcome.NORMAL;
    }

    private FlowOutcome executeRepeat(BlockNode block, int count) {
        enter(block);
        var scopes = env.scopes();
        scopes.push(ScopeKind.LOOP);
        try {
            for (int i = 0; i < count; i++) {
                var outcome = executeBody(block.body());
                if (outcome.signal() == ControlSignal.BREAK) {
                    break;
                }
                if (outcome.signal() == ControlSignal.RETURN) {
                    return outcome;
                }
            }
            return FlowOutcome.NORMAL;
        } finally {
            scopes.pop();
        }
    }

    private FlowOutcome executeWhile(BlockNode block, String condition) {
        enter(block);
        var limit = env.settings().maxWhileIterations();
        var scopes = env.scopes();
        scopes.push(ScopeKind.LOOP);
        try {
            int iterations = 0;
            while (evaluate(condition, block.lineNumber())) {
                if (iterations >= limit) {
                    env.log().warn("line %d: while loop stopped after %d iterations (safety limit)", block.lineNumber(), limit);
                    break;
                }
                iterations++;
                var outcome = executeBody(block.body());
                if (outcome.signal() == ControlSignal.BREAK) {
                    break;
                }
                if (outcome.signal() == ControlSignal.RETURN) {
                    return outcome;
                }
            }
            return FlowOutcome.NORMAL;
        } finally {
            scopes.pop();
        }
    }

    private FlowOutcome executeForEach(BlockNode block, BlockHeader.ForEach header) {
        enter(block);
        List<Object> items;
        try {
            items = new ArrayList<>(executor.resolveList(header.source(), context(block.lineNumber())));
        } catch (ScriptErrorException ex) {
            throw ex.atLine(block.lineNumber());
        }
        var scopes = env.scopes();
        scopes.push(ScopeKind.LOOP);
        try {
            for (var item : items) {
                scopes.bind(header.binding(), item);
                var outcome = executeBody(block.body());
                if (outcome.signal() == ControlSignal.BREAK) {
                    break;
                }
                if (outcome.signal() == ControlSignal.RETURN) {
                    return outcome;
                }
            }
            return FlowOutcome.NORMAL;
        } finally {
            scopes.pop();
        }
    }

    private FlowOutcome executeCommand(Command command) {
        var line = command.lineNumber();
        try {
            var call = FunctionCall.recognize(command.text());
            if (call.isPresent()) {
                var value = callFunction(call.get().name(), resolveArguments(call.get().arguments()), line);
                if (value != null) {
                    env.scopes().assign(RESULT_VARIABLE, value);
                }
                stats.commandSucceeded();
                return FlowOutcome.NORMAL;
            }
            env.log().trace("line %d: %s", line, command.text());
            var result = executor.executeLeaf(command.text(), context(line));
            if (!result.success()) {
                stats.commandFailed();
                env.log().warn("line %d: %s", line, result.message());
                return FlowOutcome.NORMAL;
            }
            stats.commandSucceeded();
            if (result.signal() == ControlSignal.RETURN) {
                return FlowOutcome.returning(result.value(), line);
            }
            return FlowOutcome.of(result.signal(), line);
        } catch (ScriptErrorException ex) {
            throw ex.atLine(line);
        }
    }

    private boolean evaluate(String condition, int line) {
        try {
            return executor.evaluatePredicate(condition, context(line));
        } catch (ScriptErrorException ex) {
            throw ex.atLine(line);
        }
    }

    private List<Object> resolveArguments(List<String> raw) {
        var values = new ArrayList<Object>(raw.size());
        for (var argument : raw) {
            if (Values.isIdentifier(argument) && env.scopes().isDefined(argument.strip())) {
                values.add(env.scopes().resolve(argument.strip()));
            } else {
                values.add(Values.parseLiteral(argument));
            }
        }
        return values;
    }

    private CommandContext context(int line) {
        return new CommandContext(env, line, (text, nestedLine) -> executeCommand(new Command(text.strip(), nestedLine, 0)));
    }

    private void enter(BlockNode block) {
        stats.blockEntered();
        env.log().debug("line %d: entering %s block", block.lineNumber(), block.kind().name().toLowerCase());
    }

    private static BlockNode elseFollowing(List<ScriptNode> body, int index) {
        if (index + 1 < body.size() && body.get(index + 1) instanceof BlockNode next && next.spec() instanceof BlockHeader.Else) {
            return next;
        }
        return null;
    }
}
