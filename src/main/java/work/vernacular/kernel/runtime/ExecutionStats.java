package work.vernacular.kernel.runtime;

/**
 * Counters gathered while a program runs.
 */
public final class ExecutionStats {
    private int commandsExecuted;
    private int commandsSucceeded;
    private int commandsFailed;
    private int blocksEntered;
    private int functionCalls;

    void commandSucceeded() {
        commandsExecuted++;
        commandsSucceeded++;
    }

    void commandFailed() {
        commandsExecuted++;
        commandsFailed++;
    }

    void blockEntered() {
        blocksEntered++;
    }

    void functionCalled() {
        functionCalls++;
    }

    public int commandsExecuted() {
        return commandsExecuted;
    }

    public int commandsSucceeded() {
        return commandsSucceeded;
    }

    public int commandsFailed() {
        return commandsFailed;
    }

    public int blocksEntered() {
        return blocksEntered;
    }

    public int functionCalls() {
        return functionCalls;
    }
}
