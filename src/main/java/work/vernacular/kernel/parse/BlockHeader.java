package work.vernacular.kernel.parse;

import java.util.List;
import java.util.Objects;

/**
 * Structured payload of a block header, one record per {@link BlockKind}.
 */
public interface BlockHeader {
    BlockKind kind();

    record If(String condition) implements BlockHeader {
        public If {
            Objects.requireNonNull(condition, "condition");
        }

        @Override
        public BlockKind kind() {
            return BlockKind.IF;
        }
    }

    record Else() implements BlockHeader {
        @Override
        public BlockKind kind() {
            return BlockKind.ELSE;
        }
    }

    record While(String condition) implements BlockHeader {
        public While {
            Objects.requireNonNull(condition, "condition");
        }

        @Override
        public BlockKind kind() {
            return BlockKind.WHILE;
        }
    }

    record ForEach(String binding, String source) implements BlockHeader {
        public ForEach {
            Objects.requireNonNull(binding, "binding");
            Objects.requireNonNull(source, "source");
        }

        @Override
        public BlockKind kind() {
            return BlockKind.FOR_EACH;
        }
    }

    record Repeat(int count) implements BlockHeader {
        public Repeat {
            if (count < 0) {
                throw new IllegalArgumentException("count must be non-negative");
            }
        }

        @Override
        public BlockKind kind() {
            return BlockKind.REPEAT;
        }
    }

    record FunctionDef(String name, List<String> parameters) implements BlockHeader {
        public FunctionDef {
            Objects.requireNonNull(name, "name");
            parameters = parameters == null ? List.of() : List.copyOf(parameters);
        }

        @Override
        public BlockKind kind() {
            return BlockKind.FUNCTION_DEF;
        }
    }
}
