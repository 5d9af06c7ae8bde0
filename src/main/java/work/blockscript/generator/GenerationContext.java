package work.blockscript.generator;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Script-scoped state threaded through block generation.
 */
public final class GenerationContext {
    private final DefinedVariables definedVariables;
    private final Set<String> capturedVariables = new LinkedHashSet<>();

    public GenerationContext() {
        this(new DefinedVariables());
    }

    public GenerationContext(DefinedVariables definedVariables) {
        this.definedVariables = Objects.requireNonNull(definedVariables, "definedVariables");
    }

    public DefinedVariables definedVariables() {
        return definedVariables;
    }

    public void markCaptured(String variable) {
        capturedVariables.add(variable);
    }

    public List<String> capturedVariables() {
        return List.copyOf(capturedVariables);
    }
}
