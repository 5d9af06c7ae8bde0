package work.blockscript.generator;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Names already declared in the emitted program, in declaration order. Lives for one
 * generation run and is passed by reference to every block.
 */
public final class DefinedVariables {
    private final Set<String> names = new LinkedHashSet<>();

    public boolean contains(String name) {
        return names.contains(name);
    }

    public boolean add(String name) {
        return names.add(name);
    }

    public int size() {
        return names.size();
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    public List<String> asList() {
        return List.copyOf(names);
    }

    @Override
    public String toString() {
        return names.toString();
    }
}
