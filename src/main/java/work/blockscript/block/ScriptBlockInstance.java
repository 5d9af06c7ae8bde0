package work.blockscript.block;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.blockscript.codec.SourceLine;
import work.blockscript.descriptor.BlockDescriptor;
import work.blockscript.descriptor.BlockKind;
import work.blockscript.generator.GenerationContext;

/**
 * Raw statements copied verbatim into the generated program. Trailing blank lines are dropped
 * since the codec uses them to separate blocks.
 */
public final class ScriptBlockInstance extends AbstractBlockInstance {
    private final List<String> code = new ArrayList<>();

    public ScriptBlockInstance(BlockDescriptor descriptor) {
        super(descriptor, BlockKind.SCRIPT);
    }

    public List<String> code() {
        return code;
    }

    public void setCode(List<String> lines) {
        code.clear();
        code.addAll(lines);
        trimTrailingBlanks();
    }

    @Override
    protected void readBody(List<SourceLine> lines) {
        code.clear();
        for (var line : lines) {
            code.add(line.text());
        }
        trimTrailingBlanks();
    }

    @Override
    protected void writeBody(List<String> lines) {
        for (String line : code) {
            lines.add(line.isEmpty() ? "" : INDENT + line);
        }
    }

    @Override
    protected String emit(GenerationContext context) {
        if (code.isEmpty()) {
            return "";
        }
        return String.join("\n", code) + "\n";
    }

    private void trimTrailingBlanks() {
        while (!code.isEmpty() && code.get(code.size() - 1).isBlank()) {
            code.remove(code.size() - 1);
        }
    }

    @Override
    public boolean equals(Object other) {
        return super.equals(other) && code.equals(((ScriptBlockInstance) other).code);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), code);
    }
}
