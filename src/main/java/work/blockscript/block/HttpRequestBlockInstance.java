package work.blockscript.block;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.blockscript.codec.SourceLine;
import work.blockscript.descriptor.BlockDescriptor;
import work.blockscript.descriptor.BlockKind;
import work.blockscript.generator.GenerationContext;

/**
 * Performs an HTTP request; the runtime stores the response on {@code data}. A {@code SAFE}
 * request records failures on {@code data} instead of aborting the run.
 */
public final class HttpRequestBlockInstance extends AbstractBlockInstance {
    private static final String SAFE = "SAFE";

    private boolean safe;

    public HttpRequestBlockInstance(BlockDescriptor descriptor) {
        super(descriptor, BlockKind.HTTP_REQUEST);
    }

    public boolean isSafe() {
        return safe;
    }

    public void setSafe(boolean safe) {
        this.safe = safe;
    }

    @Override
    protected void readBodyLine(SourceLine line) {
        if (line.text().equals(SAFE)) {
            safe = true;
        } else {
            readSetting(line);
        }
    }

    @Override
    protected void writeBody(List<String> lines) {
        if (safe) {
            lines.add(INDENT + SAFE);
        }
    }

    @Override
    protected String emit(GenerationContext context) {
        var arguments = new ArrayList<String>();
        arguments.add("data");
        for (String name : descriptor().parameterNames()) {
            arguments.add(resolve(name));
        }
        String call = descriptor().callee() + "(" + String.join(", ", arguments) + ");\n";
        if (!safe) {
            return call;
        }
        return "try {\n"
            + "    " + call
            + "} catch (Exception safeException) {\n"
            + "    data.setError(safeException);\n"
            + "}\n";
    }

    @Override
    public boolean equals(Object other) {
        return super.equals(other) && safe == ((HttpRequestBlockInstance) other).safe;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), safe);
    }
}
