package work.blockscript.block;

import java.util.ArrayList;
import java.util.List;
import work.blockscript.codec.SourceLine;
import work.blockscript.descriptor.BlockDescriptor;
import work.blockscript.descriptor.BlockKind;
import work.blockscript.generator.GenerationContext;

/**
 * Calls a runtime function with every parameter in declaration order, e.g.
 * {@code var hashStringOutput = hashString(data, "abc", HashFunction.MD5);}.
 * Functions without a return type are emitted as plain calls and take no output line.
 */
public final class FunctionBlockInstance extends OutputBlockInstance {
    public FunctionBlockInstance(BlockDescriptor descriptor) {
        super(descriptor, BlockKind.FUNCTION, descriptor.callee() + "Output");
    }

    @Override
    protected void readBodyLine(SourceLine line) {
        if (isOutputLine(line)) {
            if (!descriptor().hasReturnValue()) {
                throw parseError(line, "Block " + id() + " does not return a value");
            }
            readOutputLine(line);
        } else {
            readSetting(line);
        }
    }

    @Override
    protected void writeBody(List<String> lines) {
        if (descriptor().hasReturnValue()) {
            writeOutputLine(lines);
        }
    }

    @Override
    protected String emit(GenerationContext context) {
        var arguments = new ArrayList<String>();
        arguments.add("data");
        for (String name : descriptor().parameterNames()) {
            arguments.add(resolve(name));
        }
        String call = descriptor().callee() + "(" + String.join(", ", arguments) + ")";
        if (!descriptor().hasReturnValue()) {
            return call + ";\n";
        }
        return emitOutput(context, call);
    }
}
