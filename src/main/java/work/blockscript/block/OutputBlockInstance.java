package work.blockscript.block;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.blockscript.codec.SourceLine;
import work.blockscript.descriptor.BlockDescriptor;
import work.blockscript.descriptor.BlockKind;
import work.blockscript.generator.GenerationContext;
import work.blockscript.setting.JavaLiterals;

/**
 * Block that stores its result in a variable, declared with {@code => VAR @name} or
 * {@code => CAP @name} (capture: the runtime also collects the value into the task result).
 */
public abstract class OutputBlockInstance extends AbstractBlockInstance {
    private static final Pattern OUTPUT = Pattern.compile("^=>\\s*([A-Za-z]{3})\\s+(.*)$");

    private String outputVariable;
    private boolean capture;

    protected OutputBlockInstance(BlockDescriptor descriptor, BlockKind expectedKind, String defaultOutputVariable) {
        super(descriptor, expectedKind);
        this.outputVariable = VariableNames.makeValid(defaultOutputVariable);
    }

    public String outputVariable() {
        return outputVariable;
    }

    public void setOutputVariable(String outputVariable) {
        this.outputVariable = VariableNames.makeValid(outputVariable);
    }

    public boolean isCapture() {
        return capture;
    }

    public void setCapture(boolean capture) {
        this.capture = capture;
    }

    protected final boolean isOutputLine(SourceLine line) {
        return line.text().startsWith("=>");
    }

    protected final void readOutputLine(SourceLine line) {
        Matcher matcher = OUTPUT.matcher(line.text());
        String target = matcher.matches() ? matcher.group(2).trim() : "";
        String type = matcher.matches() ? matcher.group(1) : "";
        boolean isCap = "CAP".equalsIgnoreCase(type);
        if ((!isCap && !"VAR".equalsIgnoreCase(type)) || !target.startsWith("@") || target.length() < 2) {
            throw parseError(line, "The output variable declaration is in the wrong format");
        }
        this.capture = isCap;
        setOutputVariable(target.substring(1).trim());
    }

    protected final void writeOutputLine(List<String> lines) {
        lines.add(INDENT + "=> " + (capture ? "CAP" : "VAR") + " @" + outputVariable);
    }

    /**
     * Assigns {@code expression} to the output variable, followed by the capture marker when requested.
     */
    protected final String emitOutput(GenerationContext context, String expression) {
        var statements = new StringBuilder(assignment(context, outputVariable, expression));
        if (capture) {
            context.markCaptured(outputVariable);
            statements.append("data.markForCapture(").append(JavaLiterals.quoteJava(outputVariable)).append(");\n");
        }
        return statements.toString();
    }

    @Override
    public boolean equals(Object other) {
        return super.equals(other)
            && outputVariable.equals(((OutputBlockInstance) other).outputVariable)
            && capture == ((OutputBlockInstance) other).capture;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), outputVariable, capture);
    }
}
