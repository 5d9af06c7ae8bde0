package work.blockscript.generator;

import java.util.List;

/**
 * Output of a generation run: the statements plus the variables they declare and capture.
 */
public record GeneratedProgram(String source, List<String> definedVariables, List<String> capturedVariables) {
    public GeneratedProgram {
        definedVariables = List.copyOf(definedVariables);
        capturedVariables = List.copyOf(capturedVariables);
    }
}
