package work.blockscript.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.blockscript.api.BlockScriptCompiler;
import work.blockscript.api.CompileConfiguration;
import work.blockscript.api.CompileResult;
import work.blockscript.api.EmitTarget;
import work.blockscript.api.LogLevel;
import work.blockscript.api.ScriptSource;

@CommandLine.Command(
    name = "blockscript",
    description = "Decode a block script and emit Java code, canonical script text or a JSON outline.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class BlockScriptCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-s", "--script"},
        required = true,
        paramLabel = "PATH|-",
        description = "Script file; use '-' to read from stdin."
    )
    private String script;

    @CommandLine.Option(
        names = {"-e", "--emit"},
        description = "What to emit (code|script|json).",
        defaultValue = "code"
    )
    private String emitRaw;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Write the emitted text to this file instead of stdout.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String output;

    @CommandLine.Option(
        names = "--catalog",
        paramLabel = "PATH",
        description = "Extra descriptor catalog (TOML or YAML); may be repeated.",
        arity = "1..*"
    )
    private List<String> catalogs = new ArrayList<>();

    @CommandLine.Option(
        names = "--print-defaults",
        description = "Write settings that still hold their default value (script emit).",
        negatable = true,
        defaultValue = "true",
        fallbackValue = "true"
    )
    private boolean printDefaults = true;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--json",
        description = "Print the full compilation result as JSON."
    )
    private boolean json;

    @Override
    public Integer call() {
        LogLevel logLevel = resolveLogLevel();
        LoggingSetup.apply(logLevel);

        CompileConfiguration.Builder builder = CompileConfiguration.builder()
            .source(resolveSource())
            .emitTarget(resolveEmitTarget())
            .printDefaults(printDefaults)
            .logLevel(logLevel);
        for (String catalog : catalogs) {
            builder.addCatalog(resolveExistingFile(catalog, "Catalog file not found: "));
        }
        if (output != null && !output.isBlank()) {
            builder.outputFile(Paths.get(output).toAbsolutePath().normalize());
        }

        CompileResult result = new BlockScriptCompiler().compile(builder.build());
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (json) {
            out.println(result.toPrettyJson());
        } else if (result.isSuccess()) {
            if (output == null || output.isBlank()) {
                out.print(result.output());
            }
        } else {
            err.println(spec.commandLine().getColorScheme().errorText(String.valueOf(result.metadata().get("error"))));
        }
        out.flush();
        err.flush();
        return result.status().exitCode();
    }

    private ScriptSource resolveSource() {
        if ("-".equals(script)) {
            return ScriptSource.forText(readStdin());
        }
        return ScriptSource.forPath(resolveExistingFile(script, "Script file not found: "));
    }

    private Path resolveExistingFile(String value, String message) {
        Path path = Paths.get(value).toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw new CommandLine.ParameterException(spec.commandLine(), message + path);
        }
        return path;
    }

    private EmitTarget resolveEmitTarget() {
        try {
            return EmitTarget.from(emitRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private LogLevel resolveLogLevel() {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv("BLOCKSCRIPT_LOG_LEVEL");
        }
        try {
            return LogLevel.from(candidate);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private String readStdin() {
        try {
            InputStream stdin = System.in;
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ExecutionException(spec.commandLine(), "Unable to read stdin: " + ex.getMessage(), ex);
        }
    }
}
