package work.blockscript.api;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration for one {@link BlockScriptCompiler} run.
 */
public record CompileConfiguration(
    ScriptSource source,
    Optional<Path> outputFile,
    EmitTarget emitTarget,
    List<Path> extraCatalogs,
    boolean printDefaults,
    LogLevel logLevel
) {
    public CompileConfiguration {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(outputFile, "outputFile");
        Objects.requireNonNull(emitTarget, "emitTarget");
        Objects.requireNonNull(logLevel, "logLevel");
        extraCatalogs = List.copyOf(extraCatalogs);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ScriptSource source;
        private Optional<Path> outputFile = Optional.empty();
        private EmitTarget emitTarget = EmitTarget.CODE;
        private final List<Path> extraCatalogs = new ArrayList<>();
        private boolean printDefaults = true;
        private LogLevel logLevel = LogLevel.WARN;

        public Builder source(ScriptSource source) {
            this.source = source;
            return this;
        }

        public Builder scriptFile(Path path) {
            return source(ScriptSource.forPath(path));
        }

        public Builder scriptText(String text) {
            return source(ScriptSource.forText(text));
        }

        public Builder outputFile(Path outputFile) {
            this.outputFile = Optional.ofNullable(outputFile);
            return this;
        }

        public Builder emitTarget(EmitTarget emitTarget) {
            this.emitTarget = emitTarget;
            return this;
        }

        public Builder extraCatalogs(List<Path> catalogs) {
            this.extraCatalogs.clear();
            if (catalogs != null) {
                this.extraCatalogs.addAll(catalogs);
            }
            return this;
        }

        public Builder addCatalog(Path catalog) {
            this.extraCatalogs.add(catalog);
            return this;
        }

        public Builder printDefaults(boolean printDefaults) {
            this.printDefaults = printDefaults;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public CompileConfiguration build() {
            return new CompileConfiguration(
                source,
                outputFile,
                emitTarget,
                extraCatalogs,
                printDefaults,
                logLevel
            );
        }
    }
}
