package work.blockscript.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.blockscript.block.BlockInstance;
import work.blockscript.block.BlockScript;
import work.blockscript.codec.CodecOptions;
import work.blockscript.codec.ScriptCodec;
import work.blockscript.descriptor.DescriptorRegistries;
import work.blockscript.descriptor.DescriptorRegistry;
import work.blockscript.error.BlockScriptException;
import work.blockscript.generator.GeneratedProgram;
import work.blockscript.generator.ScriptGenerator;
import work.blockscript.setting.SettingWriter;

/**
 * Public entry point for embedding the codec and generator: decode a script, then emit code,
 * canonical script text or a JSON outline.
 */
public final class BlockScriptCompiler {
    private static final Logger LOG = LoggerFactory.getLogger(BlockScriptCompiler.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    public CompileResult compile(CompileConfiguration configuration) {
        var started = Instant.now();
        try {
            var registry = bootstrapRegistry(configuration);
            var codec = new ScriptCodec(registry, new CodecOptions(configuration.printDefaults()));
            var script = codec.decode(configuration.source().read());

            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("script", configuration.source().display());
            metadata.put("emit", configuration.emitTarget().name().toLowerCase(Locale.ROOT));
            metadata.put("blocks", script.size());
            metadata.put("logLevel", configuration.logLevel().name());

            String output = switch (configuration.emitTarget()) {
                case CODE -> {
                    GeneratedProgram program = new ScriptGenerator().generate(script);
                    metadata.put("definedVariables", program.definedVariables());
                    metadata.put("capturedVariables", program.capturedVariables());
                    yield program.source();
                }
                case SCRIPT -> codec.encode(script);
                case JSON -> outline(script);
            };
            if (configuration.outputFile().isPresent()) {
                var target = writeOutput(configuration.outputFile().get(), output);
                metadata.put("outputFile", target.toString());
            }
            metadata.put("status", "ok");
            return CompileResult.success(output, metadata, started);
        } catch (BlockScriptException ex) {
            LOG.debug("Compilation of {} failed", configuration.source().display(), ex);
            var errorMeta = new LinkedHashMap<String, Object>();
            errorMeta.put("script", configuration.source().display());
            errorMeta.putAll(ex.toDiagnostic());
            errorMeta.put("error", ex.getMessage());
            return CompileResult.failure(ex.getMessage(), errorMeta, started);
        } catch (Exception ex) {
            LOG.debug("Compilation of {} failed", configuration.source().display(), ex);
            var errorMeta = new LinkedHashMap<String, Object>();
            errorMeta.put("script", configuration.source().display());
            if (ex.getMessage() != null && !ex.getMessage().isBlank()) {
                errorMeta.put("error", ex.getMessage());
            }
            return CompileResult.failure(ex.getMessage(), errorMeta, started);
        }
    }

    private DescriptorRegistry bootstrapRegistry(CompileConfiguration configuration) {
        if (configuration.extraCatalogs().isEmpty()) {
            return DescriptorRegistries.createDefault();
        }
        return DescriptorRegistries.create(configuration.extraCatalogs());
    }

    private Path writeOutput(Path file, String output) throws IOException {
        var target = file.toAbsolutePath().normalize();
        var parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, output, StandardCharsets.UTF_8);
        LOG.debug("Wrote {} characters to {}", output.length(), target);
        return target;
    }

    static String outline(BlockScript script) throws JsonProcessingException {
        List<Map<String, Object>> blocks = new ArrayList<>();
        for (BlockInstance block : script) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("id", block.id());
            entry.put("label", block.label());
            entry.put("disabled", block.isDisabled());
            entry.put("line", block.sourceLine());
            var settings = new LinkedHashMap<String, Object>();
            block.settings().forEach((name, setting) -> {
                var schema = block.descriptor().parameter(name);
                if (schema != null) {
                    settings.put(name, SettingWriter.writeValue(setting.value(), schema.type()));
                }
            });
            entry.put("settings", settings);
            blocks.add(entry);
        }
        return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(blocks);
    }
}
