package work.blockscript.generator;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.blockscript.block.BlockInstance;
import work.blockscript.block.BlockScript;

/**
 * Emits one linear Java statement sequence for a script. Disabled blocks are skipped here, so they
 * neither emit code nor declare variables. Any failure aborts the whole run.
 */
public final class ScriptGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(ScriptGenerator.class);

    public GeneratedProgram generate(BlockScript script) {
        var context = new GenerationContext();
        var source = new StringBuilder();
        for (BlockInstance block : script) {
            if (block.isDisabled()) {
                LOG.trace("Skipping disabled block {} ({})", block.id(), block.label());
                continue;
            }
            source.append(block.generate(context));
        }
        var defined = context.definedVariables().asList();
        LOG.debug("Generated {} blocks, {} variables declared", script.size(), defined.size());
        return new GeneratedProgram(source.toString(), defined, context.capturedVariables());
    }

    public GeneratedProgram generate(List<? extends BlockInstance> blocks) {
        return generate(BlockScript.of(blocks));
    }

    public String generateSource(BlockScript script) {
        return generate(script).source();
    }
}
