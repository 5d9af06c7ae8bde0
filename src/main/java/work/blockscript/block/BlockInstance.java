package work.blockscript.block;

import java.util.List;
import java.util.Map;
import work.blockscript.codec.CodecOptions;
import work.blockscript.codec.ScriptLines;
import work.blockscript.codec.SourceLine;
import work.blockscript.descriptor.BlockDescriptor;
import work.blockscript.generator.GenerationContext;
import work.blockscript.setting.BlockSetting;

/**
 * Capability interface shared by every block variant: text in, text out, code out.
 */
public interface BlockInstance {
    BlockDescriptor descriptor();

    default String id() {
        return descriptor().id();
    }

    boolean isDisabled();

    void setDisabled(boolean disabled);

    String label();

    void setLabel(String label);

    /**
     * Mutable, descriptor-ordered settings keyed by parameter name.
     */
    Map<String, BlockSetting> settings();

    /**
     * 1-based line of the {@code BLOCK:} header this instance was decoded from, 0 when built in code.
     */
    int sourceLine();

    void setSourceLine(int line);

    /**
     * Body lines (everything after the {@code BLOCK:} header), joined with newlines.
     */
    String serialize(CodecOptions options);

    default String serialize() {
        return serialize(CodecOptions.defaults());
    }

    /**
     * Reads the body lines of this block, updating it in place.
     *
     * @return the number of lines consumed
     */
    int deserialize(List<SourceLine> lines);

    default int deserialize(String text, int startLine) {
        return deserialize(ScriptLines.split(text, startLine));
    }

    /**
     * Emits the Java statements for this block, ending with a newline.
     */
    String generate(GenerationContext context);
}
