package work.blockscript.codec;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.blockscript.block.BlockFactory;
import work.blockscript.block.BlockInstance;
import work.blockscript.block.BlockScript;
import work.blockscript.descriptor.DescriptorRegistry;
import work.blockscript.error.ScriptParseException;
import work.blockscript.error.UnknownBlockKindException;

/**
 * Converts between script text and {@link BlockScript}. Each block starts at a
 * {@code BLOCK:<kindId>} header and runs until the next header; blocks are written
 * separated by a blank line.
 */
public final class ScriptCodec {
    private static final Logger LOG = LoggerFactory.getLogger(ScriptCodec.class);
    private static final Pattern HEADER = Pattern.compile("^BLOCK:(.*)$");

    private final DescriptorRegistry registry;
    private final CodecOptions options;

    public ScriptCodec(DescriptorRegistry registry) {
        this(registry, CodecOptions.defaults());
    }

    public ScriptCodec(DescriptorRegistry registry, CodecOptions options) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.options = options == null ? CodecOptions.defaults() : options;
    }

    public BlockScript decode(String text) {
        List<SourceLine> lines = ScriptLines.split(text);
        var script = new BlockScript();
        int index = 0;
        while (index < lines.size() && lines.get(index).isBlank()) {
            index++;
        }
        while (index < lines.size()) {
            var header = lines.get(index);
            Matcher matcher = HEADER.matcher(header.text());
            if (!matcher.matches()) {
                throw new ScriptParseException(header.number(), header.text(),
                    "Expected a BLOCK:<id> header: " + header.excerpt());
            }
            String kindId = matcher.group(1).trim();
            if (kindId.isEmpty()) {
                throw new ScriptParseException(header.number(), header.text(), "Missing block id: " + header.excerpt());
            }
            var descriptor = registry.find(kindId)
                .orElseThrow(() -> new UnknownBlockKindException(kindId, header.number(), header.text()));

            int end = index + 1;
            while (end < lines.size() && !HEADER.matcher(lines.get(end).text()).matches()) {
                end++;
            }
            var block = BlockFactory.create(descriptor);
            block.setSourceLine(header.number());
            block.deserialize(lines.subList(index + 1, end));
            LOG.trace("Decoded {} at line {}", kindId, header.number());
            script.add(block);
            index = end;
        }
        LOG.debug("Decoded script with {} blocks", script.size());
        return script;
    }

    public String encode(BlockScript script) {
        var builder = new StringBuilder();
        for (BlockInstance block : script) {
            if (builder.length() > 0) {
                builder.append('\n');
            }
            builder.append("BLOCK:").append(block.id()).append('\n');
            String body = block.serialize(options);
            if (!body.isEmpty()) {
                builder.append(body).append('\n');
            }
        }
        LOG.debug("Encoded script with {} blocks", script.size());
        return builder.toString();
    }

    public String encode(List<? extends BlockInstance> blocks) {
        return encode(BlockScript.of(blocks));
    }
}
