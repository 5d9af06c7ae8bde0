package work.blockscript.block;

import work.blockscript.descriptor.BlockDescriptor;
import work.blockscript.descriptor.DescriptorRegistry;

/**
 * Creates default instances (settings seeded from descriptor defaults) for each block variant.
 */
public final class BlockFactory {
    private BlockFactory() {}

    public static BlockInstance create(BlockDescriptor descriptor) {
        return switch (descriptor.kind()) {
            case PARSE -> new ParseBlockInstance(descriptor);
            case FUNCTION -> new FunctionBlockInstance(descriptor);
            case HTTP_REQUEST -> new HttpRequestBlockInstance(descriptor);
            case KEYCHECK -> new KeycheckBlockInstance(descriptor);
            case SCRIPT -> new ScriptBlockInstance(descriptor);
        };
    }

    public static BlockInstance create(DescriptorRegistry registry, String kindId) {
        return create(registry.get(kindId));
    }
}
