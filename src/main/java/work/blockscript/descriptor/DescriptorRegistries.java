package work.blockscript.descriptor;

import java.nio.file.Path;
import java.util.List;

/**
 * Shared registry bootstrap so the CLI, the compiler facade and tests use the same catalog set.
 */
public final class DescriptorRegistries {
    static final List<String> BUNDLED_CATALOGS = List.of(
        "/descriptors/core.toml",
        "/descriptors/crypto.toml"
    );

    private static volatile DescriptorRegistry defaultRegistry;

    private DescriptorRegistries() {}

    /**
     * Frozen registry holding the bundled catalogs, built once per process.
     */
    public static DescriptorRegistry createDefault() {
        var registry = defaultRegistry;
        if (registry == null) {
            synchronized (DescriptorRegistries.class) {
                registry = defaultRegistry;
                if (registry == null) {
                    registry = create(List.of());
                    defaultRegistry = registry;
                }
            }
        }
        return registry;
    }

    /**
     * Bundled catalogs plus extra catalog files; later catalogs override earlier ids.
     */
    public static DescriptorRegistry create(List<Path> extraCatalogs) {
        var registry = new DescriptorRegistry();
        for (String resource : BUNDLED_CATALOGS) {
            registry.registerAll(DescriptorCatalogLoader.loadResource(resource));
        }
        if (extraCatalogs != null) {
            for (Path catalog : extraCatalogs) {
                registry.registerAll(DescriptorCatalogLoader.load(catalog));
            }
        }
        return registry.freeze();
    }
}
