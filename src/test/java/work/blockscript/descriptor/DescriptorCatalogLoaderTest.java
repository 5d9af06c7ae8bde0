package work.blockscript.descriptor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.blockscript.setting.FixedValue;
import work.blockscript.support.BlockScriptTestSupport;

class DescriptorCatalogLoaderTest {
    @Test
    void loadsYamlCatalog() {
        var descriptors = DescriptorCatalogLoader.load(BlockScriptTestSupport.resource("catalogs", "logging.yaml"));
        assertEquals(1, descriptors.size());
        var log = descriptors.get(0);
        assertEquals("LogMessage", log.id());
        assertEquals(BlockKind.FUNCTION, log.kind());
        assertEquals("log", log.callee());
        assertNull(log.returnType());
        var level = log.parameter("level");
        assertEquals(ParamType.ENUM, level.type());
        assertEquals("LogLevel", level.enumType());
        assertEquals(List.of("INFO", "WARN"), level.enumValues());
        assertEquals(FixedValue.of("INFO"), level.defaultValue());
    }

    @Test
    void extraCatalogsExtendTheBundledSet() {
        var registry = DescriptorRegistries.create(List.of(BlockScriptTestSupport.resource("catalogs", "logging.yaml")));
        assertTrue(registry.contains("LogMessage"));
        assertTrue(registry.contains("Parse"));
        assertTrue(registry.isFrozen());
    }

    @Test
    void tomlDefaultsAreTyped(@TempDir Path dir) throws IOException {
        var catalog = dir.resolve("custom.toml");
        Files.writeString(catalog, String.join("\n",
            "[[block]]",
            "id = \"Wait\"",
            "kind = \"function\"",
            "",
            "  [[block.parameter]]",
            "  name = \"milliseconds\"",
            "  type = \"int\"",
            "  default = 250",
            "",
            "  [[block.parameter]]",
            "  name = \"jitter\"",
            "  type = \"float\"",
            "  default = 0.5",
            ""));
        var wait = DescriptorCatalogLoader.load(catalog).get(0);
        assertEquals("Wait", wait.name());
        assertEquals(FixedValue.of(250), wait.parameter("milliseconds").defaultValue());
        assertEquals(FixedValue.of(0.5d), wait.parameter("jitter").defaultValue());
    }

    @Test
    void intDefaultsMustBeWholeAndInRange(@TempDir Path dir) throws IOException {
        for (String bad : new String[] {"1.5", "3000000000"}) {
            var catalog = dir.resolve("int-" + bad.length() + ".toml");
            Files.writeString(catalog, String.join("\n",
                "[[block]]",
                "id = \"Wait\"",
                "",
                "  [[block.parameter]]",
                "  name = \"milliseconds\"",
                "  type = \"int\"",
                "  default = " + bad,
                ""));
            var ex = assertThrows(IllegalStateException.class, () -> DescriptorCatalogLoader.load(catalog), bad);
            assertTrue(ex.getMessage().contains("Wait.milliseconds"), ex.getMessage());
        }
    }

    @Test
    void enumDefaultOutsideValuesIsRejected(@TempDir Path dir) throws IOException {
        var catalog = dir.resolve("broken.toml");
        Files.writeString(catalog, String.join("\n",
            "[[block]]",
            "id = \"Broken\"",
            "",
            "  [[block.parameter]]",
            "  name = \"mode\"",
            "  type = \"enum\"",
            "  values = [\"A\", \"B\"]",
            "  default = \"C\"",
            ""));
        var ex = assertThrows(IllegalStateException.class, () -> DescriptorCatalogLoader.load(catalog));
        assertTrue(ex.getMessage().contains("Broken.mode"), ex.getMessage());
    }

    @Test
    void unknownParameterTypeIsRejected(@TempDir Path dir) throws IOException {
        var catalog = dir.resolve("broken.yaml");
        Files.writeString(catalog, "block:\n  - id: Odd\n    parameter:\n      - name: x\n        type: matrix\n");
        assertThrows(IllegalStateException.class, () -> DescriptorCatalogLoader.load(catalog));
    }

    @Test
    void missingResourceIsReported() {
        assertThrows(IllegalStateException.class, () -> DescriptorCatalogLoader.loadResource("/descriptors/none.toml"));
    }
}
