package work.blockscript.descriptor;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.blockscript.setting.DictValue;
import work.blockscript.setting.FixedValue;
import work.blockscript.setting.Interpolated;
import work.blockscript.setting.ListValue;
import work.blockscript.setting.SettingValue;
import work.blockscript.setting.VariableRef;

/**
 * Reads descriptor catalogs. TOML catalogs use {@code [[block]]} entries with nested
 * {@code [[block.parameter]]} tables; YAML/JSON catalogs use the same keys.
 *
 * <pre>
 * [[block]]
 * id = "HashString"
 * kind = "function"
 * returnType = "String"
 *
 *   [[block.parameter]]
 *   name = "hashFunction"
 *   type = "enum"
 *   enumType = "HashFunction"
 *   values = ["MD5", "SHA1"]
 *   default = "MD5"
 * </pre>
 */
public final class DescriptorCatalogLoader {
    private static final Logger LOG = LoggerFactory.getLogger(DescriptorCatalogLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private DescriptorCatalogLoader() {}

    public static List<BlockDescriptor> load(Path path) {
        String fileName = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        try (var in = Files.newInputStream(path)) {
            return fileName.endsWith(".toml") ? fromToml(in, path.toString()) : fromYaml(in, path.toString());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read descriptor catalog: " + path, ex);
        }
    }

    public static List<BlockDescriptor> loadResource(String resource) {
        try (var in = DescriptorCatalogLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Descriptor catalog not found on classpath: " + resource);
            }
            return resource.endsWith(".toml") ? fromToml(in, resource) : fromYaml(in, resource);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read descriptor catalog: " + resource, ex);
        }
    }

    public static List<BlockDescriptor> fromToml(InputStream in, String source) throws IOException {
        TomlParseResult result = Toml.parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        if (result.hasErrors()) {
            throw new IllegalStateException("Invalid descriptor catalog " + source + ": " + result.errors().get(0));
        }
        return fromPlain(toPlainTable(result), source);
    }

    public static List<BlockDescriptor> fromYaml(InputStream in, String source) throws IOException {
        Map<String, Object> root = YAML_MAPPER.readValue(in, MAP_TYPE);
        return fromPlain(root == null ? Map.of() : root, source);
    }

    static List<BlockDescriptor> fromPlain(Map<String, Object> root, String source) {
        var descriptors = new ArrayList<BlockDescriptor>();
        for (var entry : asMaps(root.get("block"), source, "block")) {
            try {
                descriptors.add(toDescriptor(entry, source));
            } catch (IllegalArgumentException ex) {
                throw new IllegalStateException("Invalid descriptor catalog " + source + ": " + ex.getMessage(), ex);
            }
        }
        LOG.debug("Loaded {} block descriptors from {}", descriptors.size(), source);
        return descriptors;
    }

    private static BlockDescriptor toDescriptor(Map<String, Object> entry, String source) {
        String id = string(entry.get("id"));
        var builder = BlockDescriptor.builder(id, BlockKind.from(string(entry.get("kind"))))
            .name(string(entry.get("name")))
            .category(string(entry.get("category")))
            .description(string(entry.get("description")))
            .callee(string(entry.get("callee")))
            .returnType(string(entry.get("returnType")));
        for (var parameter : asMaps(entry.get("parameter"), source, "block " + id + " parameter")) {
            builder.parameter(toSchema(parameter, id));
        }
        return builder.build();
    }

    private static ParamSchema toSchema(Map<String, Object> parameter, String blockId) {
        String name = string(parameter.get("name"));
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("parameter without name in block " + blockId);
        }
        ParamType type = ParamType.from(string(parameter.get("type")));
        List<String> values = new ArrayList<>();
        if (parameter.get("values") instanceof List<?> raw) {
            raw.forEach(item -> values.add(String.valueOf(item)));
        }
        SettingValue defaultValue = toDefault(parameter, type, values, blockId + "." + name);
        return new ParamSchema(name, type, defaultValue, values, string(parameter.get("enumType")));
    }

    private static SettingValue toDefault(Map<String, Object> parameter, ParamType type, List<String> values, String where) {
        if (parameter.get("variable") != null) {
            return new VariableRef(string(parameter.get("variable")));
        }
        if (parameter.get("interpolated") != null) {
            if (!type.acceptsInterpolation()) {
                throw new IllegalArgumentException(where + " cannot default to an interpolated value");
            }
            return new Interpolated(string(parameter.get("interpolated")));
        }
        Object raw = parameter.get("default");
        if (raw == null) {
            return null;
        }
        return switch (type) {
            case STRING -> FixedValue.of(String.valueOf(raw));
            case INT -> FixedValue.of(toInteger(raw, where));
            case FLOAT -> FixedValue.of(toNumber(raw, where).doubleValue());
            case BOOL -> FixedValue.of(toBoolean(raw, where));
            case BYTES -> FixedValue.ofBytes(Base64.getDecoder().decode(String.valueOf(raw)));
            case ENUM -> {
                String token = String.valueOf(raw);
                if (!values.contains(token)) {
                    throw new IllegalArgumentException(where + " default " + token + " is not one of " + values);
                }
                yield FixedValue.of(token);
            }
            case LIST -> {
                if (!(raw instanceof List<?> list)) {
                    throw new IllegalArgumentException(where + " default must be an array");
                }
                yield ListValue.ofStrings(list.stream().map(String::valueOf).toList());
            }
            case DICT -> {
                if (!(raw instanceof Map<?, ?> map)) {
                    throw new IllegalArgumentException(where + " default must be a table");
                }
                var entries = new LinkedHashMap<String, String>();
                map.forEach((key, value) -> entries.put(String.valueOf(key), String.valueOf(value)));
                yield DictValue.ofStrings(entries);
            }
        };
    }

    private static int toInteger(Object raw, String where) {
        double value = toNumber(raw, where).doubleValue();
        if (value != Math.rint(value) || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(where + " default is not a 32-bit integer: " + raw);
        }
        return (int) value;
    }

    private static Number toNumber(Object raw, String where) {
        if (raw instanceof Number number) {
            return number;
        }
        try {
            return Double.valueOf(String.valueOf(raw));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(where + " default is not a number: " + raw);
        }
    }

    private static boolean toBoolean(Object raw, String where) {
        if (raw instanceof Boolean bool) {
            return bool;
        }
        String text = String.valueOf(raw);
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return Boolean.parseBoolean(text);
        }
        throw new IllegalArgumentException(where + " default is not a boolean: " + raw);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> asMaps(Object raw, String source, String what) {
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            throw new IllegalStateException("Invalid descriptor catalog " + source + ": " + what + " must be a list");
        }
        var maps = new ArrayList<Map<String, Object>>();
        for (var item : list) {
            if (!(item instanceof Map<?, ?>)) {
                throw new IllegalStateException("Invalid descriptor catalog " + source + ": " + what + " entries must be tables");
            }
            maps.add((Map<String, Object>) item);
        }
        return maps;
    }

    private static String string(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static Map<String, Object> toPlainTable(TomlTable table) {
        var map = new LinkedHashMap<String, Object>();
        for (String key : table.keySet()) {
            map.put(key, toPlain(table.get(List.of(key))));
        }
        return map;
    }

    private static Object toPlain(Object value) {
        if (value instanceof TomlTable table) {
            return toPlainTable(table);
        }
        if (value instanceof TomlArray array) {
            var list = new ArrayList<Object>(array.size());
            for (int i = 0; i < array.size(); i++) {
                list.add(toPlain(array.get(i)));
            }
            return list;
        }
        return value;
    }
}
