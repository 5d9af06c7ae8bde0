package work.blockscript.descriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable schema of a block kind. Parameters keep their declaration order, which is also the
 * order settings are written in and the order function arguments are generated in.
 */
public final class BlockDescriptor {
    private final String id;
    private final String name;
    private final BlockKind kind;
    private final String category;
    private final String description;
    private final String callee;
    private final String returnType;
    private final Map<String, ParamSchema> parameters;

    private BlockDescriptor(Builder builder) {
        this.id = requireText(builder.id, "id");
        this.name = builder.name == null || builder.name.isBlank() ? builder.id : builder.name;
        this.kind = Objects.requireNonNull(builder.kind, "kind");
        this.category = builder.category == null ? "" : builder.category;
        this.description = builder.description == null ? "" : builder.description;
        this.callee = builder.callee == null || builder.callee.isBlank() ? lowerCamel(builder.id) : builder.callee;
        this.returnType = builder.returnType == null || builder.returnType.isBlank() ? null : builder.returnType;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
    }

    public static Builder builder(String id, BlockKind kind) {
        return new Builder(id, kind);
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public BlockKind kind() {
        return kind;
    }

    public String category() {
        return category;
    }

    public String description() {
        return description;
    }

    /**
     * Runtime method the generated statement calls, defaulting to the lower camel case id.
     */
    public String callee() {
        return callee;
    }

    /**
     * Runtime return type for function blocks, or {@code null} when the call produces no value.
     */
    public String returnType() {
        return returnType;
    }

    public boolean hasReturnValue() {
        return returnType != null;
    }

    public Map<String, ParamSchema> parameters() {
        return parameters;
    }

    public ParamSchema parameter(String name) {
        return parameters.get(name);
    }

    public boolean hasParameter(String name) {
        return parameters.containsKey(name);
    }

    public List<String> parameterNames() {
        return List.copyOf(parameters.keySet());
    }

    @Override
    public String toString() {
        return "BlockDescriptor[" + id + ", " + kind + "]";
    }

    static String lowerCamel(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        int upper = 0;
        while (upper < value.length() && Character.isUpperCase(value.charAt(upper))) {
            upper++;
        }
        if (upper == 0) {
            return value;
        }
        // NTLMHash -> ntlmHash, Hash -> hash, AESEncrypt -> aesEncrypt
        int cut = upper == 1 || upper == value.length() ? upper : upper - 1;
        return value.substring(0, cut).toLowerCase(Locale.ROOT) + value.substring(cut);
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Descriptor " + field + " is required");
        }
        return value;
    }

    public static final class Builder {
        private final String id;
        private final BlockKind kind;
        private String name;
        private String category;
        private String description;
        private String callee;
        private String returnType;
        private final Map<String, ParamSchema> parameters = new LinkedHashMap<>();

        private Builder(String id, BlockKind kind) {
            this.id = id;
            this.kind = kind;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder callee(String callee) {
            this.callee = callee;
            return this;
        }

        public Builder returnType(String returnType) {
            this.returnType = returnType;
            return this;
        }

        public Builder parameter(ParamSchema schema) {
            if (parameters.putIfAbsent(schema.name(), schema) != null) {
                throw new IllegalArgumentException("Duplicate parameter " + schema.name() + " in block " + id);
            }
            return this;
        }

        public BlockDescriptor build() {
            return new BlockDescriptor(this);
        }
    }
}
