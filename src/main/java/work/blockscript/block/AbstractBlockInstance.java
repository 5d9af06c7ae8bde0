package work.blockscript.block;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.blockscript.codec.CodecOptions;
import work.blockscript.codec.SourceLine;
import work.blockscript.descriptor.BlockDescriptor;
import work.blockscript.descriptor.BlockKind;
import work.blockscript.descriptor.ParamSchema;
import work.blockscript.error.InvalidSettingException;
import work.blockscript.error.ScriptParseException;
import work.blockscript.generator.GenerationContext;
import work.blockscript.setting.BlockSetting;
import work.blockscript.setting.JavaLiterals;
import work.blockscript.setting.SettingParser;
import work.blockscript.setting.SettingResolver;
import work.blockscript.setting.SettingValue;
import work.blockscript.setting.SettingWriter;
import work.blockscript.setting.VariableRef;

/**
 * Common header handling ({@code DISABLED}, {@code LABEL:}), settings storage and validation.
 * Variants add their own body lines through {@link #readBodyLine} / {@link #writeBody} and
 * their statements through {@link #emit}.
 */
public abstract class AbstractBlockInstance implements BlockInstance {
    protected static final String INDENT = "  ";
    private static final String DISABLED = "DISABLED";
    private static final Pattern LABEL = Pattern.compile("^LABEL:(.*)$");

    private final BlockDescriptor descriptor;
    private final Map<String, BlockSetting> settings = new LinkedHashMap<>();
    private boolean disabled;
    private String label;
    private int sourceLine;

    protected AbstractBlockInstance(BlockDescriptor descriptor, BlockKind expectedKind) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        if (descriptor.kind() != expectedKind) {
            throw new IllegalArgumentException("Descriptor " + descriptor.id() + " is a " + descriptor.kind() + " block, not " + expectedKind);
        }
        this.label = descriptor.name();
        for (ParamSchema schema : descriptor.parameters().values()) {
            settings.put(schema.name(), schema.toBlockSetting());
        }
    }

    @Override
    public BlockDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public boolean isDisabled() {
        return disabled;
    }

    @Override
    public void setDisabled(boolean disabled) {
        this.disabled = disabled;
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public void setLabel(String label) {
        this.label = label == null ? descriptor.name() : label;
    }

    @Override
    public Map<String, BlockSetting> settings() {
        return settings;
    }

    public SettingValue setting(String name) {
        var setting = settings.get(name);
        return setting == null ? null : setting.value();
    }

    public void setSetting(String name, SettingValue value) {
        settings.put(name, new BlockSetting(name, value));
    }

    @Override
    public int sourceLine() {
        return sourceLine;
    }

    @Override
    public void setSourceLine(int line) {
        this.sourceLine = line;
    }

    @Override
    public final String serialize(CodecOptions options) {
        validateSettings();
        var lines = new ArrayList<String>();
        if (disabled) {
            lines.add(INDENT + DISABLED);
        }
        if (!label.equals(descriptor.name())) {
            lines.add(INDENT + "LABEL:" + label);
        }
        for (ParamSchema schema : descriptor.parameters().values()) {
            var setting = settings.get(schema.name());
            if (setting == null || (!options.printDefaults() && schema.isDefault(setting.value()))) {
                continue;
            }
            lines.add(INDENT + SettingWriter.write(setting, schema));
        }
        writeBody(lines);
        return String.join("\n", lines);
    }

    @Override
    public final int deserialize(List<SourceLine> lines) {
        int index = 0;
        while (index < lines.size()) {
            var line = lines.get(index);
            if (line.isBlank()) {
                index++;
            } else if (line.text().equals(DISABLED)) {
                disabled = true;
                index++;
            } else {
                Matcher matcher = LABEL.matcher(line.text());
                if (!matcher.matches()) {
                    break;
                }
                label = matcher.group(1);
                index++;
            }
        }
        var body = lines.subList(index, lines.size());
        readBody(body);
        return lines.size();
    }

    /**
     * Reads the lines left after the common header. The default reads one statement per non-blank line.
     */
    protected void readBody(List<SourceLine> lines) {
        for (var line : lines) {
            if (!line.isBlank()) {
                readBodyLine(line);
            }
        }
    }

    protected void readBodyLine(SourceLine line) {
        readSetting(line);
    }

    protected void writeBody(List<String> lines) {
    }

    protected final void readSetting(SourceLine line) {
        try {
            var setting = SettingParser.parseLine(line.text(), descriptor);
            settings.put(setting.name(), setting);
        } catch (IllegalArgumentException ex) {
            throw new ScriptParseException(line.number(), line.text(),
                "Could not parse the setting (" + ex.getMessage() + "): " + line.excerpt(), ex);
        }
    }

    @Override
    public final String generate(GenerationContext context) {
        validateSettings();
        return emit(context);
    }

    protected abstract String emit(GenerationContext context);

    /**
     * Every stored setting must be a declared parameter of the descriptor.
     */
    protected final void validateSettings() {
        for (String name : settings.keySet()) {
            if (!descriptor.hasParameter(name)) {
                throw new InvalidSettingException(name,
                    "This setting is not a valid input parameter of " + descriptor.id() + ": " + name,
                    sourceLine, headerText());
            }
        }
    }

    protected final BlockSetting requireSetting(String name) {
        var setting = settings.get(name);
        if (setting == null || !descriptor.hasParameter(name)) {
            throw new InvalidSettingException(name,
                "Block " + descriptor.id() + " is missing the setting " + name,
                sourceLine, headerText());
        }
        return setting;
    }

    protected final String resolve(String name) {
        return SettingResolver.resolve(requireSetting(name), descriptor.parameter(name));
    }

    /**
     * Statement assigning {@code expression} to {@code variable}: a declaration the first time a
     * local name is seen, a plain assignment afterwards, a store write for {@code globals.} names.
     * Disabled blocks still get a declaration but never register the name.
     */
    protected final String assignment(GenerationContext context, String variable, String expression) {
        if (VariableNames.isGlobal(variable)) {
            String key = variable.substring(VariableRef.GLOBALS_PREFIX.length());
            return "globals.put(" + JavaLiterals.quoteJava(key) + ", " + expression + ");\n";
        }
        var defined = context.definedVariables();
        if (defined.contains(variable)) {
            return variable + " = " + expression + ";\n";
        }
        if (!disabled) {
            defined.add(variable);
        }
        return "var " + variable + " = " + expression + ";\n";
    }

    protected final String headerText() {
        return "BLOCK:" + descriptor.id();
    }

    protected final ScriptParseException parseError(SourceLine line, String message) {
        return new ScriptParseException(line.number(), line.text(), message + ": " + line.excerpt());
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        var that = (AbstractBlockInstance) other;
        return descriptor.id().equals(that.descriptor.id())
            && disabled == that.disabled
            && label.equals(that.label)
            && settings.equals(that.settings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(descriptor.id(), disabled, label, settings);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + descriptor.id() + (disabled ? ", disabled" : "") + ", label=" + label + "]";
    }
}
