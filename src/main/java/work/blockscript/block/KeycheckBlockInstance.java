package work.blockscript.block;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.blockscript.codec.SourceLine;
import work.blockscript.descriptor.BlockDescriptor;
import work.blockscript.descriptor.BlockKind;
import work.blockscript.error.ScriptParseException;
import work.blockscript.error.UnsupportedGenerationException;
import work.blockscript.generator.GenerationContext;
import work.blockscript.setting.SettingParser;
import work.blockscript.setting.SettingResolver;
import work.blockscript.setting.SettingValue;
import work.blockscript.setting.SettingWriter;

/**
 * Sets the bot status from the first keychain that matches.
 *
 * <pre>
 * BLOCK:Keycheck
 *   banIfNoMatch = True
 *   KEYCHAIN SUCCESS OR
 *     STRINGKEY @data.SOURCE Contains "welcome"
 *   KEYCHAIN FAIL AND
 *     INTKEY @data.RESPONSECODE EqualTo 401
 * </pre>
 */
public final class KeycheckBlockInstance extends AbstractBlockInstance {
    private static final Pattern KEYCHAIN = Pattern.compile("^KEYCHAIN\\s+([A-Za-z_]+)\\s+([A-Za-z]+)$");

    private final List<Keychain> keychains = new ArrayList<>();

    public KeycheckBlockInstance(BlockDescriptor descriptor) {
        super(descriptor, BlockKind.KEYCHECK);
    }

    public List<Keychain> keychains() {
        return keychains;
    }

    @Override
    protected void readBody(List<SourceLine> lines) {
        keychains.clear();
        String status = null;
        Keychain.Mode mode = null;
        List<Key> keys = new ArrayList<>();
        for (var line : lines) {
            if (line.isBlank()) {
                continue;
            }
            String text = line.text();
            if (text.startsWith("KEYCHAIN")) {
                if (status != null) {
                    keychains.add(new Keychain(status, mode, keys));
                }
                Matcher matcher = KEYCHAIN.matcher(text);
                if (!matcher.matches()) {
                    throw parseError(line, "Could not understand the keychain declaration");
                }
                status = matcher.group(1).toUpperCase(Locale.ROOT);
                mode = readMode(matcher.group(2), line);
                keys = new ArrayList<>();
            } else if (KeyType.fromKeyword(firstWord(text)).isPresent()) {
                if (status == null) {
                    throw parseError(line, "Key declared outside of a keychain");
                }
                keys.add(readKey(line));
            } else {
                readSetting(line);
            }
        }
        if (status != null) {
            keychains.add(new Keychain(status, mode, keys));
        }
    }

    @Override
    protected void writeBody(List<String> lines) {
        for (var keychain : keychains) {
            lines.add(INDENT + "KEYCHAIN " + keychain.status() + " " + keychain.mode());
            for (var key : keychain.keys()) {
                lines.add(INDENT + INDENT + key.type().keyword()
                    + " " + SettingWriter.writeValue(key.left(), key.type().operandType())
                    + " " + key.comparison().token()
                    + " " + SettingWriter.writeValue(key.right(), key.type().operandType()));
            }
        }
    }

    @Override
    protected String emit(GenerationContext context) {
        if (keychains.isEmpty()) {
            return "";
        }
        var code = new StringBuilder();
        for (int i = 0; i < keychains.size(); i++) {
            var keychain = keychains.get(i);
            code.append(i == 0 ? "if (" : "else if (")
                .append(condition(keychain))
                .append(") {\n")
                .append("    data.setStatus(\"").append(keychain.status()).append("\");\n")
                .append("}\n");
        }
        String ban = resolve("banIfNoMatch");
        if ("true".equals(ban)) {
            code.append("else {\n    data.setStatus(\"BAN\");\n}\n");
        } else if (!"false".equals(ban)) {
            code.append("else if (Boolean.TRUE.equals(").append(ban).append(")) {\n    data.setStatus(\"BAN\");\n}\n");
        }
        return code.toString();
    }

    private String condition(Keychain keychain) {
        if (keychain.keys().isEmpty()) {
            return keychain.mode() == Keychain.Mode.AND ? "true" : "false";
        }
        String joiner = keychain.mode() == Keychain.Mode.AND ? " && " : " || ";
        var checks = new ArrayList<String>();
        for (var key : keychain.keys()) {
            if (!key.type().supports(key.comparison())) {
                throw new UnsupportedGenerationException(
                    key.type().keyword() + " does not support the comparison " + key.comparison().token(),
                    sourceLine(), headerText());
            }
            var type = key.type();
            checks.add("checkCondition(data, "
                + SettingResolver.resolve(key.left(), type.operandType(), null) + ", "
                + type.comparisonType() + "." + key.comparison().name() + ", "
                + SettingResolver.resolve(key.right(), type.operandType(), null) + ")");
        }
        return String.join(joiner, checks);
    }

    private Keychain.Mode readMode(String raw, SourceLine line) {
        try {
            return Keychain.Mode.valueOf(raw.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw parseError(line, "Keychain mode must be AND or OR");
        }
    }

    private Key readKey(SourceLine line) {
        try {
            var parser = new SettingParser(line.text());
            KeyType type = KeyType.fromKeyword(parser.readWord()).orElseThrow();
            SettingValue left = parser.readValue(type.operandType(), List.of());
            String token = parser.readWord();
            Comparison comparison = Comparison.fromToken(token)
                .filter(type::supports)
                .orElseThrow(() -> new IllegalArgumentException(type.keyword() + " does not support " + token));
            SettingValue right = parser.readValue(type.operandType(), List.of());
            parser.expectEnd();
            return new Key(type, left, comparison, right);
        } catch (IllegalArgumentException ex) {
            throw new ScriptParseException(line.number(), line.text(),
                "Could not parse the key (" + ex.getMessage() + "): " + line.excerpt(), ex);
        }
    }

    private static String firstWord(String text) {
        int space = text.indexOf(' ');
        return space < 0 ? text : text.substring(0, space);
    }

    @Override
    public boolean equals(Object other) {
        return super.equals(other) && keychains.equals(((KeycheckBlockInstance) other).keychains);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), keychains);
    }
}
