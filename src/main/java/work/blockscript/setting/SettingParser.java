package work.blockscript.setting;

import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.blockscript.descriptor.BlockDescriptor;
import work.blockscript.descriptor.ParamSchema;
import work.blockscript.descriptor.ParamType;

/**
 * Cursor over a single line of setting notation. Parsing is type directed: the declared
 * {@link ParamType} decides which literal shapes are accepted.
 *
 * <pre>
 * input = @data.SOURCE
 * leftDelim = "hello"
 * caseSensitive = False
 * url = $"https://example.com/&lt;path&gt;"
 * customHeaders = {("Accept", "*&#47;*"), ("Cookie", @cookie)}
 * </pre>
 *
 * Syntax errors surface as {@link IllegalArgumentException}; block parsers attach line information.
 */
public final class SettingParser {
    private static final Pattern SETTING_LINE = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)\\s*=\\s*(.*)$");
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?([eE][-+]?\\d+)?");
    private static final Pattern WORD = Pattern.compile("[A-Za-z0-9_]+");
    private static final Pattern VARIABLE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

    private final String text;
    private int position;

    public SettingParser(String text) {
        this.text = text == null ? "" : text;
    }

    /**
     * Parses {@code name = literal} against the owning block's descriptor.
     */
    public static BlockSetting parseLine(String line, BlockDescriptor descriptor) {
        Matcher matcher = SETTING_LINE.matcher(line.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("expected <name> = <value>");
        }
        String name = matcher.group(1);
        ParamSchema schema = descriptor.parameter(name);
        if (schema == null) {
            throw new IllegalArgumentException("block " + descriptor.id() + " has no parameter named " + name);
        }
        var parser = new SettingParser(matcher.group(2));
        SettingValue value = parser.readValue(schema.type(), schema.enumValues());
        parser.expectEnd();
        return new BlockSetting(name, value);
    }

    public SettingValue readValue(ParamType type, List<String> enumValues) {
        skipWhitespace();
        if (atEnd()) {
            throw new IllegalArgumentException("missing value");
        }
        if (peek() == '@') {
            return readVariable();
        }
        return switch (type) {
            case STRING -> readStringLike();
            case INT -> readInteger();
            case FLOAT -> readFloat();
            case BOOL -> readBoolean();
            case BYTES -> readBytes();
            case ENUM -> readEnum(enumValues);
            case LIST -> readList();
            case DICT -> readDict();
        };
    }

    public String readWord() {
        skipWhitespace();
        String word = match(WORD);
        if (word == null) {
            throw new IllegalArgumentException("expected a word at column " + (position + 1));
        }
        return word;
    }

    public void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(text.charAt(position))) {
            position++;
        }
    }

    public boolean atEnd() {
        return position >= text.length();
    }

    public void expectEnd() {
        skipWhitespace();
        if (!atEnd()) {
            throw new IllegalArgumentException("unexpected text after value: " + text.substring(position));
        }
    }

    private SettingValue readStringLike() {
        char c = peek();
        if (c == '@') {
            return readVariable();
        }
        if (c == '$') {
            position++;
            return new Interpolated(readQuoted());
        }
        if (c == '"') {
            return FixedValue.of(readQuoted());
        }
        throw new IllegalArgumentException("expected a quoted string, @variable or $\"template\"");
    }

    private VariableRef readVariable() {
        position++;
        String name = match(VARIABLE);
        if (name == null) {
            throw new IllegalArgumentException("expected a variable name after @");
        }
        return new VariableRef(name);
    }

    private FixedValue readInteger() {
        String number = readNumber();
        try {
            return FixedValue.of(Integer.parseInt(number));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("expected an integer but found " + number);
        }
    }

    private FixedValue readFloat() {
        String number = readNumber();
        double value = Double.parseDouble(number);
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("number out of range: " + number);
        }
        return FixedValue.of(value);
    }

    private String readNumber() {
        String number = match(NUMBER);
        if (number == null) {
            throw new IllegalArgumentException("expected a number");
        }
        return number;
    }

    private FixedValue readBoolean() {
        String word = readWord();
        String lower = word.toLowerCase(Locale.ROOT);
        if (!"true".equals(lower) && !"false".equals(lower)) {
            throw new IllegalArgumentException("expected True or False but found " + word);
        }
        return FixedValue.of(Boolean.parseBoolean(lower));
    }

    private FixedValue readBytes() {
        if (peek() != '"') {
            throw new IllegalArgumentException("expected a quoted base64 string");
        }
        String encoded = readQuoted();
        try {
            return FixedValue.ofBytes(Base64.getDecoder().decode(encoded));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("invalid base64 value: " + encoded);
        }
    }

    private FixedValue readEnum(List<String> enumValues) {
        String token = readWord();
        if (enumValues != null && !enumValues.isEmpty() && !enumValues.contains(token)) {
            throw new IllegalArgumentException(token + " is not one of " + enumValues);
        }
        return FixedValue.of(token);
    }

    private ListValue readList() {
        expect('[');
        var items = new ArrayList<SettingValue>();
        skipWhitespace();
        if (tryConsume(']')) {
            return new ListValue(items);
        }
        do {
            skipWhitespace();
            items.add(readStringLike());
            skipWhitespace();
        } while (tryConsume(','));
        expect(']');
        return new ListValue(items);
    }

    private DictValue readDict() {
        expect('{');
        var entries = new LinkedHashMap<String, SettingValue>();
        skipWhitespace();
        if (tryConsume('}')) {
            return new DictValue(entries);
        }
        do {
            expect('(');
            skipWhitespace();
            if (peek() != '"') {
                throw new IllegalArgumentException("dictionary keys must be quoted strings");
            }
            String key = readQuoted();
            expect(',');
            skipWhitespace();
            entries.put(key, readStringLike());
            expect(')');
            skipWhitespace();
        } while (tryConsume(','));
        expect('}');
        return new DictValue(entries);
    }

    private String readQuoted() {
        expect('"');
        var builder = new StringBuilder();
        while (!atEnd()) {
            char c = text.charAt(position++);
            if (c == '"') {
                return builder.toString();
            }
            if (c == '\\') {
                if (atEnd()) {
                    break;
                }
                char escaped = text.charAt(position++);
                switch (escaped) {
                    case 'n' -> builder.append('\n');
                    case 'r' -> builder.append('\r');
                    case 't' -> builder.append('\t');
                    case '"' -> builder.append('"');
                    case '\\' -> builder.append('\\');
                    default -> throw new IllegalArgumentException("unsupported escape \\" + escaped);
                }
            } else {
                builder.append(c);
            }
        }
        throw new IllegalArgumentException("unterminated string");
    }

    private String match(Pattern pattern) {
        Matcher matcher = pattern.matcher(text);
        matcher.region(position, text.length());
        if (!matcher.lookingAt()) {
            return null;
        }
        position = matcher.end();
        return matcher.group();
    }

    private char peek() {
        return atEnd() ? '\0' : text.charAt(position);
    }

    private void expect(char c) {
        skipWhitespace();
        if (!tryConsume(c)) {
            throw new IllegalArgumentException("expected '" + c + "' at column " + (position + 1));
        }
    }

    private boolean tryConsume(char c) {
        if (peek() == c) {
            position++;
            return true;
        }
        return false;
    }
}
