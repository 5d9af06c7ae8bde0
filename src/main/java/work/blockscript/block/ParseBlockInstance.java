package work.blockscript.block;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.blockscript.codec.SourceLine;
import work.blockscript.descriptor.BlockDescriptor;
import work.blockscript.descriptor.BlockKind;
import work.blockscript.error.UnsupportedGenerationException;
import work.blockscript.generator.GenerationContext;

/**
 * Extracts a value from some input text.
 *
 * <pre>
 * BLOCK:Parse
 *   input = @data.SOURCE
 *   leftDelim = "hello"
 *   rightDelim = "you"
 *   RECURSIVE
 *   MODE:LR
 *   => CAP @parsed
 * </pre>
 */
public final class ParseBlockInstance extends OutputBlockInstance {
    private static final Pattern MODE = Pattern.compile("^MODE:([A-Za-z]+)$");
    private static final Map<ParseMode, ParseCall> CALLS = new EnumMap<>(ParseMode.class);

    static {
        CALLS.put(ParseMode.LR, new ParseCall("parseBetweenStrings", List.of("leftDelim", "rightDelim", "caseSensitive")));
        CALLS.put(ParseMode.CSS, new ParseCall("queryCssSelector", List.of("cssSelector", "attributeName")));
        CALLS.put(ParseMode.JSON, new ParseCall("queryJsonToken", List.of("jToken")));
        CALLS.put(ParseMode.REGEX, new ParseCall("matchRegexGroups", List.of("pattern", "outputFormat")));
    }

    private boolean recursive;
    private ParseMode mode = ParseMode.LR;

    public ParseBlockInstance(BlockDescriptor descriptor) {
        super(descriptor, BlockKind.PARSE, "parseOutput");
    }

    public boolean isRecursive() {
        return recursive;
    }

    public void setRecursive(boolean recursive) {
        this.recursive = recursive;
    }

    public ParseMode mode() {
        return mode;
    }

    public void setMode(ParseMode mode) {
        this.mode = mode;
    }

    @Override
    protected void readBodyLine(SourceLine line) {
        String text = line.text();
        if (text.startsWith("RECURSIVE")) {
            recursive = true;
        } else if (text.startsWith("MODE")) {
            Matcher matcher = MODE.matcher(text);
            Optional<ParseMode> parsed = matcher.matches() ? ParseMode.fromToken(matcher.group(1)) : Optional.empty();
            mode = parsed.orElseThrow(() -> parseError(line, "Could not understand the parsing mode"));
        } else if (isOutputLine(line)) {
            readOutputLine(line);
        } else {
            readSetting(line);
        }
    }

    @Override
    protected void writeBody(List<String> lines) {
        if (recursive) {
            lines.add(INDENT + "RECURSIVE");
        }
        lines.add(INDENT + "MODE:" + mode.token());
        writeOutputLine(lines);
    }

    @Override
    protected String emit(GenerationContext context) {
        ParseCall call = mode == null ? null : CALLS.get(mode);
        if (call == null) {
            throw new UnsupportedGenerationException("No parse function is mapped for mode " + mode, sourceLine(), headerText());
        }
        var arguments = new ArrayList<String>();
        arguments.add("data");
        arguments.add(resolve("input"));
        for (String name : call.arguments()) {
            arguments.add(resolve(name));
        }
        arguments.add(resolve("prefix"));
        arguments.add(resolve("suffix"));
        String callee = recursive ? call.callee() + "Recursive" : call.callee();
        return emitOutput(context, callee + "(" + String.join(", ", arguments) + ")");
    }

    @Override
    public boolean equals(Object other) {
        return super.equals(other)
            && recursive == ((ParseBlockInstance) other).recursive
            && mode == ((ParseBlockInstance) other).mode;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), recursive, mode);
    }

    private record ParseCall(String callee, List<String> arguments) {}
}
