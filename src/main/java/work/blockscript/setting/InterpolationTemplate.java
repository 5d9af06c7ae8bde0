package work.blockscript.setting;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits {@code $"..."} templates into literal text and {@code <variable>} placeholders.
 * Angle brackets that do not enclose a variable name stay literal.
 */
public final class InterpolationTemplate {
    private static final Pattern PLACEHOLDER = Pattern.compile("<([A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)*)>");

    private InterpolationTemplate() {}

    public static List<Part> parse(String template) {
        var parts = new ArrayList<Part>();
        Matcher matcher = PLACEHOLDER.matcher(template);
        int last = 0;
        while (matcher.find()) {
            if (matcher.start() > last) {
                parts.add(new Part(false, template.substring(last, matcher.start())));
            }
            parts.add(new Part(true, matcher.group(1)));
            last = matcher.end();
        }
        if (last < template.length()) {
            parts.add(new Part(false, template.substring(last)));
        }
        return parts;
    }

    public static List<String> variables(String template) {
        return parse(template).stream().filter(Part::variable).map(Part::text).toList();
    }

    public record Part(boolean variable, String text) {}
}
