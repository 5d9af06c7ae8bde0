package work.blockscript.codec;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits script text into numbered, trimmed lines. Line endings are normalized first.
 */
public final class ScriptLines {
    private ScriptLines() {}

    public static List<SourceLine> split(String text) {
        return split(text, 1);
    }

    public static List<SourceLine> split(String text, int firstLineNumber) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        String[] raw = normalized.split("\n", -1);
        int count = raw.length;
        // a trailing newline does not open another line
        if (count > 0 && raw[count - 1].isEmpty()) {
            count--;
        }
        var lines = new ArrayList<SourceLine>(count);
        for (int i = 0; i < count; i++) {
            lines.add(new SourceLine(firstLineNumber + i, raw[i]));
        }
        return lines;
    }
}
