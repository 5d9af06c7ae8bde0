package work.blockscript.codec;

import work.blockscript.shared.Excerpts;

/**
 * One trimmed script line together with its original 1-based line number.
 */
public record SourceLine(int number, String text) {
    public SourceLine {
        text = text == null ? "" : text.trim();
    }

    public boolean isBlank() {
        return text.isEmpty();
    }

    public String excerpt() {
        return Excerpts.truncate(text);
    }
}
