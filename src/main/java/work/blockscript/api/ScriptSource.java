package work.blockscript.api;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Where the script text comes from: a file on disk or text supplied inline (stdin, tests).
 */
public record ScriptSource(Optional<Path> path, Optional<String> inlineText) {
    public ScriptSource {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(inlineText, "inlineText");
        if (path.isEmpty() && inlineText.isEmpty()) {
            throw new IllegalArgumentException("Either path or inlineText must be present.");
        }
    }

    public static ScriptSource forPath(Path path) {
        return new ScriptSource(Optional.of(path), Optional.empty());
    }

    public static ScriptSource forText(String text) {
        return new ScriptSource(Optional.empty(), Optional.of(text));
    }

    public boolean isInline() {
        return inlineText.isPresent();
    }

    public String read() {
        if (inlineText.isPresent()) {
            return inlineText.get();
        }
        var file = path.orElseThrow();
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot read script file: " + file, ex);
        }
    }

    public String display() {
        return path.map(Path::toString).orElse("<inline>");
    }
}
