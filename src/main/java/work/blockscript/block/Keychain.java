package work.blockscript.block;

import java.util.List;
import java.util.Objects;

/**
 * Keys combined with AND/OR; when they hold, the bot status becomes {@code status}.
 */
public record Keychain(String status, Mode mode, List<Key> keys) {
    public Keychain {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(mode, "mode");
        keys = keys == null ? List.of() : List.copyOf(keys);
    }

    public enum Mode {
        AND,
        OR
    }
}
