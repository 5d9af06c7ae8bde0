package work.blockscript.block;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered block sequence owned by one script. The same instance cannot appear twice.
 */
public final class BlockScript implements Iterable<BlockInstance> {
    private final List<BlockInstance> blocks = new ArrayList<>();

    public static BlockScript of(List<? extends BlockInstance> blocks) {
        var script = new BlockScript();
        blocks.forEach(script::add);
        return script;
    }

    public BlockScript add(BlockInstance block) {
        Objects.requireNonNull(block, "block");
        for (var existing : blocks) {
            if (existing == block) {
                throw new IllegalArgumentException("Block instance already belongs to this script: " + block);
            }
        }
        blocks.add(block);
        return this;
    }

    public BlockInstance get(int index) {
        return blocks.get(index);
    }

    public BlockInstance remove(int index) {
        return blocks.remove(index);
    }

    public int size() {
        return blocks.size();
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    public List<BlockInstance> blocks() {
        return Collections.unmodifiableList(blocks);
    }

    @Override
    public Iterator<BlockInstance> iterator() {
        return blocks().iterator();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof BlockScript that && blocks.equals(that.blocks);
    }

    @Override
    public int hashCode() {
        return blocks.hashCode();
    }

    @Override
    public String toString() {
        return "BlockScript" + blocks;
    }
}
