package work.blockscript.descriptor;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import work.blockscript.error.UnknownBlockKindException;

/**
 * Catalog of block descriptors. Populated once at startup, then frozen so decode and generate
 * calls can share it across threads.
 */
public final class DescriptorRegistry {
    private final Map<String, BlockDescriptor> descriptors = new ConcurrentHashMap<>();
    private final Collection<String> order = new ConcurrentLinkedQueue<>();
    private volatile boolean frozen;

    public DescriptorRegistry register(BlockDescriptor descriptor) {
        if (frozen) {
            throw new RegistryFrozenException(descriptor.id());
        }
        if (descriptors.put(descriptor.id(), descriptor) == null) {
            order.add(descriptor.id());
        }
        return this;
    }

    public DescriptorRegistry registerAll(Collection<BlockDescriptor> batch) {
        for (var descriptor : batch) {
            register(descriptor);
        }
        return this;
    }

    public BlockDescriptor get(String kindId) {
        var descriptor = kindId == null ? null : descriptors.get(kindId);
        if (descriptor == null) {
            throw new UnknownBlockKindException(kindId);
        }
        return descriptor;
    }

    public Optional<BlockDescriptor> find(String kindId) {
        return kindId == null ? Optional.empty() : Optional.ofNullable(descriptors.get(kindId));
    }

    public boolean contains(String kindId) {
        return kindId != null && descriptors.containsKey(kindId);
    }

    public DescriptorRegistry freeze() {
        this.frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public int size() {
        return descriptors.size();
    }

    /**
     * Descriptors in registration order.
     */
    public Collection<BlockDescriptor> descriptors() {
        return Collections.unmodifiableList(order.stream().map(descriptors::get).toList());
    }
}
