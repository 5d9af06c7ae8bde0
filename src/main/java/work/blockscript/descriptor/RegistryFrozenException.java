package work.blockscript.descriptor;

/**
 * Thrown when a descriptor is registered after the registry has been frozen.
 */
public final class RegistryFrozenException extends IllegalStateException {
    public RegistryFrozenException(String id) {
        super("Descriptor registry is frozen; cannot register " + id);
    }
}
