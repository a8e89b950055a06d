package me.christianrobert.cljtojs.transformer.naming;

/**
 * Allocates synthetic identifiers for compiler-generated temporaries and parameters.
 *
 * <p>Contract:</p>
 * <ul>
 *   <li>Every returned name is unique for the lifetime of the generator</li>
 *   <li>Calling the generator with the same tags in the same order yields the same names</li>
 *   <li>The tag only aids debugging (e.g. "and", "ifLet", "p0"); uniqueness never depends on it</li>
 * </ul>
 *
 * <p>Implementations are confined to one thread. Callers that translate forms in
 * parallel must synchronize externally.</p>
 */
public interface NameGenerator {

    /**
     * Allocates a fresh name.
     *
     * @param tag Debugging hint embedded in the name
     * @return Name that no previous call returned
     */
    String freshName(String tag);

    /**
     * Whether a name has the shape of the names this generator returns.
     *
     * <p>Source symbols of that shape are rejected, so a temporary can never
     * shadow or be shadowed by a user binding.</p>
     */
    boolean isReserved(String name);
}
