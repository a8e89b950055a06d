package me.christianrobert.cljtojs.transformer.context;

import me.christianrobert.cljtojs.transformer.naming.NameGenerator;
import me.christianrobert.cljtojs.transformer.naming.SequentialNameGenerator;

/**
 * Compilation-unit state shared by every form the unit translates.
 *
 * <h3>Immutable</h3>
 * <ul>
 *   <li>{@link #settings} - runtime names to emit</li>
 * </ul>
 *
 * <h3>Monotonic, never reset within a unit</h3>
 * <ul>
 *   <li>{@link #names} - synthetic identifier allocation</li>
 *   <li>{@link #vectorIdentity} - identity counter of vector literals</li>
 * </ul>
 *
 * <p><strong>Lifecycle:</strong> one context per compilation unit. Forms of a unit are
 * translated strictly in source order so synthetic names are stable across runs.
 * A context is confined to one thread.</p>
 */
public class TranslationContext {

    private final NameGenerator names;
    private final TranslatorSettings settings;

    private long vectorIdentity;

    public TranslationContext() {
        this(new SequentialNameGenerator(), TranslatorSettings.defaults());
    }

    public TranslationContext(NameGenerator names, TranslatorSettings settings) {
        if (names == null) {
            throw new IllegalArgumentException("Name generator cannot be null");
        }
        if (settings == null) {
            throw new IllegalArgumentException("Translator settings cannot be null");
        }
        this.names = names;
        this.settings = settings;
    }

    public TranslatorSettings getSettings() {
        return settings;
    }

    /**
     * Allocates a synthetic identifier.
     *
     * @param tag Debugging hint (e.g. "and", "ifLet", "p0")
     * @return Identifier unique within this unit
     */
    public String freshName(String tag) {
        return names.freshName(tag);
    }

    /**
     * Whether a source symbol would clash with the synthetic identifiers of this unit.
     */
    public boolean isReservedName(String name) {
        return names.isReserved(name);
    }

    /**
     * Allocates the identity of the next vector literal (1, 2, 3, ...).
     */
    public long nextVectorIdentity() {
        return ++vectorIdentity;
    }

    /**
     * Identity of the last vector literal, 0 if none was built yet.
     */
    public long getVectorIdentity() {
        return vectorIdentity;
    }
}
