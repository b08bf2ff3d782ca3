package com.courtvision.rag.routing;

/**
 * Phrasing style of a question, used to size downstream query expansion.
 *
 * <p>Declared in detection priority order: the first category whose markers fire wins.</p>
 */
public enum QueryStyleCategory {
    /** Slang, typos, off-topic or injection-like input. Expanding it only amplifies noise. */
    NOISY(1),
    /** Multi-part or synthesis questions that are already detailed. */
    COMPLEX(2),
    /** Follow-ups that lean on earlier turns and need aggressive expansion. */
    CONVERSATIONAL(5),
    /** Clear single-topic questions. */
    SIMPLE(4);

    private final int expansionBase;

    QueryStyleCategory(int expansionBase) {
        this.expansionBase = expansionBase;
    }

    public int getExpansionBase() {
        return this.expansionBase;
    }
}
