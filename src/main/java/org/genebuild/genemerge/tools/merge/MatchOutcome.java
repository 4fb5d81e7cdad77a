package org.genebuild.genemerge.tools.merge;

/**
 * Verdict on a pair of transcripts, one from each annotation, that cluster into the same gene.
 * The first transcript of a pair is always the manual one.
 */
public enum MatchOutcome {
    /** The annotations disagree on the model; both transcripts stay, unrelated. */
    KEEP_BOTH(0),
    /** Same coding structure but different UTR structure; both stay and are linked by cross-references. */
    LINK(1),
    /** The first (manual) transcript is redundant and is removed. */
    DROP_FIRST(2),
    /** The second (automatic) transcript is redundant and is removed. */
    DROP_SECOND(3);

    private final int priority;

    MatchOutcome(final int priority) {
        this.priority = priority;
    }

    /**
     * When a manual transcript matches several automatic ones, the pairing with the highest priority is applied.
     */
    public int getPriority() {
        return priority;
    }

    public boolean relatesPair() {
        return this != KEEP_BOTH;
    }
}
