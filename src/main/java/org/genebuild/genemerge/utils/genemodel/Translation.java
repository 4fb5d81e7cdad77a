package org.genebuild.genemerge.utils.genemodel;

import org.genebuild.genemerge.utils.Utils;

/**
 * The coding part of a transcript.
 *
 * A translation refers to its first and last coding exon by their index in the owning transcript's exon list
 * (in transcription order), so exons of the transcript can be replaced by equivalent objects without touching
 * the translation. {@code seqStart} and {@code seqEnd} are 1-based offsets, counted in the direction of
 * transcription, of the first and last coding base inside those exons.
 */
public final class Translation {

    private final int startExonIndex;
    private final int seqStart;
    private final int endExonIndex;
    private final int seqEnd;

    public Translation(final int startExonIndex, final int seqStart, final int endExonIndex, final int seqEnd) {
        Utils.validateArg(startExonIndex >= 0, () -> "negative start exon index " + startExonIndex);
        Utils.validateArg(endExonIndex >= startExonIndex,
                () -> "end exon index " + endExonIndex + " precedes start exon index " + startExonIndex);
        Utils.validateArg(seqStart > 0 && seqEnd > 0, "translation offsets are 1-based");
        Utils.validateArg(startExonIndex != endExonIndex || seqStart <= seqEnd,
                () -> "translation ends (" + seqEnd + ") before it starts (" + seqStart + ")");
        this.startExonIndex = startExonIndex;
        this.seqStart = seqStart;
        this.endExonIndex = endExonIndex;
        this.seqEnd = seqEnd;
    }

    public int getStartExonIndex() {
        return startExonIndex;
    }

    public int getSeqStart() {
        return seqStart;
    }

    public int getEndExonIndex() {
        return endExonIndex;
    }

    public int getSeqEnd() {
        return seqEnd;
    }

    @Override
    public String toString() {
        return "Translation{exon " + startExonIndex + "@" + seqStart + " .. exon " + endExonIndex + "@" + seqEnd + "}";
    }
}
