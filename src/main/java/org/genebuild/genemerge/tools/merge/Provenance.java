package org.genebuild.genemerge.tools.merge;

/**
 * Which annotations the transcripts of a merged gene came from.
 */
public enum Provenance {
    /** Transcripts from both annotations, or at least one transcript paired across them. */
    MERGED,
    MANUAL_ONLY,
    AUTOMATIC_ONLY
}
