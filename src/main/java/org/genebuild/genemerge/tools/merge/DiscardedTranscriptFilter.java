package org.genebuild.genemerge.tools.merge;

import org.genebuild.genemerge.utils.genemodel.Transcript;

/**
 * Tells whether a transcript was rejected by curators in an earlier merge and must stay out of this one.
 */
@FunctionalInterface
public interface DiscardedTranscriptFilter {

    /** A filter that discards nothing. */
    DiscardedTranscriptFilter NONE = transcript -> false;

    boolean isDiscarded(final Transcript transcript);
}
