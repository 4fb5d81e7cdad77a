package org.genebuild.genemerge.tools.merge;

import org.genebuild.genemerge.utils.Utils;
import org.genebuild.genemerge.utils.genemodel.Exon;
import org.genebuild.genemerge.utils.genemodel.GeneModelUtils;
import org.genebuild.genemerge.utils.genemodel.Transcript;

import java.util.*;

/**
 * Coding exons of transcripts, sorted by start, computed once per transcript. Keyed by transcript identity.
 * One cache serves a single clustering run and must not outlive it: transcripts are mutated between runs.
 */
final class CodingExonCache {

    private final Map<Transcript, List<Exon>> codingExons = new IdentityHashMap<>();

    /**
     * @return the coding exons of {@code transcript}, empty if it has no translation
     */
    List<Exon> get(final Transcript transcript) {
        Utils.nonNull(transcript);
        return codingExons.computeIfAbsent(transcript, t -> {
            final List<Exon> sorted = new ArrayList<>(t.getTranslateableExons());
            sorted.sort(GeneModelUtils.START_THEN_LONGEST);
            return Collections.unmodifiableList(sorted);
        });
    }

    int size() {
        return codingExons.size();
    }
}
