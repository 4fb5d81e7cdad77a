package org.genebuild.genemerge.tools.merge;

import org.genebuild.genemerge.utils.Utils;
import org.genebuild.genemerge.utils.genemodel.Exon;
import org.genebuild.genemerge.utils.genemodel.Gene;
import org.genebuild.genemerge.utils.genemodel.Transcript;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Discards a transcript when a transcript of the discarded set has exactly the same exons: same number, and the same
 * start, end and strand at every position.
 */
public final class ExonCoordinateDiscardedTranscriptFilter implements DiscardedTranscriptFilter {

    private final List<Transcript> discarded;

    /**
     * @param discardedGenes genes holding the discarded transcripts of the region
     */
    public ExonCoordinateDiscardedTranscriptFilter(final Collection<Gene> discardedGenes) {
        Utils.nonNull(discardedGenes);
        final List<Transcript> transcripts = new ArrayList<>();
        discardedGenes.forEach(g -> transcripts.addAll(g.getTranscripts()));
        this.discarded = Collections.unmodifiableList(transcripts);
    }

    @Override
    public boolean isDiscarded(final Transcript transcript) {
        Utils.nonNull(transcript);
        return discarded.stream().anyMatch(d -> sameExons(transcript, d));
    }

    private static boolean sameExons(final Transcript a, final Transcript b) {
        if (a.getExonCount() != b.getExonCount()) {
            return false;
        }
        final List<Exon> exonsA = a.getExons();
        final List<Exon> exonsB = b.getExons();
        for (int i = 0; i < exonsA.size(); i++) {
            if (!exonsA.get(i).hasSameCoordinates(exonsB.get(i))) {
                return false;
            }
        }
        return true;
    }
}
