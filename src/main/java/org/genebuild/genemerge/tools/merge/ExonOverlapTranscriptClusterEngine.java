package org.genebuild.genemerge.tools.merge;

import org.genebuild.genemerge.utils.genemodel.Exon;
import org.genebuild.genemerge.utils.genemodel.GeneModelUtils;
import org.genebuild.genemerge.utils.genemodel.Transcript;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Clusters transcripts on their full exon structure, used for pseudogenes and processed transcripts: two
 * transcripts belong together when one of their exons overlaps on the same strand.
 */
public final class ExonOverlapTranscriptClusterEngine extends TranscriptClusterEngine {

    /**
     * @param geneIdPrefix prefix of the gene ids, which tells pseudogene clusters from processed transcript ones
     */
    public ExonOverlapTranscriptClusterEngine(final String geneIdPrefix, final String geneBiotype, final String geneLogicName) {
        super(geneIdPrefix, geneBiotype, geneLogicName);
    }

    @Override
    protected List<Transcript> selectTranscripts(final Collection<Transcript> transcripts) {
        final List<Transcript> sorted = new ArrayList<>(transcripts);
        sorted.sort(GeneModelUtils.START_THEN_LONGEST);
        return sorted;
    }

    @Override
    protected boolean clusterTogether(final Transcript a, final Transcript b, final CodingExonCache exonCache) {
        if (!GeneModelUtils.overlaps(a, b)) {
            return false;
        }
        for (final Exon exonA : a.getExons()) {
            for (final Exon exonB : b.getExons()) {
                if (GeneModelUtils.sameStrandOverlap(exonA, exonB)) {
                    return true;
                }
            }
        }
        return false;
    }
}
