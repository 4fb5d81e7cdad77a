package org.genebuild.genemerge.tools.merge;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.genebuild.genemerge.utils.genemodel.Exon;
import org.genebuild.genemerge.utils.genemodel.GeneModelUtils;
import org.genebuild.genemerge.utils.genemodel.Transcript;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Clusters coding transcripts: two transcripts belong together when their coding regions intersect and one of
 * their coding exons overlaps on the same strand. Transcripts without a translation are left out.
 */
public final class CodingTranscriptClusterEngine extends TranscriptClusterEngine {

    private static final Logger logger = LogManager.getLogger(CodingTranscriptClusterEngine.class);

    public CodingTranscriptClusterEngine(final String geneBiotype, final String geneLogicName) {
        super("coding", geneBiotype, geneLogicName);
    }

    @Override
    protected List<Transcript> selectTranscripts(final Collection<Transcript> transcripts) {
        final List<Transcript> coding = new ArrayList<>(transcripts.size());
        for (final Transcript transcript : transcripts) {
            if (transcript.isCoding()) {
                coding.add(transcript);
            } else {
                logger.warn("Transcript " + transcript.getId() + " of biotype " + transcript.getBiotype() +
                        " has no translation and is left out of coding clustering");
            }
        }
        coding.sort(GeneModelUtils.CODING_START_THEN_LONGEST);
        return coding;
    }

    @Override
    protected boolean clusterTogether(final Transcript a, final Transcript b, final CodingExonCache exonCache) {
        if (!a.getContig().equals(b.getContig()) ||
                a.getCodingRegionEnd() < b.getCodingRegionStart() || a.getCodingRegionStart() > b.getCodingRegionEnd()) {
            return false;
        }
        final List<Exon> bExons = exonCache.get(b);
        for (final Exon exonA : exonCache.get(a)) {
            for (final Exon exonB : bExons) {
                if (GeneModelUtils.sameStrandOverlap(exonA, exonB)) {
                    return true;
                }
            }
        }
        return false;
    }
}
