package org.genebuild.genemerge.tools.merge;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.genebuild.genemerge.utils.Utils;
import org.genebuild.genemerge.utils.genemodel.Exon;
import org.genebuild.genemerge.utils.genemodel.Gene;
import org.genebuild.genemerge.utils.genemodel.GeneModelUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Folds pseudogene and processed transcript clusters into the coding clusters they substantially overlap.
 *
 * A non-coding gene is absorbed by the first coding gene (by start, longest first) having a coding exon that
 * overlaps one of its exons on the same strand by more than {@code absorptionThreshold} percent of the coding
 * gene's longest translation. Its transcripts are moved into that coding gene.
 */
public final class GeneClusterCombiner {

    private static final Logger logger = LogManager.getLogger(GeneClusterCombiner.class);

    private final double absorptionThreshold;

    public GeneClusterCombiner(final double absorptionThreshold) {
        Utils.validateArg(absorptionThreshold >= 0, () -> "negative absorption threshold " + absorptionThreshold);
        this.absorptionThreshold = absorptionThreshold;
    }

    /**
     * @return the coding genes, sorted and possibly enlarged, followed by the non-coding genes that were not absorbed
     */
    public List<Gene> combine(final Collection<Gene> codingGenes, final Collection<Gene> nonCodingGenes) {
        Utils.nonNull(codingGenes);
        Utils.nonNull(nonCodingGenes);

        final List<Gene> sortedCoding = new ArrayList<>(codingGenes);
        sortedCoding.sort(GeneModelUtils.START_THEN_LONGEST);
        final List<Gene> sortedNonCoding = new ArrayList<>(nonCodingGenes);
        sortedNonCoding.sort(GeneModelUtils.START_THEN_LONGEST);

        final List<Gene> unabsorbed = new ArrayList<>();
        for (final Gene nonCoding : sortedNonCoding) {
            boolean absorbed = false;
            for (final Gene coding : sortedCoding) {
                if (absorbs(coding, nonCoding)) {
                    nonCoding.getTranscripts().forEach(coding::addTranscript);
                    logger.debug("Gene " + nonCoding.getId() + " absorbed by coding gene " + coding.getId());
                    absorbed = true;
                    break;
                }
            }
            if (!absorbed) {
                unabsorbed.add(nonCoding);
            }
        }

        final List<Gene> combined = new ArrayList<>(sortedCoding);
        combined.addAll(unabsorbed);
        return combined;
    }

    /**
     * @return true if {@code nonCoding} overlaps {@code coding} enough to become part of it
     */
    boolean absorbs(final Gene coding, final Gene nonCoding) {
        if (!GeneModelUtils.overlaps(coding, nonCoding)) {
            return false;
        }
        final int codingLength = GeneModelUtils.codingLength(coding);
        if (codingLength == 0) {
            return false;
        }
        final List<Exon> nonCodingExons = allExons(nonCoding);
        for (final Exon codingExon : GeneModelUtils.codingExons(coding)) {
            for (final Exon exon : nonCodingExons) {
                if (GeneModelUtils.sameStrandOverlap(codingExon, exon) &&
                        GeneModelUtils.overlapPercent(codingExon, exon, codingLength) > absorptionThreshold) {
                    return true;
                }
            }
        }
        return false;
    }

    private static List<Exon> allExons(final Gene gene) {
        final List<Exon> exons = new ArrayList<>();
        gene.getTranscripts().forEach(t -> exons.addAll(t.getExons()));
        return exons;
    }
}
