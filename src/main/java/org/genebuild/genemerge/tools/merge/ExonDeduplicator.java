package org.genebuild.genemerge.tools.merge;

import org.genebuild.genemerge.utils.Utils;
import org.genebuild.genemerge.utils.genemodel.Exon;
import org.genebuild.genemerge.utils.genemodel.Gene;
import org.genebuild.genemerge.utils.genemodel.Transcript;

import java.util.ArrayList;
import java.util.List;

/**
 * Makes the transcripts of a gene share one exon object for every group of structurally identical exons.
 * The first exon met, walking transcripts and then exons in order, becomes the shared one.
 */
public final class ExonDeduplicator {

    /**
     * Deduplicates the exons of {@code gene} in place.
     * @return the same gene
     */
    public Gene pruneExons(final Gene gene) {
        Utils.nonNull(gene);
        final List<Exon> uniqueExons = new ArrayList<>();
        for (final Transcript transcript : gene.getTranscripts()) {
            final List<Exon> exons = transcript.getExons();
            for (int i = 0; i < exons.size(); i++) {
                final Exon exon = exons.get(i);
                final Exon shared = findIdentical(uniqueExons, exon);
                if (shared == null) {
                    uniqueExons.add(exon);
                } else if (shared != exon) {
                    transcript.replaceExon(i, shared);
                }
            }
        }
        return gene;
    }

    private static Exon findIdentical(final List<Exon> uniqueExons, final Exon exon) {
        for (final Exon unique : uniqueExons) {
            if (unique.isStructurallyIdenticalTo(exon)) {
                return unique;
            }
        }
        return null;
    }
}
