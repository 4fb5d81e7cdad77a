package org.genebuild.genemerge.utils.genemodel;

import htsjdk.samtools.util.Locatable;
import org.genebuild.genemerge.utils.Utils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Overlap and coding-length computations over gene models.
 */
public final class GeneModelUtils {

    private GeneModelUtils() {}

    /**
     * Orders by start ascending, longest first among equal starts.
     */
    public static final Comparator<Locatable> START_THEN_LONGEST =
            Comparator.comparingInt(Locatable::getStart).thenComparing(Locatable::getEnd, Comparator.reverseOrder());

    /**
     * Orders coding transcripts by coding region start ascending, longest coding region first among equal starts.
     */
    public static final Comparator<Transcript> CODING_START_THEN_LONGEST =
            Comparator.comparingInt(Transcript::getCodingRegionStart)
                    .thenComparing(Transcript::getCodingRegionEnd, Comparator.reverseOrder());

    /**
     * Inclusive interval overlap on the same contig, whatever the strand.
     */
    public static boolean overlaps(final Locatable a, final Locatable b) {
        Utils.nonNull(a);
        Utils.nonNull(b);
        return a.getContig().equals(b.getContig()) && a.getStart() <= b.getEnd() && b.getStart() <= a.getEnd();
    }

    /**
     * @return true if the exons overlap and lie on the same strand
     */
    public static boolean sameStrandOverlap(final Exon a, final Exon b) {
        return overlaps(a, b) && a.getStrand() == b.getStrand();
    }

    /**
     * @return the length in amino acids of the longest translation among the transcripts of the gene, 0 if none
     * of them is coding
     */
    public static int codingLength(final Gene gene) {
        Utils.nonNull(gene);
        return gene.getTranscripts().stream().mapToInt(Transcript::getTranslationLength).max().orElse(0);
    }

    /**
     * @return the coding parts of the exons of every coding transcript of the gene
     */
    public static List<Exon> codingExons(final Gene gene) {
        Utils.nonNull(gene);
        final List<Exon> coding = new ArrayList<>();
        for (final Transcript transcript : gene.getTranscripts()) {
            coding.addAll(transcript.getTranslateableExons());
        }
        return coding;
    }

    /**
     * Percentage of {@code denominator} covered by the overlap of two intervals, measured as
     * {@code (min(end) - max(start)) / denominator * 100}.
     *
     * @param denominator must be positive
     * @throws IllegalArgumentException if the intervals do not overlap
     */
    public static double overlapPercent(final Locatable a, final Locatable b, final int denominator) {
        Utils.validateArg(overlaps(a, b), () -> a + " and " + b + " do not overlap");
        Utils.validateArg(denominator > 0, () -> "overlap percentage needs a positive denominator, got " + denominator);
        final int overlapLength = Math.min(a.getEnd(), b.getEnd()) - Math.max(a.getStart(), b.getStart());
        return ((double) overlapLength / denominator) * 100.0;
    }
}
