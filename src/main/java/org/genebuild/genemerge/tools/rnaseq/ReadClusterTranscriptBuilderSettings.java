package org.genebuild.genemerge.tools.rnaseq;

import org.genebuild.genemerge.utils.Utils;

/**
 * Limits applied by {@link ReadClusterTranscriptBuilder} when chaining exon clusters and filtering the models.
 */
public final class ReadClusterTranscriptBuilderSettings {

    public static final int DEFAULT_PADDING = 20;

    private final int minExons;
    private final int minLength;
    private final int minSingleExonLength;
    private final double minSpan;
    private final int maxIntronLength;
    private final boolean paired;
    private final int padding;

    /**
     * @param minExons fewest exons a model may have
     * @param minLength smallest total exon length of a model
     * @param minSingleExonLength smallest length of a single-exon model; multi-exon models with a poor span ratio
     *                            are kept only if at least this long
     * @param minSpan smallest ratio of genomic span to exon length for a multi-exon model
     * @param maxIntronLength largest gap allowed between chained clusters when reads are not paired
     * @param paired whether clusters are joined by read pairs rather than by distance
     */
    public ReadClusterTranscriptBuilderSettings(final int minExons, final int minLength, final int minSingleExonLength,
                                                final double minSpan, final int maxIntronLength, final boolean paired) {
        Utils.validateArg(minExons >= 1, "a model has at least one exon");
        Utils.validateArg(minLength >= 0 && minSingleExonLength >= 0, "lengths cannot be negative");
        Utils.validateArg(minSpan >= 0, "span ratio cannot be negative");
        Utils.validateArg(maxIntronLength >= 0, "intron length cannot be negative");
        this.minExons = minExons;
        this.minLength = minLength;
        this.minSingleExonLength = minSingleExonLength;
        this.minSpan = minSpan;
        this.maxIntronLength = maxIntronLength;
        this.paired = paired;
        this.padding = DEFAULT_PADDING;
    }

    public int getMinExons() {
        return minExons;
    }

    public int getMinLength() {
        return minLength;
    }

    public int getMinSingleExonLength() {
        return minSingleExonLength;
    }

    public double getMinSpan() {
        return minSpan;
    }

    public int getMaxIntronLength() {
        return maxIntronLength;
    }

    public boolean isPaired() {
        return paired;
    }

    public int getPadding() {
        return padding;
    }
}
