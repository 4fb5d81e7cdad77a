package org.genebuild.genemerge.utils.genemodel;

import htsjdk.samtools.util.Locatable;
import htsjdk.tribble.annotation.Strand;
import org.genebuild.genemerge.utils.Utils;

import java.util.Objects;

/**
 * An alignment of a piece of evidence (a protein or a cDNA) supporting an exon or a whole transcript.
 * The query side is placed on the region being merged, the hit side on the evidence sequence.
 *
 * Instances are immutable and compare equal when every field matches.
 */
public final class SupportingFeature implements Locatable {

    public enum Type {
        PROTEIN,
        DNA
    }

    private final Type type;
    private final String contig;
    private final int start;
    private final int end;
    private final Strand strand;
    private final String hitName;
    private final int hitStart;
    private final int hitEnd;
    private final Strand hitStrand;
    private final double score;

    public SupportingFeature(final Type type, final String contig, final int start, final int end, final Strand strand,
                             final String hitName, final int hitStart, final int hitEnd, final Strand hitStrand,
                             final double score) {
        Utils.nonNull(type, "type");
        Utils.nonNull(contig, "contig");
        Utils.nonEmpty(hitName, "hitName");
        Utils.nonNull(strand, "strand");
        Utils.nonNull(hitStrand, "hitStrand");
        Utils.validateArg(start > 0 && end >= start, () -> "invalid feature coordinates " + start + "-" + end);
        Utils.validateArg(hitStart > 0 && hitEnd >= hitStart, () -> "invalid hit coordinates " + hitStart + "-" + hitEnd);
        this.type = type;
        this.contig = contig;
        this.start = start;
        this.end = end;
        this.strand = strand;
        this.hitName = hitName;
        this.hitStart = hitStart;
        this.hitEnd = hitEnd;
        this.hitStrand = hitStrand;
        this.score = score;
    }

    public Type getType() {
        return type;
    }

    @Override
    public String getContig() {
        return contig;
    }

    @Override
    public int getStart() {
        return start;
    }

    @Override
    public int getEnd() {
        return end;
    }

    public Strand getStrand() {
        return strand;
    }

    public String getHitName() {
        return hitName;
    }

    public int getHitStart() {
        return hitStart;
    }

    public int getHitEnd() {
        return hitEnd;
    }

    public Strand getHitStrand() {
        return hitStrand;
    }

    public double getScore() {
        return score;
    }

    /**
     * Two features describe the same piece of evidence when they align the same hit region onto the same
     * stretch of the region. Type, hit strand and score are ignored.
     */
    public boolean isSameEvidenceAs(final SupportingFeature other) {
        Utils.nonNull(other);
        return start == other.start && end == other.end && strand == other.strand
                && hitName.equals(other.hitName) && hitStart == other.hitStart && hitEnd == other.hitEnd;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final SupportingFeature that = (SupportingFeature) o;
        return start == that.start && end == that.end && hitStart == that.hitStart && hitEnd == that.hitEnd
                && Double.compare(that.score, score) == 0 && type == that.type && contig.equals(that.contig)
                && strand == that.strand && hitName.equals(that.hitName) && hitStrand == that.hitStrand;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, contig, start, end, strand, hitName, hitStart, hitEnd, hitStrand, score);
    }

    @Override
    public String toString() {
        return type + ":" + hitName + "[" + hitStart + "-" + hitEnd + "]@" + contig + ":" + start + "-" + end;
    }
}
