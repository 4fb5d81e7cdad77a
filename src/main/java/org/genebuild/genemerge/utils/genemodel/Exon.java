package org.genebuild.genemerge.utils.genemodel;

import htsjdk.samtools.util.Locatable;
import htsjdk.tribble.annotation.Strand;
import org.genebuild.genemerge.exceptions.UserException;
import org.genebuild.genemerge.utils.SimpleInterval;
import org.genebuild.genemerge.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A stranded interval of a transcript together with its reading frame phases and the evidence supporting it.
 *
 * Coordinates, strand and phases are fixed at construction; only the supporting evidence may grow.
 * Exons have identity semantics: two structurally identical exons stay distinct objects until
 * exon deduplication makes the transcripts of a gene share one of them.
 */
public final class Exon implements Locatable {

    /** Phase of an exon whose boundary is not inside a reading frame. */
    public static final int NO_PHASE = -1;

    private final String contig;
    private final int start;
    private final int end;
    private final Strand strand;
    private final int phase;
    private final int endPhase;
    private final List<SupportingFeature> supportingFeatures = new ArrayList<>();

    public Exon(final String contig, final int start, final int end, final Strand strand, final int phase, final int endPhase) {
        Utils.validateArg(SimpleInterval.isValid(contig, start, end),
                () -> "Invalid exon coordinates. Contig:" + contig + " start:" + start + " end:" + end);
        Utils.nonNull(strand, "strand");
        if (strand == Strand.NONE) {
            throw new UserException.MalformedGeneModel(contig + ":" + start + "-" + end, "exons must be stranded");
        }
        Utils.validateArg(isValidPhase(phase), () -> "invalid phase " + phase);
        Utils.validateArg(isValidPhase(endPhase), () -> "invalid end phase " + endPhase);
        this.contig = contig;
        this.start = start;
        this.end = end;
        this.strand = strand;
        this.phase = phase;
        this.endPhase = endPhase;
    }

    /**
     * Creates an exon without reading frame information.
     */
    public Exon(final String contig, final int start, final int end, final Strand strand) {
        this(contig, start, end, strand, NO_PHASE, NO_PHASE);
    }

    private static boolean isValidPhase(final int phase) {
        return phase >= NO_PHASE && phase <= 2;
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

    public int getPhase() {
        return phase;
    }

    public int getEndPhase() {
        return endPhase;
    }

    public int getLength() {
        return end - start + 1;
    }

    public List<SupportingFeature> getSupportingFeatures() {
        return Collections.unmodifiableList(supportingFeatures);
    }

    public void addSupportingFeature(final SupportingFeature feature) {
        supportingFeatures.add(Utils.nonNull(feature));
    }

    /**
     * @return true if both exons sit on the same bases of the same strand
     */
    public boolean hasSameCoordinates(final Exon other) {
        Utils.nonNull(other);
        return start == other.start && end == other.end && strand == other.strand && contig.equals(other.contig);
    }

    /**
     * Exons are structurally identical, and therefore interchangeable within a gene, when coordinates, strand,
     * phase and end phase all match.
     */
    public boolean isStructurallyIdenticalTo(final Exon other) {
        return hasSameCoordinates(other) && phase == other.phase && endPhase == other.endPhase;
    }

    /**
     * @return this exon if the requested bounds are its own bounds, otherwise a new exon restricted to
     * {@code [newStart, newEnd]} with the same strand and phases and no evidence
     */
    Exon trimTo(final int newStart, final int newEnd) {
        Utils.validateArg(newStart >= start && newEnd <= end && newStart <= newEnd,
                () -> "cannot trim " + this + " to " + newStart + "-" + newEnd);
        if (newStart == start && newEnd == end) {
            return this;
        }
        return new Exon(contig, newStart, newEnd, strand, phase, endPhase);
    }

    @Override
    public String toString() {
        return contig + ":" + start + "-" + end + (strand == Strand.POSITIVE ? "(+)" : "(-)");
    }
}
