package org.genebuild.genemerge.utils.genemodel;

import htsjdk.samtools.util.Locatable;
import htsjdk.tribble.annotation.Strand;
import org.genebuild.genemerge.exceptions.UserException;
import org.genebuild.genemerge.utils.Utils;

import java.util.*;
import java.util.function.Predicate;

/**
 * A transcript model: exons in transcription order (ascending coordinates on the forward strand, descending on the
 * reverse strand), an optional {@link Translation}, a biotype with its provenance, cross-references, attributes and
 * transcript-level supporting evidence.
 *
 * Transcripts have identity semantics; the merge keeps track of them by reference.
 */
public final class Transcript implements Locatable {

    private final String id;
    private final List<Exon> exons;
    private final String logicName;
    private Translation translation;

    private String biotype;
    private AnnotationSource source = AnnotationSource.AUTOMATIC;
    private AnnotationSource biotypeSource;
    private boolean merged;

    private final Set<DBEntry> dbEntries = new LinkedHashSet<>();
    private final Set<TranscriptAttribute> attributes = new LinkedHashSet<>();
    private final Set<SupportingFeature> supportingFeatures = new LinkedHashSet<>();

    /**
     * @param id identifier used in logs and cross-references
     * @param exons non-empty list of exons on one contig and strand, in transcription order and not overlapping
     * @param biotype the biotype as stored by the source annotation
     * @param logicName name of the analysis that produced the transcript
     */
    public Transcript(final String id, final List<Exon> exons, final String biotype, final String logicName) {
        this.id = Utils.nonEmpty(id, "transcript id");
        Utils.nonEmpty(exons, "exons of transcript " + id);
        Utils.containsNoNull(exons, "null exon in transcript " + id);
        validateExonOrder(id, exons);
        this.exons = new ArrayList<>(exons);
        this.biotype = Utils.nonEmpty(biotype, "biotype");
        this.logicName = Utils.nonNull(logicName, "logicName");
    }

    private static void validateExonOrder(final String id, final List<Exon> exons) {
        final Exon first = exons.get(0);
        for (int i = 1; i < exons.size(); i++) {
            final Exon previous = exons.get(i - 1);
            final Exon exon = exons.get(i);
            if (!exon.getContig().equals(first.getContig()) || exon.getStrand() != first.getStrand()) {
                throw new UserException.MalformedGeneModel(id, "exons on more than one contig or strand");
            }
            final boolean inOrder = first.getStrand() == Strand.POSITIVE ?
                    previous.getEnd() < exon.getStart() :
                    previous.getStart() > exon.getEnd();
            if (!inOrder) {
                throw new UserException.MalformedGeneModel(id,
                        "exons " + previous + " and " + exon + " overlap or are not in transcription order");
            }
        }
    }

    public String getId() {
        return id;
    }

    public String getLogicName() {
        return logicName;
    }

    @Override
    public String getContig() {
        return exons.get(0).getContig();
    }

    /** @return the lowest coordinate covered by an exon, whatever the strand */
    @Override
    public int getStart() {
        return isForward() ? exons.get(0).getStart() : exons.get(exons.size() - 1).getStart();
    }

    /** @return the highest coordinate covered by an exon, whatever the strand */
    @Override
    public int getEnd() {
        return isForward() ? exons.get(exons.size() - 1).getEnd() : exons.get(0).getEnd();
    }

    public Strand getStrand() {
        return exons.get(0).getStrand();
    }

    public boolean isForward() {
        return getStrand() == Strand.POSITIVE;
    }

    public List<Exon> getExons() {
        return Collections.unmodifiableList(exons);
    }

    public int getExonCount() {
        return exons.size();
    }

    /**
     * Puts {@code replacement} at position {@code index}. The replacement must be structurally identical to the
     * exon it replaces, so the translation indices stay valid.
     */
    public void replaceExon(final int index, final Exon replacement) {
        Utils.validIndex(index, exons.size());
        Utils.nonNull(replacement);
        Utils.validateArg(exons.get(index).isStructurallyIdenticalTo(replacement),
                () -> "exon " + replacement + " cannot replace " + exons.get(index) + " in transcript " + id);
        exons.set(index, replacement);
    }

    // =================================================================================================================
    // Translation
    // =================================================================================================================

    public boolean isCoding() {
        return translation != null;
    }

    public Translation getTranslation() {
        return translation;
    }

    /**
     * @param translation the new translation, which must address exons of this transcript, or {@code null} to make
     *                    the transcript non-coding
     */
    public void setTranslation(final Translation translation) {
        if (translation != null) {
            if (translation.getEndExonIndex() >= exons.size()) {
                throw new UserException.MalformedGeneModel(id, translation + " refers to a missing exon");
            }
            if (translation.getSeqStart() > exons.get(translation.getStartExonIndex()).getLength() ||
                    translation.getSeqEnd() > exons.get(translation.getEndExonIndex()).getLength()) {
                throw new UserException.MalformedGeneModel(id, translation + " points outside of its exons");
            }
        }
        this.translation = translation;
    }

    /**
     * @return the lowest coding coordinate of this transcript
     */
    public int getCodingRegionStart() {
        Utils.validate(isCoding(), () -> "transcript " + id + " has no translation");
        if (isForward()) {
            return exons.get(translation.getStartExonIndex()).getStart() + translation.getSeqStart() - 1;
        }
        return exons.get(translation.getEndExonIndex()).getEnd() - translation.getSeqEnd() + 1;
    }

    /**
     * @return the highest coding coordinate of this transcript
     */
    public int getCodingRegionEnd() {
        Utils.validate(isCoding(), () -> "transcript " + id + " has no translation");
        if (isForward()) {
            return exons.get(translation.getEndExonIndex()).getStart() + translation.getSeqEnd() - 1;
        }
        return exons.get(translation.getStartExonIndex()).getEnd() - translation.getSeqStart() + 1;
    }

    /**
     * The coding parts of the exons, in transcription order. Exons entirely coding are returned as they are,
     * the first and last coding exons are trimmed copies when they carry UTR.
     *
     * @return an empty list for a non-coding transcript
     */
    public List<Exon> getTranslateableExons() {
        if (!isCoding()) {
            return Collections.emptyList();
        }
        final int codingStart = getCodingRegionStart();
        final int codingEnd = getCodingRegionEnd();
        final List<Exon> translateable = new ArrayList<>();
        for (int i = translation.getStartExonIndex(); i <= translation.getEndExonIndex(); i++) {
            final Exon exon = exons.get(i);
            translateable.add(exon.trimTo(Math.max(exon.getStart(), codingStart), Math.min(exon.getEnd(), codingEnd)));
        }
        return translateable;
    }

    /**
     * @return number of coding bases, 0 for a non-coding transcript
     */
    public int getCodingLength() {
        return getTranslateableExons().stream().mapToInt(Exon::getLength).sum();
    }

    /**
     * @return length in amino acids of the translated peptide, 0 for a non-coding transcript
     */
    public int getTranslationLength() {
        return getCodingLength() / 3;
    }

    // =================================================================================================================
    // Biotype and provenance
    // =================================================================================================================

    public String getBiotype() {
        return biotype;
    }

    public AnnotationSource getSource() {
        return source;
    }

    /**
     * Marks which annotation this transcript came from. The biotype is taken to belong to the same annotation
     * until {@link #adoptBiotype(Transcript)} is called.
     */
    public void setSource(final AnnotationSource source) {
        this.source = Utils.nonNull(source);
    }

    /**
     * @return the annotation whose biotype vocabulary {@link #getBiotype()} belongs to
     */
    public AnnotationSource getBiotypeSource() {
        return biotypeSource == null ? source : biotypeSource;
    }

    /**
     * Takes over the biotype of a transcript from the other annotation, keeping this transcript's own source.
     */
    public void adoptBiotype(final Transcript other) {
        Utils.nonNull(other);
        this.biotype = other.getBiotype();
        this.biotypeSource = other.getBiotypeSource();
    }

    /**
     * @return true once the transcript has been paired with a transcript of the other annotation
     */
    public boolean isMerged() {
        return merged;
    }

    public void markMerged() {
        this.merged = true;
    }

    // =================================================================================================================
    // Cross-references, attributes, evidence
    // =================================================================================================================

    public Set<DBEntry> getDBEntries() {
        return Collections.unmodifiableSet(dbEntries);
    }

    /**
     * @return false if an equal entry was already present
     */
    public boolean addDBEntry(final DBEntry entry) {
        return dbEntries.add(Utils.nonNull(entry));
    }

    /**
     * @return true if any entry was removed
     */
    public boolean removeDBEntriesIf(final Predicate<DBEntry> filter) {
        return dbEntries.removeIf(filter);
    }

    public boolean hasDBEntryFrom(final String dbName) {
        return dbEntries.stream().anyMatch(e -> e.getDbName().equals(dbName));
    }

    public Set<TranscriptAttribute> getAttributes() {
        return Collections.unmodifiableSet(attributes);
    }

    /**
     * @return false if an equal attribute was already present
     */
    public boolean addAttribute(final TranscriptAttribute attribute) {
        return attributes.add(Utils.nonNull(attribute));
    }

    public Set<SupportingFeature> getSupportingFeatures() {
        return Collections.unmodifiableSet(supportingFeatures);
    }

    public boolean addSupportingFeature(final SupportingFeature feature) {
        return supportingFeatures.add(Utils.nonNull(feature));
    }

    public void clearSupportingFeatures() {
        supportingFeatures.clear();
    }

    @Override
    public String toString() {
        return id + "[" + getContig() + ":" + getStart() + "-" + getEnd() + (isForward() ? "(+)" : "(-)") + "]";
    }
}
