package org.genebuild.genemerge.tools.merge;

import com.google.common.annotations.VisibleForTesting;
import org.genebuild.genemerge.exceptions.UserException;
import org.genebuild.genemerge.utils.Utils;
import org.genebuild.genemerge.utils.genemodel.*;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Records on the surviving transcripts what the merge decided about a manual / automatic pair: cross-references
 * to the curated identifiers, link attributes and the supporting evidence of the dropped transcript.
 */
public final class TranscriptRelationAnnotator {

    /**
     * Annotates a related pair.
     *
     * @param outcome any outcome but {@link MatchOutcome#KEEP_BOTH}
     * @param manual the manual transcript of the pair
     * @param automatic the automatic transcript of the pair
     */
    public void relate(final MatchOutcome outcome, final Transcript manual, final Transcript automatic) {
        Utils.nonNull(outcome);
        Utils.nonNull(manual);
        Utils.nonNull(automatic);
        switch (outcome) {
            case LINK:
                for (final DBEntry vega : curatedIds(manual)) {
                    automatic.addDBEntry(new DBEntry(DBEntry.SHARES_CDS_WITH_OTTT, vega.getPrimaryId(), vega.getDisplayId()));
                    manual.addDBEntry(new DBEntry(DBEntry.OTTT, vega.getPrimaryId(), vega.getDisplayId()));
                }
                automatic.addAttribute(new TranscriptAttribute(TranscriptAttribute.ENST_LINK, automatic.getId()));
                manual.addDBEntry(new DBEntry(DBEntry.SHARES_CDS_WITH_ENST, automatic.getId(), automatic.getId()));
                break;
            case DROP_FIRST:
                for (final DBEntry vega : curatedIds(manual)) {
                    automatic.addDBEntry(new DBEntry(DBEntry.SHARES_CDS_WITH_OTTT, vega.getPrimaryId(), vega.getDisplayId()));
                }
                automatic.addAttribute(new TranscriptAttribute(TranscriptAttribute.TRANSCRIPT_EDGE,
                        manual.getContig() + ":" + manual.getStart() + ":" + manual.getEnd() + ":1"));
                transferExonEvidence(manual, automatic);
                addEvidenceAttributes(manual, automatic);
                break;
            case DROP_SECOND:
                for (final DBEntry vega : curatedIds(manual)) {
                    manual.addDBEntry(new DBEntry(DBEntry.SHARES_CDS_AND_UTR_WITH_OTTT, vega.getPrimaryId(), vega.getDisplayId()));
                }
                automatic.getSupportingFeatures().forEach(manual::addSupportingFeature);
                transferExonEvidence(automatic, manual);
                break;
            default:
                throw new IllegalArgumentException("transcripts kept as unrelated need no annotation: " + outcome);
        }
    }

    /**
     * Gives a manual transcript that matched nothing an {@code OTTT} cross-reference for each of its curated ids.
     */
    public void addUnmatchedXrefs(final Transcript manual) {
        Utils.nonNull(manual);
        for (final DBEntry vega : curatedIds(manual)) {
            manual.addDBEntry(new DBEntry(DBEntry.OTTT, vega.getPrimaryId(), manual.getId()));
        }
    }

    /**
     * Adds to {@code target} one attribute per distinct evidence name supporting {@code evidenceSource}, telling
     * transcript-level from exon-level and protein from cDNA evidence.
     */
    public void addEvidenceAttributes(final Transcript evidenceSource, final Transcript target) {
        Utils.nonNull(evidenceSource);
        Utils.nonNull(target);
        for (final SupportingFeature feature : evidenceSource.getSupportingFeatures()) {
            target.addAttribute(new TranscriptAttribute(feature.getType() == SupportingFeature.Type.PROTEIN ?
                    TranscriptAttribute.TRANSCRIPT_PROTEIN_SUPPORT : TranscriptAttribute.TRANSCRIPT_DNA_SUPPORT,
                    feature.getHitName()));
        }
        for (final Exon exon : evidenceSource.getExons()) {
            for (final SupportingFeature feature : exon.getSupportingFeatures()) {
                target.addAttribute(new TranscriptAttribute(feature.getType() == SupportingFeature.Type.PROTEIN ?
                        TranscriptAttribute.EXON_PROTEIN_SUPPORT : TranscriptAttribute.EXON_DNA_SUPPORT,
                        feature.getHitName()));
            }
        }
    }

    /**
     * Copies the exon evidence of {@code from} onto the exon at the same position in {@code to}.
     *
     * @throws UserException.MalformedGeneModel if the transcripts have different numbers of exons
     */
    @VisibleForTesting
    static void transferExonEvidence(final Transcript from, final Transcript to) {
        if (from.getExonCount() != to.getExonCount()) {
            throw new UserException.MalformedGeneModel(from.getId(), "cannot transfer exon evidence onto " + to.getId() +
                    ": " + from.getExonCount() + " exons against " + to.getExonCount());
        }
        for (int i = 0; i < from.getExonCount(); i++) {
            transferSupportingEvidence(from.getExons().get(i), to.getExons().get(i));
        }
    }

    /**
     * Adds the evidence of {@code source} to {@code target}, skipping records already on the target or already
     * transferred by this call.
     *
     * @return number of records transferred
     */
    @VisibleForTesting
    static int transferSupportingEvidence(final Exon source, final Exon target) {
        if (source == target) {
            return 0;
        }
        final List<SupportingFeature> existing = new ArrayList<>(target.getSupportingFeatures());
        final Set<SupportingFeature> transferred = new LinkedHashSet<>();
        for (final SupportingFeature feature : source.getSupportingFeatures()) {
            if (existing.stream().anyMatch(feature::isSameEvidenceAs) ||
                    transferred.stream().anyMatch(feature::isSameEvidenceAs)) {
                continue;
            }
            target.addSupportingFeature(feature);
            transferred.add(feature);
        }
        return transferred.size();
    }

    private static List<DBEntry> curatedIds(final Transcript transcript) {
        final List<DBEntry> curated = new ArrayList<>();
        for (final DBEntry entry : transcript.getDBEntries()) {
            if (entry.isSelfNamedVegaTranscript()) {
                curated.add(entry);
            }
        }
        return curated;
    }
}
