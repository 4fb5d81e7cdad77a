package org.genebuild.genemerge.tools.merge;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.genebuild.genemerge.utils.Utils;
import org.genebuild.genemerge.utils.genemodel.AnnotationSource;
import org.genebuild.genemerge.utils.genemodel.Gene;
import org.genebuild.genemerge.utils.genemodel.Transcript;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Removes redundancy between the two annotations inside each gene cluster.
 *
 * Every manual transcript is matched against every automatic transcript still in the gene. The pairing with
 * the highest {@link MatchOutcome#getPriority() priority} is applied (the earliest one among equals): the pair is
 * annotated, both transcripts are marked as merged and the redundant one, if any, leaves the gene.
 * Manual transcripts that pair with nothing only get cross-references to their curated ids.
 */
public final class RedundantTranscriptMerger {

    private static final Logger logger = LogManager.getLogger(RedundantTranscriptMerger.class);

    private final TranscriptPairMatcher matcher;
    private final TranscriptRelationAnnotator annotator;

    public RedundantTranscriptMerger(final TranscriptPairMatcher matcher, final TranscriptRelationAnnotator annotator) {
        this.matcher = Utils.nonNull(matcher);
        this.annotator = Utils.nonNull(annotator);
    }

    public void mergeRedundantTranscripts(final Collection<Gene> genes) {
        Utils.nonNull(genes);
        logger.info("Number of genes in clusters: " + genes.size());
        genes.forEach(this::mergeGene);
    }

    public void mergeGene(final Gene gene) {
        Utils.nonNull(gene);
        final List<Transcript> manual = new ArrayList<>();
        final List<Transcript> automatic = new ArrayList<>();
        for (final Transcript transcript : gene.getTranscripts()) {
            if (transcript.getSource() == AnnotationSource.MANUAL) {
                manual.add(transcript);
            } else {
                automatic.add(transcript);
            }
        }
        if (manual.isEmpty()) {
            return;
        }

        for (final Transcript manualTranscript : manual) {
            // the evidence of a manual transcript survives as attributes only
            annotator.addEvidenceAttributes(manualTranscript, manualTranscript);
            manualTranscript.clearSupportingFeatures();

            TranscriptPairMatcher.MatchDecision best = null;
            Transcript bestPartner = null;
            for (final Transcript automaticTranscript : automatic) {
                final TranscriptPairMatcher.MatchDecision decision = matcher.match(manualTranscript, automaticTranscript);
                logger.debug(manualTranscript.getId() + " / " + automaticTranscript.getId() + ": " + decision);
                if (manualTranscript.isCoding() != automaticTranscript.isCoding() &&
                        manualTranscript.getExonCount() == automaticTranscript.getExonCount()) {
                    logger.warn("Coding and non-coding transcripts overlap: manual " + manualTranscript.getId() +
                            ", automatic " + automaticTranscript.getId());
                }
                if (decision.getOutcome().relatesPair() &&
                        (best == null || decision.getOutcome().getPriority() > best.getOutcome().getPriority())) {
                    best = decision;
                    bestPartner = automaticTranscript;
                }
            }

            if (best == null) {
                annotator.addUnmatchedXrefs(manualTranscript);
            } else {
                applyDecision(gene, manualTranscript, bestPartner, best, automatic);
            }
        }
    }

    private void applyDecision(final Gene gene, final Transcript manual, final Transcript automatic,
                               final TranscriptPairMatcher.MatchDecision decision, final List<Transcript> candidates) {
        if (decision.demotesSecond()) {
            automatic.setTranslation(null);
            automatic.adoptBiotype(manual);
        }
        annotator.relate(decision.getOutcome(), manual, automatic);
        manual.markMerged();
        automatic.markMerged();

        switch (decision.getOutcome()) {
            case DROP_FIRST:
                gene.removeTranscript(manual);
                logger.debug("Removed manual transcript " + manual.getId() + " in favour of " + automatic.getId());
                break;
            case DROP_SECOND:
                gene.removeTranscript(automatic);
                candidates.removeIf(t -> t == automatic);
                logger.debug("Removed automatic transcript " + automatic.getId() + " in favour of " + manual.getId());
                break;
            default:
                break;
        }
    }
}
