package org.genebuild.genemerge.tools.merge;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.genebuild.genemerge.exceptions.UserException;
import org.genebuild.genemerge.utils.Utils;
import org.genebuild.genemerge.utils.genemodel.AnnotationSource;
import org.genebuild.genemerge.utils.genemodel.Gene;
import org.genebuild.genemerge.utils.genemodel.Transcript;

import java.util.stream.Collectors;

/**
 * Assigns final biotypes to merged genes: a functional class from the biotypes of the transcripts
 * (coding over processed transcript over pseudogene) followed by a suffix telling which annotations the
 * transcripts came from.
 */
public final class BiotypeResolver {

    private static final Logger logger = LogManager.getLogger(BiotypeResolver.class);

    private final BiotypeCatalog catalog;

    public BiotypeResolver(final BiotypeCatalog catalog) {
        this.catalog = Utils.nonNull(catalog);
    }

    public GeneClassification classify(final Gene gene) {
        Utils.nonNull(gene);
        boolean hasCoding = false;
        boolean hasProcessed = false;
        boolean hasPseudo = false;
        for (final Transcript transcript : gene.getTranscripts()) {
            switch (catalog.classify(transcript)) {
                case PROTEIN_CODING: hasCoding = true; break;
                case PROCESSED_TRANSCRIPT: hasProcessed = true; break;
                case PSEUDOGENE: hasPseudo = true; break;
                default: break;
            }
        }
        if (hasCoding) {
            return GeneClassification.PROTEIN_CODING;
        } else if (hasProcessed) {
            return GeneClassification.PROCESSED_TRANSCRIPT;
        } else if (hasPseudo) {
            return GeneClassification.PSEUDOGENE;
        }
        return GeneClassification.UNCLASSIFIED;
    }

    public Provenance provenance(final Gene gene) {
        Utils.nonNull(gene);
        boolean hasManual = false;
        boolean hasAutomatic = false;
        for (final Transcript transcript : gene.getTranscripts()) {
            if (transcript.isMerged()) {
                return Provenance.MERGED;
            }
            if (transcript.getSource() == AnnotationSource.MANUAL) {
                hasManual = true;
            } else {
                hasAutomatic = true;
            }
        }
        if (hasManual && hasAutomatic) {
            return Provenance.MERGED;
        }
        return hasManual ? Provenance.MANUAL_ONLY : Provenance.AUTOMATIC_ONLY;
    }

    /**
     * Sets the biotype of {@code gene} from its transcripts.
     *
     * @return the class the gene was given
     * @throws UserException.MalformedGeneModel if the gene has no transcripts
     */
    public GeneClassification resolve(final Gene gene) {
        Utils.nonNull(gene);
        if (gene.isEmpty()) {
            throw new UserException.MalformedGeneModel(gene.getId(), "gene without transcripts cannot be given a biotype");
        }
        final GeneClassification classification = classify(gene);
        final Provenance provenance = provenance(gene);
        if (classification == GeneClassification.UNCLASSIFIED) {
            logger.warn("Gene " + gene.getId() + " at " + gene.getContig() + ":" + gene.getStart() + "-" + gene.getEnd() +
                    " has no transcript of a known biotype: " + gene.getTranscripts().stream()
                    .map(t -> t.getId() + "=" + catalog.transcriptBiotype(t))
                    .collect(Collectors.joining(", ")));
        }
        gene.setBiotype(classification.getBiotype() + catalog.geneSuffix(provenance));
        return classification;
    }

    /**
     * @return the biotype {@code transcript} is written out with
     */
    public String transcriptBiotype(final Transcript transcript) {
        return catalog.transcriptBiotype(transcript);
    }
}
