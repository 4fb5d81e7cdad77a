package org.genebuild.genemerge.tools.merge;

import com.google.common.collect.ImmutableSet;
import org.genebuild.genemerge.utils.Utils;
import org.genebuild.genemerge.utils.config.GeneMergeConfig;
import org.genebuild.genemerge.utils.genemodel.AnnotationSource;
import org.genebuild.genemerge.utils.genemodel.Transcript;

import java.util.Collection;
import java.util.Set;

/**
 * The biotype vocabulary of both annotations and the suffixes that mark provenance, read from a
 * {@link GeneMergeConfig}. Biotypes are looked up by exact match in the vocabulary of the annotation they belong to.
 */
public final class BiotypeCatalog {

    private final Set<String> manualCoding;
    private final Set<String> manualProcessed;
    private final Set<String> manualPseudo;
    private final Set<String> automaticCoding;
    private final Set<String> automaticProcessed;
    private final Set<String> automaticPseudo;

    private final String manualBiotypeSuffix;
    private final String demotedTranscriptSuffix;
    private final String mergedTranscriptSuffix;
    private final String mergedGeneSuffix;
    private final String manualGeneSuffix;
    private final String automaticGeneSuffix;

    public BiotypeCatalog(final GeneMergeConfig config) {
        Utils.nonNull(config);
        this.manualCoding = toSet(config.manualCodingBiotypes());
        this.manualProcessed = toSet(config.manualProcessedBiotypes());
        this.manualPseudo = toSet(config.manualPseudoBiotypes());
        this.automaticCoding = toSet(config.automaticCodingBiotypes());
        this.automaticProcessed = toSet(config.automaticProcessedBiotypes());
        this.automaticPseudo = toSet(config.automaticPseudoBiotypes());
        this.manualBiotypeSuffix = Utils.nonNull(config.manualBiotypeSuffix());
        this.demotedTranscriptSuffix = Utils.nonNull(config.demotedTranscriptSuffix());
        this.mergedTranscriptSuffix = Utils.nonNull(config.mergedTranscriptSuffix());
        this.mergedGeneSuffix = Utils.nonNull(config.mergedGeneSuffix());
        this.manualGeneSuffix = Utils.nonNull(config.manualGeneSuffix());
        this.automaticGeneSuffix = Utils.nonNull(config.automaticGeneSuffix());
    }

    private static Set<String> toSet(final Collection<String> biotypes) {
        Utils.nonNull(biotypes);
        final ImmutableSet.Builder<String> builder = ImmutableSet.builder();
        for (final String biotype : biotypes) {
            if (!biotype.trim().isEmpty()) {
                builder.add(biotype.trim());
            }
        }
        return builder.build();
    }

    public Set<String> getCodingBiotypes(final AnnotationSource source) {
        return Utils.nonNull(source) == AnnotationSource.MANUAL ? manualCoding : automaticCoding;
    }

    public Set<String> getProcessedBiotypes(final AnnotationSource source) {
        return Utils.nonNull(source) == AnnotationSource.MANUAL ? manualProcessed : automaticProcessed;
    }

    public Set<String> getPseudoBiotypes(final AnnotationSource source) {
        return Utils.nonNull(source) == AnnotationSource.MANUAL ? manualPseudo : automaticPseudo;
    }

    /**
     * @return the class of {@code biotype} in the vocabulary of {@code source}, {@link GeneClassification#UNCLASSIFIED}
     * if it is not part of it
     */
    public GeneClassification classify(final AnnotationSource source, final String biotype) {
        Utils.nonNull(biotype);
        if (getCodingBiotypes(source).contains(biotype)) {
            return GeneClassification.PROTEIN_CODING;
        }
        if (getProcessedBiotypes(source).contains(biotype)) {
            return GeneClassification.PROCESSED_TRANSCRIPT;
        }
        if (getPseudoBiotypes(source).contains(biotype)) {
            return GeneClassification.PSEUDOGENE;
        }
        return GeneClassification.UNCLASSIFIED;
    }

    public GeneClassification classify(final Transcript transcript) {
        Utils.nonNull(transcript);
        return classify(transcript.getBiotypeSource(), transcript.getBiotype());
    }

    /**
     * The biotype a transcript is written out with: its own biotype, the manual suffix when the biotype comes from
     * the manual annotation, the demoted suffix when the transcript carries the biotype of the other annotation,
     * and the merged suffix once it has been paired.
     */
    public String transcriptBiotype(final Transcript transcript) {
        Utils.nonNull(transcript);
        final StringBuilder biotype = new StringBuilder(transcript.getBiotype());
        if (transcript.getBiotypeSource() == AnnotationSource.MANUAL) {
            biotype.append(manualBiotypeSuffix);
        }
        if (transcript.getBiotypeSource() != transcript.getSource()) {
            biotype.append(demotedTranscriptSuffix);
        }
        if (transcript.isMerged()) {
            biotype.append(mergedTranscriptSuffix);
        }
        return biotype.toString();
    }

    public String geneSuffix(final Provenance provenance) {
        Utils.nonNull(provenance);
        switch (provenance) {
            case MERGED:
                return mergedGeneSuffix;
            case MANUAL_ONLY:
                return manualGeneSuffix;
            case AUTOMATIC_ONLY:
                return automaticGeneSuffix;
            default:
                throw new IllegalArgumentException("unknown provenance " + provenance);
        }
    }
}
