package org.genebuild.genemerge.tools.merge;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.genebuild.genemerge.exceptions.UserException;
import org.genebuild.genemerge.utils.SimpleInterval;
import org.genebuild.genemerge.utils.Utils;
import org.genebuild.genemerge.utils.config.ConfigFactory;
import org.genebuild.genemerge.utils.config.GeneMergeConfig;
import org.genebuild.genemerge.utils.genemodel.AnnotationSource;
import org.genebuild.genemerge.utils.genemodel.Gene;
import org.genebuild.genemerge.utils.genemodel.Transcript;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Builds the merged gene set of a region from a manual and an automatic annotation.
 *
 * <ol>
 *     <li>Coding, processed transcript and pseudogene genes are fetched from both annotations.</li>
 *     <li>Transcripts left over by an earlier merge or found in the discarded set are filtered out.</li>
 *     <li>Coding transcripts are clustered on their coding exons, the others on their exons.</li>
 *     <li>Pseudogene and processed transcript clusters overlapping a coding cluster enough are folded into it.</li>
 *     <li>Redundant transcripts between the annotations are removed inside each cluster.</li>
 *     <li>Identical exons are shared between the transcripts of a gene.</li>
 *     <li>Each gene gets its final biotype.</li>
 * </ol>
 *
 * An engine keeps no state between regions; any failure only affects the region being built.
 */
public final class GeneMergeEngine {

    private static final Logger logger = LogManager.getLogger(GeneMergeEngine.class);

    private final GeneMergeConfig config;
    private final GeneSource manualSource;
    private final GeneSource automaticSource;
    private final BiotypeCatalog catalog;
    private final TranscriptPreFilter preFilter;
    private final TranscriptClusterEngine codingClusterEngine;
    private final TranscriptClusterEngine processedClusterEngine;
    private final TranscriptClusterEngine pseudoClusterEngine;
    private final GeneClusterCombiner combiner;
    private final RedundantTranscriptMerger merger;
    private final ExonDeduplicator deduplicator;
    private final BiotypeResolver biotypeResolver;

    public GeneMergeEngine(final GeneMergeConfig config, final GeneSource manualSource, final GeneSource automaticSource,
                           final DiscardedTranscriptFilter discardedFilter) {
        this.config = Utils.nonNull(config);
        this.manualSource = Utils.nonNull(manualSource);
        this.automaticSource = Utils.nonNull(automaticSource);
        Utils.nonNull(discardedFilter);
        ConfigFactory.logConfigFields(config);

        this.catalog = new BiotypeCatalog(config);
        this.preFilter = new TranscriptPreFilter(config.manualLogicName(), config.mergedGeneLogicName(),
                config.mergedTranscriptLogicName(), discardedFilter);
        this.codingClusterEngine = new CodingTranscriptClusterEngine(
                GeneClassification.PROTEIN_CODING.getBiotype(), config.mergedGeneLogicName());
        this.processedClusterEngine = new ExonOverlapTranscriptClusterEngine("processed",
                GeneClassification.PROCESSED_TRANSCRIPT.getBiotype(), config.mergedGeneLogicName());
        this.pseudoClusterEngine = new ExonOverlapTranscriptClusterEngine("pseudo",
                GeneClassification.PSEUDOGENE.getBiotype(), config.mergedGeneLogicName());
        this.combiner = new GeneClusterCombiner(config.pseudogeneAbsorptionThreshold());
        this.merger = new RedundantTranscriptMerger(new TranscriptPairMatcher(), new TranscriptRelationAnnotator());
        this.deduplicator = new ExonDeduplicator();
        this.biotypeResolver = new BiotypeResolver(catalog);
    }

    /**
     * Creates an engine that discards no transcript.
     */
    public GeneMergeEngine(final GeneMergeConfig config, final GeneSource manualSource, final GeneSource automaticSource) {
        this(config, manualSource, automaticSource, DiscardedTranscriptFilter.NONE);
    }

    /**
     * @return the merged genes of {@code region} with their final biotypes
     * @throws UserException.MissingRegion if no region is given
     */
    public List<Gene> buildGenes(final SimpleInterval region) {
        if (region == null) {
            throw new UserException.MissingRegion("A region is required to build genes");
        }
        logger.info("Building genes on " + region);

        final List<Gene> codingInput = new ArrayList<>();
        final List<Gene> processedInput = new ArrayList<>();
        final List<Gene> pseudoInput = new ArrayList<>();
        for (final AnnotationSource annotation : new AnnotationSource[]{AnnotationSource.AUTOMATIC, AnnotationSource.MANUAL}) {
            final GeneSource source = annotation == AnnotationSource.MANUAL ? manualSource : automaticSource;
            codingInput.addAll(fetchGenes(source, annotation, region, catalog.getCodingBiotypes(annotation), "coding"));
            processedInput.addAll(fetchGenes(source, annotation, region, catalog.getProcessedBiotypes(annotation), "processed transcript"));
            pseudoInput.addAll(fetchGenes(source, annotation, region, catalog.getPseudoBiotypes(annotation), "pseudogene"));
        }

        final List<Transcript> codingTranscripts = preFilter.filter(codingInput);
        final List<Transcript> processedTranscripts = preFilter.filter(processedInput);
        final List<Transcript> pseudoTranscripts = preFilter.filter(pseudoInput);

        final List<Gene> codingGenes = codingClusterEngine.clusterIntoGenes(codingTranscripts);
        logger.info("Coding gene clusters: " + codingGenes.size());
        final List<Gene> processedGenes = processedClusterEngine.clusterIntoGenes(processedTranscripts);
        logger.info("Processed transcript gene clusters: " + processedGenes.size());
        final List<Gene> pseudoGenes = pseudoClusterEngine.clusterIntoGenes(pseudoTranscripts);
        logger.info("Pseudogene clusters: " + pseudoGenes.size());

        final List<Gene> nonCodingGenes = new ArrayList<>(pseudoGenes);
        nonCodingGenes.addAll(processedGenes);
        final List<Gene> genes = combiner.combine(codingGenes, nonCodingGenes);
        logger.info("Total clusters: " + genes.size());

        merger.mergeRedundantTranscripts(genes);
        genes.forEach(deduplicator::pruneExons);
        logger.info(genes.size() + " genes built");

        genes.forEach(biotypeResolver::resolve);
        return genes;
    }

    /**
     * @return the resolver giving the output biotypes of the transcripts of built genes
     */
    public BiotypeResolver getBiotypeResolver() {
        return biotypeResolver;
    }

    private List<Gene> fetchGenes(final GeneSource source, final AnnotationSource annotation, final SimpleInterval region,
                                  final Set<String> biotypes, final String kind) {
        final List<Gene> genes = new ArrayList<>();
        for (final String biotype : biotypes) {
            for (final Gene gene : source.fetchGenesByType(region, biotype)) {
                if (annotation == AnnotationSource.AUTOMATIC && gene.getLogicName().equals(config.manualLogicName())) {
                    // imported from the manual annotation by an earlier merge
                    logger.debug("Skipping automatic gene " + gene.getId() + " of manual origin");
                    continue;
                }
                gene.getTranscripts().forEach(t -> t.setSource(annotation));
                genes.add(gene);
            }
        }
        logger.info("Retrieved " + genes.size() + " " + annotation.name().toLowerCase() + " " + kind +
                " genes of types: " + StringUtils.join(biotypes, ", "));
        return genes;
    }
}
