package org.genebuild.genemerge.tools.merge;

import com.google.common.annotations.VisibleForTesting;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.genebuild.genemerge.exceptions.GeneMergeException;
import org.genebuild.genemerge.utils.Utils;
import org.genebuild.genemerge.utils.genemodel.Gene;
import org.genebuild.genemerge.utils.genemodel.Transcript;

import java.util.*;

/**
 * Groups transcripts into genes by single linkage: a transcript joins every cluster holding a transcript it
 * {@link #clusterTogether clusters together} with, and clusters joined by one transcript are merged.
 * The resulting partition does not depend on the order transcripts are processed in.
 *
 * Subclasses choose which transcripts take part, the order they are processed in and the linkage predicate.
 */
public abstract class TranscriptClusterEngine {

    private static final Logger logger = LogManager.getLogger(TranscriptClusterEngine.class);

    private final String geneIdPrefix;
    private final String geneBiotype;
    private final String geneLogicName;

    /**
     * @param geneIdPrefix prefix of the ids given to the genes built from the clusters
     * @param geneBiotype provisional biotype of those genes, replaced once the merge resolves biotypes
     * @param geneLogicName logic name of those genes
     */
    protected TranscriptClusterEngine(final String geneIdPrefix, final String geneBiotype, final String geneLogicName) {
        this.geneIdPrefix = Utils.nonEmpty(geneIdPrefix, "geneIdPrefix");
        this.geneBiotype = Utils.nonEmpty(geneBiotype, "geneBiotype");
        this.geneLogicName = Utils.nonNull(geneLogicName, "geneLogicName");
    }

    /**
     * @return the transcripts of {@code transcripts} that take part in clustering, in processing order
     */
    protected abstract List<Transcript> selectTranscripts(final Collection<Transcript> transcripts);

    /**
     * @param exonCache coding exons of the transcripts of the current run
     * @return true if {@code a} and {@code b} belong to the same gene
     */
    protected abstract boolean clusterTogether(final Transcript a, final Transcript b, final CodingExonCache exonCache);

    /**
     * Clusters transcripts into genes, one gene per cluster. Every selected transcript ends up in exactly one gene.
     *
     * @throws GeneMergeException.InconsistentClustersException if the clusters do not partition the selected transcripts
     */
    public final List<Gene> clusterIntoGenes(final Collection<Transcript> transcripts) {
        Utils.nonNull(transcripts);
        Utils.containsNoNull(transcripts, "transcripts to cluster contain a null");

        final List<Transcript> selected = selectTranscripts(transcripts);
        final List<List<Transcript>> clusters = cluster(selected, new CodingExonCache());
        checkClusters(selected.size(), clusters);

        final List<Gene> genes = new ArrayList<>(clusters.size());
        int geneIndex = 1;
        for (final List<Transcript> cluster : clusters) {
            genes.add(new Gene(geneIdPrefix + "." + geneIndex++, geneBiotype, geneLogicName, cluster));
        }
        logger.debug(selected.size() + " transcripts clustered into " + genes.size() + " " + geneIdPrefix + " genes");
        return genes;
    }

    private List<List<Transcript>> cluster(final List<Transcript> transcripts, final CodingExonCache exonCache) {
        List<List<Transcript>> clusters = new ArrayList<>();
        for (final Transcript transcript : transcripts) {
            final List<List<Transcript>> matchingClusters = new ArrayList<>();
            for (final List<Transcript> cluster : clusters) {
                if (cluster.stream().anyMatch(member -> clusterTogether(transcript, member, exonCache))) {
                    matchingClusters.add(cluster);
                }
            }

            if (matchingClusters.isEmpty()) {
                final List<Transcript> newCluster = new ArrayList<>();
                newCluster.add(transcript);
                clusters.add(newCluster);
            } else if (matchingClusters.size() == 1) {
                matchingClusters.get(0).add(transcript);
            } else {
                // the merged cluster goes first, followed by the untouched ones in their previous order
                final List<Transcript> mergedCluster = new ArrayList<>();
                matchingClusters.forEach(mergedCluster::addAll);
                mergedCluster.add(transcript);

                final List<List<Transcript>> newClusters = new ArrayList<>();
                newClusters.add(mergedCluster);
                for (final List<Transcript> cluster : clusters) {
                    if (matchingClusters.stream().noneMatch(m -> m == cluster)) {
                        newClusters.add(cluster);
                    }
                }
                clusters = newClusters;
            }
        }
        return clusters;
    }

    /**
     * Partition check run after every clustering pass: no empty cluster, no transcript in two clusters and
     * {@code expectedTranscripts} transcripts in total.
     */
    @VisibleForTesting
    static void checkClusters(final int expectedTranscripts, final List<? extends Collection<Transcript>> clusters) {
        final Set<Transcript> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        int total = 0;
        for (final Collection<Transcript> cluster : clusters) {
            if (cluster.isEmpty()) {
                throw new GeneMergeException.InconsistentClustersException("empty cluster");
            }
            for (final Transcript transcript : cluster) {
                if (!seen.add(transcript)) {
                    throw new GeneMergeException.InconsistentClustersException(
                            "transcript " + transcript.getId() + " added twice to clusters");
                }
            }
            total += cluster.size();
        }
        if (total != expectedTranscripts) {
            throw new GeneMergeException.InconsistentClustersException(
                    "not all transcripts have been added into clusters: " + total + " and " + expectedTranscripts);
        }
    }
}
