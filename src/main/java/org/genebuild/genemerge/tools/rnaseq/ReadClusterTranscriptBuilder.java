package org.genebuild.genemerge.tools.rnaseq;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.tribble.annotation.Strand;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.genebuild.genemerge.utils.SimpleInterval;
import org.genebuild.genemerge.utils.Utils;
import org.genebuild.genemerge.utils.genemodel.Exon;
import org.genebuild.genemerge.utils.genemodel.Gene;
import org.genebuild.genemerge.utils.genemodel.GeneModelUtils;
import org.genebuild.genemerge.utils.genemodel.SupportingFeature;
import org.genebuild.genemerge.utils.genemodel.Transcript;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns exon clusters built from aligned RNA-seq reads into rough, untranslated gene models.
 *
 * <p>Clusters are grouped into models either by distance (the gap to the previous cluster is at most the maximum
 * intron length) or, for paired reads, by the reads they share. Every exon of a model is padded, neighbours that
 * come to overlap are cut back halfway, and models that are too small or too sparse are dropped.</p>
 *
 * <p>Strand is unknown at this stage, so every model is placed on the reverse strand.</p>
 */
public final class ReadClusterTranscriptBuilder {
    private static final Logger logger = LogManager.getLogger(ReadClusterTranscriptBuilder.class);

    public static final String ROUGH_BIOTYPE = "rough";

    private final ReadClusterTranscriptBuilderSettings settings;
    private final String logicName;

    public ReadClusterTranscriptBuilder(final ReadClusterTranscriptBuilderSettings settings, final String logicName) {
        this.settings = Utils.nonNull(settings, "settings");
        this.logicName = Utils.nonEmpty(logicName, "logicName");
    }

    /**
     * Builds rough models for the clusters of one region.
     *
     * @param region region the clusters were called on; exons are padded no further than its end
     * @param clusters exon clusters of the region, with unique names
     * @param readToClusters for paired data, the names of the clusters each read (or pair) lands in; ignored otherwise
     * @return one single-transcript gene per model that passes the filters, in genomic order
     */
    public List<Gene> buildGenes(final SimpleInterval region, final Collection<ExonCluster> clusters,
                                 final Map<String, Set<String>> readToClusters) {
        Utils.nonNull(region, "region");
        Utils.nonNull(clusters, "clusters");
        Utils.containsNoNull(clusters, "clusters cannot contain null");
        final List<String> names = new ArrayList<>(clusters.size());
        for (final ExonCluster cluster : clusters) {
            Utils.validateArg(region.contains(cluster), () -> "cluster " + cluster + " lies outside " + region);
            names.add(cluster.getName());
        }
        Utils.checkForDuplicatesAndReturnSet(names, "Exon cluster names must be unique.");

        final List<List<ExonCluster>> models = settings.isPaired() && clusters.size() > 1
                ? groupByReads(clusters, Utils.nonNull(readToClusters, "read memberships are required for paired data"))
                : groupByDistance(clusters, settings.getMaxIntronLength());

        final List<Gene> genes = new ArrayList<>();
        int rejected = 0;
        for (final List<ExonCluster> model : models) {
            final List<Exon> exons = padExons(model, region.getEnd(), settings.getPadding());
            if (!passesFilters(exons)) {
                rejected++;
                continue;
            }
            final String id = ROUGH_BIOTYPE + "." + (genes.size() + 1);
            final Transcript transcript = new Transcript(id, exons, ROUGH_BIOTYPE, logicName);
            genes.add(new Gene(id, ROUGH_BIOTYPE, logicName, Collections.singletonList(transcript)));
        }
        logger.info("Built " + genes.size() + " rough models from " + clusters.size() + " exon clusters on "
                + region + " (" + rejected + " rejected)");
        return genes;
    }

    /**
     * Chains clusters sorted by start: a cluster joins the current model when it starts no further than
     * {@code maxIntronLength} past the end of the previous one.
     */
    @VisibleForTesting
    static List<List<ExonCluster>> groupByDistance(final Collection<ExonCluster> clusters, final int maxIntronLength) {
        final List<ExonCluster> sorted = new ArrayList<>(clusters);
        sorted.sort(GeneModelUtils.START_THEN_LONGEST);
        final List<List<ExonCluster>> models = new ArrayList<>();
        List<ExonCluster> current = null;
        ExonCluster previous = null;
        for (final ExonCluster cluster : sorted) {
            if (previous == null || cluster.getStart() > (long) previous.getEnd() + maxIntronLength) {
                current = new ArrayList<>();
                models.add(current);
            }
            current.add(cluster);
            previous = cluster;
        }
        return models;
    }

    /**
     * Groups clusters into the connected components of the graph in which two clusters are linked if some read
     * lands in both. Clusters with no shared read form models of their own.
     */
    @VisibleForTesting
    static List<List<ExonCluster>> groupByReads(final Collection<ExonCluster> clusters,
                                                final Map<String, Set<String>> readToClusters) {
        final Map<String, ExonCluster> byName = new LinkedHashMap<>();
        for (final ExonCluster cluster : clusters) {
            byName.put(cluster.getName(), cluster);
        }
        final Map<String, String> parent = new HashMap<>();
        for (final String name : byName.keySet()) {
            parent.put(name, name);
        }
        for (final Map.Entry<String, Set<String>> read : readToClusters.entrySet()) {
            String first = null;
            for (final String name : read.getValue()) {
                if (!byName.containsKey(name)) {
                    logger.warn("Read " + read.getKey() + " refers to unknown exon cluster " + name + "; ignoring it");
                    continue;
                }
                if (first == null) {
                    first = name;
                } else {
                    parent.put(find(parent, name), find(parent, first));
                }
            }
        }

        final Map<String, List<ExonCluster>> components = new LinkedHashMap<>();
        for (final ExonCluster cluster : byName.values()) {
            components.computeIfAbsent(find(parent, cluster.getName()), k -> new ArrayList<>()).add(cluster);
        }
        // keyed by the start of the leftmost member so models come out in genomic order
        final TreeMap<Integer, List<List<ExonCluster>>> ordered = new TreeMap<>();
        for (final List<ExonCluster> component : components.values()) {
            component.sort(GeneModelUtils.START_THEN_LONGEST);
            ordered.computeIfAbsent(component.get(0).getStart(), k -> new ArrayList<>()).add(component);
        }
        final List<List<ExonCluster>> models = new ArrayList<>();
        ordered.values().forEach(models::addAll);
        return models;
    }

    private static String find(final Map<String, String> parent, final String name) {
        String root = name;
        while (!parent.get(root).equals(root)) {
            root = parent.get(root);
        }
        String node = name;
        while (!node.equals(root)) {
            final String next = parent.get(node);
            parent.put(node, root);
            node = next;
        }
        return root;
    }

    /**
     * Pads every cluster of a model on both sides, clamped to [1, regionEnd], and cuts overlapping neighbours back
     * halfway so that no two exons share a base. Each exon carries its cluster as DNA evidence.
     *
     * @return reverse strand exons in transcription order (descending)
     */
    @VisibleForTesting
    static List<Exon> padExons(final List<ExonCluster> model, final int regionEnd, final int padding) {
        Utils.nonEmpty(model, "a model has at least one cluster");
        final List<ExonCluster> sorted = new ArrayList<>(model);
        sorted.sort(GeneModelUtils.START_THEN_LONGEST);
        final int[] starts = new int[sorted.size()];
        final int[] ends = new int[sorted.size()];
        for (int i = 0; i < sorted.size(); i++) {
            final ExonCluster cluster = sorted.get(i);
            starts[i] = Math.max(1, cluster.getStart() - padding);
            ends[i] = Math.min(regionEnd, cluster.getEnd() + padding);
            if (i > 0 && ends[i - 1] >= starts[i]) {
                final int trim = (starts[i] - ends[i - 1]) / 2;
                ends[i - 1] += trim - 1;
                starts[i] -= trim - 1;
            }
            Utils.validate(i == 0 || ends[i - 1] < starts[i],
                    () -> "exon clusters " + sorted + " overlap and cannot be made into a transcript");
        }

        final List<Exon> exons = new ArrayList<>(sorted.size());
        for (int i = sorted.size() - 1; i >= 0; i--) {
            final ExonCluster cluster = sorted.get(i);
            final Exon exon = new Exon(cluster.getContig(), starts[i], ends[i], Strand.NEGATIVE);
            exon.addSupportingFeature(new SupportingFeature(SupportingFeature.Type.DNA, cluster.getContig(),
                    starts[i], ends[i], Strand.NEGATIVE, cluster.getName(), 1, exon.getLength(), Strand.POSITIVE,
                    cluster.getScore()));
            exons.add(exon);
        }
        return exons;
    }

    @VisibleForTesting
    boolean passesFilters(final List<Exon> exons) {
        if (exons.size() < settings.getMinExons()) {
            return false;
        }
        int length = 0;
        int start = Integer.MAX_VALUE;
        int end = 0;
        for (final Exon exon : exons) {
            length += exon.getLength();
            start = Math.min(start, exon.getStart());
            end = Math.max(end, exon.getEnd());
        }
        if (length < settings.getMinLength()) {
            return false;
        }
        if (exons.size() == 1) {
            return length >= settings.getMinSingleExonLength();
        }
        final double span = (double) (end - start + 1) / length;
        return span >= settings.getMinSpan() || length >= settings.getMinSingleExonLength();
    }
}
