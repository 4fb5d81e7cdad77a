package org.genebuild.genemerge.tools.rnaseq;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import htsjdk.tribble.annotation.Strand;
import org.genebuild.genemerge.testutils.BaseTest;
import org.genebuild.genemerge.utils.SimpleInterval;
import org.genebuild.genemerge.utils.genemodel.Exon;
import org.genebuild.genemerge.utils.genemodel.Gene;
import org.genebuild.genemerge.utils.genemodel.SupportingFeature;
import org.genebuild.genemerge.utils.genemodel.Transcript;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class ReadClusterTranscriptBuilderUnitTest extends BaseTest {

    private static final String CONTIG = "1";
    private static final SimpleInterval REGION = new SimpleInterval(CONTIG, 1, 100000);

    private static ExonCluster cluster(final String name, final int start, final int end) {
        return new ExonCluster(name, new SimpleInterval(CONTIG, start, end), 10.0);
    }

    private static ReadClusterTranscriptBuilder builder(final boolean paired) {
        return new ReadClusterTranscriptBuilder(
                new ReadClusterTranscriptBuilderSettings(1, 100, 1000, 1.5, 5000, paired), "bam2genes");
    }

    @Test
    public void testGroupByDistance() {
        final ExonCluster a = cluster("a", 100, 200);
        final ExonCluster b = cluster("b", 1000, 1100);
        final ExonCluster c = cluster("c", 50000, 50100);
        final List<List<ExonCluster>> models = ReadClusterTranscriptBuilder.groupByDistance(Arrays.asList(c, b, a), 5000);
        Assert.assertEquals(models, Arrays.asList(Arrays.asList(a, b), Collections.singletonList(c)));
    }

    @Test
    public void testGroupByDistanceAtTheLimit() {
        final ExonCluster a = cluster("a", 100, 200);
        final ExonCluster b = cluster("b", 5200, 5300);
        final ExonCluster c = cluster("c", 10301, 10400);
        final List<List<ExonCluster>> models = ReadClusterTranscriptBuilder.groupByDistance(Arrays.asList(a, b, c), 5000);
        Assert.assertEquals(models.size(), 2);
        Assert.assertEquals(models.get(0), Arrays.asList(a, b));
    }

    @Test
    public void testGroupByReads() {
        final ExonCluster a = cluster("a", 100, 200);
        final ExonCluster b = cluster("b", 5000, 5100);
        final ExonCluster c = cluster("c", 90000, 90100);
        final ExonCluster d = cluster("d", 95000, 95100);
        final Map<String, Set<String>> reads = ImmutableMap.of(
                "read1", ImmutableSet.of("a", "c"),
                "read2", ImmutableSet.of("c", "d"),
                "read3", ImmutableSet.of("b", "unknown"));

        final List<List<ExonCluster>> models = ReadClusterTranscriptBuilder.groupByReads(Arrays.asList(d, c, b, a), reads);
        Assert.assertEquals(models, Arrays.asList(Arrays.asList(a, c, d), Collections.singletonList(b)));
    }

    @Test
    public void testPaddingAndHalfwayTrim() {
        final List<Exon> exons = ReadClusterTranscriptBuilder.padExons(
                Arrays.asList(cluster("a", 100, 200), cluster("b", 230, 300)), 100000, 20);
        Assert.assertEquals(exons.size(), 2);
        // reverse strand, transcription order
        Assert.assertEquals(exons.get(0).getStart(), 216);
        Assert.assertEquals(exons.get(0).getEnd(), 320);
        Assert.assertEquals(exons.get(1).getStart(), 80);
        Assert.assertEquals(exons.get(1).getEnd(), 214);
        Assert.assertEquals(exons.get(0).getStrand(), Strand.NEGATIVE);

        final SupportingFeature evidence = exons.get(0).getSupportingFeatures().get(0);
        Assert.assertEquals(evidence.getType(), SupportingFeature.Type.DNA);
        Assert.assertEquals(evidence.getHitName(), "b");
        Assert.assertEquals(evidence.getHitStart(), 1);
        Assert.assertEquals(evidence.getHitEnd(), exons.get(0).getLength());
        Assert.assertEquals(evidence.getScore(), 10.0);
        Assert.assertEquals(evidence.getStrand(), Strand.NEGATIVE);
        Assert.assertEquals(evidence.getHitStrand(), Strand.POSITIVE);
    }

    @Test
    public void testPaddingIsClampedToRegion() {
        final List<Exon> exons = ReadClusterTranscriptBuilder.padExons(
                Collections.singletonList(cluster("a", 5, 50)), 60, 20);
        Assert.assertEquals(exons.get(0).getStart(), 1);
        Assert.assertEquals(exons.get(0).getEnd(), 60);
    }

    @Test
    public void testBuildGenesFilters() {
        final List<ExonCluster> clusters = Arrays.asList(
                cluster("short-single", 1000, 1200),
                cluster("long-single", 10000, 11000),
                cluster("spliced-1", 20000, 20100),
                cluster("spliced-2", 21000, 21100),
                cluster("dense-1", 30000, 30100),
                cluster("dense-2", 30150, 30250));

        final List<Gene> genes = builder(false).buildGenes(REGION, clusters, null);
        Assert.assertEquals(genes.size(), 2);

        final Transcript single = genes.get(0).getTranscripts().get(0);
        Assert.assertEquals(single.getExonCount(), 1);
        Assert.assertEquals(single.getStart(), 9980);
        Assert.assertEquals(genes.get(0).getId(), "rough.1");
        Assert.assertEquals(genes.get(0).getBiotype(), ReadClusterTranscriptBuilder.ROUGH_BIOTYPE);
        Assert.assertEquals(genes.get(0).getLogicName(), "bam2genes");

        final Transcript spliced = genes.get(1).getTranscripts().get(0);
        Assert.assertEquals(spliced.getExonCount(), 2);
        Assert.assertEquals(spliced.getStrand(), Strand.NEGATIVE);
        Assert.assertFalse(spliced.isCoding());
        Assert.assertEquals(genes.get(1).getId(), "rough.2");
    }

    @Test
    public void testMinExons() {
        final ReadClusterTranscriptBuilder builder = new ReadClusterTranscriptBuilder(
                new ReadClusterTranscriptBuilderSettings(2, 0, 0, 0, 5000, false), "bam2genes");
        final List<Gene> genes = builder.buildGenes(REGION,
                Arrays.asList(cluster("a", 100, 200), cluster("b", 50000, 50100), cluster("c", 51000, 51100)), null);
        Assert.assertEquals(genes.size(), 1);
        Assert.assertEquals(genes.get(0).getTranscripts().get(0).getExonCount(), 2);
    }

    @Test
    public void testSingleClusterInPairedMode() {
        final List<Gene> genes = builder(true).buildGenes(REGION,
                Collections.singletonList(cluster("a", 10000, 11000)), null);
        Assert.assertEquals(genes.size(), 1);
    }

    @Test
    public void testPairedModeJoinsDistantClusters() {
        final List<ExonCluster> clusters = Arrays.asList(cluster("a", 10000, 10500), cluster("b", 60000, 60600));
        final Map<String, Set<String>> reads = Collections.singletonMap("pair1", ImmutableSet.of("a", "b"));
        final List<Gene> genes = builder(true).buildGenes(REGION, clusters, reads);
        Assert.assertEquals(genes.size(), 1);
        Assert.assertEquals(genes.get(0).getTranscripts().get(0).getExonCount(), 2);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testDuplicateClusterNames() {
        builder(false).buildGenes(REGION, Arrays.asList(cluster("a", 100, 200), cluster("a", 300, 400)), null);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testClusterOutsideRegion() {
        builder(false).buildGenes(new SimpleInterval(CONTIG, 1, 1000), Collections.singletonList(cluster("a", 900, 1100)), null);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testPairedModeNeedsReads() {
        builder(true).buildGenes(REGION, Arrays.asList(cluster("a", 100, 200), cluster("b", 300, 400)), null);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testInvalidSettings() {
        new ReadClusterTranscriptBuilderSettings(0, 0, 0, 0, 0, false);
    }
}
