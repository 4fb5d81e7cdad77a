package org.genebuild.genemerge.tools.merge;

import htsjdk.tribble.annotation.Strand;
import org.genebuild.genemerge.exceptions.GeneMergeException;
import org.genebuild.genemerge.testutils.BaseTest;
import org.genebuild.genemerge.utils.genemodel.AnnotationSource;
import org.genebuild.genemerge.utils.genemodel.Gene;
import org.genebuild.genemerge.utils.genemodel.Transcript;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.genebuild.genemerge.testutils.GeneModelTestUtils.codingTranscript;
import static org.genebuild.genemerge.testutils.GeneModelTestUtils.transcript;

public final class TranscriptClusterEngineUnitTest extends BaseTest {

    private static final AnnotationSource A = AnnotationSource.AUTOMATIC;
    private static final AnnotationSource M = AnnotationSource.MANUAL;

    private final TranscriptClusterEngine codingEngine = new CodingTranscriptClusterEngine("protein_coding", "ensembl_havana_gene");
    private final TranscriptClusterEngine exonEngine = new ExonOverlapTranscriptClusterEngine("pseudo", "pseudogene", "ensembl_havana_gene");

    private static int totalTranscripts(final List<Gene> genes) {
        return genes.stream().mapToInt(g -> g.getTranscripts().size()).sum();
    }

    @Test
    public void testCodingClustersArePartition() {
        final Transcript a = codingTranscript("a", A, Strand.POSITIVE, 150, 350, 100, 200, 300, 400);
        final Transcript b = codingTranscript("b", M, Strand.POSITIVE, 160, 340, 100, 200, 300, 400);
        final Transcript c = codingTranscript("c", A, Strand.POSITIVE, 1150, 1350, 1100, 1200, 1300, 1400);

        final List<Gene> genes = codingEngine.clusterIntoGenes(Arrays.asList(c, a, b));
        Assert.assertEquals(genes.size(), 2);
        Assert.assertEquals(totalTranscripts(genes), 3);
        Assert.assertEquals(genes.get(0).getId(), "coding.1");
        Assert.assertEquals(genes.get(0).getTranscripts(), Arrays.asList(a, b));
        Assert.assertEquals(genes.get(1).getTranscripts(), Collections.singletonList(c));
        Assert.assertEquals(genes.get(0).getBiotype(), "protein_coding");
        Assert.assertEquals(genes.get(0).getLogicName(), "ensembl_havana_gene");
    }

    @Test
    public void testOppositeStrandsDoNotCluster() {
        final Transcript forward = codingTranscript("f", A, Strand.POSITIVE, 150, 350, 100, 200, 300, 400);
        final Transcript reverse = codingTranscript("r", A, Strand.NEGATIVE, 150, 350, 100, 200, 300, 400);
        Assert.assertEquals(codingEngine.clusterIntoGenes(Arrays.asList(forward, reverse)).size(), 2);
        Assert.assertEquals(exonEngine.clusterIntoGenes(Arrays.asList(forward, reverse)).size(), 2);
    }

    @Test
    public void testCodingClusteringIgnoresUtrOverlap() {
        // exons overlap only in UTR
        final Transcript a = codingTranscript("a", A, Strand.POSITIVE, 100, 150, 100, 200, 300, 400);
        final Transcript b = codingTranscript("b", A, Strand.POSITIVE, 350, 400, 100, 200, 300, 400);
        Assert.assertEquals(codingEngine.clusterIntoGenes(Arrays.asList(a, b)).size(), 2);
        Assert.assertEquals(exonEngine.clusterIntoGenes(Arrays.asList(a, b)).size(), 1);
    }

    @Test
    public void testNonCodingTranscriptsAreLeftOutOfCodingClusters() {
        final Transcript coding = codingTranscript("a", A, Strand.POSITIVE, 150, 350, 100, 200, 300, 400);
        final Transcript nonCoding = transcript("b", A, Strand.POSITIVE, "protein_coding", 100, 200, 300, 400);
        final List<Gene> genes = codingEngine.clusterIntoGenes(Arrays.asList(coding, nonCoding));
        Assert.assertEquals(genes.size(), 1);
        Assert.assertEquals(totalTranscripts(genes), 1);
    }

    @Test
    public void testTransitiveMerge() {
        // a and c share no exon and form two clusters until b, processed last, bridges them
        final Transcript a = transcript("a", A, Strand.POSITIVE, "pseudogene", 100, 200, 500, 600);
        final Transcript c = transcript("c", A, Strand.POSITIVE, "pseudogene", 300, 400);
        final Transcript b = transcript("b", A, Strand.POSITIVE, "pseudogene", 350, 550);
        final Transcript d = transcript("d", A, Strand.POSITIVE, "pseudogene", 1000, 1100);

        final List<Gene> genes = exonEngine.clusterIntoGenes(Arrays.asList(d, b, c, a));
        Assert.assertEquals(genes.size(), 2);
        Assert.assertEquals(genes.get(0).getTranscripts(), Arrays.asList(a, c, b));
        Assert.assertEquals(genes.get(1).getTranscripts(), Collections.singletonList(d));
        Assert.assertEquals(genes.get(0).getId(), "pseudo.1");
        Assert.assertEquals(genes.get(1).getId(), "pseudo.2");
    }

    @Test
    public void testIntronicTranscriptDoesNotCluster() {
        final Transcript spliced = transcript("a", A, Strand.POSITIVE, "pseudogene", 100, 200, 500, 600);
        final Transcript intronic = transcript("b", A, Strand.POSITIVE, "pseudogene", 300, 400);
        Assert.assertEquals(exonEngine.clusterIntoGenes(Arrays.asList(spliced, intronic)).size(), 2);
    }

    @Test
    public void testEmptyInput() {
        Assert.assertTrue(codingEngine.clusterIntoGenes(Collections.emptyList()).isEmpty());
    }

    @Test
    public void testCheckClustersAcceptsPartition() {
        final Transcript a = transcript("a", A, Strand.POSITIVE, "pseudogene", 100, 200);
        final Transcript b = transcript("b", A, Strand.POSITIVE, "pseudogene", 300, 400);
        TranscriptClusterEngine.checkClusters(2, Arrays.asList(Collections.singletonList(a), Collections.singletonList(b)));
    }

    @Test(expectedExceptions = GeneMergeException.InconsistentClustersException.class)
    public void testCheckClustersDuplicate() {
        final Transcript a = transcript("a", A, Strand.POSITIVE, "pseudogene", 100, 200);
        TranscriptClusterEngine.checkClusters(2, Arrays.asList(Collections.singletonList(a), Collections.singletonList(a)));
    }

    @Test(expectedExceptions = GeneMergeException.InconsistentClustersException.class)
    public void testCheckClustersMissing() {
        final Transcript a = transcript("a", A, Strand.POSITIVE, "pseudogene", 100, 200);
        TranscriptClusterEngine.checkClusters(2, Collections.singletonList(Collections.singletonList(a)));
    }

    @Test(expectedExceptions = GeneMergeException.InconsistentClustersException.class)
    public void testCheckClustersEmptyCluster() {
        TranscriptClusterEngine.checkClusters(0, Collections.singletonList(Collections.<Transcript>emptyList()));
    }
}
