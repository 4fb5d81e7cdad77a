package org.genebuild.genemerge.tools.merge;

import htsjdk.tribble.annotation.Strand;
import org.genebuild.genemerge.testutils.BaseTest;
import org.genebuild.genemerge.utils.genemodel.AnnotationSource;
import org.genebuild.genemerge.utils.genemodel.Exon;
import org.genebuild.genemerge.utils.genemodel.Gene;
import org.genebuild.genemerge.utils.genemodel.Transcript;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.genebuild.genemerge.testutils.GeneModelTestUtils.CONTIG;
import static org.genebuild.genemerge.testutils.GeneModelTestUtils.codingTranscript;
import static org.genebuild.genemerge.testutils.GeneModelTestUtils.gene;

public final class ExonDeduplicatorUnitTest extends BaseTest {

    private final ExonDeduplicator deduplicator = new ExonDeduplicator();

    @Test
    public void testIdenticalExonsAreShared() {
        final Transcript a = codingTranscript("a", AnnotationSource.MANUAL, Strand.POSITIVE, 150, 350, 100, 200, 300, 400);
        final Transcript b = codingTranscript("b", AnnotationSource.AUTOMATIC, Strand.POSITIVE, 150, 350, 100, 210, 300, 400);
        final Gene gene = gene("g", "protein_coding", a, b);

        Assert.assertSame(deduplicator.pruneExons(gene), gene);
        Assert.assertSame(b.getExons().get(1), a.getExons().get(1));
        Assert.assertNotSame(b.getExons().get(0), a.getExons().get(0));
        Assert.assertEquals(b.getCodingRegionStart(), 150);
    }

    @Test
    public void testPhasesKeepExonsApart() {
        final List<Exon> exonsA = Arrays.asList(new Exon(CONTIG, 100, 200, Strand.POSITIVE, 0, 1));
        final List<Exon> exonsB = Arrays.asList(new Exon(CONTIG, 100, 200, Strand.POSITIVE, 1, 2));
        final Transcript a = new Transcript("a", exonsA, "protein_coding", "ensembl");
        final Transcript b = new Transcript("b", exonsB, "protein_coding", "ensembl");
        deduplicator.pruneExons(gene("g", "protein_coding", a, b));
        Assert.assertNotSame(a.getExons().get(0), b.getExons().get(0));
    }

    @Test
    public void testIdempotent() {
        final Transcript a = codingTranscript("a", AnnotationSource.MANUAL, Strand.NEGATIVE, 150, 550, 100, 200, 300, 400, 500, 600);
        final Transcript b = codingTranscript("b", AnnotationSource.AUTOMATIC, Strand.NEGATIVE, 150, 550, 100, 200, 300, 400, 500, 600);
        final Gene gene = gene("g", "protein_coding", a, b);
        deduplicator.pruneExons(gene);
        final List<Exon> once = new ArrayList<>(b.getExons());
        deduplicator.pruneExons(gene);
        for (int i = 0; i < once.size(); i++) {
            Assert.assertSame(b.getExons().get(i), once.get(i));
            Assert.assertSame(a.getExons().get(i), once.get(i));
        }
    }
}
