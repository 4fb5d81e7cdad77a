package org.genebuild.genemerge.tools.merge;

import htsjdk.tribble.annotation.Strand;
import org.genebuild.genemerge.testutils.BaseTest;
import org.genebuild.genemerge.utils.genemodel.AnnotationSource;
import org.genebuild.genemerge.utils.genemodel.Exon;
import org.genebuild.genemerge.utils.genemodel.Transcript;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.List;

import static org.genebuild.genemerge.testutils.GeneModelTestUtils.codingTranscript;
import static org.genebuild.genemerge.testutils.GeneModelTestUtils.transcript;

public final class CodingExonCacheUnitTest extends BaseTest {

    @Test
    public void testCodingExonsSortedByStart() {
        final Transcript reverse = codingTranscript("r", AnnotationSource.AUTOMATIC, Strand.NEGATIVE,
                150, 550, 100, 200, 300, 400, 500, 600);
        final CodingExonCache cache = new CodingExonCache();
        final List<Exon> exons = cache.get(reverse);
        Assert.assertEquals(exons.size(), 3);
        Assert.assertEquals(exons.get(0).getStart(), 150);
        Assert.assertEquals(exons.get(2).getEnd(), 550);
        Assert.assertSame(cache.get(reverse), exons);
        Assert.assertEquals(cache.size(), 1);
    }

    @Test
    public void testNonCodingHasNoCodingExons() {
        final CodingExonCache cache = new CodingExonCache();
        Assert.assertTrue(cache.get(transcript("n", AnnotationSource.AUTOMATIC, Strand.POSITIVE, "lincRNA", 100, 200)).isEmpty());
    }

    @Test
    public void testKeyedByIdentity() {
        final Transcript a = codingTranscript("same", AnnotationSource.AUTOMATIC, Strand.POSITIVE, 100, 200, 100, 200);
        final Transcript b = codingTranscript("same", AnnotationSource.AUTOMATIC, Strand.POSITIVE, 100, 200, 100, 200);
        final CodingExonCache cache = new CodingExonCache();
        cache.get(a);
        cache.get(b);
        Assert.assertEquals(cache.size(), 2);
    }
}
