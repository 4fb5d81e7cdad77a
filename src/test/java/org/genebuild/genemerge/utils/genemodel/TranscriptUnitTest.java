package org.genebuild.genemerge.utils.genemodel;

import htsjdk.tribble.annotation.Strand;
import org.genebuild.genemerge.exceptions.UserException;
import org.genebuild.genemerge.testutils.BaseTest;
import org.genebuild.genemerge.testutils.GeneModelTestUtils;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.List;

public final class TranscriptUnitTest extends BaseTest {

    @Test
    public void testForwardCodingRegion() {
        final Transcript t = GeneModelTestUtils.codingTranscript("t1", AnnotationSource.AUTOMATIC, Strand.POSITIVE,
                150, 350, 100, 200, 300, 400);
        Assert.assertEquals(t.getTranslation().getStartExonIndex(), 0);
        Assert.assertEquals(t.getTranslation().getSeqStart(), 51);
        Assert.assertEquals(t.getCodingRegionStart(), 150);
        Assert.assertEquals(t.getCodingRegionEnd(), 350);

        final List<Exon> coding = t.getTranslateableExons();
        Assert.assertEquals(coding.size(), 2);
        Assert.assertEquals(coding.get(0).getStart(), 150);
        Assert.assertEquals(coding.get(0).getEnd(), 200);
        Assert.assertEquals(coding.get(1).getStart(), 300);
        Assert.assertEquals(coding.get(1).getEnd(), 350);
        Assert.assertEquals(t.getCodingLength(), 51 + 51);
        Assert.assertEquals(t.getTranslationLength(), 34);
    }

    @Test
    public void testReverseCodingRegion() {
        final Transcript t = GeneModelTestUtils.codingTranscript("t1", AnnotationSource.AUTOMATIC, Strand.NEGATIVE,
                150, 350, 100, 200, 300, 400);
        // transcription order: 300-400 first
        Assert.assertEquals(t.getExons().get(0).getStart(), 300);
        Assert.assertEquals(t.getTranslation().getSeqStart(), 51);
        Assert.assertEquals(t.getTranslation().getSeqEnd(), 51);
        Assert.assertEquals(t.getCodingRegionStart(), 150);
        Assert.assertEquals(t.getCodingRegionEnd(), 350);
        Assert.assertEquals(t.getTranslateableExons().get(0).getEnd(), 350);
        Assert.assertEquals(t.getStart(), 100);
        Assert.assertEquals(t.getEnd(), 400);
        Assert.assertFalse(t.isForward());
    }

    @Test
    public void testFullyCodingExonsAreNotCopied() {
        final Transcript t = GeneModelTestUtils.codingTranscript("t1", AnnotationSource.AUTOMATIC, Strand.POSITIVE,
                100, 400, 100, 200, 300, 400);
        Assert.assertSame(t.getTranslateableExons().get(0), t.getExons().get(0));
        Assert.assertSame(t.getTranslateableExons().get(1), t.getExons().get(1));
    }

    @Test
    public void testNonCoding() {
        final Transcript t = GeneModelTestUtils.transcript("t1", AnnotationSource.MANUAL, Strand.POSITIVE,
                "processed_transcript", 100, 200);
        Assert.assertFalse(t.isCoding());
        Assert.assertTrue(t.getTranslateableExons().isEmpty());
        Assert.assertEquals(t.getCodingLength(), 0);
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testCodingRegionOfNonCoding() {
        GeneModelTestUtils.transcript("t1", AnnotationSource.MANUAL, Strand.POSITIVE, "lincRNA", 100, 200)
                .getCodingRegionStart();
    }

    @Test(expectedExceptions = UserException.MalformedGeneModel.class)
    public void testExonsOutOfOrder() {
        new Transcript("t1", Arrays.asList(new Exon("1", 300, 400, Strand.POSITIVE), new Exon("1", 100, 200, Strand.POSITIVE)),
                "protein_coding", "ensembl");
    }

    @Test(expectedExceptions = UserException.MalformedGeneModel.class)
    public void testOverlappingExons() {
        new Transcript("t1", Arrays.asList(new Exon("1", 100, 200, Strand.POSITIVE), new Exon("1", 200, 300, Strand.POSITIVE)),
                "protein_coding", "ensembl");
    }

    @Test(expectedExceptions = UserException.MalformedGeneModel.class)
    public void testMixedStrands() {
        new Transcript("t1", Arrays.asList(new Exon("1", 100, 200, Strand.POSITIVE), new Exon("1", 300, 400, Strand.NEGATIVE)),
                "protein_coding", "ensembl");
    }

    @Test(expectedExceptions = UserException.MalformedGeneModel.class)
    public void testUnstrandedExon() {
        new Exon("1", 100, 200, Strand.NONE);
    }

    @Test(expectedExceptions = UserException.MalformedGeneModel.class)
    public void testTranslationOutsideExons() {
        final Transcript t = GeneModelTestUtils.transcript("t1", AnnotationSource.AUTOMATIC, Strand.POSITIVE,
                "protein_coding", 100, 200);
        t.setTranslation(new Translation(0, 1, 0, 500));
    }

    @Test
    public void testAdoptBiotype() {
        final Transcript manual = GeneModelTestUtils.transcript("m", AnnotationSource.MANUAL, Strand.POSITIVE,
                "retained_intron", 100, 200);
        final Transcript automatic = GeneModelTestUtils.codingTranscript("a", AnnotationSource.AUTOMATIC,
                Strand.POSITIVE, 100, 200, 100, 200);
        Assert.assertEquals(automatic.getBiotypeSource(), AnnotationSource.AUTOMATIC);

        automatic.adoptBiotype(manual);
        Assert.assertEquals(automatic.getBiotype(), "retained_intron");
        Assert.assertEquals(automatic.getSource(), AnnotationSource.AUTOMATIC);
        Assert.assertEquals(automatic.getBiotypeSource(), AnnotationSource.MANUAL);
    }

    @Test
    public void testReplaceExon() {
        final Transcript t = GeneModelTestUtils.transcript("t1", AnnotationSource.AUTOMATIC, Strand.POSITIVE,
                "protein_coding", 100, 200, 300, 400);
        final Exon copy = new Exon("1", 300, 400, Strand.POSITIVE);
        t.replaceExon(1, copy);
        Assert.assertSame(t.getExons().get(1), copy);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testReplaceExonWithDifferentExon() {
        final Transcript t = GeneModelTestUtils.transcript("t1", AnnotationSource.AUTOMATIC, Strand.POSITIVE,
                "protein_coding", 100, 200, 300, 400);
        t.replaceExon(1, new Exon("1", 300, 401, Strand.POSITIVE));
    }

    @Test
    public void testDBEntriesAreDeduplicated() {
        final Transcript t = GeneModelTestUtils.transcript("t1", AnnotationSource.AUTOMATIC, Strand.POSITIVE,
                "protein_coding", 100, 200);
        Assert.assertTrue(t.addDBEntry(new DBEntry(DBEntry.OTTT, "OTTHUMT1", "OTTHUMT1")));
        Assert.assertFalse(t.addDBEntry(new DBEntry(DBEntry.OTTT, "OTTHUMT1", "OTTHUMT1")));
        Assert.assertTrue(t.hasDBEntryFrom(DBEntry.OTTT));
        Assert.assertTrue(t.removeDBEntriesIf(e -> e.getDbName().equals(DBEntry.OTTT)));
        Assert.assertTrue(t.getDBEntries().isEmpty());
    }
}
