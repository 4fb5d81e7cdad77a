package org.genebuild.genemerge.utils;

import htsjdk.samtools.util.Locatable;
import org.genebuild.genemerge.exceptions.UserException;
import org.genebuild.genemerge.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class SimpleIntervalUnitTest extends BaseTest {

    @DataProvider(name = "badIntervals")
    public Object[][] badIntervals(){
        return new Object[][]{
                {null,1,12, "null contig"},
                {"1", 0, 10, "start==0"},
                {"1", -10, 10, "negative start"},
                {"1", 10, 9, "end < start"}
        };
    }

    @Test(dataProvider = "badIntervals", expectedExceptions = IllegalArgumentException.class)
    public void badIntervals(String contig, int start, int end, String name){
        new SimpleInterval(contig, start, end);
    }

    @Test(dataProvider = "badIntervals", expectedExceptions = IllegalArgumentException.class)
    public void badIntervalsFromLocatable(String contig, int start, int end, String name){
        new SimpleInterval(getLocatable(contig, start, end));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void illegalArgumentExceptionFromNullLocatable(){
        new SimpleInterval((Locatable)null);
    }

    @DataProvider(name = "goodIntervals")
    public Object[][] goodIntervals(){
        return new Object[][]{
                {"1", "1", 1, Integer.MAX_VALUE},
                {"chrX", "chrX", 1, Integer.MAX_VALUE},
                {"1:2", "1", 2, 2},
                {"1:4-5", "1", 4, 5},
                {"1:2,000", "1", 2000, 2000},
                {"1:4,000-5,000", "1", 4000, 5000},
                {"1:4,0,0,0-5,0,0,0", "1", 4000, 5000}, //this is OK too, we just remove commas wherever they are
        };
    }

    @Test(dataProvider = "goodIntervals")
    public void testGoodIntervals(String str, String contig, int start, int end){
        final SimpleInterval interval = new SimpleInterval(str);
        Assert.assertEquals(interval.getContig(), contig, "contig");
        Assert.assertEquals(interval.getStart(), start, "start");
        Assert.assertEquals(interval.getEnd(), end, "end");
    }

    @Test(expectedExceptions = UserException.class)
    public void testUnparseablePosition(){
        new SimpleInterval("1:abc-100");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testEmptyString(){
        new SimpleInterval("");
    }

    private static Locatable getLocatable(final String contig, final int start, final int end) {
        return new Locatable() {
            @Override
            public String getContig() {
                return contig;
            }

            @Override
            public int getStart() {
                return start;
            }

            @Override
            public int getEnd() {
                return end;
            }
        };
    }

    @Test
    public void testEquality(){
        final SimpleInterval i1 = new SimpleInterval("1",1,100);
        final SimpleInterval i2 = new SimpleInterval("1",1,100);
        final SimpleInterval i3 = new SimpleInterval("chr1", 1, 100);
        final SimpleInterval i4 = new SimpleInterval("1:1-100");

        Assert.assertEquals(i1, i2);
        Assert.assertEquals(i1, i4);
        Assert.assertEquals(i1.hashCode(), i4.hashCode());
        Assert.assertNotEquals(i1, i3);
        Assert.assertEquals(i1.toString(), "1:1-100");
        Assert.assertEquals(i1.size(), 100);
    }

    @Test
    public void testContains(){
        final SimpleInterval region = new SimpleInterval("1", 100, 200);
        Assert.assertTrue(region.contains(new SimpleInterval("1", 100, 200)));
        Assert.assertTrue(region.contains(new SimpleInterval("1", 150, 160)));
        Assert.assertFalse(region.contains(new SimpleInterval("1", 99, 160)));
        Assert.assertFalse(region.contains(new SimpleInterval("2", 150, 160)));
        Assert.assertFalse(region.contains(null));
    }
}
