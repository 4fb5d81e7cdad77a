package org.genebuild.genemerge.tools.rnaseq;

import htsjdk.samtools.util.Locatable;
import org.genebuild.genemerge.utils.SimpleInterval;
import org.genebuild.genemerge.utils.Utils;

/**
 * A block of bases covered by aligned reads, believed to be (part of) an exon.
 */
public final class ExonCluster implements Locatable {

    private final String name;
    private final SimpleInterval interval;
    private final double score;

    /**
     * @param name unique name of the cluster, referred to by read membership
     * @param interval bases covered by the cluster
     * @param score support of the cluster, usually its read count
     */
    public ExonCluster(final String name, final SimpleInterval interval, final double score) {
        this.name = Utils.nonEmpty(name, "cluster name");
        this.interval = Utils.nonNull(interval, "interval");
        this.score = score;
    }

    public String getName() {
        return name;
    }

    public double getScore() {
        return score;
    }

    @Override
    public String getContig() {
        return interval.getContig();
    }

    @Override
    public int getStart() {
        return interval.getStart();
    }

    @Override
    public int getEnd() {
        return interval.getEnd();
    }

    @Override
    public String toString() {
        return name + "@" + interval;
    }
}
