package org.genebuild.genemerge.tools.merge;

import com.google.common.collect.ImmutableSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.genebuild.genemerge.utils.Utils;
import org.genebuild.genemerge.utils.genemodel.DBEntry;
import org.genebuild.genemerge.utils.genemodel.Gene;
import org.genebuild.genemerge.utils.genemodel.Transcript;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Turns fetched genes into the transcripts to merge, so that a region can be merged again after an earlier merge:
 * <ul>
 *     <li>manual transcripts copied into merged genes by the earlier merge are dropped;</li>
 *     <li>merged transcripts that only shared their coding sequence with a manual one are dropped;</li>
 *     <li>cross-references written by the earlier merge are removed;</li>
 *     <li>transcripts in the discarded set are dropped.</li>
 * </ul>
 */
public final class TranscriptPreFilter {

    private static final Logger logger = LogManager.getLogger(TranscriptPreFilter.class);

    private static final Set<String> MERGE_XREF_DBS = ImmutableSet.of(
            DBEntry.SHARES_CDS_AND_UTR_WITH_OTTT,
            DBEntry.SHARES_CDS_WITH_OTTT,
            DBEntry.SHARES_CDS_WITH_ENST,
            DBEntry.OTTT);

    private final String manualLogicName;
    private final String mergedGeneLogicName;
    private final String mergedTranscriptLogicName;
    private final DiscardedTranscriptFilter discardedFilter;

    public TranscriptPreFilter(final String manualLogicName, final String mergedGeneLogicName,
                               final String mergedTranscriptLogicName, final DiscardedTranscriptFilter discardedFilter) {
        this.manualLogicName = Utils.nonNull(manualLogicName);
        this.mergedGeneLogicName = Utils.nonNull(mergedGeneLogicName);
        this.mergedTranscriptLogicName = Utils.nonNull(mergedTranscriptLogicName);
        this.discardedFilter = Utils.nonNull(discardedFilter);
    }

    /**
     * @return the transcripts of {@code genes} that take part in the merge, in gene order
     */
    public List<Transcript> filter(final Collection<Gene> genes) {
        Utils.nonNull(genes);
        final List<Transcript> kept = new ArrayList<>();
        for (final Gene gene : genes) {
            for (final Transcript transcript : gene.getTranscripts()) {
                if (isCopiedManualTranscript(gene, transcript) || isCodingOnlyMergedTranscript(transcript)) {
                    logger.debug("Transcript " + transcript.getId() + " was produced by a previous merge, skipping it");
                    continue;
                }
                transcript.removeDBEntriesIf(e -> MERGE_XREF_DBS.contains(e.getDbName()));
                if (discardedFilter.isDiscarded(transcript)) {
                    logger.debug("Transcript " + transcript.getId() + " is in the discarded set, skipping it");
                    continue;
                }
                kept.add(transcript);
            }
        }
        return kept;
    }

    private boolean isCopiedManualTranscript(final Gene gene, final Transcript transcript) {
        return gene.getLogicName().equals(mergedGeneLogicName) && transcript.getLogicName().equals(manualLogicName);
    }

    private boolean isCodingOnlyMergedTranscript(final Transcript transcript) {
        return transcript.getLogicName().equals(mergedTranscriptLogicName) &&
                transcript.hasDBEntryFrom(DBEntry.SHARES_CDS_WITH_ENST) &&
                !transcript.hasDBEntryFrom(DBEntry.SHARES_CDS_AND_UTR_WITH_OTTT);
    }
}
