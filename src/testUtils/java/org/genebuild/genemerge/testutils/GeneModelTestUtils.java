package org.genebuild.genemerge.testutils;

import htsjdk.tribble.annotation.Strand;
import org.genebuild.genemerge.utils.Utils;
import org.genebuild.genemerge.utils.genemodel.AnnotationSource;
import org.genebuild.genemerge.utils.genemodel.Exon;
import org.genebuild.genemerge.utils.genemodel.Gene;
import org.genebuild.genemerge.utils.genemodel.Transcript;
import org.genebuild.genemerge.utils.genemodel.Translation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Builders for small gene models on contig {@link #CONTIG}.
 *
 * Exon coordinates are always given as start,end pairs in ascending genomic order; reverse strand transcripts
 * get their exons flipped into transcription order.
 */
public final class GeneModelTestUtils {

    public static final String CONTIG = "1";
    public static final String AUTOMATIC_LOGIC_NAME = "ensembl";
    public static final String MANUAL_LOGIC_NAME = "havana";

    private GeneModelTestUtils() {}

    public static List<Exon> exons(final Strand strand, final int... coordinates) {
        Utils.validateArg(coordinates.length > 0 && coordinates.length % 2 == 0, "coordinates come in start,end pairs");
        final List<Exon> exons = new ArrayList<>();
        for (int i = 0; i < coordinates.length; i += 2) {
            exons.add(new Exon(CONTIG, coordinates[i], coordinates[i + 1], strand));
        }
        if (strand == Strand.NEGATIVE) {
            Collections.reverse(exons);
        }
        return exons;
    }

    /**
     * A non-coding transcript.
     */
    public static Transcript transcript(final String id, final AnnotationSource source, final Strand strand,
                                        final String biotype, final int... coordinates) {
        final Transcript transcript = new Transcript(id, exons(strand, coordinates), biotype, logicName(source));
        transcript.setSource(source);
        return transcript;
    }

    /**
     * A coding transcript whose coding region spans the genomic positions codingStart..codingEnd.
     */
    public static Transcript codingTranscript(final String id, final AnnotationSource source, final Strand strand,
                                              final String biotype, final int codingStart, final int codingEnd,
                                              final int... coordinates) {
        final Transcript transcript = transcript(id, source, strand, biotype, coordinates);
        transcript.setTranslation(translation(transcript.getExons(), codingStart, codingEnd));
        return transcript;
    }

    public static Transcript codingTranscript(final String id, final AnnotationSource source, final Strand strand,
                                              final int codingStart, final int codingEnd, final int... coordinates) {
        return codingTranscript(id, source, strand, "protein_coding", codingStart, codingEnd, coordinates);
    }

    /**
     * Converts a genomic coding region into a translation over exons given in transcription order.
     */
    public static Translation translation(final List<Exon> exons, final int codingStart, final int codingEnd) {
        final boolean forward = exons.get(0).getStrand() == Strand.POSITIVE;
        final int firstCoding = forward ? codingStart : codingEnd;
        final int lastCoding = forward ? codingEnd : codingStart;
        final int startIndex = indexOfExonContaining(exons, firstCoding);
        final int endIndex = indexOfExonContaining(exons, lastCoding);
        final Exon startExon = exons.get(startIndex);
        final Exon endExon = exons.get(endIndex);
        return forward ?
                new Translation(startIndex, codingStart - startExon.getStart() + 1, endIndex, codingEnd - endExon.getStart() + 1) :
                new Translation(startIndex, startExon.getEnd() - codingEnd + 1, endIndex, endExon.getEnd() - codingStart + 1);
    }

    private static int indexOfExonContaining(final List<Exon> exons, final int position) {
        for (int i = 0; i < exons.size(); i++) {
            if (exons.get(i).getStart() <= position && position <= exons.get(i).getEnd()) {
                return i;
            }
        }
        throw new IllegalArgumentException("no exon contains " + position);
    }

    public static Gene gene(final String id, final String biotype, final Transcript... transcripts) {
        final String logicName = transcripts.length == 0 ? AUTOMATIC_LOGIC_NAME : transcripts[0].getLogicName();
        return new Gene(id, biotype, logicName, Arrays.asList(transcripts));
    }

    public static String logicName(final AnnotationSource source) {
        return source == AnnotationSource.MANUAL ? MANUAL_LOGIC_NAME : AUTOMATIC_LOGIC_NAME;
    }
}
