package org.genebuild.genemerge.utils;

import htsjdk.samtools.util.Locatable;
import org.genebuild.genemerge.exceptions.UserException;

import java.io.Serializable;

/**
 * Minimal immutable class representing a 1-based closed ended region of a reference sequence.
 * It is the "slice" a merge run works on: every gene, transcript and exon of a run is placed on it.
 * SimpleInterval does not allow null contig names.
 */
public final class SimpleInterval implements Locatable, Serializable {
    private static final long serialVersionUID = 1L;
    public static final char CONTIG_SEPARATOR = ':';
    public static final char START_END_SEPARATOR = '-';

    private final int start;
    private final int end;
    private final String contig;

    /**
     * Create a new immutable 1-based interval of the form [start, end]
     * @param contig the name of the contig, must not be null
     * @param start  1-based inclusive start position
     * @param end  1-based inclusive end position
     */
    public SimpleInterval(final String contig, final int start, final int end){
        validatePositions(contig, start, end);
        this.contig = contig;
        this.start = start;
        this.end = end;
    }

    /**
     * Create a new SimpleInterval from a {@link Locatable}
     * @param locatable any Locatable
     * @throws IllegalArgumentException if locatable violates any of the SimpleInterval constraints or is null
     */
    public SimpleInterval(final Locatable locatable){
        this(Utils.nonNull(locatable).getContig(),
                locatable.getStart(), locatable.getEnd());
    }

    /**
     * Makes an interval by parsing the string.
     *
     * The format is one of:
     *
     * contig           (Represents the whole contig, from position 1 to the {@link Integer#MAX_VALUE})
     *
     * contig:start-end (Represents the range start-end on the given contig)
     *
     * Commas in numbers are ignored, so 'chr2:1,000,000-2,000,000' is accepted.
     *
     * @param str non-empty string to be parsed
     */
    public SimpleInterval(final String str){
        Utils.nonNull(str);
        Utils.validateArg(!str.isEmpty(), "str should not be empty");

        final String contig;
        final int start;
        final int end;

        final int colonIndex = str.lastIndexOf(CONTIG_SEPARATOR);
        if (colonIndex == -1) {
            contig = str;
            start = 1;
            end = Integer.MAX_VALUE;
        } else {
            contig = str.substring(0, colonIndex);
            final int dashIndex = str.indexOf(START_END_SEPARATOR, colonIndex);
            if (dashIndex == -1) {
                start = parsePosition(str.substring(colonIndex + 1));
                end = start;
            } else {
                start = parsePosition(str.substring(colonIndex + 1, dashIndex));
                end = parsePosition(str.substring(dashIndex + 1));
            }
        }

        validatePositions(contig, start, end);
        this.contig = contig;
        this.start = start;
        this.end = end;
    }

    /**
     * Test that these are valid values for constructing a SimpleInterval:
     *    contig cannot be null
     *    start must be >= 1
     *    end must be >= start
     * @throws IllegalArgumentException if it is invalid
     */
    static void validatePositions(final String contig, final int start, final int end) {
        Utils.validateArg(isValid(contig, start, end), () -> "Invalid interval. Contig:" + contig + " start:"+start + " end:" + end);
    }

    public static boolean isValid(final String contig, final int start, final int end) {
        return contig != null && start > 0 && end >= start;
    }

    static int parsePosition(final String pos) {
        try {
            return Integer.parseInt(pos.replaceAll(",", ""));
        } catch (NumberFormatException e){
            throw new UserException("Problem parsing start/end value in region string. Value was: " + pos, e);
        }
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final SimpleInterval that = (SimpleInterval) o;

        if (end != that.end) return false;
        if (start != that.start) return false;
        return contig.equals(that.contig);
    }

    @Override
    public int hashCode() {
        int result = start;
        result = 31 * result + end;
        result = 31 * result + contig.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return contig + CONTIG_SEPARATOR + start + START_END_SEPARATOR + end;
    }

    @Override
    public String getContig(){
        return contig;
    }

    /** Gets the 1-based start position of the interval on the contig. */
    @Override
    public int getStart(){
        return start;
    }

    /**
     * @return the 1-based closed-ended end position of the interval on the contig.
     */
    @Override
    public int getEnd(){
        return end;
    }

    /**
     * @return number of bases covered by this interval (will always be > 0)
     */
    public int size() {
        return end - start + 1;
    }

    /**
     * Determines whether this interval contains the entire region represented by other
     * (in other words, whether it covers it).
     *
     * @param other interval to check
     * @return true if this interval contains all of the bases spanned by other, otherwise false
     */
    public boolean contains( final Locatable other ) {
        if ( other == null || other.getContig() == null ) {
            return false;
        }

        return this.contig.equals(other.getContig()) && this.start <= other.getStart() && this.end >= other.getEnd();
    }
}
