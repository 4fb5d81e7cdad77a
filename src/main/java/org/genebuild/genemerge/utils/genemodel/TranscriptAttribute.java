package org.genebuild.genemerge.utils.genemodel;

import org.genebuild.genemerge.utils.Utils;

/**
 * Immutable code/value annotation of a transcript.
 */
public final class TranscriptAttribute {

    public static final String ENST_LINK = "enst_link";
    public static final String TRANSCRIPT_EDGE = "TranscriptEdge";
    public static final String TRANSCRIPT_PROTEIN_SUPPORT = "tp_otter_support";
    public static final String TRANSCRIPT_DNA_SUPPORT = "td_otter_support";
    public static final String EXON_PROTEIN_SUPPORT = "ep_otter_support";
    public static final String EXON_DNA_SUPPORT = "ed_otter_support";

    private final String code;
    private final String value;

    public TranscriptAttribute(final String code, final String value) {
        this.code = Utils.nonEmpty(code, "code");
        this.value = Utils.nonNull(value, "value");
    }

    public String getCode() {
        return code;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final TranscriptAttribute that = (TranscriptAttribute) o;
        return code.equals(that.code) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return 31 * code.hashCode() + value.hashCode();
    }

    @Override
    public String toString() {
        return code + "=" + value;
    }
}
