package org.genebuild.genemerge.utils.genemodel;

import org.genebuild.genemerge.utils.Utils;

/**
 * Immutable cross-reference attached to a transcript, e.g. the curated identifier of a transcript it shares its
 * coding sequence with.
 */
public final class DBEntry {

    public static final String VEGA_TRANSCRIPT = "Vega_transcript";
    public static final String OTTT = "OTTT";
    public static final String SHARES_CDS_WITH_OTTT = "shares_CDS_with_OTTT";
    public static final String SHARES_CDS_AND_UTR_WITH_OTTT = "shares_CDS_and_UTR_with_OTTT";
    public static final String SHARES_CDS_WITH_ENST = "shares_CDS_with_ENST";

    private final String dbName;
    private final String primaryId;
    private final String displayId;

    public DBEntry(final String dbName, final String primaryId, final String displayId) {
        this.dbName = Utils.nonEmpty(dbName, "dbName");
        this.primaryId = Utils.nonEmpty(primaryId, "primaryId");
        this.displayId = Utils.nonNull(displayId, "displayId");
    }

    public String getDbName() {
        return dbName;
    }

    public String getPrimaryId() {
        return primaryId;
    }

    public String getDisplayId() {
        return displayId;
    }

    /**
     * @return true for a curated transcript identifier that names itself, the only kind of entry
     * propagated to merge partners
     */
    public boolean isSelfNamedVegaTranscript() {
        return VEGA_TRANSCRIPT.equals(dbName) && primaryId.equals(displayId);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final DBEntry that = (DBEntry) o;

        if (!dbName.equals(that.dbName)) return false;
        if (!primaryId.equals(that.primaryId)) return false;
        return displayId.equals(that.displayId);
    }

    @Override
    public int hashCode() {
        int result = dbName.hashCode();
        result = 31 * result + primaryId.hashCode();
        result = 31 * result + displayId.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return dbName + ":" + primaryId + "(" + displayId + ")";
    }
}
