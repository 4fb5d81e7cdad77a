package org.genebuild.genemerge.tools.merge;

/**
 * Functional class of a merged gene, in decreasing priority. A gene takes the highest class any of its
 * transcripts belongs to.
 */
public enum GeneClassification {
    PROTEIN_CODING("protein_coding"),
    PROCESSED_TRANSCRIPT("processed_transcript"),
    PSEUDOGENE("pseudogene"),
    /** None of the transcripts has a configured biotype. */
    UNCLASSIFIED("unclassified");

    private final String biotype;

    GeneClassification(final String biotype) {
        this.biotype = biotype;
    }

    /**
     * @return the gene biotype this class is written as, before the provenance suffix
     */
    public String getBiotype() {
        return biotype;
    }
}
