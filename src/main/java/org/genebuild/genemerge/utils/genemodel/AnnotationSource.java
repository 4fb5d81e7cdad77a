package org.genebuild.genemerge.utils.genemodel;

/**
 * The two independently built annotations a merge reconciles.
 */
public enum AnnotationSource {
    /** Curated annotation. It takes the first position whenever a pair of transcripts is compared. */
    MANUAL,
    /** Pipeline-predicted annotation. */
    AUTOMATIC
}
