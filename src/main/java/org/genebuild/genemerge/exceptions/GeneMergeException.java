package org.genebuild.genemerge.exceptions;

/**
 * <p/>
 * Class GeneMergeException.
 * <p/>
 * This exception is for errors that are beyond the caller's control, such as internal pre/post condition failures
 * of the clustering algorithms and "this should never happen" kinds of scenarios.
 */
public class GeneMergeException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public GeneMergeException( String msg ) {
        super(msg);
    }

    public GeneMergeException( String message, Throwable throwable ) {
        super(message, throwable);
    }

    /*
      Subtypes of GeneMergeException for common kinds of errors
     */

    /**
     * <p/>
     * For wrapping errors that are believed to never be reachable
     */
    public static class ShouldNeverReachHereException extends GeneMergeException {
        private static final long serialVersionUID = 0L;
        public ShouldNeverReachHereException( final String s ) {
            super(s);
        }
        public ShouldNeverReachHereException( final String s, final Throwable throwable ) {
            super(s, throwable);
        }
    }

    /**
     * Thrown when a clustering pass does not partition its input: a transcript was lost, added twice,
     * or a cluster came out empty.
     */
    public static class InconsistentClustersException extends GeneMergeException {
        private static final long serialVersionUID = 0L;

        public InconsistentClustersException( final String message ) {
            super(String.format("Transcript clusters are inconsistent: %s", message));
        }
    }
}
