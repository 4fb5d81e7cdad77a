package org.genebuild.genemerge.exceptions;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to the input handed to the merge, such as malformed gene models
 * or a missing region.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException() {
        super();
    }

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    /**
     * Subtypes of UserException for common kinds of errors
     */

    /**
     * <p/>
     * Class UserException.MalformedGeneModel
     * <p/>
     * For genes, transcripts or exons that violate the structural assumptions of the merge.
     */
    public static class MalformedGeneModel extends UserException {
        private static final long serialVersionUID = 0L;

        public MalformedGeneModel(final String message) {
            super(String.format("Malformed gene model: %s", message));
        }

        public MalformedGeneModel(final String id, final String message) {
            super(String.format("Malformed gene model %s: %s", id, message));
        }
    }

    public static class MissingRegion extends UserException {
        private static final long serialVersionUID = 0L;

        public MissingRegion(final String message) {
            super(message);
        }
    }
}
