package edu.colorado.clear.vn;

/**
 * A well-formed document lacks a required attribute or section, or the
 * corpus as a whole is inconsistent (e.g. a class id defined twice).
 */
public class CorpusIntegrityException extends VerbNetException {

    /**
     * 
     */
    private static final long serialVersionUID = 1L;

    public CorpusIntegrityException(String message) {
        super(message);
    }

    public CorpusIntegrityException(String documentName, String message) {
        super(documentName, message, null);
    }
}
