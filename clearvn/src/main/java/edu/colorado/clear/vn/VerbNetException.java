package edu.colorado.clear.vn;

/**
 * Failure while building the VerbNet model. Any instance aborts the whole
 * corpus build.
 */
public class VerbNetException extends Exception {

    /**
     * 
     */
    private static final long serialVersionUID = 1L;

    String documentName;

    public VerbNetException(String message) {
        super(message);
    }

    public VerbNetException(String message, Throwable cause) {
        super(message, cause);
    }

    public VerbNetException(String documentName, String message, Throwable cause) {
        super(documentName==null?message:documentName+": "+message, cause);
        this.documentName = documentName;
    }

    /**
     * @return name of the offending document, null if not tied to one
     */
    public String getDocumentName() {
        return documentName;
    }
}
