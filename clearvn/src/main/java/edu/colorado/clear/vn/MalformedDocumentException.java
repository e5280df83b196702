package edu.colorado.clear.vn;

/**
 * A class document could not be read or is not well-formed markup.
 */
public class MalformedDocumentException extends VerbNetException {

    /**
     * 
     */
    private static final long serialVersionUID = 1L;

    public MalformedDocumentException(String documentName, Throwable cause) {
        super(documentName, cause.toString(), cause);
    }
}
