package edu.colorado.clear.vn;

/**
 * Thrown by class lookups for an id that is not in the corpus.
 */
public class UnknownClassException extends Exception {

    /**
     * 
     */
    private static final long serialVersionUID = 1L;

    final String classId;

    public UnknownClassException(String classId) {
        super("unknown VerbNet class: "+classId);
        this.classId = classId;
    }

    public String getClassId() {
        return classId;
    }
}
