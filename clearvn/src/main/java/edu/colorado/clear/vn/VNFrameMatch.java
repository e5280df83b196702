package edu.colorado.clear.vn;

import java.io.Serializable;

/**
 * A frame found by pattern/member lookup, tagged with the class it came from.
 */
public class VNFrameMatch implements Serializable {

    /**
     * 
     */
    private static final long serialVersionUID = 1L;

    final String classId;
    final VNFrame frame;

    public VNFrameMatch(String classId, VNFrame frame) {
        this.classId = classId;
        this.frame = frame;
    }

    public String getClassId() {
        return classId;
    }

    public VNFrame getFrame() {
        return frame;
    }

    @Override
    public boolean equals(Object obj) {
        if (this==obj) return true;
        if (!(obj instanceof VNFrameMatch)) return false;
        VNFrameMatch rhs = (VNFrameMatch)obj;
        return classId.equals(rhs.classId) && frame.equals(rhs.frame);
    }

    @Override
    public int hashCode() {
        return classId.hashCode()*31+frame.hashCode();
    }

    @Override
    public String toString() {
        return classId+' '+frame;
    }
}
