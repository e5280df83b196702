package edu.colorado.clear.vn.common.xml;

import java.io.Serializable;

/**
 * Child of a canonical node: either a nested {@link XMLNode} or an
 * {@link XMLText} leaf.
 */
public abstract class XMLContent implements Serializable {

    /**
     * 
     */
    private static final long serialVersionUID = 1L;

    public abstract boolean isText();

    public XMLNode asNode() {
        if (isText())
            throw new ClassCastException("text content is not a node: "+this);
        return (XMLNode)this;
    }

    public String getText() {
        return null;
    }
}
