package edu.colorado.clear.vn.common.xml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical markup node: an interned tag, an attribute map keyed by interned
 * symbols, and an ordered list of children (nested nodes or text leaves).
 * Instances are immutable once built.
 * 
 * @author shumin
 */
public final class XMLNode extends XMLContent {

    /**
     * 
     */
    private static final long serialVersionUID = 1L;

    final XMLSymbol tag;
    final Map<XMLSymbol, String> attributes;
    final List<XMLContent> children;

    public XMLNode(XMLSymbol tag, Map<XMLSymbol, String> attributes, List<XMLContent> children) {
        if (tag==null)
            throw new NullPointerException("tag");
        this.tag = tag;
        this.attributes = attributes==null||attributes.isEmpty()?Collections.<XMLSymbol, String>emptyMap():
            Collections.unmodifiableMap(new LinkedHashMap<XMLSymbol, String>(attributes));
        this.children = children==null||children.isEmpty()?Collections.<XMLContent>emptyList():
            Collections.unmodifiableList(new ArrayList<XMLContent>(children));
    }

    @Override
    public boolean isText() {
        return false;
    }

    public XMLSymbol getTag() {
        return tag;
    }

    public boolean hasTag(XMLSymbol symbol) {
        return tag==symbol;
    }

    public Map<XMLSymbol, String> getAttributes() {
        return attributes;
    }

    public String getAttribute(XMLSymbol key) {
        return attributes.get(key);
    }

    public String getAttribute(String key) {
        return attributes.get(XMLSymbol.valueOf(key));
    }

    public List<XMLContent> getChildren() {
        return children;
    }

    /**
     * @return the element children, text leaves skipped
     */
    public List<XMLNode> getChildNodes() {
        List<XMLNode> nodes = new ArrayList<XMLNode>(children.size());
        for (XMLContent child:children)
            if (!child.isText())
                nodes.add((XMLNode)child);
        return Collections.unmodifiableList(nodes);
    }

    /**
     * @return the first text leaf directly under this node, or null
     */
    @Override
    public String getText() {
        for (XMLContent child:children)
            if (child.isText())
                return child.getText();
        return null;
    }

    @Override
    public boolean equals(Object obj) {
        if (this==obj) return true;
        if (!(obj instanceof XMLNode)) return false;
        XMLNode rhs = (XMLNode)obj;
        return tag==rhs.tag && attributes.equals(rhs.attributes) && children.equals(rhs.children);
    }

    @Override
    public int hashCode() {
        return (tag.hashCode()*31+attributes.hashCode())*31+children.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append('(').append(tag.name);
        if (!attributes.isEmpty())
            builder.append(' ').append(attributes);
        for (XMLContent child:children)
            builder.append(' ').append(child);
        builder.append(')');
        return builder.toString();
    }
}
