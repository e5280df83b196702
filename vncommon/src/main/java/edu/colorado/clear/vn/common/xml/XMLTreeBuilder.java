package edu.colorado.clear.vn.common.xml;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.xml.sax.Attributes;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * SAX handler that normalizes parser events into a canonical {@link XMLNode}
 * tree. Element and attribute names are lower-cased and interned, attribute
 * values keep their case, contiguous character data becomes a single text leaf
 * and whitespace-only character data is dropped.
 * <p>
 * A builder holds per-document state and must not be shared between threads.
 */
public class XMLTreeBuilder extends DefaultHandler {

    static class PendingNode {
        XMLSymbol tag;
        Map<XMLSymbol, String> attributes;
        List<XMLContent> children;

        PendingNode(XMLSymbol tag, Map<XMLSymbol, String> attributes) {
            this.tag = tag;
            this.attributes = attributes;
            this.children = new ArrayList<XMLContent>();
        }
    }

    Deque<PendingNode> stack;
    StringBuilder textBuilder;
    XMLNode root;

    public XMLTreeBuilder() {
        stack = new ArrayDeque<PendingNode>();
        textBuilder = new StringBuilder();
    }

    /**
     * Names keep their namespace prefix (<code>xsi:type</code> and
     * <code>type</code> are different keys); the local name is only used when
     * the parser reports no qualified name.
     */
    public static XMLSymbol normalizeName(String localName, String qName) {
        return XMLSymbol.valueOf(qName==null||qName.isEmpty()?localName:qName);
    }

    public static Map<XMLSymbol, String> normalizeAttributes(Attributes atts) {
        if (atts==null || atts.getLength()==0)
            return Collections.emptyMap();
        Map<XMLSymbol, String> attributes = new LinkedHashMap<XMLSymbol, String>();
        for (int i=0; i<atts.getLength(); ++i)
            attributes.put(normalizeName(atts.getLocalName(i), atts.getQName(i)), atts.getValue(i));
        return attributes;
    }

    /**
     * @return the root of the last document parsed, null if none completed
     */
    public XMLNode getRoot() {
        return root;
    }

    @Override
    public void startDocument() {
        stack.clear();
        textBuilder.setLength(0);
        root = null;
    }

    @Override
    public void startElement(String uri, String localName, String qName, Attributes atts) throws SAXException {
        flushText();
        stack.push(new PendingNode(normalizeName(localName, qName), normalizeAttributes(atts)));
    }

    @Override
    public void characters(char[] ch, int start, int length) {
        if (!stack.isEmpty())
            textBuilder.append(ch, start, length);
    }

    @Override
    public void endElement(String uri, String localName, String qName) throws SAXException {
        flushText();
        PendingNode pending = stack.pop();
        XMLNode node = new XMLNode(pending.tag, pending.attributes, pending.children);
        if (stack.isEmpty())
            root = node;
        else
            stack.peek().children.add(node);
    }

    void flushText() {
        if (textBuilder.length()==0)
            return;
        String text = textBuilder.toString();
        textBuilder.setLength(0);
        if (!text.trim().isEmpty() && !stack.isEmpty())
            stack.peek().children.add(new XMLText(text));
    }
}
