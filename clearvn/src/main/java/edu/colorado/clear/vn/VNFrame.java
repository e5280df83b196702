package edu.colorado.clear.vn;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import edu.colorado.clear.vn.common.xml.XMLNode;

/**
 * One syntactic frame of a VerbNet class.
 * <p>
 * Syntax and semantics are kept as raw {@link XMLNode} lists: callers match
 * the tags they understand (<code>np</code>, <code>verb</code>,
 * <code>pred</code>, <code>arg</code>, ...) and ignore the rest.
 * 
 * @author shumin
 */
public class VNFrame implements Serializable {

    /**
     * 
     */
    private static final long serialVersionUID = 1L;

    final String primary;
    final Map<String, String> description;
    final List<List<String>> examples;
    final List<XMLNode> syntax;
    final List<XMLNode> semantics;

    public VNFrame(Map<String, String> description, List<List<String>> examples, List<XMLNode> syntax, List<XMLNode> semantics) {
        this.description = Collections.unmodifiableMap(new LinkedHashMap<String, String>(description));
        this.primary = this.description.get(VNVocabulary.PRIMARY.getName());
        if (primary==null)
            throw new IllegalArgumentException("frame description has no primary pattern: "+description);

        List<List<String>> exampleList = new ArrayList<List<String>>(examples.size());
        for (List<String> example:examples)
            exampleList.add(Collections.unmodifiableList(new ArrayList<String>(example)));
        this.examples = Collections.unmodifiableList(exampleList);

        this.syntax = Collections.unmodifiableList(new ArrayList<XMLNode>(syntax));
        this.semantics = Collections.unmodifiableList(new ArrayList<XMLNode>(semantics));
    }

    /**
     * @return the primary POS pattern, e.g. <code>NP V NP</code>
     */
    public String getPrimary() {
        return primary;
    }

    public Map<String, String> getDescription() {
        return description;
    }

    public String getDescription(String key) {
        return description.get(key);
    }

    /**
     * Each example holds the first text segment of its <code>EXAMPLE</code>
     * element; an example without text is an empty list.
     */
    public List<List<String>> getExamples() {
        return examples;
    }

    public List<XMLNode> getSyntax() {
        return syntax;
    }

    public List<XMLNode> getSemantics() {
        return semantics;
    }

    @Override
    public boolean equals(Object obj) {
        if (this==obj) return true;
        if (!(obj instanceof VNFrame)) return false;
        VNFrame rhs = (VNFrame)obj;
        return description.equals(rhs.description) && examples.equals(rhs.examples) &&
                syntax.equals(rhs.syntax) && semantics.equals(rhs.semantics);
    }

    @Override
    public int hashCode() {
        return ((description.hashCode()*31+examples.hashCode())*31+syntax.hashCode())*31+semantics.hashCode();
    }

    @Override
    public String toString() {
        return primary+' '+description+' '+examples;
    }
}
