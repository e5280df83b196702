package edu.colorado.clear.vn;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Verb listed in a VerbNet class. The attributes are those of the
 * <code>MEMBER</code> element minus <code>name</code>.
 */
public class VNMember implements Serializable {

    /**
     * 
     */
    private static final long serialVersionUID = 1L;

    final String name;
    final Map<String, String> attributes;

    public VNMember(String name, Map<String, String> attributes) {
        this.name = name;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<String, String>(attributes));
    }

    public String getName() {
        return name;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public String getAttribute(String key) {
        return attributes.get(key);
    }

    /**
     * @return the sense grouping (e.g. <code>wish.02</code>), null if absent
     */
    public String getGrouping() {
        return attributes.get(VNVocabulary.GROUPING.getName());
    }

    /**
     * @return space separated WordNet sense keys, null if absent
     */
    public String getWordNet() {
        return attributes.get(VNVocabulary.WN.getName());
    }

    @Override
    public boolean equals(Object obj) {
        if (this==obj) return true;
        if (!(obj instanceof VNMember)) return false;
        VNMember rhs = (VNMember)obj;
        return name.equals(rhs.name) && attributes.equals(rhs.attributes);
    }

    @Override
    public int hashCode() {
        return name.hashCode()*31+attributes.hashCode();
    }

    @Override
    public String toString() {
        return name+' '+attributes;
    }
}
