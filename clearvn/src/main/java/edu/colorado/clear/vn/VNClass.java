package edu.colorado.clear.vn;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import edu.colorado.clear.vn.common.xml.XMLContent;

/**
 * A VerbNet class: its members, thematic roles and frames. Subclasses are
 * extracted as separate instances and are not linked back to their parent.
 * 
 * @author shumin
 */
public class VNClass implements Serializable {

    /**
     * 
     */
    private static final long serialVersionUID = 1L;

    final String id;
    final Map<String, VNMember> members;
    final Map<String, List<XMLContent>> roles;
    final Map<String, VNFrame> frames;

    public VNClass(String id, Map<String, VNMember> members, Map<String, List<XMLContent>> roles, Map<String, VNFrame> frames) {
        this.id = id;
        this.members = Collections.unmodifiableMap(new LinkedHashMap<String, VNMember>(members));

        Map<String, List<XMLContent>> roleMap = new LinkedHashMap<String, List<XMLContent>>();
        for (Map.Entry<String, List<XMLContent>> entry:roles.entrySet())
            roleMap.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<XMLContent>(entry.getValue())));
        this.roles = Collections.unmodifiableMap(roleMap);

        this.frames = Collections.unmodifiableMap(new LinkedHashMap<String, VNFrame>(frames));
    }

    public String getId() {
        return id;
    }

    /**
     * @return members keyed by verb, in document order
     */
    public Map<String, VNMember> getMembers() {
        return members;
    }

    /**
     * @return content of each thematic role (selectional restrictions),
     * keyed by role type
     */
    public Map<String, List<XMLContent>> getRoles() {
        return roles;
    }

    /**
     * @return frames keyed by primary POS pattern
     */
    public Map<String, VNFrame> getFrames() {
        return frames;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(id+'\n');
        builder.append("  members: "+members.keySet()+'\n');
        builder.append("  roles: "+roles.keySet()+'\n');
        for (VNFrame frame:frames.values())
            builder.append("  "+frame+'\n');
        return builder.toString();
    }
}
