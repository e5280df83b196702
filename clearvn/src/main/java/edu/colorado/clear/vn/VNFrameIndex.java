package edu.colorado.clear.vn;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reverse index from (primary POS pattern, member verb) to the frames that
 * apply. Matches are listed in the order their classes were given, then in
 * member order within a class; no linguistic precedence is imposed.
 * <p>
 * Immutable once built.
 *
 * @author shumin
 */
public class VNFrameIndex implements Serializable {

    /**
     *
     */
    private static final long serialVersionUID = 1L;

    final Map<String, Map<String, List<VNFrameMatch>>> patternMap;
    final int entryCount;

    public VNFrameIndex(Collection<VNClass> classes) {
        Map<String, Map<String, List<VNFrameMatch>>> index = new HashMap<String, Map<String, List<VNFrameMatch>>>();
        int count = 0;

        for (VNClass vnClass:classes)
            for (Map.Entry<String, VNFrame> entry:vnClass.getFrames().entrySet()) {
                Map<String, List<VNFrameMatch>> memberMap = index.get(entry.getKey());
                if (memberMap==null)
                    index.put(entry.getKey(), memberMap = new HashMap<String, List<VNFrameMatch>>());
                VNFrameMatch match = new VNFrameMatch(vnClass.getId(), entry.getValue());
                for (String member:vnClass.getMembers().keySet()) {
                    List<VNFrameMatch> matches = memberMap.get(member);
                    if (matches==null)
                        memberMap.put(member, matches = new ArrayList<VNFrameMatch>());
                    matches.add(match);
                    ++count;
                }
            }

        // freeze
        for (Map.Entry<String, Map<String, List<VNFrameMatch>>> entry:index.entrySet()) {
            for (Map.Entry<String, List<VNFrameMatch>> mEntry:entry.getValue().entrySet())
                mEntry.setValue(Collections.unmodifiableList(mEntry.getValue()));
            entry.setValue(Collections.unmodifiableMap(entry.getValue()));
        }
        patternMap = Collections.unmodifiableMap(index);
        entryCount = count;
    }

    /**
     * @param pattern space separated primary pattern, e.g. <code>NP V NP</code>
     * @param member member verb
     * @return matching frames, empty if there are none
     */
    public List<VNFrameMatch> findFrames(String pattern, String member) {
        Map<String, List<VNFrameMatch>> memberMap = patternMap.get(pattern);
        if (memberMap==null)
            return Collections.emptyList();
        List<VNFrameMatch> matches = memberMap.get(member);
        return matches==null?Collections.<VNFrameMatch>emptyList():matches;
    }

    /**
     * Same as {@link #findFrames(String, String)} with the pattern tokens
     * joined by single spaces.
     */
    public List<VNFrameMatch> findFrames(List<String> patternTokens, String member) {
        return findFrames(joinPattern(patternTokens), member);
    }

    public static String joinPattern(List<String> patternTokens) {
        return String.join(" ", patternTokens);
    }

    public Collection<String> getPatterns() {
        return patternMap.keySet();
    }

    /**
     * @return number of distinct (pattern, member) keys
     */
    public int size() {
        int size = 0;
        for (Map<String, List<VNFrameMatch>> memberMap:patternMap.values())
            size += memberMap.size();
        return size;
    }

    /**
     * @return total number of indexed (pattern, member, frame) entries
     */
    public int getEntryCount() {
        return entryCount;
    }
}
