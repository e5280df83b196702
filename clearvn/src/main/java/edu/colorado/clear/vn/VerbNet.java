package edu.colorado.clear.vn;

import java.io.File;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Logger;

import edu.colorado.clear.vn.common.util.PropertyUtil;
import edu.colorado.clear.vn.common.xml.XMLContent;

/**
 * Lookup interface into the VerbNet semantic mapping dataset: VerbNet classes
 * by id, and semantic frames by primary POS pattern and member verb.
 * <p>
 * The whole model is built once from a complete corpus and is read-only
 * afterwards; all lookups are safe for concurrent use.
 *
 * @author shumin
 */
public class VerbNet implements Serializable {

    /**
     *
     */
    private static final long serialVersionUID = 1L;

    private static Logger logger = Logger.getLogger("clearvn");

    final Map<String, VNClass> classMap;
    final VNFrameIndex frameIndex;

    /**
     * @param classes extracted classes, subclasses flattened
     * @throws CorpusIntegrityException if a class id occurs more than once
     */
    public VerbNet(List<VNClass> classes) throws CorpusIntegrityException {
        Map<String, VNClass> map = new LinkedHashMap<String, VNClass>();
        for (VNClass vnClass:classes)
            if (map.put(vnClass.getId(), vnClass)!=null)
                throw new CorpusIntegrityException("class "+vnClass.getId()+" is defined more than once");
        classMap = Collections.unmodifiableMap(map);
        frameIndex = new VNFrameIndex(classMap.values());
        logger.info(String.format("%d classes, %d pattern/member keys, %d frame entries indexed",
                classMap.size(), frameIndex.size(), frameIndex.getEntryCount()));
    }

    /**
     * Loads the corpus at <code>location</code> (directory or zip archive)
     * with default settings.
     */
    public static VerbNet load(File location) throws VerbNetException {
        return new VerbNet(new VNCorpusReader(location).read());
    }

    /**
     * Loads the corpus described by the <code>verbnet.*</code> properties.
     * @see VNCorpusReader#VNCorpusReader(Properties)
     */
    public static VerbNet load(Properties props) throws VerbNetException {
        Properties vnProps = PropertyUtil.filterProperties(props, "verbnet.");
        return new VerbNet(new VNCorpusReader(vnProps).read());
    }

    public boolean hasClass(String classId) {
        return classMap.containsKey(classId);
    }

    /**
     * @return all class ids in corpus order
     */
    public List<String> getClassIds() {
        return Collections.unmodifiableList(new ArrayList<String>(classMap.keySet()));
    }

    /**
     * @return all classes in corpus order
     */
    public Collection<VNClass> getVerbClasses() {
        return classMap.values();
    }

    public int size() {
        return classMap.size();
    }

    public VNClass getVerbClass(String classId) throws UnknownClassException {
        VNClass vnClass = classMap.get(classId);
        if (vnClass==null)
            throw new UnknownClassException(classId);
        return vnClass;
    }

    /**
     * @return members of the class keyed by verb
     */
    public Map<String, VNMember> getMembers(String classId) throws UnknownClassException {
        return getVerbClass(classId).getMembers();
    }

    /**
     * @return content of each thematic role keyed by role type
     */
    public Map<String, List<XMLContent>> getRoles(String classId) throws UnknownClassException {
        return getVerbClass(classId).getRoles();
    }

    /**
     * @return frames of the class keyed by primary POS pattern
     */
    public Map<String, VNFrame> getFrames(String classId) throws UnknownClassException {
        return getVerbClass(classId).getFrames();
    }

    /**
     * Finds the frames whose primary pattern is <code>pattern</code> in every
     * class that lists <code>member</code>, in corpus order.
     * @param pattern space separated POS pattern, e.g. <code>NP V NP</code>
     * @param member member verb, e.g. <code>wish</code>
     * @return the matching frames, empty if there are none
     */
    public List<VNFrameMatch> findFrames(String pattern, String member) {
        return frameIndex.findFrames(pattern, member);
    }

    /**
     * @param patternTokens POS pattern tokens, e.g. <code>[NP, V, NP]</code>
     * @see #findFrames(String, String)
     */
    public List<VNFrameMatch> findFrames(List<String> patternTokens, String member) {
        return frameIndex.findFrames(patternTokens, member);
    }

    /**
     * @return the first matching frame in corpus order, null if none
     */
    public VNFrameMatch findFrame(String pattern, String member) {
        List<VNFrameMatch> matches = findFrames(pattern, member);
        return matches.isEmpty()?null:matches.get(0);
    }

    public VNFrameMatch findFrame(List<String> patternTokens, String member) {
        return findFrame(VNFrameIndex.joinPattern(patternTokens), member);
    }

    public VNFrameIndex getFrameIndex() {
        return frameIndex;
    }
}
