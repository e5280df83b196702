package edu.colorado.clear.vn;

import static edu.colorado.clear.vn.VNVocabulary.DESCRIPTION;
import static edu.colorado.clear.vn.VNVocabulary.EXAMPLE;
import static edu.colorado.clear.vn.VNVocabulary.EXAMPLES;
import static edu.colorado.clear.vn.VNVocabulary.FRAME;
import static edu.colorado.clear.vn.VNVocabulary.FRAMES;
import static edu.colorado.clear.vn.VNVocabulary.ID;
import static edu.colorado.clear.vn.VNVocabulary.MEMBER;
import static edu.colorado.clear.vn.VNVocabulary.MEMBERS;
import static edu.colorado.clear.vn.VNVocabulary.NAME;
import static edu.colorado.clear.vn.VNVocabulary.PRIMARY;
import static edu.colorado.clear.vn.VNVocabulary.SEMANTICS;
import static edu.colorado.clear.vn.VNVocabulary.SUBCLASSES;
import static edu.colorado.clear.vn.VNVocabulary.SYNTAX;
import static edu.colorado.clear.vn.VNVocabulary.THEMROLE;
import static edu.colorado.clear.vn.VNVocabulary.THEMROLES;
import static edu.colorado.clear.vn.VNVocabulary.TYPE;
import static edu.colorado.clear.vn.VNVocabulary.VNCLASS;
import static edu.colorado.clear.vn.VNVocabulary.VNSUBCLASS;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import edu.colorado.clear.vn.common.xml.XMLContent;
import edu.colorado.clear.vn.common.xml.XMLNode;
import edu.colorado.clear.vn.common.xml.XMLSymbol;

/**
 * Turns a normalized <code>VNCLASS</code> document into {@link VNClass}
 * records. Nested subclasses, at any depth, are flattened into the returned
 * list right after their parent, in document order.
 * <p>
 * Missing ids, member names, role types or frame patterns are integrity
 * defects and fail the extraction. Unknown sections are dropped.
 * <p>
 * The extractor keeps no per-document state and may be shared between
 * threads.
 *
 * @author shumin
 */
public class VNClassExtractor {

    private static Logger logger = Logger.getLogger("clearvn");

    boolean strictFrames;

    public VNClassExtractor() {
        this(false);
    }

    /**
     * @param strictFrames whether two frames with the same primary pattern in
     * one class are an integrity defect (otherwise the later frame wins)
     */
    public VNClassExtractor(boolean strictFrames) {
        this.strictFrames = strictFrames;
    }

    public boolean isStrictFrames() {
        return strictFrames;
    }

    // class level sections of one VNCLASS/VNSUBCLASS element
    static class ClassSections {
        Map<String, VNMember> members = Collections.emptyMap();
        Map<String, List<XMLContent>> roles = Collections.emptyMap();
        Map<String, VNFrame> frames = Collections.emptyMap();
        List<XMLNode> subclasses = Collections.emptyList();
    }

    public List<VNClass> extractClasses(XMLNode root) throws CorpusIntegrityException {
        return extractClasses(root, null);
    }

    /**
     * @param root document root, must be a <code>VNCLASS</code> element
     * @param documentName name used in error messages, may be null
     * @return the class followed by all its descendants
     */
    public List<VNClass> extractClasses(XMLNode root, String documentName) throws CorpusIntegrityException {
        if (!root.hasTag(VNCLASS))
            throw new CorpusIntegrityException(documentName, "document root is <"+root.getTag()+">, expected <"+VNCLASS+">");

        List<VNClass> classes = new ArrayList<VNClass>();
        extractClasses(root, documentName, classes);
        return classes;
    }

    void extractClasses(XMLNode node, String documentName, List<VNClass> classes) throws CorpusIntegrityException {
        String classId = requireAttribute(node, ID, "<"+node.getTag()+">", documentName);

        ClassSections sections = extractSections(classId, node, documentName);
        classes.add(new VNClass(classId, sections.members, sections.roles, sections.frames));

        for (XMLNode subclass:sections.subclasses) {
            if (!subclass.hasTag(VNSUBCLASS) && !subclass.hasTag(VNCLASS))
                throw new CorpusIntegrityException(documentName, "unexpected <"+subclass.getTag()+"> in subclasses of "+classId);
            extractClasses(subclass, documentName, classes);
        }
    }

    ClassSections extractSections(String classId, XMLNode classNode, String documentName) throws CorpusIntegrityException {
        ClassSections sections = new ClassSections();
        for (XMLNode section:classNode.getChildNodes()) {
            XMLSymbol tag = section.getTag();
            if (tag==MEMBERS)
                sections.members = extractMembers(classId, section, documentName);
            else if (tag==THEMROLES)
                sections.roles = extractRoles(classId, section, documentName);
            else if (tag==FRAMES)
                sections.frames = extractFrames(classId, section, documentName);
            else if (tag==SUBCLASSES)
                sections.subclasses = section.getChildNodes();
            else
                logger.fine("dropping section <"+tag+"> of "+classId);
        }
        return sections;
    }

    Map<String, VNMember> extractMembers(String classId, XMLNode section, String documentName) throws CorpusIntegrityException {
        Map<String, VNMember> members = new LinkedHashMap<String, VNMember>();
        for (XMLNode member:section.getChildNodes()) {
            requireTag(member, MEMBER, classId, documentName);
            String name = requireAttribute(member, NAME, "member of "+classId, documentName);
            if (members.put(name, new VNMember(name, toStringMap(member.getAttributes(), NAME)))!=null)
                logger.fine("duplicate member "+name+" in "+classId);
        }
        return members;
    }

    Map<String, List<XMLContent>> extractRoles(String classId, XMLNode section, String documentName) throws CorpusIntegrityException {
        Map<String, List<XMLContent>> roles = new LinkedHashMap<String, List<XMLContent>>();
        for (XMLNode role:section.getChildNodes()) {
            requireTag(role, THEMROLE, classId, documentName);
            String type = requireAttribute(role, TYPE, "thematic role of "+classId, documentName);
            roles.put(type, role.getChildren());
        }
        return roles;
    }

    Map<String, VNFrame> extractFrames(String classId, XMLNode section, String documentName) throws CorpusIntegrityException {
        Map<String, VNFrame> frames = new LinkedHashMap<String, VNFrame>();
        for (XMLNode frameNode:section.getChildNodes()) {
            requireTag(frameNode, FRAME, classId, documentName);
            VNFrame frame = extractFrame(classId, frameNode, documentName);
            if (frames.put(frame.getPrimary(), frame)!=null) {
                if (strictFrames)
                    throw new CorpusIntegrityException(documentName, "duplicate frame \""+frame.getPrimary()+"\" in "+classId);
                logger.warning("duplicate frame \""+frame.getPrimary()+"\" in "+classId+", keeping the last one");
            }
        }
        return frames;
    }

    VNFrame extractFrame(String classId, XMLNode frameNode, String documentName) throws CorpusIntegrityException {
        Map<String, String> description = null;
        List<List<String>> examples = Collections.emptyList();
        List<XMLNode> syntax = Collections.emptyList();
        List<XMLNode> semantics = Collections.emptyList();

        for (XMLNode section:frameNode.getChildNodes()) {
            XMLSymbol tag = section.getTag();
            if (tag==DESCRIPTION)
                description = toStringMap(section.getAttributes(), null);
            else if (tag==EXAMPLES)
                examples = extractExamples(section);
            else if (tag==SYNTAX)
                syntax = section.getChildNodes();
            else if (tag==SEMANTICS)
                semantics = section.getChildNodes();
            else
                logger.fine("dropping frame section <"+tag+"> of "+classId);
        }

        if (description==null)
            throw new CorpusIntegrityException(documentName, "frame without <"+DESCRIPTION+"> in "+classId);
        if (description.get(PRIMARY.getName())==null)
            throw new CorpusIntegrityException(documentName, "frame description without "+PRIMARY+" in "+classId+": "+description);

        return new VNFrame(description, examples, syntax, semantics);
    }

    // only the first text segment of each example is kept
    static List<List<String>> extractExamples(XMLNode section) {
        List<List<String>> examples = new ArrayList<List<String>>();
        for (XMLNode example:section.getChildNodes()) {
            if (!example.hasTag(EXAMPLE))
                continue;
            String text = example.getText();
            examples.add(text==null?Collections.<String>emptyList():Collections.singletonList(text));
        }
        return examples;
    }

    static Map<String, String> toStringMap(Map<XMLSymbol, String> attributes, XMLSymbol exclude) {
        Map<String, String> map = new LinkedHashMap<String, String>();
        for (Map.Entry<XMLSymbol, String> entry:attributes.entrySet())
            if (entry.getKey()!=exclude)
                map.put(entry.getKey().getName(), entry.getValue());
        return map;
    }

    static String requireAttribute(XMLNode node, XMLSymbol key, String context, String documentName) throws CorpusIntegrityException {
        String value = node.getAttribute(key);
        if (value==null)
            throw new CorpusIntegrityException(documentName, context+" has no "+key+" attribute");
        return value;
    }

    static void requireTag(XMLNode node, XMLSymbol tag, String classId, String documentName) throws CorpusIntegrityException {
        if (!node.hasTag(tag))
            throw new CorpusIntegrityException(documentName, "unexpected <"+node.getTag()+"> in "+classId+", expected <"+tag+">");
    }
}
