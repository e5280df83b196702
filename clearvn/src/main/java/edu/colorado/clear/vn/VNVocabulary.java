package edu.colorado.clear.vn;

import edu.colorado.clear.vn.common.xml.XMLSymbol;

/**
 * Element and attribute names of VerbNet class documents.
 */
public final class VNVocabulary {

    public static final XMLSymbol VNCLASS = XMLSymbol.valueOf("vnclass");
    public static final XMLSymbol VNSUBCLASS = XMLSymbol.valueOf("vnsubclass");
    public static final XMLSymbol SUBCLASSES = XMLSymbol.valueOf("subclasses");

    public static final XMLSymbol MEMBERS = XMLSymbol.valueOf("members");
    public static final XMLSymbol MEMBER = XMLSymbol.valueOf("member");

    public static final XMLSymbol THEMROLES = XMLSymbol.valueOf("themroles");
    public static final XMLSymbol THEMROLE = XMLSymbol.valueOf("themrole");

    public static final XMLSymbol FRAMES = XMLSymbol.valueOf("frames");
    public static final XMLSymbol FRAME = XMLSymbol.valueOf("frame");
    public static final XMLSymbol DESCRIPTION = XMLSymbol.valueOf("description");
    public static final XMLSymbol EXAMPLES = XMLSymbol.valueOf("examples");
    public static final XMLSymbol EXAMPLE = XMLSymbol.valueOf("example");
    public static final XMLSymbol SYNTAX = XMLSymbol.valueOf("syntax");
    public static final XMLSymbol SEMANTICS = XMLSymbol.valueOf("semantics");

    public static final XMLSymbol ID = XMLSymbol.valueOf("id");
    public static final XMLSymbol NAME = XMLSymbol.valueOf("name");
    public static final XMLSymbol TYPE = XMLSymbol.valueOf("type");
    public static final XMLSymbol PRIMARY = XMLSymbol.valueOf("primary");
    public static final XMLSymbol GROUPING = XMLSymbol.valueOf("grouping");
    public static final XMLSymbol WN = XMLSymbol.valueOf("wn");

    private VNVocabulary() {
    }
}
