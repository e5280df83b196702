package edu.colorado.clear.vn.common.xml;

import java.io.ObjectStreamException;
import java.io.Serializable;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Interned, lower-cased name of an element or attribute. Two symbols with the
 * same name are always the same instance, so symbols may be compared with
 * <code>==</code>.
 * 
 * @author shumin
 */
public final class XMLSymbol implements Comparable<XMLSymbol>, Serializable {

    /**
     * 
     */
    private static final long serialVersionUID = 1L;

    static final ConcurrentMap<String, XMLSymbol> symbolTable = new ConcurrentHashMap<String, XMLSymbol>();

    final String name;

    private XMLSymbol(String name) {
        this.name = name;
    }

    /**
     * Returns the symbol for the lower-cased form of <code>name</code>.
     * @param name element or attribute name, any case
     * @return the interned symbol
     */
    public static XMLSymbol valueOf(String name) {
        String key = name.toLowerCase(Locale.ROOT);
        XMLSymbol symbol = symbolTable.get(key);
        if (symbol!=null)
            return symbol;
        XMLSymbol newSymbol = new XMLSymbol(key);
        symbol = symbolTable.putIfAbsent(key, newSymbol);
        return symbol==null?newSymbol:symbol;
    }

    public String getName() {
        return name;
    }

    // keep identity across serialization
    private Object readResolve() throws ObjectStreamException {
        return valueOf(name);
    }

    @Override
    public int compareTo(XMLSymbol o) {
        return name.compareTo(o.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
