package edu.colorado.clear.vn.common.xml;

import java.io.IOException;
import java.io.StringReader;

import org.xml.sax.EntityResolver;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.XMLReader;
import org.xml.sax.helpers.XMLReaderFactory;

/**
 * Parses markup documents into canonical {@link XMLNode} trees. Each reader
 * owns its own parser and is meant to be used by one thread at a time.
 */
public class XMLTreeReader {

    public static final String PARSER_CLASS = "org.apache.xerces.parsers.SAXParser";
    static final String NAMESPACES_FEATURE = "http://xml.org/sax/features/namespaces";

    XMLReader parser;
    XMLTreeBuilder builder;

    public XMLTreeReader() throws SAXException {
        this(null);
    }

    /**
     * @param resolver resolves external entities (DTDs); when it is null or
     * cannot find an entity, an empty entity is substituted so nothing is
     * fetched from the network
     */
    @SuppressWarnings("deprecation")
    public XMLTreeReader(final EntityResolver resolver) throws SAXException {
        builder = new XMLTreeBuilder();
        parser = XMLReaderFactory.createXMLReader(PARSER_CLASS);
        // report qualified names and xmlns declarations as plain attributes
        parser.setFeature(NAMESPACES_FEATURE, false);
        parser.setContentHandler(builder);
        parser.setErrorHandler(builder);
        parser.setEntityResolver(new EntityResolver() {
            @Override
            public InputSource resolveEntity(String publicId, String systemId) throws SAXException, IOException {
                InputSource source = resolver==null?null:resolver.resolveEntity(publicId, systemId);
                if (source==null) {
                    source = new InputSource(new StringReader(""));
                    source.setSystemId(systemId);
                }
                return source;
            }
        });
    }

    public XMLNode read(InputSource source) throws IOException, SAXException {
        parser.parse(source);
        XMLNode root = builder.getRoot();
        if (root==null)
            throw new SAXException("no root element in "+source.getSystemId());
        return root;
    }
}
