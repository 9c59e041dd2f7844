package com.williamcallahan.book_archive_engine.service.assembly;

import com.williamcallahan.book_archive_engine.exception.LibraryArchiveException;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * DOM helpers for FictionBook 2 markup.
 */
final class Fb2Markup {

    static final String FB_NS = "http://www.gribuser.ru/xml/fictionbook/2.0";
    static final String XLINK_NS = "http://www.w3.org/1999/xlink";
    private static final String DEFAULT_XLINK_PREFIX = "l";

    private static final Logger logger = LoggerFactory.getLogger(Fb2Markup.class);

    /**
     * Rethrows errors instead of letting the parser print them to stderr.
     */
    private static final ErrorHandler RETHROWING_HANDLER = new ErrorHandler() {
        @Override
        public void warning(SAXParseException exception) {
            logger.debug("FB2 parse warning at line {}: {}", exception.getLineNumber(), exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    };

    private Fb2Markup() {
    }

    static Document parse(InputStream in, String source) throws IOException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(RETHROWING_HANDLER);
            return builder.parse(in);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure configuration", e);
        } catch (SAXException e) {
            throw new LibraryArchiveException("Payload " + source + " is not well-formed FB2: " + e.getMessage(), e);
        }
    }

    static byte[] serialize(Document document) {
        try {
            document.setXmlStandalone(true);
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "no");
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            transformer.transform(new DOMSource(document), new StreamResult(out));
            return out.toByteArray();
        } catch (TransformerException e) {
            throw new LibraryArchiveException("Failed to serialize FB2 document", e);
        }
    }

    /**
     * Markup of an element's children, without the element itself.
     */
    static String innerXml(Element element) {
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            StringWriter out = new StringWriter();
            for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
                transformer.transform(new DOMSource(child), new StreamResult(out));
            }
            return out.toString();
        } catch (TransformerException e) {
            throw new LibraryArchiveException("Failed to serialize " + element.getLocalName(), e);
        }
    }

    /**
     * Elements in the FictionBook namespace, in document order.
     */
    static List<Element> elements(Node scope, String localName) {
        NodeList nodes = scope instanceof Document document
            ? document.getElementsByTagNameNS(FB_NS, localName)
            : ((Element) scope).getElementsByTagNameNS(FB_NS, localName);
        List<Element> result = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    static Element firstChild(Element parent, String localName) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element element && FB_NS.equals(element.getNamespaceURI())
                    && localName.equals(element.getLocalName())) {
                return element;
            }
        }
        return null;
    }

    /**
     * Create an element in the FictionBook namespace, reusing the root's prefix.
     */
    static Element create(Document document, String localName) {
        String prefix = document.getDocumentElement().getPrefix();
        return document.createElementNS(FB_NS, prefix == null ? localName : prefix + ":" + localName);
    }

    static String href(Element element) {
        Attr attr = element.getAttributeNodeNS(XLINK_NS, "href");
        return attr == null ? null : attr.getValue();
    }

    /**
     * Set {@code xlink:href}, keeping the attribute's existing prefix and declaring the
     * xlink namespace on the root when the document has none.
     */
    static void setHref(Element element, String value) {
        Attr existing = element.getAttributeNodeNS(XLINK_NS, "href");
        if (existing != null) {
            existing.setValue(value);
            return;
        }
        Element root = element.getOwnerDocument().getDocumentElement();
        String prefix = root.lookupPrefix(XLINK_NS);
        if (prefix == null) {
            prefix = DEFAULT_XLINK_PREFIX;
            root.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:" + prefix, XLINK_NS);
        }
        element.setAttributeNS(XLINK_NS, prefix + ":href", value);
    }
}
