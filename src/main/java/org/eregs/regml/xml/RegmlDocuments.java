package org.eregs.regml.xml;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Parsing, copying and serialization of RegML documents. */
public final class RegmlDocuments {

    private RegmlDocuments() {}

    public static Document parse(String xml) {
        return parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "<string>");
    }

    public static Document parse(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in, file.toString());
        } catch (IOException e) {
            throw new RegmlDocumentException("cannot read " + file, e);
        }
    }

    private static Document parse(InputStream in, String source) {
        try {
            return newBuilder().parse(in);
        } catch (SAXException | IOException e) {
            throw new RegmlDocumentException("cannot parse RegML document " + source, e);
        }
    }

    /** A structurally independent copy; nothing done to the copy is visible in {@code doc}. */
    public static Document copy(Document doc) {
        Document out = newBuilder().newDocument();
        Element root = doc.getDocumentElement();
        if (root != null) out.appendChild(out.importNode(root, true));
        return out;
    }

    public static String toXml(Document doc) {
        try {
            Transformer t = TransformerFactory.newInstance().newTransformer();
            t.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            t.setOutputProperty(OutputKeys.INDENT, "yes");
            StringWriter out = new StringWriter();
            t.transform(new DOMSource(doc), new StreamResult(out));
            return out.toString();
        } catch (TransformerException e) {
            throw new RegmlDocumentException("cannot serialize RegML document", e);
        }
    }

    public static void write(Document doc, Path file) {
        try {
            Files.writeString(file, toXml(doc), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RegmlDocumentException("cannot write " + file, e);
        }
    }

    private static DocumentBuilder newBuilder() {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setNamespaceAware(true); dbf.setIgnoringComments(true); dbf.setCoalescing(true);
        try {
            return dbf.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new RegmlDocumentException("XML parser unavailable", e);
        }
    }
}
