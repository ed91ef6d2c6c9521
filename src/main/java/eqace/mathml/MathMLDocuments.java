package eqace.mathml;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
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

import org.w3c.dom.*;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import eqace.EquationException;

/**
 * DOM plumbing shared by the content and presentation codecs
 */
public class MathMLDocuments {

	public static final String MATH_NS = "http://www.w3.org/1998/Math/MathML";

	public static final String ENCODING = "UTF-8";

	private MathMLDocuments(){
	}

	/**
	 * New document with an empty {@code <math>} root element
	 */
	public static Document newMathDocument(){
		Document doc = newDocumentBuilder().newDocument();
		doc.appendChild(doc.createElementNS(MATH_NS, "math"));
		return doc;
	}

	public static Element element(Document doc, String name){
		return doc.createElementNS(MATH_NS, name);
	}

	public static Element textElement(Document doc, String name, String text){
		Element element = element(doc, name);
		element.setTextContent(text);
		return element;
	}

	/**
	 * Serializes the document without an XML declaration and without indentation
	 */
	public static String serialize(Document doc){
		try {
			Transformer transformer = TransformerFactory.newInstance().newTransformer();
			transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
			transformer.setOutputProperty(OutputKeys.INDENT, "no");
			transformer.setOutputProperty(OutputKeys.ENCODING, ENCODING);
			StringWriter writer = new StringWriter();
			transformer.transform(new DOMSource(doc), new StreamResult(writer));
			return writer.toString();
		} catch (TransformerException e) {
			throw new EquationException("Can't serialize MathML document", e);
		}
	}

	/**
	 * Parses a namespace aware document, external entities and DTDs are not loaded
	 *
	 * @throws SAXException if the text isn't well formed
	 */
	public static Document parse(String text) throws SAXException {
		try {
			return newDocumentBuilder().parse(new InputSource(new StringReader(text)));
		} catch (IOException e) {
			throw new EquationException("Can't read MathML text", e);
		}
	}

	/**
	 * Element children of the passed node, text and comments are skipped
	 */
	public static List<Element> childElements(Node node){
		List<Element> elements = new ArrayList<>();
		NodeList children = node.getChildNodes();
		for (int i = 0; i < children.getLength(); i++){
			if (children.item(i) instanceof Element){
				elements.add((Element)children.item(i));
			}
		}
		return elements;
	}

	/**
	 * Local name without namespace prefix, lower case
	 */
	public static String localName(Element element){
		String name = element.getLocalName();
		if (name == null){
			name = element.getTagName();
			int colon = name.indexOf(':');
			if (colon >= 0){
				name = name.substring(colon + 1);
			}
		}
		return name.toLowerCase();
	}

	private static DocumentBuilder newDocumentBuilder(){
		try {
			DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
			factory.setNamespaceAware(true);
			factory.setExpandEntityReferences(false);
			factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
			factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
			DocumentBuilder builder = factory.newDocumentBuilder();
			// report fatal errors only as exceptions and not on stderr
			builder.setErrorHandler(new DefaultHandler());
			return builder;
		} catch (ParserConfigurationException e) {
			throw new EquationException("Can't create XML parser", e);
		}
	}
}
