package edu.virginia.lib.dataone.helper;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Writes {@link SystemMetadata} as a DataONE v2 SystemMetadata XML document, the form
 * the Member Node expects in the "sysmeta" part of create and update requests.
 */
public class SystemMetadataXml {

    public static final String DATAONE_TYPES_V2 = "http://ns.dataone.org/service/types/v2.0";

    public static byte[] toXml(final SystemMetadata sysmeta) throws IOException {
        try {
            Document doc = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
            Element root = doc.createElementNS(DATAONE_TYPES_V2, "d1:systemMetadata");
            doc.appendChild(root);

            appendText(doc, root, "serialVersion", "1");
            appendText(doc, root, "identifier", sysmeta.getIdentifier());
            appendText(doc, root, "formatId", sysmeta.getFormatId());
            appendText(doc, root, "size", String.valueOf(sysmeta.getSize()));
            appendText(doc, root, "checksum", sysmeta.getChecksum()).setAttribute("algorithm", sysmeta.getChecksumAlgorithm());
            appendText(doc, root, "submitter", sysmeta.getSubmitter());
            appendText(doc, root, "rightsHolder", sysmeta.getRightsHolder());

            if (!sysmeta.getAccessPolicy().isEmpty()) {
                Element accessPolicy = doc.createElement("accessPolicy");
                root.appendChild(accessPolicy);
                for (AccessRule rule : sysmeta.getAccessPolicy()) {
                    Element allow = doc.createElement("allow");
                    accessPolicy.appendChild(allow);
                    appendText(doc, allow, "subject", rule.getSubject());
                    appendText(doc, allow, "permission", rule.getPermission());
                }
            }

            if (sysmeta.getReplicationPolicy() != null) {
                Element replicationPolicy = doc.createElement("replicationPolicy");
                replicationPolicy.setAttribute("replicationAllowed", String.valueOf(sysmeta.getReplicationPolicy().isReplicationAllowed()));
                replicationPolicy.setAttribute("numberReplicas", String.valueOf(sysmeta.getReplicationPolicy().getNumberReplicas()));
                root.appendChild(replicationPolicy);
            }

            if (sysmeta.getFileName() != null) {
                appendText(doc, root, "fileName", sysmeta.getFileName());
            }

            Transformer t = TransformerFactory.newInstance().newTransformer();
            t.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            t.setOutputProperty(OutputKeys.INDENT, "yes");
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            t.transform(new DOMSource(doc), new StreamResult(baos));
            return baos.toByteArray();
        } catch (ParserConfigurationException e) {
            throw new IOException("Unable to build system metadata for " + sysmeta.getIdentifier(), e);
        } catch (TransformerException e) {
            throw new IOException("Unable to serialize system metadata for " + sysmeta.getIdentifier(), e);
        }
    }

    private static Element appendText(Document doc, Element parent, String name, String value) {
        Element e = doc.createElement(name);
        e.setTextContent(value);
        parent.appendChild(e);
        return e;
    }
}
