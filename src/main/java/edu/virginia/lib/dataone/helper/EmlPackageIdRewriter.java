package edu.virginia.lib.dataone.helper;

import java.io.File;
import java.io.IOException;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;

/**
 * Sets the "packageId" attribute on the root element of an EML document.
 */
public class EmlPackageIdRewriter implements MetadataRewriter {

    final private static Logger LOGGER = LoggerFactory.getLogger(EmlPackageIdRewriter.class);

    @Override
    public File rewrite(File source, String newIdentifier) throws IOException {
        File target = File.createTempFile("metadata-", ".xml");
        try {
            DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
            f.setNamespaceAware(true);
            Document doc = f.newDocumentBuilder().parse(source);
            final String previous = doc.getDocumentElement().getAttribute("packageId");
            doc.getDocumentElement().setAttribute("packageId", newIdentifier);
            LOGGER.debug("Replaced packageId \"" + previous + "\" with \"" + newIdentifier + "\" in " + source.getName() + ".");

            Transformer t = TransformerFactory.newInstance().newTransformer();
            t.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            t.transform(new DOMSource(doc), new StreamResult(target));
            return target;
        } catch (ParserConfigurationException e) {
            target.delete();
            throw new IOException(e);
        } catch (SAXException e) {
            target.delete();
            throw new IOException("Unable to parse " + source.getPath(), e);
        } catch (TransformerException e) {
            target.delete();
            throw new IOException("Unable to write " + target.getPath(), e);
        }
    }
}
