package edu.virginia.lib.dataone.helper;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayInputStream;
import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

public class SystemMetadataXmlTest {

    @Test
    public void writesDataOneSystemMetadata() throws Exception {
        SystemMetadata sysmeta = new SystemMetadata("urn:uuid:1", "text/csv", 42, "abc123", "CN=s", "CN=r",
                "data.csv", new ReplicationPolicy(false, 0))
                .withAccessRules(Arrays.asList(new AccessRule(AccessRule.PUBLIC, AccessRule.READ)));

        Document doc = HttpHelper.parseXml(new ByteArrayInputStream(SystemMetadataXml.toXml(sysmeta)));
        Element root = doc.getDocumentElement();

        assertThat(root.getNamespaceURI()).isEqualTo(SystemMetadataXml.DATAONE_TYPES_V2);
        assertThat(root.getLocalName()).isEqualTo("systemMetadata");
        assertThat(text(root, "identifier")).isEqualTo("urn:uuid:1");
        assertThat(text(root, "size")).isEqualTo("42");
        assertThat(text(root, "fileName")).isEqualTo("data.csv");
        Element checksum = (Element) root.getElementsByTagName("checksum").item(0);
        assertThat(checksum.getAttribute("algorithm")).isEqualTo("SHA256");
        assertThat(text(root, "subject")).isEqualTo("public");
        Element replication = (Element) root.getElementsByTagName("replicationPolicy").item(0);
        assertThat(replication.getAttribute("replicationAllowed")).isEqualTo("false");
    }

    @Test
    public void omitsClearedReplicationPolicy() throws Exception {
        SystemMetadata sysmeta = new SystemMetadata("urn:uuid:1", "text/csv", 42, "abc123", "CN=s", "CN=r",
                "data.csv", new ReplicationPolicy(true, 3)).withoutReplicationPolicy();

        Document doc = HttpHelper.parseXml(new ByteArrayInputStream(SystemMetadataXml.toXml(sysmeta)));

        assertThat(doc.getElementsByTagName("replicationPolicy").getLength()).isZero();
        assertThat(doc.getElementsByTagName("accessPolicy").getLength()).isZero();
    }

    private static String text(Element root, String name) {
        return root.getElementsByTagName(name).item(0).getTextContent().trim();
    }
}
