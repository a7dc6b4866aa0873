package edu.virginia.lib.dataone.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.File;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import edu.virginia.lib.dataone.RdfConstants;
import edu.virginia.lib.dataone.helper.ConfiguredAccessPolicy;
import edu.virginia.lib.dataone.helper.Environment;
import edu.virginia.lib.dataone.helper.Sha256Hasher;
import edu.virginia.lib.dataone.helper.SystemMetadata;
import edu.virginia.lib.dataone.inventory.InMemoryInventory;
import edu.virginia.lib.dataone.inventory.InventoryRecord;
import edu.virginia.lib.dataone.inventory.InventoryValidationException;
import edu.virginia.lib.dataone.resourcemap.ResourceMap;
import edu.virginia.lib.dataone.resourcemap.ResourceMapBuilder;
import edu.virginia.lib.dataone.resourcemap.ResourceMapSerializer;

@ExtendWith(MockitoExtension.class)
public class PackageIngestTest {

    @TempDir
    File root;

    @Mock
    ResourceMapSerializer serializer;

    private PackageFixture fixture;

    private RecordingRepositoryClient client;

    @BeforeEach
    public void setUp() {
        fixture = new PackageFixture(root);
        client = new RecordingRepositoryClient();
    }

    private PackageIngest ingest(Environment env) {
        return new PackageIngest(env, client);
    }

    private PackageIngest ingestWithSerializer(Environment env) {
        return new PackageIngest(env, client, new IdentifierResolver(client),
                new SystemMetadataFactory(env, new Sha256Hasher(), new ConfiguredAccessPolicy(env)),
                new ObjectUploader(client), new ResourceMapBuilder(), serializer);
    }

    @Test
    public void insertsMetadataDataAndResourceMap() throws Exception {
        fixture.metadata("p1", null);
        fixture.data("p1", "one.csv");
        fixture.data("p1", "two.csv");
        InMemoryInventory inventory = fixture.inventory();

        IngestResult result = ingest(fixture.environment()).insertPackage(inventory, "p1");

        assertThat(result.getState()).isEqualTo(PackageState.RESOURCE_MAP_UPLOADED);
        assertThat(result.isComplete()).isTrue();
        InventoryRecord metadata = PackageFixture.find(result.getRecords(), "p1/metadata.xml");
        assertThat(metadata.getPid()).isEqualTo("doi:10.5065/TEST1");
        for (InventoryRecord r : result.getRecords()) {
            assertThat(r.isCreated()).isTrue();
            assertThat(r.isResmapCreated()).isTrue();
            if (!r.isMetadata()) {
                assertThat(r.getPid()).startsWith(IdentifierResolver.UUID_PREFIX);
            }
        }
        assertThat(client.calls).hasSize(5);
        assertThat(client.calls.get(0)).isEqualTo("mint DOI");
        assertThat(client.calls.get(1)).isEqualTo("create doi:10.5065/TEST1");
        assertThat(client.calls.get(4)).isEqualTo("create resource_map_doi:10.5065/TEST1");

        SystemMetadata resourceMapSysmeta = client.sysmeta.get(3);
        assertThat(resourceMapSysmeta.getFormatId()).isEqualTo(RdfConstants.RESOURCE_MAP_FORMAT_ID);
        assertThat(resourceMapSysmeta.getFileName()).isEqualTo("resource_map_doi_10.5065/TEST1.xml");
        assertThat(resourceMapSysmeta.getChecksumAlgorithm()).isEqualTo(SystemMetadata.SHA256);
        assertThat(resourceMapSysmeta.getReplicationPolicy()).isNull();

        // the inventory itself is untouched until the caller saves
        assertThat(inventory.getRecord("p1/metadata.xml").isCreated()).isFalse();
    }

    @Test
    public void completedPackageMakesNoRemoteCalls() throws Exception {
        InventoryRecord m = fixture.metadata("p1", null);
        InventoryRecord d = fixture.data("p1", "one.csv");
        m.setPid("doi:m");
        d.setPid("urn:uuid:d");
        for (InventoryRecord r : fixture.records) {
            r.setCreated(true);
            r.setResmapCreated(true);
        }
        InMemoryInventory inventory = fixture.inventory();

        IngestResult result = ingest(fixture.environment()).insertPackage(inventory, "p1");

        assertThat(client.calls).isEmpty();
        assertThat(result.getRecords()).containsExactlyElementsOf(inventory.getPackageRecords("p1"));
        assertThat(result.getState()).isEqualTo(PackageState.RESOURCE_MAP_UPLOADED);
    }

    @Test
    public void refusesPackageWithUninsertedChild() throws Exception {
        fixture.metadata("parent", null);
        fixture.data("parent", "one.csv");
        InventoryRecord child = fixture.metadata("child", "parent");
        child.setPid("doi:child");
        InMemoryInventory inventory = fixture.inventory();

        assertThatThrownBy(() -> ingest(fixture.environment()).insertPackage(inventory, "parent"))
                .isInstanceOf(InventoryValidationException.class)
                .hasMessageContaining("child");
        assertThat(client.calls).isEmpty();
    }

    @Test
    public void refusesPackageWithTwoMetadataFiles() throws Exception {
        fixture.metadata("p1", null);
        fixture.data("p1", "one.csv").setMetadata(true);
        InMemoryInventory inventory = fixture.inventory();

        assertThatThrownBy(() -> ingest(fixture.environment()).insertPackage(inventory, "p1"))
                .isInstanceOf(InventoryValidationException.class);
        assertThat(client.calls).isEmpty();
    }

    @Test
    public void refusesUnknownPackage() throws Exception {
        fixture.metadata("p1", null);
        InMemoryInventory inventory = fixture.inventory();

        assertThatThrownBy(() -> ingest(fixture.environment()).insertPackage(inventory, "nope"))
                .isInstanceOf(InventoryValidationException.class);
        assertThatThrownBy(() -> ingest(fixture.environment()).insertPackage(inventory, ""))
                .isInstanceOf(InventoryValidationException.class);
    }

    @Test
    public void metadataFailureStopsBeforeData() throws Exception {
        fixture.metadata("p1", null).setPid("doi:m");
        fixture.data("p1", "one.csv");
        client.failing.add("doi:m");

        IngestResult result = ingest(fixture.environment()).insertPackage(fixture.inventory(), "p1");

        assertThat(client.calls).containsExactly("create doi:m");
        assertThat(result.getState()).isEqualTo(PackageState.METADATA_DESCRIBED);
        for (InventoryRecord r : result.getRecords()) {
            assertThat(r.isCreated()).isFalse();
            assertThat(r.isResmapCreated()).isFalse();
        }
        assertThat(PackageFixture.find(result.getRecords(), "p1/one.csv").getPid()).isNull();
    }

    @Test
    public void dataFailureHaltsTheLoop() throws Exception {
        fixture.metadata("p1", null).setPid("doi:m");
        fixture.data("p1", "one.csv").setPid("urn:uuid:1");
        fixture.data("p1", "two.csv").setPid("urn:uuid:2");
        fixture.data("p1", "three.csv").setPid("urn:uuid:3");
        client.failing.add("urn:uuid:2");

        IngestResult result = ingest(fixture.environment()).insertPackage(fixture.inventory(), "p1");

        assertThat(client.calls).containsExactly("create doi:m", "create urn:uuid:1", "create urn:uuid:2");
        assertThat(result.getState()).isEqualTo(PackageState.DATA_UPLOADING);
        assertThat(PackageFixture.find(result.getRecords(), "p1/metadata.xml").isCreated()).isTrue();
        assertThat(PackageFixture.find(result.getRecords(), "p1/one.csv").isCreated()).isTrue();
        assertThat(PackageFixture.find(result.getRecords(), "p1/two.csv").isCreated()).isFalse();
        assertThat(PackageFixture.find(result.getRecords(), "p1/three.csv").isCreated()).isFalse();
    }

    @Test
    public void rerunResumesWhereThePreviousRunStopped() throws Exception {
        fixture.metadata("p1", null).setPid("doi:m");
        fixture.data("p1", "one.csv").setPid("urn:uuid:1");
        fixture.data("p1", "two.csv").setPid("urn:uuid:2");
        InMemoryInventory inventory = fixture.inventory();
        PackageIngest ingest = ingest(fixture.environment());

        client.failing.add("urn:uuid:2");
        inventory.save(ingest.insertPackage(inventory, "p1").getRecords());
        client.failing.clear();
        IngestResult result = ingest.insertPackage(inventory, "p1");

        assertThat(result.isComplete()).isTrue();
        assertThat(client.calls("create")).containsExactly("create doi:m", "create urn:uuid:1", "create urn:uuid:2",
                "create urn:uuid:2", "create resource_map_doi:m");
    }

    @Test
    public void missingFileLeavesRecordForRetry() throws Exception {
        fixture.metadata("p1", null).setPid("doi:m");
        InventoryRecord missing = new InventoryRecord("p1/missing.csv", "missing.csv");
        missing.setPackageId("p1");
        missing.setFormatId("text/csv");
        fixture.records.add(missing);

        IngestResult result = ingest(fixture.environment()).insertPackage(fixture.inventory(), "p1");

        assertThat(result.getState()).isEqualTo(PackageState.DATA_UPLOADING);
        InventoryRecord r = PackageFixture.find(result.getRecords(), "p1/missing.csv");
        assertThat(r.isCreated()).isFalse();
        assertThat(r.getPid()).startsWith(IdentifierResolver.UUID_PREFIX);
        assertThat(client.calls).containsExactly("create doi:m");
    }

    @Test
    public void expiredTokenLeavesPackageUnchanged() throws Exception {
        fixture.metadata("p1", null);
        fixture.data("p1", "one.csv");
        InMemoryInventory inventory = fixture.inventory();
        client.tokenExpired = true;

        IngestResult result = ingest(fixture.environment()).insertPackage(inventory, "p1");

        assertThat(client.calls).isEmpty();
        assertThat(result.getRecords()).containsExactlyElementsOf(inventory.getPackageRecords("p1"));
        assertThat(result.getState()).isEqualTo(PackageState.NO_METADATA_ID);
    }

    @Test
    public void resourceMapAggregatesChildPackages() throws Exception {
        fixture.metadata("parent", null).setPid("doi:parent");
        fixture.data("parent", "one.csv").setPid("urn:uuid:1");
        InventoryRecord child = fixture.metadata("child", "parent");
        child.setPid("doi:child");
        child.setCreated(true);
        when(serializer.serialize(any(ResourceMap.class))).thenReturn("<rdf:RDF/>".getBytes(StandardCharsets.UTF_8));

        IngestResult result = ingestWithSerializer(fixture.environment()).insertPackage(fixture.inventory(), "parent");

        assertThat(result.isComplete()).isTrue();
        ArgumentCaptor<ResourceMap> captor = ArgumentCaptor.forClass(ResourceMap.class);
        verify(serializer).serialize(captor.capture());
        ResourceMap map = captor.getValue();
        assertThat(map.getIdentifier()).isEqualTo("resource_map_doi:parent");
        assertThat(map.getAggregatedIdentifiers())
                .containsExactly("doi:parent", "urn:uuid:1", "resource_map_doi:child");
        // only the parent's own records are returned
        assertThat(result.getRecords()).hasSize(2);
    }

    @Test
    public void failedResourceMapUploadIsRecorded() throws Exception {
        fixture.metadata("p1", null).setPid("doi:m");
        fixture.data("p1", "one.csv").setPid("urn:uuid:1");
        client.failing.add("resource_map_doi:m");

        IngestResult result = ingest(fixture.environment()).insertPackage(fixture.inventory(), "p1");

        assertThat(result.getState()).isEqualTo(PackageState.RESOURCE_MAP_BUILT);
        for (InventoryRecord r : result.getRecords()) {
            assertThat(r.isCreated()).isTrue();
            assertThat(r.isResmapCreated()).isFalse();
        }
    }

    @Test
    public void insertsSingleFile() throws Exception {
        fixture.metadata("p1", null);
        fixture.data("p1", "one.csv");
        InMemoryInventory inventory = fixture.inventory();
        PackageIngest ingest = ingest(fixture.environment());

        InventoryRecord data = ingest.insertFile(inventory, "p1/one.csv");
        assertThat(data.isCreated()).isTrue();
        assertThat(data.getPid()).startsWith(IdentifierResolver.UUID_PREFIX);

        InventoryRecord metadata = ingest.insertFile(inventory, "p1/metadata.xml");
        assertThat(metadata.getPid()).isEqualTo("doi:10.5065/TEST1");
        assertThat(client.calls("create")).hasSize(2);

        assertThatThrownBy(() -> ingest.insertFile(inventory, "p1/unknown.csv"))
                .isInstanceOf(InventoryValidationException.class);
    }

    @Test
    public void createdFileIsNotInsertedAgain() throws Exception {
        InventoryRecord data = fixture.data("p1", "one.csv");
        data.setPid("urn:uuid:1");
        data.setCreated(true);

        InventoryRecord result = ingest(fixture.environment()).insertFile(fixture.inventory(), "p1/one.csv");

        assertThat(result).isEqualTo(data);
        assertThat(client.calls).isEmpty();
    }
}
