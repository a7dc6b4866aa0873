package edu.virginia.lib.dataone.inventory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class InMemoryInventoryTest {

    private InventoryRecord metadata;

    private InventoryRecord data;

    private InventoryRecord child;

    private InMemoryInventory inventory;

    @BeforeEach
    public void setUp() {
        metadata = new InventoryRecord("p1/eml.xml", "eml.xml");
        metadata.setPackageId("p1");
        metadata.setMetadata(true);
        metadata.setPid("doi:m");
        data = new InventoryRecord("p1/a.csv", "a.csv");
        data.setPackageId("p1");
        child = new InventoryRecord("p2/eml.xml", "eml.xml");
        child.setPackageId("p2");
        child.setParentPackage("p1");
        child.setMetadata(true);
        inventory = new InMemoryInventory(Arrays.asList(metadata, data, child));
    }

    @Test
    public void queries() {
        assertThat(inventory.getPackageIds()).containsExactly("p1", "p2");
        assertThat(inventory.getPackageRecords("p1")).containsExactly(metadata, data);
        assertThat(inventory.getChildPackageRecords("p1")).containsExactly(child);
        assertThat(inventory.getChildPackageRecords("p2")).isEmpty();
        assertThat(inventory.getRecord("missing")).isNull();
    }

    @Test
    public void readsReturnCopies() {
        inventory.getRecord("p1/a.csv").setCreated(true);
        inventory.getPackageRecords("p1").get(1).setPid("urn:uuid:x");

        assertThat(inventory.getRecord("p1/a.csv")).isEqualTo(data);
    }

    @Test
    public void saveMergesRecords() {
        InventoryRecord update = inventory.getRecord("p1/a.csv");
        update.setPid("urn:uuid:1");
        update.setCreated(true);

        inventory.save(Collections.singletonList(update));

        assertThat(inventory.getRecord("p1/a.csv").isComplete()).isTrue();
    }

    @Test
    public void createdIsNeverReset() {
        InventoryRecord update = inventory.getRecord("p1/eml.xml");
        update.setCreated(true);
        inventory.save(Collections.singletonList(update));
        update.setCreated(false);
        update.setResmapCreated(true);

        inventory.save(Collections.singletonList(update));

        InventoryRecord saved = inventory.getRecord("p1/eml.xml");
        assertThat(saved.isCreated()).isTrue();
        assertThat(saved.isResmapCreated()).isTrue();
    }

    @Test
    public void identifierChangesRequireSupersede() {
        InventoryRecord changed = inventory.getRecord("p1/eml.xml");
        changed.setPid("doi:other");
        InventoryRecord otherwiseFine = inventory.getRecord("p1/a.csv");
        otherwiseFine.setCreated(true);

        assertThatThrownBy(() -> inventory.save(Arrays.asList(otherwiseFine, changed)))
                .isInstanceOf(InventoryValidationException.class);
        // nothing from a rejected save is applied
        assertThat(inventory.getRecord("p1/a.csv").isCreated()).isFalse();

        InventoryRecord superseded = inventory.getRecord("p1/eml.xml");
        superseded.supersede("doi:m2");
        inventory.save(Collections.singletonList(superseded));
        assertThat(inventory.getRecord("p1/eml.xml").getPid()).isEqualTo("doi:m2");
        assertThat(inventory.getRecord("p1/eml.xml").getPidOld()).isEqualTo("doi:m");
    }

    @Test
    public void unknownAndDuplicateFilesAreRejected() {
        assertThatThrownBy(() -> inventory.save(Collections.singletonList(new InventoryRecord("other.csv", "other.csv"))))
                .isInstanceOf(InventoryValidationException.class);
        assertThatThrownBy(() -> new InMemoryInventory(Arrays.asList(data, data.copy())))
                .isInstanceOf(InventoryValidationException.class);
    }
}
