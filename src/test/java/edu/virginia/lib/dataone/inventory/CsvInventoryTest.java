package edu.virginia.lib.dataone.inventory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.File;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class CsvInventoryTest {

    private static final String HEADER = "file,filename,checksum_sha256,size_bytes,format_id,package,parent_package,"
            + "is_metadata,pid,pid_old,created,resmap_created,ready\n";

    @TempDir
    File dir;

    private File write(String content) throws Exception {
        File f = new File(dir, "inventory.csv");
        FileUtils.writeStringToFile(f, content, StandardCharsets.UTF_8);
        return f;
    }

    @Test
    public void readsTypedRecords() throws Exception {
        File f = write(HEADER
                + "p1/eml.xml,eml.xml,abc,120,eml://ecoinformatics.org/eml-2.1.1,p1,NA,TRUE,doi:10.5065/X,NA,TRUE,FALSE,TRUE\n"
                + "p1/data.csv,data.csv,def,2048,text/csv,p1,,FALSE,NA,NA,FALSE,FALSE,TRUE\n");

        InMemoryInventory inventory = CsvInventory.load(f);

        InventoryRecord metadata = inventory.getRecord("p1/eml.xml");
        assertThat(metadata.isMetadata()).isTrue();
        assertThat(metadata.getPid()).isEqualTo("doi:10.5065/X");
        assertThat(metadata.getParentPackage()).isNull();
        assertThat(metadata.isCreated()).isTrue();
        assertThat(metadata.getSize()).isEqualTo(120);
        InventoryRecord data = inventory.getRecord("p1/data.csv");
        assertThat(data.hasPid()).isFalse();
        assertThat(data.getFormatId()).isEqualTo("text/csv");
        assertThat(data.isUpdated()).isFalse();
        assertThat(inventory.getPackageIds()).containsExactly("p1");
    }

    @Test
    public void writtenInventoryReadsBackTheSame() throws Exception {
        File f = write(HEADER
                + "p1/eml.xml,eml.xml,abc,120,eml://ecoinformatics.org/eml-2.1.1,p1,NA,TRUE,doi:10.5065/X,NA,TRUE,FALSE,TRUE\n"
                + "\"p1/a, b.csv\",\"a, b.csv\",def,2048,text/csv,p1,NA,FALSE,urn:uuid:1,NA,FALSE,FALSE,TRUE\n");
        InMemoryInventory inventory = CsvInventory.load(f);

        CsvInventory.write(inventory, f);

        assertThat(CsvInventory.load(f).getRecords()).isEqualTo(inventory.getRecords());
        assertThat(new File(dir, "inventory.csv.tmp")).doesNotExist();
        assertThat(FileUtils.readFileToString(f, StandardCharsets.UTF_8)).contains(",updated");
    }

    @Test
    public void missingRequiredColumnIsRejected() throws Exception {
        File f = write("file,filename,size_bytes,package,parent_package,pid,created,ready,is_metadata\n"
                + "a.csv,a.csv,1,p1,NA,NA,FALSE,TRUE,FALSE\n");

        assertThatThrownBy(() -> CsvInventory.load(f))
                .isInstanceOf(InventoryValidationException.class)
                .hasMessageContaining("checksum_sha256");
    }

    @Test
    public void invalidValuesAreRejected() throws Exception {
        File badBoolean = write(HEADER + "a.csv,a.csv,abc,1,text/csv,p1,NA,maybe,NA,NA,FALSE,FALSE,TRUE\n");
        assertThatThrownBy(() -> CsvInventory.load(badBoolean)).isInstanceOf(InventoryValidationException.class);

        File badSize = write(HEADER + "a.csv,a.csv,abc,big,text/csv,p1,NA,FALSE,NA,NA,FALSE,FALSE,TRUE\n");
        assertThatThrownBy(() -> CsvInventory.load(badSize)).isInstanceOf(InventoryValidationException.class);

        File empty = write(HEADER);
        assertThatThrownBy(() -> CsvInventory.load(empty)).isInstanceOf(InventoryValidationException.class);
    }
}
