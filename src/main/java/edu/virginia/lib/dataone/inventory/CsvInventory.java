package edu.virginia.lib.dataone.inventory;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes inventories as CSV files with one row per file.  The shape of the
 * file is validated once, here; the rest of the code works with typed records.
 */
public class CsvInventory {

    final private static Logger LOGGER = LoggerFactory.getLogger(CsvInventory.class);

    public static final String FILE = "file";
    public static final String FILENAME = "filename";
    public static final String CHECKSUM = "checksum_sha256";
    public static final String SIZE = "size_bytes";
    public static final String FORMAT_ID = "format_id";
    public static final String PACKAGE = "package";
    public static final String PARENT_PACKAGE = "parent_package";
    public static final String IS_METADATA = "is_metadata";
    public static final String PID = "pid";
    public static final String PID_OLD = "pid_old";
    public static final String CREATED = "created";
    public static final String RESMAP_CREATED = "resmap_created";
    public static final String READY = "ready";
    public static final String UPDATED = "updated";

    public static final List<String> REQUIRED_COLUMNS = Arrays.asList(FILE, CHECKSUM, SIZE, PACKAGE, PARENT_PACKAGE,
            PID, FILENAME, CREATED, READY, IS_METADATA);

    public static final List<String> COLUMNS = Arrays.asList(FILE, FILENAME, CHECKSUM, SIZE, FORMAT_ID, PACKAGE,
            PARENT_PACKAGE, IS_METADATA, PID, PID_OLD, CREATED, RESMAP_CREATED, READY, UPDATED);

    public static InMemoryInventory load(final File csvFile) throws IOException {
        Reader in = new InputStreamReader(new FileInputStream(csvFile), StandardCharsets.UTF_8);
        try {
            CSVParser parser = CSVFormat.DEFAULT.withFirstRecordAsHeader().parse(in);
            final Map<String, Integer> header = parser.getHeaderMap();
            for (String column : REQUIRED_COLUMNS) {
                if (!header.containsKey(column)) {
                    throw new InventoryValidationException("Inventory " + csvFile.getName() + " is missing the \"" + column + "\" column!");
                }
            }
            List<InventoryRecord> records = new ArrayList<InventoryRecord>();
            for (CSVRecord row : parser) {
                records.add(toRecord(row, header));
            }
            if (records.isEmpty()) {
                throw new InventoryValidationException("Inventory " + csvFile.getName() + " has no rows!");
            }
            LOGGER.info("Loaded " + records.size() + " inventory records from " + csvFile.getPath() + ".");
            return new InMemoryInventory(records);
        } finally {
            in.close();
        }
    }

    /**
     * Writes the inventory to a temporary file beside the target and then moves it into
     * place so an interrupted write never leaves a truncated inventory behind.
     */
    public static void write(final Inventory inventory, final File csvFile) throws IOException {
        final File temp = new File(csvFile.getAbsoluteFile().getParentFile(), csvFile.getName() + ".tmp");
        Writer out = new OutputStreamWriter(new FileOutputStream(temp), StandardCharsets.UTF_8);
        try {
            CSVPrinter printer = new CSVPrinter(out, CSVFormat.DEFAULT.withHeader(COLUMNS.toArray(new String[0])));
            for (InventoryRecord r : inventory.getRecords()) {
                printer.printRecord(r.getFile(), r.getFilename(), na(r.getChecksum()), r.getSize(), na(r.getFormatId()),
                        na(r.getPackageId()), na(r.getParentPackage()), bool(r.isMetadata()), na(r.getPid()),
                        na(r.getPidOld()), bool(r.isCreated()), bool(r.isResmapCreated()), bool(r.isReady()),
                        bool(r.isUpdated()));
            }
            printer.flush();
        } finally {
            out.close();
        }
        if (csvFile.exists()) {
            FileUtils.forceDelete(csvFile);
        }
        FileUtils.moveFile(temp, csvFile);
    }

    private static InventoryRecord toRecord(CSVRecord row, Map<String, Integer> header) {
        final String file = string(row, header, FILE);
        if (file == null) {
            throw new InventoryValidationException("Row " + row.getRecordNumber() + " has no file!");
        }
        InventoryRecord r = new InventoryRecord(file, string(row, header, FILENAME));
        r.setChecksum(string(row, header, CHECKSUM));
        final String size = string(row, header, SIZE);
        try {
            r.setSize(size == null ? 0 : Long.parseLong(size));
        } catch (NumberFormatException ex) {
            throw new InventoryValidationException("Invalid size \"" + size + "\" for " + file + "!", ex);
        }
        r.setFormatId(string(row, header, FORMAT_ID));
        r.setPackageId(string(row, header, PACKAGE));
        r.setParentPackage(string(row, header, PARENT_PACKAGE));
        r.setMetadata(bool(row, header, IS_METADATA));
        r.setPid(string(row, header, PID));
        r.setPidOld(string(row, header, PID_OLD));
        r.setCreated(bool(row, header, CREATED));
        r.setResmapCreated(bool(row, header, RESMAP_CREATED));
        r.setReady(bool(row, header, READY));
        r.setUpdated(bool(row, header, UPDATED));
        return r;
    }

    /**
     * Empty cells and "NA" (as written by R) are treated as null.
     */
    private static String string(CSVRecord row, Map<String, Integer> header, String column) {
        if (!header.containsKey(column) || !row.isSet(column)) {
            return null;
        }
        final String value = row.get(column).trim();
        if (value.length() == 0 || value.equals("NA")) {
            return null;
        }
        return value;
    }

    private static boolean bool(CSVRecord row, Map<String, Integer> header, String column) {
        final String value = string(row, header, column);
        if (value == null) {
            return false;
        }
        if (value.equalsIgnoreCase("true") || value.equals("1")) {
            return true;
        } else if (value.equalsIgnoreCase("false") || value.equals("0")) {
            return false;
        }
        throw new InventoryValidationException("Invalid boolean \"" + value + "\" in column " + column
                + " of row " + row.getRecordNumber() + "!");
    }

    private static String na(String value) {
        return value == null ? "NA" : value;
    }

    private static String bool(boolean value) {
        return value ? "TRUE" : "FALSE";
    }
}
