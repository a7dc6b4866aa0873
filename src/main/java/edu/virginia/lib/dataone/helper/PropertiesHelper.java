package edu.virginia.lib.dataone.helper;

import java.io.FileInputStream;
import java.io.IOException;
import java.util.Properties;

public class PropertiesHelper {

    public static String getRequiredProperty(Properties p, String name) {
        if (p.containsKey(name) && p.getProperty(name).trim().length() > 0) {
            return p.getProperty(name).trim();
        } else {
            throw new RuntimeException("Required property \"" + name + "\" not found!");
        }
    }

    public static String getOptionalProperty(Properties p, String name) {
        if (p.containsKey(name)) {
            return p.getProperty(name).trim();
        } else {
            return null;
        }
    }

    public static String getOptionalProperty(Properties p, String name, String defaultValue) {
        final String value = getOptionalProperty(p, name);
        return value == null || value.length() == 0 ? defaultValue : value;
    }

    public static Properties getProperties(String filename) throws IOException {
        Properties p = new Properties();
        FileInputStream fis = new FileInputStream(filename);
        try {
            p.load(fis);
            return p;
        } finally {
            fis.close();
        }
    }
}
