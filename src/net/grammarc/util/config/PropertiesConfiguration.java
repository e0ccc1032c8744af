package net.grammarc.util.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

public class PropertiesConfiguration implements Configuration {

    private final Properties base;

    public PropertiesConfiguration(Properties base) {
        this.base = base;
    }

    public String get(String key) {
        return base.getProperty(key);
    }

    private static Properties load(InputStream in) throws IOException {
        Properties ret = new Properties();
        try {
            ret.load(in);
        } finally {
            in.close();
        }
        return ret;
    }

    /* Returns null if there is no such resource. */
    public static PropertiesConfiguration fromResource(String name) {
        InputStream in = PropertiesConfiguration.class.getClassLoader()
            .getResourceAsStream(name);
        if (in == null) return null;
        try {
            return new PropertiesConfiguration(load(in));
        } catch (IOException exc) {
            throw new UncheckedIOException("Cannot load configuration " +
                "resource " + name, exc);
        }
    }

}
