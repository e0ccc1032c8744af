package net.grammarc.util.config;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Properties;
import org.junit.jupiter.api.Test;

public class DynamicConfigurationTest {

    private static PropertiesConfiguration props(String... pairs) {
        Properties p = new Properties();
        for (int i = 0; i < pairs.length; i += 2)
            p.setProperty(pairs[i], pairs[i + 1]);
        return new PropertiesConfiguration(p);
    }

    @Test
    public void earlierSourcesWin() {
        DynamicConfiguration config = new DynamicConfiguration();
        config.addSource(props("a", "1"));
        config.addSource(props("a", "2", "b", "3"));
        assertEquals("1", config.get("a"));
        assertEquals("3", config.get("b"));
        assertNull(config.get("c"));
    }

    @Test
    public void explicitValuesOverrideSources() {
        DynamicConfiguration config = new DynamicConfiguration();
        config.addSource(props("a", "1"));
        config.put("a", "x");
        assertEquals("x", config.get("a"));
        config.remove("a");
        assertEquals("1", config.get("a"));
    }

    @Test
    public void parsesTypedValues() {
        DynamicConfiguration config = new DynamicConfiguration();
        config.put("on", " Yes ");
        config.put("off", "0");
        config.put("junk", "maybe");
        config.put("n", "42");
        config.put("bad", "4x2");
        assertTrue(config.getBoolean("on", false));
        assertFalse(config.getBoolean("off", true));
        assertTrue(config.getBoolean("junk", true));
        assertFalse(config.getBoolean("missing", false));
        assertEquals(42, config.getInt("n", 0));
        assertEquals(7, config.getInt("bad", 7));
        assertEquals(-1, config.getInt("missing", -1));
    }

    @Test
    public void wrapKeepsDynamicInstances() {
        DynamicConfiguration config = new DynamicConfiguration();
        assertSame(config, DynamicConfiguration.wrap(config));
        DynamicConfiguration wrapped = DynamicConfiguration.wrap(
            props("k", "v"));
        assertEquals("v", wrapped.get("k"));
    }

    @Test
    public void loadsResources() {
        PropertiesConfiguration res =
            PropertiesConfiguration.fromResource("test-config.properties");
        assertNotNull(res);
        DynamicConfiguration config = DynamicConfiguration.wrap(res);
        assertTrue(config.getBoolean("grammarc.analysis.parallel", false));
        assertEquals(64, config.getInt("grammarc.lexer.maxStates", 0));
        assertEquals("program", config.get("grammarc.analysis.entryRule"));
        assertNull(PropertiesConfiguration.fromResource("no-such.properties"));
    }

    @Test
    public void defaultsComeFromBundledResource() {
        DynamicConfiguration config = DynamicConfiguration.makeDefault();
        assertEquals("WARNING", config.get("grammarc.log.level"));
    }

}
