package net.grammarc.util;

import static org.junit.jupiter.api.Assertions.*;

import java.util.logging.Level;
import java.util.logging.Logger;
import net.grammarc.analysis.GrammarAnalyzer;
import net.grammarc.util.config.DynamicConfiguration;
import org.junit.jupiter.api.Test;

public class LoggingTest {

    @Test
    public void parsesLevels() {
        assertEquals(Level.FINE, Logging.parseLevel(" fine ", Level.INFO));
        assertEquals(Level.INFO, Logging.parseLevel(null, Level.INFO));
        assertEquals(Level.INFO, Logging.parseLevel("", Level.INFO));
        assertEquals(Level.SEVERE, Logging.parseLevel("LOUD", Level.SEVERE));
    }

    @Test
    public void analyzerAppliesConfiguredLevel() {
        Logger root = Logger.getLogger("");
        Level saved = root.getLevel();
        try {
            DynamicConfiguration config = new DynamicConfiguration();
            config.put(Logging.LEVEL_KEY, "finer");
            assertEquals(Level.FINER,
                         new GrammarAnalyzer(config).initLogging());
            assertEquals(Level.FINER, root.getLevel());
            assertEquals(Level.WARNING, Logging.applyLevel(
                new DynamicConfiguration()));
        } finally {
            root.setLevel(saved);
        }
    }

}
