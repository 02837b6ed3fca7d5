package net.sculp.util.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class DynamicConfigurationTest {

    @Test
    public void overridesTakePrecedence() {
        DynamicConfiguration config = new DynamicConfiguration();
        config.addSource(new Configuration() {
            public String get(String key) {
                return key.equals("a") ? "source" : null;
            }
        });
        assertEquals("source", config.get("a"));
        assertNull(config.get("b"));
        config.put("a", "override");
        assertEquals("override", config.get("a"));
        config.remove("a");
        assertEquals("source", config.get("a"));
    }

    @Test
    public void systemProperties() {
        String key = "sculp.test." + System.nanoTime();
        System.setProperty(key, "value");
        try {
            assertEquals("value", DynamicConfiguration.makeDefault()
                         .get(key));
            assertNull(new DynamicConfiguration().get(key));
        } finally {
            System.clearProperty(key);
        }
    }

}
