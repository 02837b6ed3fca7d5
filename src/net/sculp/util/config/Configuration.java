package net.sculp.util.config;

/**
 * A source of string-valued settings, such as the location of a custom
 * signature table.
 */
public interface Configuration {

    /**
     * System properties, then environment variables.
     */
    Configuration DEFAULT = DynamicConfiguration.makeDefault();

    /**
     * The value of key, or null if this source does not define it.
     */
    String get(String key);

}
