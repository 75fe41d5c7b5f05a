// file: engine/src/main/java/io/docsync/engine/config/ConfigException.java
package io.docsync.engine.config;

/**
 * Invalid configuration or an unusable directory layout. Fatal at startup.
 */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
