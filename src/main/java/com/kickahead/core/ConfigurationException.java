package com.kickahead.core;

/**
 * Exception thrown when the dispatcher is missing configuration it needs to run a tick.
 *
 * <p>Raised before the repository is touched, so a misconfigured host never consumes
 * or modifies pending jobs. Typical causes:</p>
 * <ul>
 *   <li>No tick interval configured, or a zero/negative one</li>
 *   <li>No clock configured</li>
 *   <li>No repository configured</li>
 *   <li>A configuration file that cannot be read</li>
 * </ul>
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
