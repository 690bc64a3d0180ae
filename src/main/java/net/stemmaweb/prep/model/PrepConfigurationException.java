package net.stemmaweb.prep.model;

/**
 * Raised for a setting or a command-line witness selection that cannot be honored.
 * Nothing is written when it occurs.
 */
public class PrepConfigurationException extends Exception {
    public PrepConfigurationException(String message) {
        super(message);
    }
}
