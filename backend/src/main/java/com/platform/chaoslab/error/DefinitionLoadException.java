package com.platform.chaoslab.error;

/**
 * Exception for experiment definition files that cannot be read or parsed.
 */
public class DefinitionLoadException extends ChaosLabException {
    
    private final String source;
    
    public DefinitionLoadException(String source, String message, Throwable cause) {
        super(ErrorCode.DEFINITION_LOAD_FAILED,
            String.format("Failed to load experiment definition from %s: %s", source, message),
            cause);
        this.source = source;
    }
    
    public String getSource() {
        return source;
    }
}
