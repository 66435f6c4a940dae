package org.gts3.atlantis.distance;

/**
 * An external tool the pipeline depends on is not installed. Retrying cannot help.
 */
public class ToolNotFoundException extends IllegalStateException {
    public ToolNotFoundException(String message) {
        super(message);
    }
}
