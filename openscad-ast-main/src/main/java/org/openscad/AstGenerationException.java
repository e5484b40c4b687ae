package org.openscad;

public class AstGenerationException extends OpenScadException {

    private final String nodeType;

    public AstGenerationException(String message, String nodeType) {
        super(message);
        this.nodeType = nodeType;
    }

    public AstGenerationException(String message, String nodeType, Throwable cause) {
        super(message, cause);
        this.nodeType = nodeType;
    }

    /**
     * CST type of the node generation failed on, or {@code null} when there was no tree at all.
     */
    public String getNodeType() {
        return nodeType;
    }
}
