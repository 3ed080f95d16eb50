package com.homelab.ops.disk;

/**
 * A failure the tool reports back as text: bad input, or a backend the report cannot do without.
 */
public class ToolFailureException extends RuntimeException {

    public enum Category {
        USER_INPUT,
        BACKEND
    }

    private final Category category;

    public ToolFailureException(Category category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public static ToolFailureException userInput(String message) {
        return new ToolFailureException(Category.USER_INPUT, message, null);
    }

    public static ToolFailureException backend(String message, Throwable cause) {
        return new ToolFailureException(Category.BACKEND, message, cause);
    }

    public Category getCategory() {
        return category;
    }
}
