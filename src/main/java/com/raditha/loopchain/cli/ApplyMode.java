package com.raditha.loopchain.cli;

/**
 * What the CLI does with a converted loop.
 */
public enum ApplyMode {
    /**
     * Preview the conversion as a unified diff. The file is not touched.
     */
    DRY_RUN,

    /**
     * Write the converted source back to the file.
     */
    APPLY;

    /**
     * Convert a string value to ApplyMode enum.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding ApplyMode
     * @throws IllegalArgumentException if the value is not a valid mode
     */
    public static ApplyMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("ApplyMode value cannot be null");
        }

        return switch (value.toLowerCase()) {
            case "dry-run" -> DRY_RUN;
            case "apply" -> APPLY;
            default -> throw new IllegalArgumentException(
                    "Invalid mode: " + value + ". Must be: dry-run or apply");
        };
    }

    /**
     * Get the string representation of this mode for CLI usage.
     *
     * @return lowercase string representation
     */
    public String toCliString() {
        return switch (this) {
            case DRY_RUN -> "dry-run";
            case APPLY -> "apply";
        };
    }
}
