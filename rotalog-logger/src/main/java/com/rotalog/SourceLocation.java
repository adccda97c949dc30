package com.rotalog;

/**
 * Source file and line of the call that produced a log entry.
 *
 * @param fileName file name without directory, e.g. {@code Main.java}
 * @param line     line number, or a negative value if unknown
 */
public record SourceLocation(String fileName, int line) {

    public static final SourceLocation UNKNOWN = new SourceLocation("unknown", -1);

    /**
     * @return the file name without its extension, e.g. {@code Main}
     */
    public String stem() {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
