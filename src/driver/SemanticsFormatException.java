package driver;

/**
 * 语义文件格式错误
 *
 * Raised while reading a semantics file; carries the line the bad block or
 * header starts on.
 */
public class SemanticsFormatException extends Exception {
    private final int lineNumber;

    public SemanticsFormatException(String message) {
        super(message);
        this.lineNumber = -1;
    }

    public SemanticsFormatException(String message, int lineNumber, String line) {
        super(formatMessage(message, lineNumber, line));
        this.lineNumber = lineNumber;
    }

    public SemanticsFormatException(String message, int lineNumber, String line, Throwable cause) {
        super(formatMessage(message, lineNumber, line), cause);
        this.lineNumber = lineNumber;
    }

    /**
     * 获取出错的行号, -1 if unknown
     */
    public int getLineNumber() {
        return lineNumber;
    }

    private static String formatMessage(String message, int lineNumber, String line) {
        StringBuilder sb = new StringBuilder(message);
        if (lineNumber >= 0) {
            sb.append(" (line ").append(lineNumber).append(")");
        }
        if (line != null && !line.isEmpty()) {
            sb.append("\n  -> ").append(line.trim());
        }
        return sb.toString();
    }

    public static SemanticsFormatException badHeader(String message, int lineNumber, String line) {
        return new SemanticsFormatException("Bad intrinsic header: " + message, lineNumber, line);
    }

    public static SemanticsFormatException badFormula(String message, int lineNumber, String line) {
        return new SemanticsFormatException("Bad formula: " + message, lineNumber, line);
    }

    public static SemanticsFormatException strayText(int lineNumber, String line) {
        return new SemanticsFormatException("Text outside any intrinsic block", lineNumber, line);
    }
}
