package util.logging;

import driver.LifterDriver;

import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Implementation of the Logger interface
 */
public class SimpleLogger implements Logger {
    private final String name;
    // null: follow the root level, which may change after the logger was handed out
    private final LogLevel level;
    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{}");

    public SimpleLogger(String name, LogLevel level) {
        this.name = name;
        this.level = level;
    }

    @Override
    public void trace(String message) {
        log(LogLevel.TRACE, message);
    }

    @Override
    public void debug(String message) {
        log(LogLevel.DEBUG, message);
    }

    @Override
    public void info(String message) {
        log(LogLevel.INFO, message);
    }

    @Override
    public void warn(String message) {
        log(LogLevel.WARN, message);
    }

    @Override
    public void error(String message) {
        log(LogLevel.ERROR, message);
    }

    @Override
    public void trace(String format, Object... args) {
        if (isEnabled(LogLevel.TRACE)) {
            log(LogLevel.TRACE, formatMessage(format, args));
        }
    }

    @Override
    public void debug(String format, Object... args) {
        if (isEnabled(LogLevel.DEBUG)) {
            log(LogLevel.DEBUG, formatMessage(format, args));
        }
    }

    @Override
    public void info(String format, Object... args) {
        if (isEnabled(LogLevel.INFO)) {
            log(LogLevel.INFO, formatMessage(format, args));
        }
    }

    @Override
    public void warn(String format, Object... args) {
        if (isEnabled(LogLevel.WARN)) {
            log(LogLevel.WARN, formatMessage(format, args));
        }
    }

    @Override
    public void error(String format, Object... args) {
        if (isEnabled(LogLevel.ERROR)) {
            log(LogLevel.ERROR, formatMessage(format, args));
        }
    }

    @Override
    public void error(String message, Throwable cause) {
        if (isEnabled(LogLevel.ERROR)) {
            log(LogLevel.ERROR, message + ": " + cause.getClass().getSimpleName()
                    + ": " + cause.getMessage());
        }
    }

    @Override
    public boolean isEnabled(LogLevel query) {
        return !query.isLessSpecificThan(effectiveLevel());
    }

    private LogLevel effectiveLevel() {
        return level != null ? level : LogManager.getRootLevel();
    }

    private void log(LogLevel level, String message) {
        if (!isEnabled(level)) {
            return;
        }

        // Get caller information
        StackTraceElement caller = getCaller();
        String methodInfo = "";

        if (caller != null) {
            methodInfo = String.format("[%s:%d] ", caller.getMethodName(), caller.getLineNumber());
        }

        LifterDriver driver = LifterDriver.getInstance();
        String current = driver != null ? driver.getCurrentInstruction() : null;
        String timestamp = new SimpleDateFormat("yyyy-MM-dd HH:mm:ss,SSS").format(new Date());
        String logMessage = String.format("%s %s [%s] %s - %s%s",
                current != null ? current : "-",
                timestamp,
                level,
                name,
                methodInfo,
                message);

        LogManager.writeLog(level, logMessage);
    }

    /**
     * Gets the calling class/method from the stack trace
     */
    private StackTraceElement getCaller() {
        StackTraceElement[] stackTrace = Thread.currentThread().getStackTrace();

        String loggerClassName = SimpleLogger.class.getName();
        boolean foundLogger = false;

        for (StackTraceElement element : stackTrace) {
            if (foundLogger && !element.getClassName().equals(loggerClassName)
                    && !element.getClassName().equals(LogManager.class.getName())) {
                return element;
            }

            if (element.getClassName().equals(loggerClassName)) {
                foundLogger = true;
            }
        }

        return null;
    }

    private String formatMessage(String format, Object... args) {
        if (args == null || args.length == 0) {
            return format;
        }

        StringBuilder result = new StringBuilder();
        int argIndex = 0;
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(format);

        while (matcher.find()) {
            if (argIndex < args.length) {
                matcher.appendReplacement(result, Matcher.quoteReplacement(String.valueOf(args[argIndex++])));
            } else {
                matcher.appendReplacement(result, "{}");
            }
        }
        matcher.appendTail(result);

        return result.toString();
    }
}
