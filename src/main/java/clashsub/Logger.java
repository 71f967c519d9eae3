package clashsub;

import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Console logging for the conversion server, optionally mirrored to a file.
 * The conversion engine itself never logs; only the server around it does.
 */
public final class Logger {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private enum LogLevel {
        DEBUG("[DEBUG]", System.out),
        INFO("[INFO]", System.out),
        WARNING("[WARNING]", System.err),
        ERROR("[ERROR]", System.err);

        private final String prefix;
        private final PrintStream stream;

        LogLevel(String prefix, PrintStream stream) {
            this.prefix = prefix;
            this.stream = stream;
        }
    }

    /**
     * Private constructor to prevent instantiation of the class.
     */
    private Logger() {
    }

    /**
     * Logs a debug message when request debugging is enabled.
     *
     * @param message The message to be logged.
     */
    public static void debug(String message) {
        if (Constants.DEBUG_REQUEST) {
            log(LogLevel.DEBUG, message, null);
        }
    }

    /**
     * Logs an informational message.
     *
     * @param message The message to be logged.
     */
    public static void info(String message) {
        log(LogLevel.INFO, message, null);
    }

    public static void warning(String message) {
        log(LogLevel.WARNING, message, null);
    }

    /**
     * Logs a warning together with the message of its cause.
     *
     * @param message The message to be logged.
     * @param e The exception behind the warning.
     */
    public static void warning(String message, Throwable e) {
        log(LogLevel.WARNING, message, e);
    }

    public static void error(String message) {
        log(LogLevel.ERROR, message, null);
    }

    /**
     * Logs an error together with the message of its cause.
     *
     * @param message The message to be logged.
     * @param e The exception behind the error.
     */
    public static void error(String message, Throwable e) {
        log(LogLevel.ERROR, message, e);
    }

    private static void log(LogLevel level, String message, Throwable cause) {
        String logEntry = level.prefix + " " + message;
        if (cause != null) {
            logEntry += ": " + cause.getMessage();
        }

        level.stream.println(logEntry);
        writeToFile(logEntry);
    }

    private static void writeToFile(String logEntry) {
        if (!Constants.DEBUG_LOG_TO_FILE) {
            return;
        }

        try (FileWriter fileWriter = new FileWriter(Constants.LOG_FILE, true);
             PrintWriter printWriter = new PrintWriter(fileWriter)) {

            printWriter.println(LocalDateTime.now().format(TIMESTAMP_FORMAT) + " " + logEntry);

        } catch (IOException e) {
            // Logger.error here would recurse
            System.err.println("[ERROR] Failed to write to log file: " + e.getMessage());
        }
    }
}
