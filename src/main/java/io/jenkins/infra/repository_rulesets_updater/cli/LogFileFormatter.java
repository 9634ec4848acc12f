package io.jenkins.infra.repository_rulesets_updater.cli;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * One line per record: {@code 2024-03-01 10:00:00,123 INFO    message}, level names as accepted by {@code --log-level}.
 */
public class LogFileFormatter extends Formatter {

    @Override
    public String format(LogRecord logRecord) {
        StringBuilder sb = new StringBuilder(String.format(
                Locale.ROOT,
                "%1$tF %1$tT,%1$tL %2$-7s %3$s%n",
                ZonedDateTime.ofInstant(logRecord.getInstant(), ZoneId.systemDefault()),
                levelName(logRecord.getLevel()),
                formatMessage(logRecord)));
        if (logRecord.getThrown() != null) {
            StringWriter sw = new StringWriter();
            try (PrintWriter pw = new PrintWriter(sw)) {
                logRecord.getThrown().printStackTrace(pw);
            }
            sb.append(sw);
        }
        return sb.toString();
    }

    static String levelName(Level level) {
        if (level.intValue() >= Level.SEVERE.intValue()) {
            return "ERROR";
        }
        if (level.intValue() >= Level.WARNING.intValue()) {
            return "WARNING";
        }
        if (level.intValue() >= Level.INFO.intValue()) {
            return "INFO";
        }
        return "DEBUG";
    }
}
