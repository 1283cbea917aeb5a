package tsforecast.analysis;

import org.slf4j.Logger;
import org.slf4j.event.Level;
import org.slf4j.helpers.MessageFormatter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Progress lines of one analysis run. Each line goes to the SLF4J logger and is kept,
 * in order, so it can travel with the result.
 */
public final class RunLog {

    /** One recorded progress line. */
    public static final class Entry {
        private final Instant time;
        private final Level level;
        private final String message;

        Entry(Instant time, Level level, String message) {
            this.time = time;
            this.level = level;
            this.message = message;
        }

        public Instant getTime() { return time; }
        public Level getLevel() { return level; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return time + " " + level + " " + message;
        }
    }

    private final Logger log;
    private final List<Entry> entries = new ArrayList<>();

    RunLog(Logger log) {
        this.log = log;
    }

    void info(String format, Object... args) {
        String message = MessageFormatter.arrayFormat(format, args).getMessage();
        log.info(message);
        entries.add(new Entry(Instant.now(), Level.INFO, message));
    }

    void warn(String format, Object... args) {
        String message = MessageFormatter.arrayFormat(format, args).getMessage();
        log.warn(message);
        entries.add(new Entry(Instant.now(), Level.WARN, message));
    }

    List<Entry> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }
}
