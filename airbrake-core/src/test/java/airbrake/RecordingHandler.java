package airbrake;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Captures records published to a logger for assertions.
 */
public class RecordingHandler extends Handler {
    private final List<LogRecord> records = new CopyOnWriteArrayList<>();

    public static Logger newLogger(RecordingHandler handler) {
        Logger logger = Logger.getAnonymousLogger();
        logger.setUseParentHandlers(false);
        logger.setLevel(Level.ALL);
        logger.addHandler(handler);
        return logger;
    }

    @Override
    public void publish(LogRecord record) {
        records.add(record);
    }

    @Override
    public void flush() {
    }

    @Override
    public void close() {
    }

    public List<LogRecord> records() {
        return records;
    }

    public boolean hasWarningContaining(String text) {
        return records.stream().anyMatch(r ->
                r.getLevel() == Level.WARNING && r.getMessage() != null && r.getMessage().contains(text));
    }
}
