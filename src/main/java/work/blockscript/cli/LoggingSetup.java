package work.blockscript.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.LoggerFactory;
import work.blockscript.api.LogLevel;

/**
 * Applies the {@code --log-level} threshold to the Logback root logger.
 */
final class LoggingSetup {
    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(LoggingSetup.class);

    private LoggingSetup() {}

    static void apply(LogLevel level) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            LOG.warn("Logback is not the active SLF4J binding; ignoring log level {}", level);
            return;
        }
        Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        root.setLevel(toLogback(level));
        LOG.debug("Root log level set to {}", level);
    }

    static Level toLogback(LogLevel level) {
        return switch (level) {
            case TRACE -> Level.TRACE;
            case DEBUG -> Level.DEBUG;
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }
}
