package fr.lapetina.codex.linker.infrastructure.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.FileAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import fr.lapetina.codex.linker.dispatch.LogDispatcher;
import fr.lapetina.codex.linker.infrastructure.config.LinkerConfig.LoggingConfig;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Applies logging options to Logback at runtime.
 *
 * <p>The stderr console appender comes from {@code logback.xml}; this class sets the root
 * level and adds the optional file, JSON and remote appenders. Appenders added by a previous
 * {@link #configure} call are detached and stopped first, so repeated configuration never
 * duplicates output.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

    static final String FILE_APPENDER = "CODEX_LINKER_FILE";
    static final String JSON_APPENDER = "CODEX_LINKER_JSON";
    static final String PLAIN_PATTERN = "%level: %msg%n";

    private final LoggerContext context;
    private final List<Appender<ILoggingEvent>> installed = new ArrayList<>();

    public LoggingConfigurator(LoggerContext context) {
        this.context = context;
    }

    public LoggingConfigurator() {
        this((LoggerContext) LoggerFactory.getILoggerFactory());
    }

    /**
     * Configures the root logger.
     *
     * @param config     Logging options
     * @param dispatcher Dispatcher for remote shipping, or null when remote logging is off
     */
    public synchronized void configure(LoggingConfig config, LogDispatcher dispatcher) {
        Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        reset();

        Level level = resolveLevel(config.getLevel(), config.isVerbose());
        root.setLevel(level);

        if (config.getFile() != null && !config.getFile().isBlank()) {
            install(root, fileAppender(config.getFile()));
        }
        if (config.isJson()) {
            install(root, jsonAppender());
        }
        if (dispatcher != null) {
            RemoteLogAppender remote = new RemoteLogAppender(dispatcher);
            remote.setContext(context);
            remote.start();
            install(root, remote);
        }

        log.debug("Logging configured: level={}, file={}, json={}, remote={}",
                level, config.getFile(), config.isJson(), dispatcher != null);
    }

    /**
     * Detaches and stops every appender this configurator added.
     */
    public synchronized void reset() {
        Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        for (Appender<ILoggingEvent> appender : installed) {
            root.detachAppender(appender);
            appender.stop();
        }
        installed.clear();
    }

    /**
     * Resolves the root level: an explicit level name wins, otherwise DEBUG when
     * verbose and WARN by default. Unknown names fall back to WARN.
     */
    public static Level resolveLevel(String levelName, boolean verbose) {
        if (levelName == null || levelName.isBlank()) {
            return verbose ? Level.DEBUG : Level.WARN;
        }
        return switch (levelName.strip().toLowerCase(Locale.ROOT)) {
            case "trace" -> Level.TRACE;
            case "debug" -> Level.DEBUG;
            case "info" -> Level.INFO;
            case "error" -> Level.ERROR;
            default -> Level.WARN;
        };
    }

    List<Appender<ILoggingEvent>> getInstalledAppenders() {
        return List.copyOf(installed);
    }

    private void install(Logger root, Appender<ILoggingEvent> appender) {
        root.addAppender(appender);
        installed.add(appender);
    }

    private Appender<ILoggingEvent> fileAppender(String file) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(PLAIN_PATTERN);
        encoder.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setName(FILE_APPENDER);
        appender.setContext(context);
        appender.setFile(file);
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.start();
        return appender;
    }

    private Appender<ILoggingEvent> jsonAppender() {
        JsonLineLayout layout = new JsonLineLayout();
        layout.setContext(context);
        layout.start();

        LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
        encoder.setContext(context);
        encoder.setLayout(layout);
        encoder.start();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setName(JSON_APPENDER);
        appender.setContext(context);
        appender.setTarget("System.out");
        appender.setEncoder(encoder);
        appender.start();
        return appender;
    }
}
