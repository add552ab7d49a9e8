package fr.lapetina.codex.linker;

import fr.lapetina.codex.linker.commands.DetectCommand;
import fr.lapetina.codex.linker.commands.ModelsCommand;
import fr.lapetina.codex.linker.infrastructure.config.ConfigLoader;
import fr.lapetina.codex.linker.infrastructure.config.ConfigLoader.ConfigurationException;
import fr.lapetina.codex.linker.infrastructure.config.LinkerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.function.Function;
import java.util.function.ToIntFunction;

/**
 * Main entry point for the codex linker diagnostics.
 */
@CommandLine.Command(
        name = "codex-linker",
        version = "1.0.0",
        mixinStandardHelpOptions = true,
        usageHelpAutoWidth = true,
        sortOptions = false,
        description = {
                "Detects local OpenAI-compatible model servers and inspects their models.",
                "",
                "Exit codes: 0 success, 1 nothing detected or listing failed, 2 usage error"
        },
        subcommands = {DetectCommand.class, ModelsCommand.class}
)
public class CodexLinkerApplication implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CodexLinkerApplication.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--config",
            description = "YAML configuration file (default: ${DEFAULT-VALUE}, file system then classpath)",
            defaultValue = ConfigLoader.DEFAULT_CONFIG)
    String configPath;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Enable debug logging")
    boolean verbose;

    @CommandLine.Option(names = "--log-level", description = "Explicit log level: debug, info, warning, error")
    String logLevel;

    @CommandLine.Option(names = "--log-file", description = "Also write plain text logs to this file")
    String logFile;

    @CommandLine.Option(names = "--log-json", description = "Also emit JSON log lines on stdout")
    boolean logJson;

    @CommandLine.Option(names = "--log-remote", description = "POST log records to this http(s) URL")
    String logRemote;

    @CommandLine.Option(names = "--log-sync", description = "Ship remote log records on the logging thread")
    boolean logSync;

    @CommandLine.Option(names = "--print-metrics", description = "Print Prometheus metrics on exit")
    boolean printMetrics;

    private final Function<LinkerConfig, DiagnosticsFactory> factoryProvider;

    public CodexLinkerApplication() {
        this(DiagnosticsFactory::create);
    }

    public CodexLinkerApplication(Function<LinkerConfig, DiagnosticsFactory> factoryProvider) {
        this.factoryProvider = factoryProvider;
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    /**
     * Loads the configuration, applies the global options and runs a subcommand body
     * against a freshly wired factory.
     *
     * @return The subcommand's exit code, or 1 when the configuration is unusable
     */
    public int execute(ToIntFunction<DiagnosticsFactory> body) {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        LinkerConfig config;
        try {
            config = loadConfig();
        } catch (ConfigurationException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }

        DiagnosticsFactory factory;
        try {
            factory = factoryProvider.apply(config);
        } catch (ConfigurationException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }

        try (factory) {
            int code = body.applyAsInt(factory);
            if (printMetrics) {
                out.print(factory.getMetricsRegistry().scrape());
            }
            return code;
        } finally {
            out.flush();
        }
    }

    LinkerConfig loadConfig() {
        LinkerConfig config = new ConfigLoader(configPath).load();
        applyOverrides(config.getLogging());
        log.debug("Configuration loaded: path={}", configPath);
        return config;
    }

    private void applyOverrides(LinkerConfig.LoggingConfig logging) {
        if (verbose) {
            logging.setVerbose(true);
        }
        if (logLevel != null) {
            logging.setLevel(logLevel);
        }
        if (logFile != null) {
            logging.setFile(logFile);
        }
        if (logJson) {
            logging.setJson(true);
        }
        if (logRemote != null) {
            logging.setRemoteUrl(logRemote);
        }
        if (logSync) {
            logging.setSynchronous(true);
        }
    }

    public static void main(String[] args) {
        int code = new CommandLine(new CodexLinkerApplication()).execute(args);
        System.exit(code);
    }
}
