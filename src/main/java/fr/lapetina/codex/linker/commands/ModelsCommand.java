package fr.lapetina.codex.linker.commands;

import fr.lapetina.codex.linker.CodexLinkerApplication;
import fr.lapetina.codex.linker.domain.model.Candidate;
import fr.lapetina.codex.linker.infrastructure.http.ModelListingException;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "models",
        description = "List the models served at a base URL (auto-detected when omitted)"
)
public class ModelsCommand implements Callable<Integer> {

    @CommandLine.ParentCommand
    CodexLinkerApplication parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--base-url", description = "Server base URL, e.g. http://localhost:11434/v1")
    String baseUrl;

    @CommandLine.Option(names = "--model", description = "Also print the context window of this model")
    String model;

    @CommandLine.Option(names = "--timeout-ms", description = "Request timeout in milliseconds")
    Long timeoutMs;

    @Override
    public Integer call() {
        if (timeoutMs != null && timeoutMs <= 0) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "--timeout-ms must be positive, got " + timeoutMs);
        }
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        return parent.execute(factory -> {
            if (timeoutMs != null) {
                factory.getConfig().getDetection().setProbeTimeoutMs(timeoutMs);
            }

            String target = baseUrl;
            if (target == null || target.isBlank()) {
                Optional<Candidate> detected = factory.detect(List.of());
                if (detected.isEmpty()) {
                    err.println("No server detected; pass --base-url");
                    return CodexLinkerApplication.EXIT_FAILURE;
                }
                target = detected.get().baseUrl();
            }

            List<String> models;
            try {
                models = factory.listModels(target);
            } catch (ModelListingException e) {
                err.println("Error: " + e.getMessage());
                return CodexLinkerApplication.EXIT_FAILURE;
            }

            models.forEach(out::println);
            if (model != null && !model.isBlank()) {
                int window = factory.detectContextWindow(target, model);
                out.println("context_window=" + (window > 0 ? Integer.toString(window) : "unknown"));
            }
            return CodexLinkerApplication.EXIT_OK;
        });
    }
}
