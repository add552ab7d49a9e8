package fr.lapetina.codex.linker.commands;

import fr.lapetina.codex.linker.CodexLinkerApplication;
import fr.lapetina.codex.linker.domain.model.Candidate;
import fr.lapetina.codex.linker.domain.provider.ProviderResolver;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "detect",
        description = "Race the candidate base URLs and print the first server that answers"
)
public class DetectCommand implements Callable<Integer> {

    @CommandLine.ParentCommand
    CodexLinkerApplication parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--candidate", split = ",",
            description = "Base URL to probe, repeatable (default: configured candidates)")
    List<String> candidates = new ArrayList<>();

    @CommandLine.Option(names = "--timeout-ms", description = "Per-probe timeout in milliseconds")
    Long timeoutMs;

    @Override
    public Integer call() {
        if (timeoutMs != null && timeoutMs <= 0) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "--timeout-ms must be positive, got " + timeoutMs);
        }
        PrintWriter out = spec.commandLine().getOut();
        return parent.execute(factory -> {
            if (timeoutMs != null) {
                factory.getConfig().getDetection().setProbeTimeoutMs(timeoutMs);
            }
            Optional<Candidate> winner = factory.detect(candidates);
            if (winner.isEmpty()) {
                spec.commandLine().getErr().println("No server detected");
                return CodexLinkerApplication.EXIT_FAILURE;
            }
            out.println("base_url=" + winner.get().baseUrl());
            out.println("provider=" + ProviderResolver.resolve(winner.get().baseUrl()));
            return CodexLinkerApplication.EXIT_OK;
        });
    }
}
