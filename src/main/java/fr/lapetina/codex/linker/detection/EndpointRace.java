package fr.lapetina.codex.linker.detection;

import fr.lapetina.codex.linker.domain.model.Candidate;
import fr.lapetina.codex.linker.domain.model.ProbeFailure;
import fr.lapetina.codex.linker.domain.model.ProbeOutcome;
import fr.lapetina.codex.linker.domain.probe.Probe;
import fr.lapetina.codex.linker.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Probes several candidate endpoints in parallel and returns the first one that answers.
 *
 * One worker thread is started per candidate and the pool is torn down as soon as the
 * race is decided. Losing probes are interrupted best-effort; whatever they return
 * afterwards is discarded.
 *
 * <p>Tie-break: when several candidates succeed at nearly the same time, the winner is
 * whichever completion the scheduler delivers first. This is non-deterministic and
 * callers must not rely on candidate order to pick among healthy servers.
 *
 * <p>{@link #race} never throws: an empty result is a normal outcome.
 */
public final class EndpointRace {

    private static final Logger log = LoggerFactory.getLogger(EndpointRace.class);

    static final Duration DEFAULT_GRACE = Duration.ofSeconds(1);

    private final Probe probe;
    private final MetricsRegistry metricsRegistry;
    private final Duration grace;

    public EndpointRace(Probe probe, MetricsRegistry metricsRegistry, Duration grace) {
        this.probe = Objects.requireNonNull(probe, "Probe is required");
        this.metricsRegistry = metricsRegistry;
        this.grace = grace;
    }

    public EndpointRace(Probe probe, MetricsRegistry metricsRegistry) {
        this(probe, metricsRegistry, DEFAULT_GRACE);
    }

    public EndpointRace(Probe probe) {
        this(probe, null, DEFAULT_GRACE);
    }

    /**
     * Races one probe per candidate.
     *
     * @param candidates      Candidates to probe; duplicates are probed once
     * @param perProbeTimeout Timeout handed to each probe
     * @return The first candidate whose probe succeeded, or empty when every probe failed
     */
    public Optional<Candidate> race(Collection<Candidate> candidates, Duration perProbeTimeout) {
        List<Candidate> distinct = new ArrayList<>(new LinkedHashSet<>(candidates));
        if (distinct.isEmpty()) {
            log.debug("Detection race skipped: no candidates");
            return Optional.empty();
        }

        long start = System.nanoTime();
        log.info("Detection race started: candidates={}, perProbeTimeoutMs={}",
                distinct.size(), perProbeTimeout.toMillis());

        ExecutorService pool = Executors.newFixedThreadPool(distinct.size(), new ProbeThreadFactory());
        CompletionService<ProbeOutcome> completions = new ExecutorCompletionService<>(pool);
        List<Future<ProbeOutcome>> futures = new ArrayList<>(distinct.size());

        Optional<Candidate> winner = Optional.empty();
        try {
            for (Candidate candidate : distinct) {
                futures.add(completions.submit(() -> runProbe(candidate, perProbeTimeout)));
            }
            winner = awaitFirstSuccess(completions, distinct.size(), perProbeTimeout);
        } finally {
            teardown(pool, futures);
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        if (metricsRegistry != null) {
            metricsRegistry.recordRace(winner.isPresent(), elapsed);
        }
        if (winner.isPresent()) {
            log.info("Detected server: candidate={}, elapsedMs={}", winner.get(), elapsed.toMillis());
        } else {
            log.warn("No server auto-detected: candidates={}, elapsedMs={}", distinct.size(), elapsed.toMillis());
        }
        return winner;
    }

    private Optional<Candidate> awaitFirstSuccess(
            CompletionService<ProbeOutcome> completions,
            int pending,
            Duration perProbeTimeout
    ) {
        // Ceiling for probe strategies that overrun their own timeout
        long deadline = System.nanoTime() + perProbeTimeout.plus(grace).toNanos();

        for (int remaining = pending; remaining > 0; remaining--) {
            Future<ProbeOutcome> done;
            try {
                long waitNanos = deadline - System.nanoTime();
                done = waitNanos > 0 ? completions.poll(waitNanos, TimeUnit.NANOSECONDS) : null;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Detection race interrupted, abandoning {} pending probes", remaining);
                return Optional.empty();
            }

            if (done == null) {
                log.warn("Detection race deadline reached with {} probes still running", remaining);
                return Optional.empty();
            }

            Optional<ProbeOutcome> completed = outcomeOf(done);
            if (completed.isEmpty()) {
                continue;
            }
            ProbeOutcome outcome = completed.get();
            if (outcome.success()) {
                return Optional.of(outcome.candidate());
            }
            log.debug("No response from candidate: candidate={}, failure={}, detail={}",
                    outcome.candidate(), outcome.failure(), outcome.detail());
        }
        return Optional.empty();
    }

    private ProbeOutcome runProbe(Candidate candidate, Duration timeout) {
        log.debug("Probing candidate: candidate={}", candidate);
        long start = System.nanoTime();
        ProbeOutcome outcome;
        try {
            outcome = probe.probe(candidate, timeout);
            if (outcome == null) {
                outcome = ProbeOutcome.failure(candidate, ProbeFailure.INTERNAL_ERROR,
                        "probe returned no outcome", Duration.ofNanos(System.nanoTime() - start));
            }
        } catch (RuntimeException e) {
            outcome = ProbeOutcome.failure(candidate, ProbeFailure.INTERNAL_ERROR,
                    e.getClass().getSimpleName() + ": " + e.getMessage(),
                    Duration.ofNanos(System.nanoTime() - start));
        }
        if (metricsRegistry != null) {
            metricsRegistry.recordProbe(outcome);
        }
        return outcome;
    }

    private Optional<ProbeOutcome> outcomeOf(Future<ProbeOutcome> future) {
        try {
            return Optional.of(future.get());
        } catch (ExecutionException e) {
            // runProbe converts exceptions, so only Errors end up here
            log.error("Probe worker failed", e.getCause());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    private void teardown(ExecutorService pool, List<Future<ProbeOutcome>> futures) {
        long stragglers = futures.stream().filter(f -> !f.isDone()).count();
        pool.shutdownNow();
        if (stragglers > 0) {
            log.debug("Detection race decided, discarding {} in-flight probes", stragglers);
        }
    }

    /**
     * Daemon threads so stray probes never keep the CLI alive.
     */
    private static final class ProbeThreadFactory implements ThreadFactory {
        private static final AtomicInteger RACE_COUNTER = new AtomicInteger(0);

        private final int race = RACE_COUNTER.incrementAndGet();
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "endpoint-probe-" + race + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
