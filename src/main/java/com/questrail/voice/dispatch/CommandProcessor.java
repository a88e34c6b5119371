package com.questrail.voice.dispatch;

import com.questrail.voice.api.CommandHandler;
import com.questrail.voice.api.ParsedCommand;
import com.questrail.voice.observability.CommandObservabilitySink;
import com.questrail.voice.observability.CommandOutcomeEvent;
import com.questrail.voice.observability.NullObservabilitySink;
import com.questrail.voice.registry.CommandRegistry;
import com.questrail.voice.registry.UnrecognizedCommandException;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * CommandProcessor
 * =============================================================================
 * Parses one decoded command line and runs its handler.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   text
 *     → CommandRegistry.parse     (Unrecognized on failure)
 *         → ParsedCommand
 *             → CommandHandler    (HandlerFailed on any exception)
 *                 → Handled
 * </pre>
 *
 * <h2>Failure isolation</h2>
 * <p>{@link #process(String, String)} never throws, not even for an
 * {@link Error} raised while parsing or handling. Parse and handler failures
 * are contained to the single line, turned into a {@link ProcessingOutcome}
 * and reported to the {@link CommandObservabilitySink}.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Stateless apart from its immutable collaborators; one instance serves
 * every connection.</p>
 */
public final class CommandProcessor
{
    private final CommandRegistry registry;
    private final CommandObservabilitySink observabilitySink;
    private final Clock clock;

    public CommandProcessor(CommandRegistry registry, CommandObservabilitySink observabilitySink)
    {
        this(registry, observabilitySink, Clock.systemUTC());
    }

    public CommandProcessor(CommandRegistry registry, CommandObservabilitySink observabilitySink, Clock clock)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Process one command line to completion on the calling thread.
     *
     * @param connectionId connection the line arrived on, for reporting
     * @param text decoded line, without terminator
     * @return the outcome, which has also been reported
     */
    public ProcessingOutcome process(String connectionId, String text)
    {
        ProcessingOutcome outcome = run(text);
        report(connectionId, text, outcome);
        return outcome;
    }

    /**
     * Report a line that was never processed because admission was refused.
     */
    public ProcessingOutcome reject(String connectionId, String text, int inFlight)
    {
        ProcessingOutcome outcome = new ProcessingOutcome.Rejected(inFlight);
        report(connectionId, text, outcome);
        return outcome;
    }

    private ProcessingOutcome run(String text)
    {
        // 1) Parse against the combined grammar
        final ParsedCommand command;
        try {
            command = registry.parse(text);
        }
        catch (UnrecognizedCommandException e) {
            return new ProcessingOutcome.Unrecognized(e.getMessage());
        }
        catch (RuntimeException | Error e) {
            return new ProcessingOutcome.Unrecognized("parse failed: " + e);
        }

        // 2) Lookup cannot miss: the grammar was compiled from the same registry
        CommandHandler handler = registry.handlerFor(command.pattern())
                .orElseThrow(() -> new IllegalStateException("no handler for " + command.pattern()));

        // 3) Invoke, containing every failure to this line
        long started = clock.millis();
        try {
            handler.handle(command);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new ProcessingOutcome.HandlerFailed(command.pattern(), e);
        }
        catch (Exception | Error e) {
            return new ProcessingOutcome.HandlerFailed(command.pattern(), e);
        }
        return new ProcessingOutcome.Handled(command.pattern(), Duration.ofMillis(clock.millis() - started));
    }

    private void report(String connectionId, String text, ProcessingOutcome outcome)
    {
        observabilitySink.onCommandOutcome(new CommandOutcomeEvent(clock.instant(), connectionId, text, outcome));
    }
}
