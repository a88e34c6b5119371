package com.questrail.voice.cli;

import com.questrail.voice.config.CommandServerConfig;
import com.questrail.voice.grammar.GrammarException;
import com.questrail.voice.observability.Slf4jCommandObservabilitySink;
import com.questrail.voice.plugins.AwtRobotInputAutomation;
import com.questrail.voice.plugins.InputAutomation;
import com.questrail.voice.plugins.LoggingInputAutomation;
import com.questrail.voice.plugins.PluginCatalog;
import com.questrail.voice.registry.DuplicateDefinitionException;
import com.questrail.voice.runtime.CommandServerRuntime;
import com.questrail.voice.transport.BindFailureException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.awt.AWTException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "voice-command-server",
        mixinStandardHelpOptions = true,
        version = "voice-command-server 0.1.0",
        description = "Accepts newline-terminated spoken commands on a Unix domain socket and runs them."
)
public final class VoiceCommandServerCli implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(VoiceCommandServerCli.class);

    static final int EXIT_ASSEMBLY_FAILURE = 2;
    static final int EXIT_BIND_FAILURE = 3;

    @Spec
    CommandSpec spec;

    @Option(names = "--socket",
            defaultValue = "${env:XDG_RUNTIME_DIR:-/tmp}/voice-command.sock",
            description = "Socket path (default: ${DEFAULT-VALUE}).")
    Path socket;

    @Option(names = "--permissions",
            description = "Permissions applied to the socket file before accepting, e.g. rw-------.")
    String permissions;

    @Option(names = "--max-line-length",
            defaultValue = "16384",
            description = "Longest accepted command line in bytes (default: ${DEFAULT-VALUE}).")
    int maxLineLength;

    @Option(names = "--max-in-flight",
            defaultValue = "64",
            description = "Commands allowed to run concurrently per connection (default: ${DEFAULT-VALUE}).")
    int maxInFlight;

    @Option(names = "--headless",
            description = "Log input actions instead of performing them.")
    boolean headless;

    @Parameters(arity = "0..*", paramLabel = "PLUGIN",
            description = "Plugins to load (default: basic).")
    List<String> pluginIds = new ArrayList<>();

    public static void main(String[] args) {
        System.exit(new CommandLine(new VoiceCommandServerCli()).execute(args));
    }

    @Override
    public Integer call() throws Exception {
        final CommandServerRuntime runtime;
        try {
            runtime = buildRuntime(inputAutomation());
        } catch (IllegalArgumentException | GrammarException | DuplicateDefinitionException e) {
            spec.commandLine().getErr().println("Cannot assemble commands: " + e.getMessage());
            return EXIT_ASSEMBLY_FAILURE;
        }

        try {
            runtime.start();
        } catch (BindFailureException e) {
            spec.commandLine().getErr().println("Cannot listen on " + socket + ": " + e.getMessage());
            return EXIT_BIND_FAILURE;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(runtime::stop, "voice-shutdown"));
        runtime.awaitTermination();
        return 0;
    }

    CommandServerConfig config() {
        CommandServerConfig.Builder builder = CommandServerConfig.builder()
                .withSocketPath(socket)
                .withMaxLineLength(maxLineLength)
                .withMaxInFlightPerConnection(maxInFlight);
        if (permissions != null) {
            builder.withSocketPermissions(permissions);
        }
        return builder.build();
    }

    List<String> selectedPlugins() {
        return pluginIds.isEmpty() ? List.of("basic") : pluginIds;
    }

    CommandServerRuntime buildRuntime(InputAutomation automation) {
        PluginCatalog catalog = PluginCatalog.standard(automation);
        return CommandServerRuntime.builder()
                .withConfig(config())
                .withPlugins(catalog.resolve(selectedPlugins()))
                .withObservabilitySink(new Slf4jCommandObservabilitySink())
                .build();
    }

    private InputAutomation inputAutomation() {
        if (headless) {
            return new LoggingInputAutomation();
        }
        try {
            return AwtRobotInputAutomation.create();
        } catch (AWTException e) {
            log.warn("Input automation unavailable ({}); actions will only be logged", e.getMessage());
            return new LoggingInputAutomation();
        }
    }
}
