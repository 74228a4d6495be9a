package me.internalizable.tatc.command;

import me.internalizable.tatc.api.http.RequestHandler;
import me.internalizable.tatc.config.ConfigurationException;
import me.internalizable.tatc.config.FrontendConfig;
import me.internalizable.tatc.config.ServerSettings;
import me.internalizable.tatc.lifecycle.ProcessLifecycleManager;
import me.internalizable.tatc.server.RequestHandlers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Container entry point.
 *
 * <p>Configuration is layered, later layers winning: built-in defaults, the optional YAML file
 * given with {@code --config}, environment variables, then command line flags.</p>
 *
 * <pre>
 * java -jar tatc-frontend.jar --proxy-headers --port 3000
 * </pre>
 */
@Command(
        name = "tatc-frontend",
        mixinStandardHelpOptions = true,
        version = "tatc-frontend 0.0.1",
        description = "Runs the HTTP front end behind a reverse proxy."
)
public class FrontendCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(FrontendCommand.class);

    public static final int EXIT_CONFIGURATION_ERROR = 2;

    @Spec
    CommandSpec spec;

    @Option(names = "--config", paramLabel = "<file>",
            description = "YAML configuration file; written with defaults if it does not exist.")
    Path configFile;

    @Option(names = "--host", description = "Address to bind (default: 0.0.0.0).")
    String host;

    @Option(names = "--port", description = "Port to listen on (default: 3000).")
    Integer port;

    @Option(names = "--proxy-headers", negatable = true,
            description = "Trust X-Forwarded-For, X-Forwarded-Proto and X-Forwarded-Host (default: on).")
    Boolean proxyHeaders;

    @Option(names = "--forwarded-allow-ips", split = ",", paramLabel = "<ip|cidr|*>",
            description = "Peers allowed to send forwarding headers (default: *).")
    List<String> forwardedAllowIps;

    @Option(names = "--request-timeout", paramLabel = "<seconds>",
            description = "Seconds a request may take before its connection is closed (default: 30).")
    Integer requestTimeoutSeconds;

    @Option(names = "--graceful-timeout", paramLabel = "<seconds>",
            description = "Seconds to wait for in-flight requests on shutdown (default: 10).")
    Integer gracefulTimeoutSeconds;

    private final Map<String, String> environment;
    private final Function<ServerSettings, ProcessLifecycleManager> lifecycleFactory;

    public FrontendCommand() {
        this(System.getenv(),
                () -> RequestHandlers.discover(FrontendCommand.class.getClassLoader()),
                null);
    }

    FrontendCommand(Map<String, String> environment, Supplier<RequestHandler> handlerSupplier,
                    Function<ServerSettings, ProcessLifecycleManager> lifecycleFactory) {
        this.environment = environment;
        this.lifecycleFactory = lifecycleFactory != null
                ? lifecycleFactory
                : settings -> new ProcessLifecycleManager(settings, handlerSupplier.get());
    }

    @Override
    public Integer call() {
        ServerSettings settings;
        try {
            settings = buildConfig().toSettings();
        } catch (ConfigurationException e) {
            LOGGER.error("Invalid configuration: {}", e.getMessage());
            spec.commandLine().getErr().println("ERROR: invalid configuration: " + e.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        } catch (IOException e) {
            LOGGER.error("Could not read configuration file {}", configFile, e);
            spec.commandLine().getErr().println("ERROR: could not read configuration file " + configFile
                    + ": " + e.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        }

        return lifecycleFactory.apply(settings).run();
    }

    /**
     * Assembles the configuration from the file, the environment and the flags.
     */
    FrontendConfig buildConfig() throws IOException {
        FrontendConfig config = configFile != null ? FrontendConfig.load(configFile) : new FrontendConfig();
        config.applyEnvironment(environment);

        if (host != null) {
            config.setBindAddress(host);
        }
        if (port != null) {
            config.setBindPort(port);
        }
        if (proxyHeaders != null) {
            config.getProxyHeaders().setEnabled(proxyHeaders);
        }
        if (forwardedAllowIps != null && !forwardedAllowIps.isEmpty()) {
            config.getProxyHeaders().setTrustedProxies(forwardedAllowIps);
        }
        if (requestTimeoutSeconds != null) {
            config.setRequestTimeoutSeconds(requestTimeoutSeconds);
        }
        if (gracefulTimeoutSeconds != null) {
            config.setShutdownGracePeriodSeconds(gracefulTimeoutSeconds);
        }
        return config;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new FrontendCommand()).execute(args);
        System.exit(exitCode);
    }
}
