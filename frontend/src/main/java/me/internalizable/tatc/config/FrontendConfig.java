package me.internalizable.tatc.config;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.introspector.Property;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;

import java.io.*;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Configuration for the front end, as read from YAML and the environment.
 *
 * <p>This is the mutable form used while assembling configuration. Call {@link #toSettings()} to
 * validate it into the immutable {@link ServerSettings} the server runs with.</p>
 */
public class FrontendConfig {

    public static final String ENV_PORT = "PORT";
    public static final String ENV_HOST = "HOST";
    public static final String ENV_PROXY_HEADERS = "PROXY_HEADERS";
    public static final String ENV_FORWARDED_ALLOW_IPS = "FORWARDED_ALLOW_IPS";
    public static final String ENV_REQUEST_TIMEOUT = "REQUEST_TIMEOUT_SECONDS";
    public static final String ENV_GRACEFUL_TIMEOUT = "GRACEFUL_TIMEOUT_SECONDS";

    // Network configuration
    private String bindAddress = ServerSettings.DEFAULT_BIND_ADDRESS;
    private int bindPort = ServerSettings.DEFAULT_PORT;

    // Request limits
    private int requestTimeoutSeconds = 30;
    private int maxContentLength = 1024 * 1024;
    private int maxConnections = 1000;
    private int handlerThreads = Math.max(4, Runtime.getRuntime().availableProcessors() * 2);

    // Shutdown
    private int shutdownGracePeriodSeconds = 10;

    // Forwarding headers
    private ProxyHeadersConfig proxyHeaders = new ProxyHeadersConfig();

    public FrontendConfig() {
    }

    // ==================== Load / Save ====================

    /**
     * Loads the configuration at {@code path}, writing a default file first if none exists.
     *
     * @throws ConfigurationException if the file is not valid YAML for this configuration
     */
    public static FrontendConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            FrontendConfig config = new FrontendConfig();
            config.save(path);
            return config;
        }

        LoaderOptions options = new LoaderOptions();
        Yaml yaml = new Yaml(new Constructor(FrontendConfig.class, options));
        try (InputStream is = Files.newInputStream(path)) {
            FrontendConfig config = yaml.load(is);
            return config != null ? config : new FrontendConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("invalid configuration file " + path + ": " + e.getMessage(), e);
        }
    }

    public void save(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        DumperOptions dumperOptions = new DumperOptions();
        dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        dumperOptions.setPrettyFlow(true);
        dumperOptions.setIndent(2);
        dumperOptions.setIndicatorIndent(2);
        dumperOptions.setIndentWithIndicator(true);

        Representer representer = new Representer(dumperOptions) {
            @Override
            protected NodeTuple representJavaBeanProperty(Object javaBean, Property property,
                                                          Object propertyValue, Tag customTag) {
                if (propertyValue == null) {
                    return null;
                }
                return super.representJavaBeanProperty(javaBean, property, propertyValue, customTag);
            }

            @Override
            protected Set<Property> getProperties(Class<? extends Object> type) {
                Set<Property> props = super.getProperties(type);
                if (type == FrontendConfig.class) {
                    return orderProperties(props,
                        "bindAddress", "bindPort",
                        "requestTimeoutSeconds", "maxContentLength", "maxConnections", "handlerThreads",
                        "shutdownGracePeriodSeconds",
                        "proxyHeaders"
                    );
                }
                if (type == ProxyHeadersConfig.class) {
                    return orderProperties(props, "enabled",
                        "forwardedForHeader", "forwardedProtoHeader", "forwardedHostHeader",
                        "trustedProxies");
                }
                return props;
            }

            private Set<Property> orderProperties(Set<Property> props, String... order) {
                Set<Property> ordered = new LinkedHashSet<>();
                for (String name : order) {
                    for (Property p : props) {
                        if (p.getName().equals(name)) {
                            ordered.add(p);
                            break;
                        }
                    }
                }
                for (Property p : props) {
                    if (!ordered.contains(p)) {
                        ordered.add(p);
                    }
                }
                return ordered;
            }
        };

        representer.addClassTag(FrontendConfig.class, Tag.MAP);
        representer.addClassTag(ProxyHeadersConfig.class, Tag.MAP);

        Yaml yaml = new Yaml(representer, dumperOptions);

        try (Writer writer = Files.newBufferedWriter(path)) {
            writer.write("# TATC front end configuration\n");
            writer.write("# Environment variables and command line flags override these values.\n\n");
            yaml.dump(this, writer);
        }
    }

    // ==================== Environment ====================

    /**
     * Applies the recognised environment variables on top of this configuration.
     *
     * @throws ConfigurationException if a recognised variable has an unusable value
     */
    public FrontendConfig applyEnvironment(Map<String, String> env) {
        String host = env.get(ENV_HOST);
        if (host != null && !host.isBlank()) {
            bindAddress = host.trim();
        }
        Integer port = intVariable(env, ENV_PORT);
        if (port != null) {
            bindPort = port;
        }
        String proxyHeadersValue = env.get(ENV_PROXY_HEADERS);
        if (proxyHeadersValue != null && !proxyHeadersValue.isBlank()) {
            proxyHeaders.setEnabled(parseBoolean(ENV_PROXY_HEADERS, proxyHeadersValue));
        }
        String allowIps = env.get(ENV_FORWARDED_ALLOW_IPS);
        if (allowIps != null && !allowIps.isBlank()) {
            proxyHeaders.setTrustedProxies(List.of(allowIps.split(",")));
        }
        Integer requestTimeout = intVariable(env, ENV_REQUEST_TIMEOUT);
        if (requestTimeout != null) {
            requestTimeoutSeconds = requestTimeout;
        }
        Integer graceful = intVariable(env, ENV_GRACEFUL_TIMEOUT);
        if (graceful != null) {
            shutdownGracePeriodSeconds = graceful;
        }
        return this;
    }

    private static Integer intVariable(Map<String, String> env, String name) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("environment variable " + name + " is not a number: '" + value + "'", e);
        }
    }

    private static boolean parseBoolean(String name, String value) {
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "1":
            case "true":
            case "yes":
            case "on":
                return true;
            case "0":
            case "false":
            case "no":
            case "off":
                return false;
            default:
                throw new ConfigurationException("environment variable " + name + " is not a boolean: '" + value + "'");
        }
    }

    // ==================== Validation ====================

    /**
     * Validates this configuration into immutable settings.
     *
     * @throws ConfigurationException if any value is out of range
     */
    public ServerSettings toSettings() {
        if (bindAddress == null) {
            throw new ConfigurationException("bindAddress must be set");
        }
        if (requestTimeoutSeconds <= 0) {
            throw new ConfigurationException("requestTimeoutSeconds must be positive, got " + requestTimeoutSeconds);
        }
        if (shutdownGracePeriodSeconds < 0) {
            throw new ConfigurationException("shutdownGracePeriodSeconds must not be negative, got "
                    + shutdownGracePeriodSeconds);
        }
        return new ServerSettings(
                bindAddress,
                bindPort,
                Duration.ofSeconds(requestTimeoutSeconds),
                Duration.ofSeconds(shutdownGracePeriodSeconds),
                maxConnections,
                maxContentLength,
                handlerThreads,
                proxyHeaders.toTrustConfig()
        );
    }

    // ==================== Network Getters/Setters ====================

    public String getBindAddress() { return bindAddress; }
    public void setBindAddress(String bindAddress) { this.bindAddress = bindAddress; }

    public int getBindPort() { return bindPort; }
    public void setBindPort(int bindPort) { this.bindPort = bindPort; }

    // ==================== Request Getters/Setters ====================

    public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }

    public int getMaxContentLength() { return maxContentLength; }
    public void setMaxContentLength(int maxContentLength) { this.maxContentLength = maxContentLength; }

    public int getMaxConnections() { return maxConnections; }
    public void setMaxConnections(int maxConnections) { this.maxConnections = maxConnections; }

    public int getHandlerThreads() { return handlerThreads; }
    public void setHandlerThreads(int handlerThreads) { this.handlerThreads = handlerThreads; }

    // ==================== Shutdown Getters/Setters ====================

    public int getShutdownGracePeriodSeconds() { return shutdownGracePeriodSeconds; }
    public void setShutdownGracePeriodSeconds(int shutdownGracePeriodSeconds) { this.shutdownGracePeriodSeconds = shutdownGracePeriodSeconds; }

    // ==================== Proxy Header Getters/Setters ====================

    public ProxyHeadersConfig getProxyHeaders() { return proxyHeaders; }
    public void setProxyHeaders(ProxyHeadersConfig proxyHeaders) {
        this.proxyHeaders = proxyHeaders != null ? proxyHeaders : new ProxyHeadersConfig();
    }
}
