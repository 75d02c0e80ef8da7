package com.eventmirror.core.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the batch ingestion server.
 *
 * <p>
 * Expected YAML structure (every key optional):
 * </p>
 *
 * <pre>
 * host: 127.0.0.1
 * port: 8000
 * nameField: name
 * envelopeField: events
 * handlerThreads: 4
 * </pre>
 *
 * <p>
 * {@code nameField} is a dot-separated path ({@code meta.type}) read from
 * each event to fill the record name; events without it are named
 * {@value #UNKNOWN_NAME}. {@code envelopeField} names the array that holds
 * the events when a batch arrives wrapped as {@code {"meta":..,"events":[..]}};
 * leave it blank to disable envelope unwrapping.
 * </p>
 *
 * <p>
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class CollectorSettings {

    public static final String UNKNOWN_NAME = "unknown";

    private String host = "127.0.0.1";
    private int port = 8000;
    private String nameField = "name";
    private String envelopeField = "events";
    private int handlerThreads = 4;

    /**
     * Validate every setting and report all problems at once.
     *
     * @throws IllegalStateException if any setting is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (host == null || host.isBlank()) {
            errors.add("'host' is required");
        }
        // 0 asks the OS for a free port
        if (port < 0 || port > 65_535) {
            errors.add("'port' must be in range [0, 65535], got: " + port);
        }
        if (nameField == null || nameField.isBlank()) {
            errors.add("'nameField' is required");
        }
        if (handlerThreads < 1) {
            errors.add("'handlerThreads' must be >= 1, got: " + handlerThreads);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid collector settings: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getNameField() {
        return nameField;
    }

    public void setNameField(String nameField) {
        this.nameField = nameField;
    }

    public String getEnvelopeField() {
        return envelopeField;
    }

    public void setEnvelopeField(String envelopeField) {
        this.envelopeField = envelopeField;
    }

    public int getHandlerThreads() {
        return handlerThreads;
    }

    public void setHandlerThreads(int handlerThreads) {
        this.handlerThreads = handlerThreads;
    }

    @Override
    public String toString() {
        return "CollectorSettings{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", nameField='" + nameField + '\'' +
                ", envelopeField='" + envelopeField + '\'' +
                ", handlerThreads=" + handlerThreads +
                '}';
    }
}
