package com.sailfish.taskman.config;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Connection settings for the task store.
 *
 * <p>Read from the environment by {@link #fromEnvironment(Map)}:
 * <ul>
 *   <li>{@code DB_HOST} (default {@code localhost})</li>
 *   <li>{@code DB_PORT} (default {@code 3306})</li>
 *   <li>{@code DB_USER} (default {@code root})</li>
 *   <li>{@code DB_PASSWORD} (default empty)</li>
 *   <li>{@code DB_NAME} (default {@code task_management})</li>
 *   <li>{@code DB_URL} overrides the JDBC URL otherwise built from the values above</li>
 *   <li>{@code DB_CONNECT_RETRIES} (default 3) and {@code DB_CONNECT_INITIAL_DELAY_MS} (default 500)</li>
 * </ul>
 */
public class StoreProperties {

    public static final String PERSISTENCE_UNIT = "taskman";

    static final String JDBC_URL = "jakarta.persistence.jdbc.url";
    static final String JDBC_USER = "jakarta.persistence.jdbc.user";
    static final String JDBC_PASSWORD = "jakarta.persistence.jdbc.password";

    private String host = "localhost";
    private int port = 3306;
    private String user = "root";
    private String password = "";
    private String database = "task_management";
    private String url;
    private int connectRetries = 3;
    private Duration connectInitialDelay = Duration.ofMillis(500);

    /**
     * Builds properties from environment variables, falling back to the defaults for any that
     * are unset or blank.
     *
     * @throws IllegalArgumentException if a numeric variable is not a number
     */
    public static StoreProperties fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env must not be null");
        StoreProperties props = new StoreProperties();
        props.setHost(env.getOrDefault("DB_HOST", props.getHost()));
        props.setPort(parseInt(env, "DB_PORT", props.getPort()));
        props.setUser(env.getOrDefault("DB_USER", props.getUser()));
        props.setPassword(env.getOrDefault("DB_PASSWORD", props.getPassword()));
        props.setDatabase(env.getOrDefault("DB_NAME", props.getDatabase()));
        props.setUrl(env.get("DB_URL"));
        props.setConnectRetries(parseInt(env, "DB_CONNECT_RETRIES", props.getConnectRetries()));
        props.setConnectInitialDelay(Duration.ofMillis(
                parseInt(env, "DB_CONNECT_INITIAL_DELAY_MS", (int) props.getConnectInitialDelay().toMillis())));
        return props;
    }

    private static int parseInt(Map<String, String> env, String name, int defaultValue) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer but was '" + raw + "'", e);
        }
    }

    /**
     * JDBC URL of the store. Unless overridden, points at MySQL and asks the driver to create the
     * database on first connection.
     */
    public String jdbcUrl() {
        if (url != null && !url.isBlank()) {
            return url;
        }
        return "jdbc:mysql://" + host + ":" + port + "/" + database
                + "?createDatabaseIfNotExist=true&useUnicode=true&characterEncoding=utf8";
    }

    /**
     * Connection settings in the form {@link jakarta.persistence.Persistence} expects.
     */
    public Map<String, Object> toJpaProperties() {
        Map<String, Object> jpa = new HashMap<>();
        jpa.put(JDBC_URL, jdbcUrl());
        jpa.put(JDBC_USER, user);
        jpa.put(JDBC_PASSWORD, password == null ? "" : password);
        return jpa;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        if (host != null && !host.isBlank()) {
            this.host = host.trim();
        }
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535 but was " + port);
        }
        this.port = port;
    }

    public String getUser() {
        return user;
    }

    public void setUser(String user) {
        if (user != null && !user.isBlank()) {
            this.user = user.trim();
        }
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getDatabase() {
        return database;
    }

    public void setDatabase(String database) {
        if (database != null && !database.isBlank()) {
            this.database = database.trim();
        }
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public int getConnectRetries() {
        return connectRetries;
    }

    public void setConnectRetries(int connectRetries) {
        if (connectRetries < 0) {
            throw new IllegalArgumentException("connectRetries must be non-negative");
        }
        this.connectRetries = connectRetries;
    }

    public Duration getConnectInitialDelay() {
        return connectInitialDelay;
    }

    public void setConnectInitialDelay(Duration connectInitialDelay) {
        if (connectInitialDelay == null || connectInitialDelay.isNegative() || connectInitialDelay.isZero()) {
            throw new IllegalArgumentException("connectInitialDelay must be a positive duration");
        }
        this.connectInitialDelay = connectInitialDelay;
    }

    @Override
    public String toString() {
        // password omitted
        return "StoreProperties{" +
               "url=" + jdbcUrl() +
               ", user=" + user +
               ", connectRetries=" + connectRetries +
               ", connectInitialDelay=" + connectInitialDelay +
               '}';
    }
}
