package com.sailfish.taskman.config;

import com.sailfish.taskman.exception.TaskStoreException;
import com.sailfish.taskman.repository.JpaTaskGateway;
import com.sailfish.taskman.repository.TaskGateway;
import com.sailfish.taskman.retry.ExponentialBackoffRetryStrategy;
import com.sailfish.taskman.retry.RetryStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.Persistence;
import jakarta.persistence.PersistenceException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Opens the task store: builds the {@link EntityManagerFactory}, verifies the schema and hands
 * back a ready {@link TaskGateway}. Failed attempts are retried according to a
 * {@link RetryStrategy}; once it gives up, the last failure is rethrown as a
 * {@link TaskStoreException}.
 */
public class StoreConnector {

    private static final Logger log = LoggerFactory.getLogger(StoreConnector.class);

    /**
     * Pauses between attempts.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final StoreProperties properties;
    private final RetryStrategy retryStrategy;
    private final Function<Map<String, Object>, EntityManagerFactory> factoryProvider;
    private final Sleeper sleeper;

    public StoreConnector(StoreProperties properties) {
        this(properties, new ExponentialBackoffRetryStrategy(
                properties.getConnectRetries(),
                properties.getConnectInitialDelay(),
                ExponentialBackoffRetryStrategy.DEFAULT_MULTIPLIER,
                ExponentialBackoffRetryStrategy.DEFAULT_MAX_DELAY,
                true));
    }

    public StoreConnector(StoreProperties properties, RetryStrategy retryStrategy) {
        this(properties, retryStrategy,
                jpa -> Persistence.createEntityManagerFactory(StoreProperties.PERSISTENCE_UNIT, jpa),
                duration -> Thread.sleep(duration.toMillis()));
    }

    public StoreConnector(StoreProperties properties,
                          RetryStrategy retryStrategy,
                          Function<Map<String, Object>, EntityManagerFactory> factoryProvider,
                          Sleeper sleeper) {
        this.properties = Objects.requireNonNull(properties, "properties cannot be null");
        this.retryStrategy = Objects.requireNonNull(retryStrategy, "retryStrategy cannot be null");
        this.factoryProvider = Objects.requireNonNull(factoryProvider, "factoryProvider cannot be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper cannot be null");
    }

    /**
     * Connects to the store and ensures the schema exists.
     *
     * @return an open connection; the caller must close it
     * @throws TaskStoreException if the store cannot be reached within the retry budget
     */
    public StoreConnection connect() {
        log.info("Connecting to task store {}", properties);
        int failedAttempts = 0;
        while (true) {
            try {
                return attempt();
            } catch (TaskStoreException | PersistenceException e) {
                failedAttempts++;
                Optional<Duration> delay = retryStrategy.nextDelay(failedAttempts);
                if (delay.isEmpty()) {
                    log.error("Giving up on task store after {} attempt(s): {}", failedAttempts, e.getMessage());
                    throw new TaskStoreException("Database connection failed after " + failedAttempts
                            + " attempt(s): " + e.getMessage(), e);
                }
                log.warn("Task store connection attempt {} failed ({}). Retrying in {}.",
                        failedAttempts, e.getMessage(), delay.get());
                pause(delay.get());
            }
        }
    }

    private StoreConnection attempt() {
        EntityManagerFactory factory = factoryProvider.apply(properties.toJpaProperties());
        try {
            TaskGateway gateway = new JpaTaskGateway(factory);
            gateway.ensureSchema();
            log.info("Connected to task store at {}", properties.jdbcUrl());
            return new StoreConnection(factory, gateway);
        } catch (RuntimeException e) {
            closeQuietly(factory, e);
            throw e;
        }
    }

    private void pause(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TaskStoreException("Interrupted while waiting to reconnect to the task store", ie);
        }
    }

    private static void closeQuietly(EntityManagerFactory factory, RuntimeException cause) {
        try {
            if (factory.isOpen()) {
                factory.close();
            }
        } catch (RuntimeException closeFailure) {
            cause.addSuppressed(closeFailure);
        }
    }

    /**
     * An open store: the gateway plus the factory that backs it.
     */
    public static final class StoreConnection implements AutoCloseable {

        private final EntityManagerFactory entityManagerFactory;
        private final TaskGateway gateway;

        StoreConnection(EntityManagerFactory entityManagerFactory, TaskGateway gateway) {
            this.entityManagerFactory = entityManagerFactory;
            this.gateway = gateway;
        }

        public TaskGateway gateway() {
            return gateway;
        }

        public EntityManagerFactory entityManagerFactory() {
            return entityManagerFactory;
        }

        @Override
        public void close() {
            if (entityManagerFactory.isOpen()) {
                entityManagerFactory.close();
                log.info("Task store connection closed");
            }
        }
    }
}
