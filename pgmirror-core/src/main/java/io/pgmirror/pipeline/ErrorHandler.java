/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.pipeline;

import java.io.IOException;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import org.apache.kafka.connect.errors.ConnectException;
import org.apache.kafka.connect.errors.RetriableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the first failure of a replication pipeline and decides whether the pipeline may be restarted.
 * <p>
 * The failure is handed to the listener either as a {@link RetriableException}, after which the pipeline is
 * reconnected from its last confirmed position, or as a {@link ConnectException}, after which it stays stopped.
 */
public class ErrorHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ErrorHandler.class);

    private final Consumer<RuntimeException> listener;
    private final AtomicReference<Throwable> producerThrowable;

    public ErrorHandler(Consumer<RuntimeException> listener) {
        this.listener = listener;
        this.producerThrowable = new AtomicReference<>();
    }

    public void setProducerThrowable(Throwable producerThrowable) {
        boolean first = this.producerThrowable.compareAndSet(null, producerThrowable);
        boolean retriable = isRetriable(producerThrowable);

        if (first) {
            if (retriable) {
                LOGGER.warn("Replication failure, the pipeline will be restarted", producerThrowable);
                listener.accept(new RetriableException("An exception occurred in the replication pipeline. It will be restarted.", producerThrowable));
            }
            else {
                LOGGER.error("Replication failure, the pipeline will be stopped", producerThrowable);
                listener.accept(new ConnectException("An exception occurred in the replication pipeline. It will be stopped.", producerThrowable));
            }
        }
        else {
            LOGGER.debug("Ignoring subsequent failure", producerThrowable);
        }
    }

    public Throwable getProducerThrowable() {
        return producerThrowable.get();
    }

    /**
     * Forget the recorded failure so that a restarted pipeline can report a new one.
     */
    public void reset() {
        producerThrowable.set(null);
    }

    protected Set<Class<? extends Exception>> communicationExceptions() {
        return Collections.singleton(IOException.class);
    }

    /**
     * Whether the given throwable is retriable (e.g. an exception indicating a
     * connection loss) or not.
     * By default only I/O exceptions are retriable
     */
    public boolean isRetriable(Throwable throwable) {
        if (throwable == null) {
            return false;
        }
        for (Class<? extends Exception> e : communicationExceptions()) {
            if (e.isAssignableFrom(throwable.getClass())) {
                return true;
            }
        }
        return isRetriable(throwable.getCause());
    }
}
