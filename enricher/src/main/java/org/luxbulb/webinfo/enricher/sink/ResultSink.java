package org.luxbulb.webinfo.enricher.sink;

import org.jetbrains.annotations.NotNull;
import org.luxbulb.webinfo.Common;
import org.luxbulb.webinfo.enricher.pipeline.ResultChannel;
import org.luxbulb.webinfo.models.results.EnrichmentResult;
import org.luxbulb.webinfo.serialization.SerializationException;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;

/**
 * Drains the result channel on a dedicated thread. Successful results are passed to the consumer; failed ones
 * are logged and, if enabled, passed to the consumer as well.
 */
public class ResultSink implements Runnable {
    public static final String COMPONENT_NAME = "result-sink";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(ResultSink.class);

    private final ResultChannel _channel;
    private final ResultConsumer _consumer;
    private final boolean _forwardErrors;
    private final CountDownLatch _finished = new CountDownLatch(1);

    private volatile long _consumed = 0;
    private volatile long _failed = 0;

    public ResultSink(@NotNull ResultChannel channel, @NotNull ResultConsumer consumer, boolean forwardErrors) {
        _channel = channel;
        _consumer = consumer;
        _forwardErrors = forwardErrors;
    }

    /**
     * Starts draining the channel on a new thread.
     */
    public Thread start() {
        final var thread = new Thread(this, "result-sink");
        thread.start();
        return thread;
    }

    @Override
    public void run() {
        Logger.debug("ResultSink started");

        try {
            while (true) {
                final var result = _channel.take();
                if (result == null)
                    break;

                handle(result);
            }
            _consumer.flush();
        } catch (InterruptedException e) {
            Logger.warn("ResultSink interrupted");
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            Logger.error("Cannot flush the output", e);
        } finally {
            Logger.debug("ResultSink stopped");
            _finished.countDown();
        }
    }

    private void handle(EnrichmentResult result) {
        _consumed++;

        if (!result.success()) {
            _failed++;
            Logger.warn("{}: Enrichment failed with code {}: {}", result.originIdentity(), result.statusCode(),
                    result.error());
            if (!_forwardErrors)
                return;
        } else {
            Logger.trace("{}: Writing result", result.originIdentity());
        }

        try {
            _consumer.consume(result);
        } catch (IOException | SerializationException e) {
            Logger.error("{}: Cannot write the result", result.originIdentity(), e);
        } catch (RuntimeException e) {
            Logger.error("{}: Unexpected failure while writing the result", result.originIdentity(), e);
        }
    }

    /**
     * Waits until the channel has been closed and drained.
     *
     * @return The number of results taken from the channel.
     */
    public long awaitTermination() throws InterruptedException {
        _finished.await();
        return _consumed;
    }

    public long getFailedCount() {
        return _failed;
    }
}
