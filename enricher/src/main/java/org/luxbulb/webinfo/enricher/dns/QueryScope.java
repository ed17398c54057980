package org.luxbulb.webinfo.enricher.dns;

import org.jetbrains.annotations.NotNull;
import org.xbill.DNS.EDNSOption;
import org.xbill.DNS.Message;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.TSIG;
import org.xbill.DNS.lookup.LookupSession;

import java.time.Duration;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;

/**
 * The queries sent on behalf of one public lookup operation. {@link LookupSession} does not propagate
 * cancellation to the resolver, so the scope records every future the resolver returns and cancels them
 * when the lookup's result future is cancelled.
 */
final class QueryScope {
    private final Queue<CompletableFuture<?>> _sent = new ConcurrentLinkedQueue<>();
    private final LookupSession _session;
    private volatile boolean _cancelled = false;

    QueryScope(@NotNull Resolver resolver, @NotNull Executor executor) {
        _session = LookupSession.builder()
                .resolver(new TrackingResolver(resolver))
                .executor(executor)
                .build();
    }

    LookupSession session() {
        return _session;
    }

    /**
     * Ties the scope to the result of the lookup: cancelling the result cancels all the queries
     * of the scope, including those sent later.
     */
    <T> CompletableFuture<T> bind(@NotNull CompletableFuture<T> result) {
        result.whenComplete((value, error) -> {
            if (result.isCancelled())
                cancel();
        });
        return result;
    }

    int cancel() {
        _cancelled = true;
        var count = 0;
        CompletableFuture<?> future;
        while ((future = _sent.poll()) != null) {
            if (future.cancel(true))
                count++;
        }
        return count;
    }

    private void register(CompletableFuture<?> future) {
        _sent.add(future);
        if (_cancelled)
            future.cancel(true);
    }

    private final class TrackingResolver implements Resolver {
        private final Resolver _delegate;

        TrackingResolver(Resolver delegate) {
            _delegate = delegate;
        }

        @Override
        public CompletionStage<Message> sendAsync(Message query, Executor executor) {
            final var future = _delegate.sendAsync(query, executor).toCompletableFuture();
            register(future);
            return future;
        }

        @Override
        public void setPort(int port) {
            _delegate.setPort(port);
        }

        @Override
        public void setTCP(boolean flag) {
            _delegate.setTCP(flag);
        }

        @Override
        public void setIgnoreTruncation(boolean flag) {
            _delegate.setIgnoreTruncation(flag);
        }

        @Override
        public void setEDNS(int version, int payloadSize, int flags, List<EDNSOption> options) {
            _delegate.setEDNS(version, payloadSize, flags, options);
        }

        @Override
        public void setTSIGKey(TSIG key) {
            _delegate.setTSIGKey(key);
        }

        @Override
        public void setTimeout(Duration timeout) {
            _delegate.setTimeout(timeout);
        }

        @Override
        public Duration getTimeout() {
            return _delegate.getTimeout();
        }
    }
}
