package org.luxbulb.webinfo.enricher.dns;

import com.google.common.net.InetAddresses;
import org.mockito.stubbing.Answer;
import org.xbill.DNS.AAAARecord;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.CNAMERecord;
import org.xbill.DNS.DClass;
import org.xbill.DNS.Flags;
import org.xbill.DNS.Message;
import org.xbill.DNS.NSRecord;
import org.xbill.DNS.Name;
import org.xbill.DNS.Rcode;
import org.xbill.DNS.Record;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.Section;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Builds Mockito resolvers that answer from a fixed zone. Names without records of the queried type
 * are answered with NXDOMAIN.
 */
public final class FakeResolvers {
    private static final long AWAIT_TIMEOUT_S = 10;

    private FakeResolvers() {
    }

    public static final class Zone {
        private final Map<String, List<Record>> _records = new HashMap<>();

        public Zone a(String name, String... ips) {
            for (var ip : ips) {
                add(name, Type.A, new ARecord(name(name), DClass.IN, 300, InetAddresses.forString(ip)));
            }
            return this;
        }

        public Zone aaaa(String name, String... ips) {
            for (var ip : ips) {
                add(name, Type.AAAA, new AAAARecord(name(name), DClass.IN, 300, InetAddresses.forString(ip)));
            }
            return this;
        }

        public Zone cname(String name, String target) {
            add(name, Type.CNAME, new CNAMERecord(name(name), DClass.IN, 300, name(target)));
            return this;
        }

        public Zone ns(String name, String... targets) {
            for (var target : targets) {
                add(name, Type.NS, new NSRecord(name(name), DClass.IN, 300, name(target)));
            }
            return this;
        }

        private void add(String name, int type, Record record) {
            _records.computeIfAbsent(key(name(name), type), k -> new ArrayList<>()).add(record);
        }

        Message respond(Message query) {
            final var question = query.getQuestion();
            final var response = new Message(query.getHeader().getID());
            response.getHeader().setFlag(Flags.QR);
            response.getHeader().setFlag(Flags.RD);
            response.getHeader().setFlag(Flags.RA);
            response.addRecord(question, Section.QUESTION);

            final var records = _records.get(key(question.getName(), question.getType()));
            if (records == null) {
                response.getHeader().setRcode(Rcode.NXDOMAIN);
            } else {
                records.forEach(record -> response.addRecord(record, Section.ANSWER));
            }
            return response;
        }
    }

    public static Zone zone() {
        return new Zone();
    }

    /**
     * Creates a resolver answering from the zone.
     */
    public static Resolver resolver(Zone zone) {
        return resolver(invocation -> CompletableFuture.completedFuture(
                zone.respond(invocation.getArgument(0, Message.class))));
    }

    /**
     * Creates a resolver whose queries all fail with the given exception.
     */
    public static Resolver failingResolver(Throwable error) {
        return resolver(invocation -> CompletableFuture.failedFuture(error));
    }

    /**
     * Creates a resolver that never answers. Every query's future is added to {@code sent}.
     */
    public static Resolver silentResolver(Collection<CompletableFuture<Message>> sent) {
        return resolver(invocation -> {
            final var future = new CompletableFuture<Message>();
            sent.add(future);
            return future;
        });
    }

    /**
     * Waits until at least {@code count} queries have been sent.
     */
    public static void awaitQueries(Collection<?> sent, int count) throws InterruptedException {
        final var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(AWAIT_TIMEOUT_S);
        while (sent.size() < count) {
            if (System.nanoTime() > deadline)
                fail("Only %d of %d queries were sent".formatted(sent.size(), count));
            Thread.sleep(10);
        }
    }

    /**
     * Waits until all the queries have been cancelled.
     */
    public static void awaitCancelled(Collection<? extends CompletableFuture<?>> queries)
            throws InterruptedException {
        final var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(AWAIT_TIMEOUT_S);
        while (!queries.stream().allMatch(CompletableFuture::isCancelled)) {
            if (System.nanoTime() > deadline)
                fail("Not all the queries were cancelled");
            Thread.sleep(10);
        }
    }

    private static Resolver resolver(Answer<CompletionStage<Message>> answer) {
        final var resolver = mock(Resolver.class);
        when(resolver.sendAsync(any(Message.class))).thenAnswer(answer);
        when(resolver.sendAsync(any(Message.class), any(Executor.class))).thenAnswer(answer);
        return resolver;
    }

    private static String key(Name name, int type) {
        return name.toString(true).toLowerCase() + "/" + Type.string(type);
    }

    private static Name name(String name) {
        try {
            return Name.fromString(name, Name.root);
        } catch (TextParseException e) {
            throw new IllegalArgumentException(e);
        }
    }
}
