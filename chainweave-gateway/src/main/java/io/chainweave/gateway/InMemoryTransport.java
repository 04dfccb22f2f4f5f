// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.gateway;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chainweave.core.DebugLogger;
import io.chainweave.core.types.Address;

/**
 * Reference {@link MessageTransport} that keeps messages in memory until they are
 * delivered explicitly.
 *
 * <p>Each destination chain has its own FIFO queue. Nothing is delivered on
 * {@link #submit}; tests and simulations drive delivery with
 * {@link #deliverNext(long)} and {@link #deliverAll()}, which makes message
 * latency and interleaving fully controllable. {@link #duplicateNext(long)} and
 * {@link #reorder(long)} inject the at-least-once and reordering behavior real
 * transports exhibit.
 *
 * <p>When a receiver throws while executing a call, the message is marked
 * {@link DeliveryStatus#REVERTED} and its revert payload, if any, is queued back
 * to the sender's {@link TransportReceiver#onInboundFailure}.
 *
 * <p><b>Thread Safety:</b> queue operations are synchronized; receivers are
 * invoked outside the lock so they may send further messages.
 */
public final class InMemoryTransport implements MessageTransport {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTransport.class);

    private final Address principal;
    private final AtomicLong sequence = new AtomicLong();
    private final Map<Endpoint, TransportReceiver> receivers = new ConcurrentHashMap<>();

    // guarded by this
    private final Map<Long, Deque<Delivery>> queues = new TreeMap<>();

    public InMemoryTransport(final Address principal) {
        this.principal = Objects.requireNonNull(principal, "principal");
    }

    @Override
    public Address principal() {
        return principal;
    }

    @Override
    public void register(final long chainId, final Address endpoint, final TransportReceiver receiver) {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(receiver, "receiver");
        final TransportReceiver previous = receivers.putIfAbsent(new Endpoint(chainId, endpoint), receiver);
        if (previous != null && previous != receiver) {
            throw new IllegalStateException("endpoint " + chainId + ":" + endpoint + " is already registered");
        }
    }

    @Override
    public DeliveryHandle submit(final OutboundMessage message) {
        Objects.requireNonNull(message, "message");
        final Handle handle = new Handle(
                "msg-" + sequence.incrementAndGet(), message.targetChainId(), message.targetEndpoint());
        enqueue(message.targetChainId(), new Delivery(Kind.CALL, message, handle));
        return handle;
    }

    // ==================== Delivery control ====================

    /**
     * Delivers the oldest queued message for {@code chainId}.
     *
     * @return false if the queue was empty
     */
    public boolean deliverNext(final long chainId) {
        final Delivery next;
        synchronized (this) {
            final Deque<Delivery> queue = queues.get(chainId);
            if (queue == null || queue.isEmpty()) {
                return false;
            }
            next = queue.pollFirst();
        }
        if (next.kind() == Kind.CALL) {
            executeCall(next);
        } else {
            executeRevert(next);
        }
        return true;
    }

    /**
     * Delivers queued messages, including any sent while delivering, until every
     * queue is empty. Chains are served round-robin in ascending chain id order.
     *
     * @return number of deliveries performed
     */
    public int deliverAll() {
        int delivered = 0;
        boolean progress = true;
        while (progress) {
            progress = false;
            for (final long chainId : chainsWithPending()) {
                if (deliverNext(chainId)) {
                    delivered++;
                    progress = true;
                }
            }
        }
        return delivered;
    }

    /**
     * Queues a second copy of the next message for {@code chainId} directly behind it.
     *
     * @return false if the queue was empty
     */
    public synchronized boolean duplicateNext(final long chainId) {
        final Deque<Delivery> queue = queues.get(chainId);
        if (queue == null || queue.isEmpty()) {
            return false;
        }
        final Delivery head = queue.pollFirst();
        queue.addFirst(head);
        queue.addFirst(head);
        return true;
    }

    /**
     * Reverses the order of the messages queued for {@code chainId}.
     */
    public synchronized void reorder(final long chainId) {
        final Deque<Delivery> queue = queues.get(chainId);
        if (queue == null || queue.size() < 2) {
            return;
        }
        final List<Delivery> items = new ArrayList<>(queue);
        Collections.reverse(items);
        queue.clear();
        queue.addAll(items);
    }

    public synchronized int pendingCount(final long chainId) {
        final Deque<Delivery> queue = queues.get(chainId);
        return queue == null ? 0 : queue.size();
    }

    public synchronized int pendingCount() {
        int total = 0;
        for (final Deque<Delivery> queue : queues.values()) {
            total += queue.size();
        }
        return total;
    }

    // ==================== Internals ====================

    private synchronized void enqueue(final long chainId, final Delivery delivery) {
        queues.computeIfAbsent(chainId, id -> new ArrayDeque<>()).addLast(delivery);
    }

    private synchronized List<Long> chainsWithPending() {
        final List<Long> chains = new ArrayList<>();
        for (final Map.Entry<Long, Deque<Delivery>> entry : queues.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                chains.add(entry.getKey());
            }
        }
        return chains;
    }

    private void executeCall(final Delivery delivery) {
        final OutboundMessage message = delivery.message();
        final Handle handle = delivery.handle();
        final TransportReceiver receiver =
                receivers.get(new Endpoint(message.targetChainId(), message.targetEndpoint()));
        if (receiver == null) {
            revert(delivery, "no receiver at " + message.targetChainId() + ":" + message.targetEndpoint());
            return;
        }
        final CallContext context = new CallContext(principal, message.sourceChainId(), message.sourceEndpoint());
        try {
            receiver.onInboundCall(context, message.payload().toBytes());
            handle.status = DeliveryStatus.DELIVERED;
            DebugLogger.logMessage("[DELIVERED] id=%s", handle.id());
        } catch (RuntimeException e) {
            revert(delivery, e.getMessage());
        }
    }

    private void revert(final Delivery delivery, final @Nullable String reason) {
        final OutboundMessage message = delivery.message();
        delivery.handle().status = DeliveryStatus.REVERTED;
        log.warn("Message {} to {}:{} reverted: {}",
                delivery.handle().id(), message.targetChainId(), message.targetEndpoint(), reason);
        if (message.revertPayload() != null) {
            enqueue(message.sourceChainId(), new Delivery(Kind.REVERT, message, delivery.handle()));
        }
    }

    private void executeRevert(final Delivery delivery) {
        final OutboundMessage message = delivery.message();
        final TransportReceiver sender =
                receivers.get(new Endpoint(message.sourceChainId(), message.sourceEndpoint()));
        if (sender == null) {
            log.warn("Revert for message {} dropped: sender {}:{} is not registered",
                    delivery.handle().id(), message.sourceChainId(), message.sourceEndpoint());
            return;
        }
        final CallContext context = new CallContext(principal, message.targetChainId(), message.targetEndpoint());
        try {
            sender.onInboundFailure(context, Objects.requireNonNull(message.revertPayload()).toBytes());
        } catch (RuntimeException e) {
            log.error("Revert handler for message {} failed", delivery.handle().id(), e);
        }
    }

    private record Endpoint(long chainId, Address address) {
    }

    private enum Kind {
        CALL,
        REVERT
    }

    private record Delivery(Kind kind, OutboundMessage message, Handle handle) {
    }

    private static final class Handle implements DeliveryHandle {

        private final String id;
        private final long targetChainId;
        private final Address targetEndpoint;
        private volatile DeliveryStatus status = DeliveryStatus.QUEUED;

        Handle(final String id, final long targetChainId, final Address targetEndpoint) {
            this.id = id;
            this.targetChainId = targetChainId;
            this.targetEndpoint = targetEndpoint;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public long targetChainId() {
            return targetChainId;
        }

        @Override
        public Address targetEndpoint() {
            return targetEndpoint;
        }

        @Override
        public DeliveryStatus status() {
            return status;
        }

        @Override
        public String toString() {
            return "DeliveryHandle[" + id + ", " + status + "]";
        }
    }
}
