// SPDX-License-Identifier: MIT OR Apache-2.0
package io.chainweave.gateway;

import java.util.Objects;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chainweave.core.DebugLogger;
import io.chainweave.core.error.UnauthorizedCallerException;
import io.chainweave.core.types.Address;
import io.chainweave.core.types.HexData;

/**
 * Binds a domain component (hub or minter) to a {@link MessageTransport}.
 *
 * <p>Outbound, it stamps the local chain and endpoint on every message. Inbound,
 * it is the authentication boundary: a delivery is forwarded to the bound
 * {@link InboundHandler} only when {@link CallContext#sender()} is the
 * configured transport principal. Anything else is rejected with
 * {@link UnauthorizedCallerException} before the handler sees it, so forged
 * completion or failure notices never reach domain state.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * GatewayAdapter gateway = new GatewayAdapter(1L, hubEndpoint, transport.principal(), transport);
 * RequestRegistry hub = new RequestRegistry(config, gateway, store, clock);
 * gateway.bind(hub);
 * }</pre>
 */
public final class GatewayAdapter implements MessagingGateway, TransportReceiver {

    private static final Logger log = LoggerFactory.getLogger(GatewayAdapter.class);

    private final long localChainId;
    private final Address identity;
    private final Address transportPrincipal;
    private final MessageTransport transport;

    private volatile @Nullable InboundHandler handler;

    /**
     * @param localChainId       chain this adapter lives on
     * @param identity           endpoint address of this adapter; also the caller
     *                           identity passed to the inbound handler
     * @param transportPrincipal the only sender accepted on inbound entry points
     * @param transport          transport used for outbound messages
     */
    public GatewayAdapter(
            final long localChainId,
            final Address identity,
            final Address transportPrincipal,
            final MessageTransport transport) {
        this.localChainId = localChainId;
        this.identity = Objects.requireNonNull(identity, "identity");
        this.transportPrincipal = Objects.requireNonNull(transportPrincipal, "transportPrincipal");
        this.transport = Objects.requireNonNull(transport, "transport");
        if (identity.isZero() || transportPrincipal.isZero()) {
            throw new IllegalArgumentException("gateway identity and transport principal must be non-zero");
        }
    }

    /**
     * Attaches the inbound handler and registers this adapter with the transport.
     * May be called once.
     */
    public synchronized void bind(final InboundHandler inboundHandler) {
        Objects.requireNonNull(inboundHandler, "inboundHandler");
        if (handler != null) {
            throw new IllegalStateException("gateway " + identity + " is already bound");
        }
        handler = inboundHandler;
        transport.register(localChainId, identity, this);
        log.debug("Gateway {} bound on chain {}", identity, localChainId);
    }

    public long localChainId() {
        return localChainId;
    }

    @Override
    public Address identity() {
        return identity;
    }

    // ==================== Outbound ====================

    @Override
    public DeliveryHandle send(
            final long targetChainId,
            final Address targetEndpoint,
            final byte[] payload,
            final byte @Nullable [] revertPayload) {
        Objects.requireNonNull(targetEndpoint, "targetEndpoint");
        Objects.requireNonNull(payload, "payload");
        final OutboundMessage message = new OutboundMessage(
                localChainId,
                identity,
                targetChainId,
                targetEndpoint,
                HexData.fromBytes(payload),
                revertPayload == null ? null : HexData.fromBytes(revertPayload));
        final DeliveryHandle handle = transport.submit(message);
        DebugLogger.logMessage("[SEND] id=%s from=%d:%s to=%d:%s bytes=%d",
                handle.id(), localChainId, identity, targetChainId, targetEndpoint, payload.length);
        return handle;
    }

    // ==================== Inbound ====================

    @Override
    public void onInboundCall(final CallContext context, final byte[] payload) {
        final InboundHandler target = authenticate(context, "onInboundCall");
        DebugLogger.logMessage("[RECV] to=%s from=%d:%s bytes=%d",
                identity, context.sourceChainId(), context.sourceEndpoint(), payload.length);
        target.onCall(identity, context, payload);
    }

    @Override
    public void onInboundFailure(final CallContext context, final byte[] payload) {
        final InboundHandler target = authenticate(context, "onInboundFailure");
        DebugLogger.logMessage("[REVERT] to=%s from=%d:%s bytes=%d",
                identity, context.sourceChainId(), context.sourceEndpoint(), payload.length);
        target.onRevert(identity, context, payload);
    }

    private InboundHandler authenticate(final CallContext context, final String entryPoint) {
        Objects.requireNonNull(context, "context");
        if (!transportPrincipal.equals(context.sender())) {
            log.warn("Rejected {} on gateway {} from untrusted sender {}", entryPoint, identity, context.sender());
            throw new UnauthorizedCallerException(context.sender(), "the transport principal");
        }
        final InboundHandler target = handler;
        if (target == null) {
            throw new IllegalStateException("gateway " + identity + " has no inbound handler");
        }
        return target;
    }
}
