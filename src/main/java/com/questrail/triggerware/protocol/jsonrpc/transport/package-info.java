/**
 * JSON-RPC Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (e.g., Netty TCP, a test double)
 * and the JSON-RPC transport.
 *
 * <h2>Why these ports exist</h2>
 * We use Netty in production (event loop model, robust lifecycle handling)
 * <strong>without</strong> letting Netty types leak into framing, correlation
 * or the session protocols.
 *
 * <p>Everything above the endpoint sees only:</p>
 * <ul>
 *   <li>Raw byte chunks as {@code byte[]}</li>
 *   <li>Connection lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations MUST:
 * <ul>
 *   <li>Perform transport I/O only (no JSON parsing)</li>
 *   <li>Deliver inbound chunks from exactly one receive task, in order</li>
 *   <li>Not reconnect; connection loss is terminal</li>
 * </ul>
 */
package com.questrail.triggerware.protocol.jsonrpc.transport;
