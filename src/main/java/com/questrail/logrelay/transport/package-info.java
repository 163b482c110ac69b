/**
 * Relay Transport Ports
 * =============================================================================
 *
 * Framework-agnostic boundary between a concrete network server (Netty
 * WebSocket in production, in-memory fakes in tests) and the relay's session
 * handling.
 *
 * <p>Everything above this boundary sees only:</p>
 * <ul>
 *   <li>Connections as {@link com.questrail.logrelay.transport.ClientEndpoint}</li>
 *   <li>Inbound frames as complete text payloads</li>
 *   <li>Connection lifecycle notifications (open/close)</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only; frames are neither decoded nor interpreted</li>
 *   <li>Not touch subscriptions, pollers or the deduplication index</li>
 *   <li>Not schedule polls</li>
 * </ul>
 */
package com.questrail.logrelay.transport;
