/**
 * Conversation Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete WebSocket implementation (Netty, or a test double) and
 * the client sessions.
 *
 * <h2>Why these ports exist</h2>
 * Netty runs the production server (event loop model, HTTP upgrade, frame
 * aggregation) <strong>without</strong> Netty types leaking into sessions or
 * the broker. Everything above the adapter sees only:
 * <ul>
 *   <li>Whole binary and text messages as {@code byte[]} / {@code String}</li>
 *   <li>Ping, pong and close notifications</li>
 *   <li>A plain {@link java.util.concurrent.Executor} as execution context</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no envelope decoding)</li>
 *   <li>Answer pings and close handshakes themselves</li>
 *   <li>Not schedule keep-alive pings on their own</li>
 * </ul>
 */
package com.questrail.conversation.transport;
