/**
 * Trait Stream Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete HTTP client (Netty, the JDK client, or a test double)
 * and the stream session.
 *
 * <p>Everything above the transport adapter sees only:</p>
 * <ul>
 *   <li>Raw response chunks as {@code byte[]}</li>
 *   <li>Endpoints as {@link java.net.URI}</li>
 *   <li>Failures as {@link com.questrail.traitstream.transport.TransportException}</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no protocol interpretation)</li>
 *   <li>Not reassemble or decode frames</li>
 *   <li>Not schedule retries or reconnects</li>
 * </ul>
 */
package com.questrail.traitstream.transport;
