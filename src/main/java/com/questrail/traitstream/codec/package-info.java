/**
 * Observe Stream Codec - Wire Framing
 * =============================================================================
 *
 * <p>The observe endpoint answers with one long-lived HTTP response body. The
 * body is a sequence of records, each a base-128 varint length followed by
 * exactly that many payload bytes (gRPC-web style framing without the flag
 * byte).</p>
 *
 * <pre>
 *   transport chunks
 *        → FrameBuffer      (accumulate, read prefix, slice payloads)
 *            → byte[] frame (one serialized StreamBody)
 *                → EnvelopeDecoder
 * </pre>
 *
 * <h2>Boundaries</h2>
 * <ul>
 *   <li>This package knows nothing about envelopes, traits or sessions.</li>
 *   <li>Netty buffers are used internally for accumulation and never escape.</li>
 * </ul>
 */
package com.questrail.traitstream.codec;
