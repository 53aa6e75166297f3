/**
 * JSON-RPC Codec: Stream Framing
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong>: the rules for
 * turning a raw, persistent byte stream into discrete JSON values and back.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] chunk (one socket read)
 *        → JsonFrameDecoder       (value delimiting, partial retention)
 *            → JsonNode
 *                → JsonRpcMessageDecoder
 *                    → JsonRpcMessage → routing
 * </pre>
 *
 * <h2>Stream semantics</h2>
 * <p>Socket reads bear no relation to message boundaries. One read may carry
 * several messages; one message may span several reads. The decoder absorbs
 * both cases. Malformed content is reported once and the retained partial
 * input is dropped; it never stalls the stream.</p>
 */
package com.questrail.triggerware.protocol.jsonrpc.codec;
