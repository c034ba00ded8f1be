/**
 * Conversation Codec: Wire-Level Implementation
 * =============================================================================
 *
 * <p>This package holds the byte-level rules of the conversation protocol:</p>
 *
 * <ul>
 *   <li>Unsigned LEB128 varints ({@link com.questrail.conversation.protocol.codec.Leb128}),
 *       shared with the message-body grammar</li>
 *   <li>Envelope header layout and payload delimiting</li>
 * </ul>
 *
 * <h2>Envelope Layout</h2>
 * <pre>
 *   offset  size  field
 *   0       8     cookie          u64, little-endian, bit 63 = server origin
 *   8       2     kind            u16, little-endian
 *   10      2     flags           u16, little-endian
 *   12      1..10 payload length  unsigned LEB128
 *   ..      n     payload
 * </pre>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] WebSocket binary message
 *        → EnvelopeDecoder         (layout rules applied here)
 *            → Envelope            (raw kind, known flags, opaque payload)
 *                → WireMessageDecoder
 *                    → WireMessage
 * </pre>
 *
 * <p>Every binary WebSocket message carries exactly one envelope. Decoders
 * never buffer across messages.</p>
 */
package com.questrail.conversation.protocol.codec;
