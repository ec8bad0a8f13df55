/**
 * MessagePack Value Codec
 * =============================================================================
 *
 * <p>Streaming encoder and pull-style decoder for the MessagePack wire format,
 * together with the two value carriers the RPC layers above depend on:</p>
 *
 * <ul>
 *   <li>{@link com.questrail.msgrpc.msgpack.RawValue}: one complete encoded
 *       value, captured verbatim so its interpretation can be deferred.</li>
 *   <li>{@link com.questrail.msgrpc.msgpack.ExtensionValue}: an application
 *       extension whose tag has no registered codec.</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   InputStream / OutputStream
 *        → MessagePackDecoder / MessagePackEncoder   (wire rules applied here)
 *            → internal.bind                          (Java object binding)
 *                → codec                              (RPC envelopes)
 * </pre>
 *
 * <p>This package knows nothing about requests, responses or notifications.
 * All failures are reported as {@link com.questrail.msgrpc.msgpack.MessagePackException}
 * or its subclass {@link com.questrail.msgrpc.msgpack.ConvertException}.</p>
 */
package com.questrail.msgrpc.msgpack;
