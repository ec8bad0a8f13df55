/**
 * Handler registration and dispatch.
 *
 * <p>Handlers are described once, at registration, by a
 * {@link com.questrail.msgrpc.handler.HandlerDescriptor}. The endpoint never
 * inspects handler types during dispatch; it hands the raw params array to
 * {@link com.questrail.msgrpc.handler.HandlerInvoker}, which binds it using
 * the descriptor.</p>
 */
package com.questrail.msgrpc.handler;
