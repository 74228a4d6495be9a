/**
 * Types shared between the front end and the application it serves.
 *
 * <p>The front end accepts connections, resolves the real client from forwarding headers and hands
 * each request to a {@link me.internalizable.tatc.api.http.RequestHandler} as a
 * {@link me.internalizable.tatc.api.http.RequestContext}.</p>
 *
 * <h2>Key Types</h2>
 * <ul>
 *   <li>{@link me.internalizable.tatc.api.http.RequestContext} - One resolved request</li>
 *   <li>{@link me.internalizable.tatc.api.http.ClientAddress} - The address a request is attributed to</li>
 *   <li>{@link me.internalizable.tatc.api.http.RequestHeaders} - Ordered, case-insensitive headers</li>
 *   <li>{@link me.internalizable.tatc.api.http.HandlerResponse} - What a handler sends back</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * public final class WhoAmIHandler implements RequestHandler {
 *     public HandlerResponse handle(RequestContext ctx) {
 *         return HandlerResponse.text(200, ctx.clientAddress().host());
 *     }
 * }
 * }</pre>
 */
package me.internalizable.tatc.api.http;
