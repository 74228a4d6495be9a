/**
 * Netty pipeline of an accepted connection.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link me.internalizable.tatc.pipeline.FrontendChannelInitializer} - Registers the connection and builds its pipeline</li>
 *   <li>{@link me.internalizable.tatc.pipeline.RequestDispatchHandler} - Resolves the request and runs the application handler</li>
 * </ul>
 */
package me.internalizable.tatc.pipeline;
