/**
 * Radio adapters. {@link io.survivalmesh.transport.LoopbackMesh} simulates range in-process;
 * {@link io.survivalmesh.transport.UdpTransport} runs nodes over datagrams.
 */
package io.survivalmesh.transport;
