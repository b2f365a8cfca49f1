/**
 * SurvivalMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.survivalmesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.survivalmesh.cli.SurvivalMeshCommand} maps commands to engine and codec APIs.</li>
 *   <li>{@code io.survivalmesh.gossip.GossipEngine} owns posts, dedup, the send queue and retries.</li>
 *   <li>{@code io.survivalmesh.chunk.MessageChunker} frames messages that exceed the radio limit.</li>
 * </ul>
 */
package io.survivalmesh;
