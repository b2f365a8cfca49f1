/**
 * Flood gossip of survival posts.
 *
 * <p>{@link io.survivalmesh.gossip.GossipEngine} is the single owner of a node's protocol state;
 * {@link io.survivalmesh.gossip.PostValidator} holds the structural rules shared by local and
 * received posts.
 */
package io.survivalmesh.gossip;
