package io.survivalmesh.model;

/**
 * "I'm coming" response to a post, flooded as an {@code ack} message.
 */
public record ComingAck(String postId, String houseNumber) {
}
