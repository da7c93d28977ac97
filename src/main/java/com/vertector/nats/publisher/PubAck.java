package com.vertector.nats.publisher;

/**
 * Acknowledgment of a stored message.
 *
 * @param stream    stream that stored the message
 * @param sequence  sequence number assigned by the stream
 * @param duplicate whether the server recognised the message id as a duplicate and
 *                  did not store it again
 */
public record PubAck(String stream, long sequence, boolean duplicate) {
}
