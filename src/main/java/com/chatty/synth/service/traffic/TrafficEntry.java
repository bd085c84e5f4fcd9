package com.chatty.synth.service.traffic;

/**
 * One recorded exchange.
 *
 * @param dir {@code in} for requests, {@code out} for replies
 * @param payload JSON-serializable request or reply body
 * @param ts ISO-8601 timestamp
 */
public record TrafficEntry(String dir, Object payload, String ts) {}
