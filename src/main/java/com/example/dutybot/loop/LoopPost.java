package com.example.dutybot.loop;

/**
 * A Loop message. {@code rootId} is the thread root and equals {@code id} for root posts.
 */
public record LoopPost(String id, String rootId, String userId, String message, long createAt) {
}
