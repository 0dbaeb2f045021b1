package com.hotpreview.core.events;

/**
 * Returned by {@link BroadcastHub#subscribe}; pass back to {@link BroadcastHub#unsubscribe} to close.
 *
 * @param channelId channel id
 * @param projectId bound project, or {@code null} for a global catalogue subscriber
 */
public record ChannelHandle(String channelId, String projectId) {

    public boolean isGlobal() {
        return projectId == null;
    }
}
