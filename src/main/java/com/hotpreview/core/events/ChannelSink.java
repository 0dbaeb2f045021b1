package com.hotpreview.core.events;

import java.io.IOException;

/**
 * Transport end of a client channel (an SSE emitter in production).
 * Calls are serialized per channel by {@link ClientChannel}.
 */
public interface ChannelSink {

    void send(PreviewMessage message) throws IOException;

    void close();
}
