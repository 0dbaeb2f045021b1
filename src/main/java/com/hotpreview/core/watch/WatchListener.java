package com.hotpreview.core.watch;

import com.hotpreview.core.model.ChangeEvent;

/**
 * Receives a watcher's output. Both callbacks run on the watcher's single emitter thread,
 * in observation order, and must not block.
 */
public interface WatchListener {

    void onChange(ChangeEvent event);

    /**
     * Terminal: the watcher has stopped and emits nothing further.
     */
    void onError(String projectId, WatchException error);
}
