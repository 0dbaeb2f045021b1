package com.hotpreview.core.scheduler;

import java.util.ArrayList;
import java.util.List;

/**
 * Cancellation flag for one running rebuild. Hooks registered before or after
 * {@link #cancel()} each run exactly once.
 */
public final class Cancellation {

    private final List<Runnable> hooks = new ArrayList<>();
    private boolean cancelled;

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    /**
     * Registers an action to run on cancellation. Runs immediately if already cancelled.
     */
    public void onCancel(Runnable hook) {
        synchronized (this) {
            if (!cancelled) {
                hooks.add(hook);
                return;
            }
        }
        hook.run();
    }

    public void cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = List.copyOf(hooks);
            hooks.clear();
        }
        toRun.forEach(Runnable::run);
    }
}
