package com.reactive.xray.http.server;

import com.reactive.xray.observe.Log;

import java.util.ArrayList;
import java.util.List;

/**
 * Completion events of one response.
 *
 * <ul>
 *   <li><b>finish</b>: the response was fully handed to the transport.</li>
 *   <li><b>close</b>: the connection went away, possibly before any response
 *       (client abort).</li>
 * </ul>
 *
 * Each event fires at most once; the server adapter decides which ones fire and
 * in what order. Listeners registered after an event fired run immediately.
 * A failing listener is logged and does not stop the others.
 */
public final class ResponseLifecycle {

    private final List<Runnable> finishListeners = new ArrayList<>();
    private final List<Runnable> closeListeners = new ArrayList<>();

    private int status = 200;
    private long contentLength = -1;
    private boolean finished;
    private boolean closed;

    /**
     * Status of the response; 200 until something else was set.
     */
    public synchronized int status() {
        return status;
    }

    public synchronized void setStatus(int status) {
        this.status = status;
    }

    /**
     * Bytes written in the body, negative until known.
     */
    public synchronized long contentLength() {
        return contentLength;
    }

    public synchronized boolean isFinished() {
        return finished;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public void onFinish(Runnable listener) {
        boolean runNow;
        synchronized (this) {
            runNow = finished;
            if (!runNow) {
                finishListeners.add(listener);
            }
        }
        if (runNow) {
            fire(List.of(listener), "finish");
        }
    }

    public void onClose(Runnable listener) {
        boolean runNow;
        synchronized (this) {
            runNow = closed;
            if (!runNow) {
                closeListeners.add(listener);
            }
        }
        if (runNow) {
            fire(List.of(listener), "close");
        }
    }

    /**
     * Signal that the response went out with the given status and body size.
     */
    public void finish(int finalStatus, long finalContentLength) {
        List<Runnable> listeners;
        synchronized (this) {
            if (finished) {
                return;
            }
            finished = true;
            status = finalStatus;
            contentLength = finalContentLength;
            listeners = List.copyOf(finishListeners);
            finishListeners.clear();
        }
        fire(listeners, "finish");
    }

    /**
     * Signal that the connection serving this response closed.
     */
    public void close() {
        List<Runnable> listeners;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            listeners = List.copyOf(closeListeners);
            closeListeners.clear();
        }
        fire(listeners, "close");
    }

    private static void fire(List<Runnable> listeners, String event) {
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                Log.error("Response " + event + " listener failed", e);
            }
        }
    }
}
