package com.example.agentdeployer.deployment;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Bounded buffer between a running deployment and whoever polls its progress.
 * Publishing never blocks: when the buffer is full the oldest event is dropped.
 */
public class ProgressChannel implements DeploymentProgressListener {

    private final BlockingQueue<DeploymentProgress> queue;
    private final AtomicReference<DeploymentProgress> latest = new AtomicReference<>();

    public ProgressChannel(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    @Override
    public void onProgress(DeploymentProgress progress) {
        latest.set(progress);
        while (!queue.offer(progress)) {
            queue.poll();
        }
    }

    /** Removes and returns everything buffered so far, oldest first. */
    public List<DeploymentProgress> drain() {
        List<DeploymentProgress> events = new ArrayList<>(queue.size());
        queue.drainTo(events);
        return events;
    }

    /** Most recent event, kept even after it has been drained. */
    public DeploymentProgress latest() {
        return latest.get();
    }

    public boolean isFinished() {
        DeploymentProgress last = latest.get();
        return last != null && last.stage().isTerminal();
    }
}
