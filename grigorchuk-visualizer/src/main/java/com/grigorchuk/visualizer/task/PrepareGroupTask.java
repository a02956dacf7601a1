package com.grigorchuk.visualizer.task;

import com.grigorchuk.core.algebra.CayleyLayers;
import com.grigorchuk.core.algebra.GrigorchukGroup;
import java.util.Objects;
import javafx.application.Platform;
import javafx.concurrent.Task;

/**
 * Background task that enumerates the Cayley layers of a group before the explorer starts stepping
 * through it. The group must not be touched by any other thread until the task completes.
 */
public final class PrepareGroupTask extends Task<CayleyLayers> {

    private final GrigorchukGroup group;

    public PrepareGroupTask(GrigorchukGroup group) {
        this.group = Objects.requireNonNull(group, "group");
    }

    @Override
    protected CayleyLayers call() {
        boolean onFxThread;
        try {
            onFxThread = Platform.isFxApplicationThread();
        } catch (IllegalStateException ex) {
            onFxThread = false;
        }
        if (onFxThread) {
            throw new IllegalStateException("Enumeration must not run on the JavaFX application thread");
        }

        updateMessage(String.format("Enumerating up to %d elements...", group.limit()));
        group.prepare();
        CayleyLayers layers = group.layers();
        updateMessage(String.format("Enumerated %d elements, complete to depth %d",
                layers.processed(), layers.completeDepth()));
        return layers;
    }
}
