package org.apirepository.repository.event;

import java.util.EventListener;

/**
 * Receives {@link IterationErrorEvent}s synchronously, on the thread that called the repository.
 */
@FunctionalInterface
public interface IterationErrorListener extends EventListener {

    void onIterationError(IterationErrorEvent event);
}
