package org.apirepository.repository.event;

import lombok.Getter;
import org.apirepository.iterator.exception.IteratorException;

import java.util.EventObject;

/**
 * Published by a repository when {@code find} or {@code getAll} catches a fault while
 * traversing its data source. The call that raised it returns an empty result.
 */
@Getter
public class IterationErrorEvent extends EventObject {

    /** The traversal fault, wrapping the original cause. */
    private final IteratorException exception;

    /**
     * @param source    repository that caught the fault
     * @param exception the wrapped fault, required
     * @throws IllegalArgumentException if {@code exception} is null
     */
    public IterationErrorEvent(Object source, IteratorException exception) {
        super(source);
        if (exception == null) {
            throw new IllegalArgumentException("exception must not be null");
        }
        this.exception = exception;
    }

    @Override
    public String toString() {
        return "IterationErrorEvent[source=" + getSource() + ", exception=" + exception + "]";
    }
}
