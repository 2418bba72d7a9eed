// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit.exception;

import io.retrykit.util.ExceptionHelper;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Immutable, ordered record of the failed attempts of one retry loop. Iteration order is attempt order, so the last
 * element is always the most recent failure.
 */
public final class AttemptErrors implements Iterable<AttemptError> {
    private static final AttemptErrors EMPTY = new AttemptErrors(List.of());

    private final List<AttemptError> errors;

    public AttemptErrors(List<AttemptError> errors) {
        this.errors = List.copyOf(errors);
    }

    public static AttemptErrors empty() {
        return EMPTY;
    }

    public int size() {
        return errors.size();
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public AttemptError get(int index) {
        return errors.get(index);
    }

    /** @return the recorded attempt errors, oldest first */
    public List<AttemptError> asList() {
        return errors;
    }

    /** @return the most recently recorded attempt error, if any attempt failed */
    public Optional<AttemptError> latest() {
        return errors.isEmpty() ? Optional.empty() : Optional.of(errors.get(errors.size() - 1));
    }

    /** @return the underlying exceptions, oldest first */
    public List<Throwable> causes() {
        return errors.stream().map(AttemptError::error).toList();
    }

    /**
     * Checks whether any recorded exception is, or was caused by, the target.
     *
     * @param target the exception to look for
     * @return true if some attempt failed with the target somewhere in its chain
     */
    public boolean contains(Throwable target) {
        return errors.stream().anyMatch(e -> ExceptionHelper.isOrCausedBy(e.error(), target));
    }

    /**
     * Checks whether any recorded exception is, or was caused by, an exception of the given type.
     *
     * @param type the type to look for
     * @return true if some attempt failed with such an exception somewhere in its chain
     */
    public boolean contains(Class<? extends Throwable> type) {
        return find(type).isPresent();
    }

    /**
     * Finds the first exception of the given type in the chains of the recorded exceptions, oldest attempt first.
     *
     * @param type the type to look for
     * @param <T> the type to look for
     * @return the matching exception, if any
     */
    public <T extends Throwable> Optional<T> find(Class<T> type) {
        for (AttemptError error : errors) {
            var found = ExceptionHelper.findInChain(error.error(), type);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    @Override
    public Iterator<AttemptError> iterator() {
        return errors.iterator();
    }

    @Override
    public String toString() {
        return errors.toString();
    }
}
