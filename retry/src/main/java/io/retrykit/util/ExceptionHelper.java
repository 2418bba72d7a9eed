// Copyright The RetryKit Authors. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package io.retrykit.util;

import io.retrykit.exception.AttemptError;
import io.retrykit.exception.RetryFailedException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/** Utility class for inspecting exception chains */
public final class ExceptionHelper {

    private ExceptionHelper() {}

    /**
     * Checks whether the target appears anywhere in the chain of the given exception.
     *
     * <p>The chain is the exception itself, its causes, its suppressed exceptions and, for a
     * {@link RetryFailedException}, every recorded attempt error along with their own chains.
     *
     * @param error the exception to inspect, may be null
     * @param target the exception to look for, compared with {@link Objects#equals}
     * @return true if the target was found
     */
    public static boolean isOrCausedBy(Throwable error, Throwable target) {
        if (target == null) {
            return false;
        }
        return search(error, candidate -> Objects.equals(candidate, target)).isPresent();
    }

    /**
     * Finds the first exception of the given type in the chain of the given exception, walked in the same order as
     * {@link #isOrCausedBy(Throwable, Throwable)}.
     *
     * @param error the exception to inspect, may be null
     * @param type the type to look for
     * @param <T> the type to look for
     * @return the first matching exception, if any
     */
    public static <T extends Throwable> Optional<T> findInChain(Throwable error, Class<T> type) {
        return search(error, type::isInstance).map(type::cast);
    }

    private static Optional<Throwable> search(Throwable error, Predicate<Throwable> predicate) {
        Set<Throwable> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        return search(error, predicate, visited);
    }

    private static Optional<Throwable> search(Throwable error, Predicate<Throwable> predicate, Set<Throwable> visited) {
        if (error == null || !visited.add(error)) {
            return Optional.empty();
        }
        if (predicate.test(error)) {
            return Optional.of(error);
        }
        if (error instanceof RetryFailedException) {
            for (AttemptError attemptError : ((RetryFailedException) error).getAttemptErrors()) {
                var found = search(attemptError.error(), predicate, visited);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        var found = search(error.getCause(), predicate, visited);
        if (found.isPresent()) {
            return found;
        }
        for (Throwable suppressed : error.getSuppressed()) {
            found = search(suppressed, predicate, visited);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }
}
