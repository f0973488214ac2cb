/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of an acquire: either the lease that was written or the reason it was refused.
 * Lets callers tell contention apart from a ledger outage without catching exceptions.
 */
public sealed interface LockResult<T> {

    static <T> LockResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> LockResult<T> failure(LockError error) {
        return new Failure<>(error);
    }

    /**
     * Collapses this result into a single value by applying the branch that matches.
     */
    <U> U fold(Function<? super T, ? extends U> onSuccess, Function<? super LockError, ? extends U> onFailure);

    default boolean isSuccess() {
        return fold(value -> true, error -> false);
    }

    /**
     * Gets the value, throws if the operation was refused.
     */
    default T getValue() {
        return fold(Function.identity(), error -> {
            throw new IllegalStateException("No value, operation was refused: " + error.message());
        });
    }

    default LockError getError() {
        return fold(value -> {
            throw new IllegalStateException("No error, operation succeeded");
        }, Function.identity());
    }

    record Success<T>(T value) implements LockResult<T> {
        @Override
        public <U> U fold(Function<? super T, ? extends U> onSuccess,
                          Function<? super LockError, ? extends U> onFailure) {
            return onSuccess.apply(value);
        }
    }

    record Failure<T>(LockError error) implements LockResult<T> {
        public Failure {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public <U> U fold(Function<? super T, ? extends U> onSuccess,
                          Function<? super LockError, ? extends U> onFailure) {
            return onFailure.apply(error);
        }
    }
}
