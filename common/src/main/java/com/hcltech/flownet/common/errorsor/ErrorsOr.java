package com.hcltech.flownet.common.errorsor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Either a value or a non-empty list of error messages. Used where every problem
 * should be reported at once instead of failing on the first one.
 */
public interface ErrorsOr<T> {

    boolean isError();

    boolean isValue();

    Optional<T> getValue();

    List<String> getErrors();

    <T1> T1 fold(Function<T, T1> onValue, Function<List<String>, T1> onError);

    // --- Helpers ---
    static <T> ErrorsOr<T> lift(T value) {
        return new Value<>(value);
    }

    static <T> ErrorsOr<T> error(String error) {
        return new Error<>(List.of(error));
    }

    static <T> ErrorsOr<T> errors(List<String> errors) {
        return new Error<>(errors);
    }

    /** Value when {@code errors} is empty, otherwise all of them. */
    static <T> ErrorsOr<T> liftOrErrors(T value, Collection<String> errors) {
        return errors.isEmpty() ? lift(value) : errors(new ArrayList<>(errors));
    }

    default T valueOrThrow() {
        return getValue().orElseThrow(() ->
                new IllegalStateException("Expected value but got errors: " + getErrors()));
    }

    /** Like {@link #valueOrThrow()} but lets the caller choose the exception. */
    default T valueOrThrow(Function<List<String>, ? extends RuntimeException> toException) {
        if (isError()) throw toException.apply(getErrors());
        return getValue().get();
    }

    // --- Functional helpers ---
    default <U> ErrorsOr<U> map(Function<? super T, ? extends U> f) {
        return isError() ? ErrorsOr.errors(getErrors()) : ErrorsOr.lift(f.apply(getValue().get()));
    }

    default <U> ErrorsOr<U> flatMap(Function<? super T, ErrorsOr<U>> f) {
        return isError() ? ErrorsOr.errors(getErrors()) : f.apply(getValue().get());
    }

    default ErrorsOr<T> addPrefixIfError(String prefix) {
        return isError() ? ErrorsOr.errors(getErrors().stream().map(e -> prefix + e).toList()) : this;
    }

    default void ifError(Consumer<? super List<String>> consumer) {
        if (isError()) consumer.accept(getErrors());
    }
}
