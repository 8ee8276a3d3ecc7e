package com.intentbench.classifier;

import java.util.function.Function;

/**
 * Outcome of a single {@link ClassificationMethod#classify} call: either a result or a typed
 * error. Methods report every failure through this type instead of throwing.
 */
public sealed interface MethodResult permits MethodResult.Success, MethodResult.Failure {

    static MethodResult success(ClassificationResult result) {
        return new Success(result);
    }

    static MethodResult failure(ClassificationError error) {
        return new Failure(error);
    }

    static MethodResult failure(ErrorKind kind, String message, String methodTag) {
        return new Failure(ClassificationError.of(kind, message, methodTag));
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    ClassificationResult result();

    ClassificationError error();

    default MethodResult map(Function<ClassificationResult, ClassificationResult> mapper) {
        return isSuccess() ? success(mapper.apply(result())) : this;
    }

    record Success(ClassificationResult value) implements MethodResult {
        public Success {
            if (value == null) {
                throw new IllegalArgumentException("Success value must not be null");
            }
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public ClassificationResult result() {
            return value;
        }

        @Override
        public ClassificationError error() {
            throw new IllegalStateException("Successful classification has no error");
        }
    }

    record Failure(ClassificationError cause) implements MethodResult {
        public Failure {
            if (cause == null) {
                throw new IllegalArgumentException("Failure cause must not be null");
            }
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public ClassificationResult result() {
            throw new IllegalStateException("Failed classification has no result: " + cause.describe());
        }

        @Override
        public ClassificationError error() {
            return cause;
        }
    }
}
