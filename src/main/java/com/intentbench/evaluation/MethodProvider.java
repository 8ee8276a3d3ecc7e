package com.intentbench.evaluation;

import com.intentbench.classifier.ClassificationMethod;

/**
 * Builds the method under test for one configuration. Unknown method names must yield a
 * method that fails every call rather than an exception.
 */
@FunctionalInterface
public interface MethodProvider {
    ClassificationMethod create(String methodName, String model);
}
