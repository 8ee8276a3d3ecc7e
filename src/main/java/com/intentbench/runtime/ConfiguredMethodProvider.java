package com.intentbench.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.intentbench.classifier.ClassificationMethod;
import com.intentbench.classifier.ClassificationMethodFactory;
import com.intentbench.classifier.MethodKind;
import com.intentbench.classifier.UnsupportedMethod;
import com.intentbench.evaluation.MethodProvider;

/**
 * Builds evaluation methods from configuration, with the model under test replacing every
 * configured model id.
 */
public class ConfiguredMethodProvider implements MethodProvider {
    private static final Logger log = LoggerFactory.getLogger(ConfiguredMethodProvider.class);

    private final MethodSettingsResolver resolver;
    private final ClassificationMethodFactory factory;

    public ConfiguredMethodProvider(MethodSettingsResolver resolver, ClassificationMethodFactory factory) {
        this.resolver = resolver;
        this.factory = factory;
    }

    /**
     * Never throws: unknown names and invalid settings both produce a method that fails every
     * call with {@code UnsupportedMethodError}.
     */
    @Override
    public ClassificationMethod create(String methodName, String model) {
        try {
            return build(methodName, model);
        } catch (IllegalArgumentException e) {
            log.warn("classifier.misconfigured method={} reason={}", methodName, e.getMessage());
            return new UnsupportedMethod(methodName,
                    "Invalid configuration for method '" + methodName + "': " + e.getMessage());
        }
    }

    /**
     * Like {@link #create}, but invalid settings throw {@link IllegalArgumentException}.
     */
    public ClassificationMethod build(String methodName, String model) {
        return resolver.resolve(methodName)
                .map(settings -> model == null || model.isBlank() ? settings : settings.withModel(model))
                .map(factory::create)
                .orElseGet(() -> new UnsupportedMethod(methodName,
                        "Unsupported method '" + methodName + "'. Supported: " + supportedNames()));
    }

    private static String supportedNames() {
        StringBuilder names = new StringBuilder();
        for (MethodKind kind : MethodKind.values()) {
            if (names.length() > 0) {
                names.append(", ");
            }
            names.append(kind.methodName());
        }
        return names.toString();
    }
}
