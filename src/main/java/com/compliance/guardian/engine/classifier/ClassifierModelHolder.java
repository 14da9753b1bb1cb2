package com.compliance.guardian.engine.classifier;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Points at the active classifier snapshot. Publishing swaps the reference in one
 * step; callers that already read a snapshot keep using it until they finish.
 */
@Component
public class ClassifierModelHolder {

    private final AtomicReference<ClassifierModel> current = new AtomicReference<>();

    public Optional<ClassifierModel> current() {
        return Optional.ofNullable(current.get());
    }

    /**
     * @return the snapshot that was replaced, or null if none was active
     */
    public ClassifierModel publish(ClassifierModel model) {
        if (model == null) {
            throw new IllegalArgumentException("Cannot publish a null model");
        }
        return current.getAndSet(model);
    }
}
