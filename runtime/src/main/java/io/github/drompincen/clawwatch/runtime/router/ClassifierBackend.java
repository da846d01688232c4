package io.github.drompincen.clawwatch.runtime.router;

/**
 * Remote model used to classify events. Returns the raw completion text.
 */
public interface ClassifierBackend {

    String classify(String prompt, int maxTokens);
}
