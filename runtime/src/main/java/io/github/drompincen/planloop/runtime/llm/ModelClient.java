package io.github.drompincen.planloop.runtime.llm;

/**
 * Provider-neutral text completion. Implementations make exactly one call per
 * invocation; retrying and ledgering are the caller's concern.
 */
public interface ModelClient {

    /**
     * @throws ModelUnavailableException network, auth or missing credential
     * @throws ModelTimeoutException     the per-call timeout elapsed
     * @throws ModelRejectedException    the provider refused the request
     */
    ModelResponse generate(String prompt, String systemInstructions, int maxTokens, double temperature);

    String provider();

    String model();
}
