package assistant.core.model.sync;

/**
 * A provider entry as listed by llama-stack.
 *
 * @param api          llama-stack API the provider serves (e.g. "inference")
 * @param providerId   provider identifier
 * @param providerType provider implementation type
 */
public record ProviderDescriptor(String api, String providerId, String providerType) {}
