package com.flagship.invoice_ledger.provider;

/**
 * Outcome of {@link ProviderRegistry#selectProvider()}: either a provider that
 * holds a reserved quota slot, or exhaustion of every configured provider.
 */
public final class ProviderSelection {

    private static final ProviderSelection EXHAUSTED = new ProviderSelection(null);

    private final InferenceProvider provider;

    private ProviderSelection(InferenceProvider provider) {
        this.provider = provider;
    }

    static ProviderSelection of(InferenceProvider provider) {
        return new ProviderSelection(provider);
    }

    public static ProviderSelection exhausted() {
        return EXHAUSTED;
    }

    public boolean isExhausted() {
        return provider == null;
    }

    public InferenceProvider provider() {
        if (provider == null) {
            throw new IllegalStateException("No provider selected: all providers exhausted");
        }
        return provider;
    }

    @Override
    public String toString() {
        return isExhausted() ? "EXHAUSTED" : provider.getId();
    }
}
