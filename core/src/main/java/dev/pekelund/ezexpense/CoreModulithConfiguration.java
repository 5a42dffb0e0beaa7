package dev.pekelund.ezexpense;

/**
 * Anchor for verifying the module structure of the core library.
 */
public final class CoreModulithConfiguration {

    private CoreModulithConfiguration() {
    }
}
