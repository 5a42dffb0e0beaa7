package dev.pekelund.ezexpense.reconciliation;

import java.util.Objects;

public record RemoveReceipt(String name, ContainerRef container) {

    public RemoveReceipt {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(container, "container");
    }
}
