package dev.pekelund.ezexpense.reconciliation;

import java.util.Objects;

public record MoveReceipt(String name, ContainerRef from, ContainerRef to) {

    public MoveReceipt {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }
}
