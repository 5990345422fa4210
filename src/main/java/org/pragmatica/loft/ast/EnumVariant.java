package org.pragmatica.loft.ast;

import java.util.List;
import java.util.Optional;

/**
 * Enum variant; {@code payload} is present for tuple variants such as {@code Some(T)}, even when empty.
 */
public record EnumVariant(String name, Optional<List<Type>> payload) {
    public EnumVariant {
        payload = payload.map(List::copyOf);
    }
}
