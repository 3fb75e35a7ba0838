package io.cardstore.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Card identity.
 * <p>
 * A card has an identity only when it is a JSON object whose "id" member is
 * present and not JSON null. The identity is the id coerced to a string, so
 * {"id": 7} and {"id": "7"} name the same record.
 * <p>
 * Object and array ids render as compact JSON text ({"k":1}, [1,2]), so two
 * different object ids never collide.
 */
public final class CardKeys {

    public static final String ID_FIELD = "id";

    private CardKeys() {
        // utility
    }

    /** Stringified id of 'card', or empty for anonymous cards. */
    public static Optional<String> keyOf(JsonNode card) {
        if (card == null || !card.isObject()) {
            return Optional.empty();
        }
        JsonNode id = card.get(ID_FIELD);
        if (id == null || id.isNull() || id.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(stringify(id));
    }

    static String stringify(JsonNode id) {
        if (id.isTextual()) {
            return id.textValue();
        }
        if (id.isNumber()) {
            BigDecimal dec = id.decimalValue();
            if (dec.signum() == 0) {
                return "0";
            }
            dec = dec.stripTrailingZeros();
            return dec.toPlainString();
        }
        if (id.isBoolean()) {
            return Boolean.toString(id.booleanValue());
        }
        // Objects, arrays, binary: compact JSON text.
        return id.toString();
    }
}
