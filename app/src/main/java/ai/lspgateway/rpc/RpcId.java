package ai.lspgateway.rpc;

import com.google.gson.JsonPrimitive;
import java.util.OptionalLong;

/** A JSON-RPC request id: a number or a string. */
public record RpcId(JsonPrimitive value) {

    public RpcId {
        if (!value.isNumber() && !value.isString()) {
            throw new IllegalArgumentException("JSON-RPC id must be a number or a string: " + value);
        }
    }

    public static RpcId of(long id) {
        return new RpcId(new JsonPrimitive(id));
    }

    public static RpcId of(String id) {
        return new RpcId(new JsonPrimitive(id));
    }

    /**
     * The integral value of this id, if it has one. Ids the gateway allocates are always integral, so a fractional
     * id never matches one.
     */
    public OptionalLong asLong() {
        try {
            return OptionalLong.of(
                    value.isNumber() ? value.getAsBigDecimal().longValueExact() : Long.parseLong(value.getAsString()));
        } catch (NumberFormatException | ArithmeticException e) {
            return OptionalLong.empty();
        }
    }

    @Override
    public String toString() {
        return value.getAsString();
    }
}
