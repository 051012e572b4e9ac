package ai.lspgateway.connection;

import com.google.gson.JsonObject;

/** Push channel to one client (a browser tab, a socket). Owned by the transport layer, not by the gateway. */
public interface ClientChannel {

    /** Opaque id, unique among the channels attached to one gateway. */
    String id();

    /**
     * Delivers {@code payload} under {@code event}. Must not block; may be called from any instance's lane.
     */
    void emit(String event, JsonObject payload);
}
