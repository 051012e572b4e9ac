package ai.lspgateway.testutil;

import ai.lspgateway.connection.ClientChannel;
import com.google.gson.JsonObject;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** A client channel that keeps every event it is sent. */
public final class RecordingChannel implements ClientChannel {

    public record Event(String name, JsonObject payload) {}

    private final String id;
    private final List<Event> events = new CopyOnWriteArrayList<>();

    public RecordingChannel(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void emit(String event, JsonObject payload) {
        events.add(new Event(event, payload));
    }

    public List<Event> events() {
        return List.copyOf(events);
    }

    public List<Event> events(String name) {
        return events.stream().filter(event -> event.name().equals(name)).toList();
    }

    public Event awaitEvent(String name) {
        Await.until(name + " on channel " + id, () -> !events(name).isEmpty());
        return events(name).get(0);
    }
}
