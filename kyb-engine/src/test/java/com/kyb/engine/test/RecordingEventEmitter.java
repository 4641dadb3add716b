package com.kyb.engine.test;

import com.kyb.core.telemetry.EventEmitter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every emitted event; optionally throws on each one.
 */
public class RecordingEventEmitter implements EventEmitter {

    public record Event(String name, Map<String, String> fields, Throwable error) {}

    private final List<Event> events = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    public static RecordingEventEmitter failingEmitter() {
        RecordingEventEmitter emitter = new RecordingEventEmitter();
        emitter.failing = true;
        return emitter;
    }

    @Override
    public void emitEvent(String eventName, Map<String, String> fields) {
        events.add(new Event(eventName, Map.copyOf(fields), null));
        if (failing) {
            throw new IllegalStateException("Injected telemetry failure");
        }
    }

    @Override
    public void emitError(String eventName, Throwable error, Map<String, String> fields) {
        events.add(new Event(eventName, Map.copyOf(fields), error));
        if (failing) {
            throw new IllegalStateException("Injected telemetry failure");
        }
    }

    public List<Event> events() {
        return List.copyOf(events);
    }

    public List<String> names() {
        return events.stream().map(Event::name).toList();
    }

    public List<Event> named(String eventName) {
        return events.stream().filter(e -> e.name().equals(eventName)).toList();
    }
}
