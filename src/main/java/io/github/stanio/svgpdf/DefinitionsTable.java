/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgpdf;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recorded element subtrees by id, for {@code <use>} expansion.
 * <p>
 * An element with an {@code id} opens a recording which collects its own
 * and its descendants' events until its end tag.  Recordings nest: events
 * go to every open recording.</p>
 */
final class DefinitionsTable {

    enum EventType { START, TEXT, END }

    static final class Event {

        final EventType type;
        final ElementKind kind;
        final String name;
        final Map<String, String> attributes;
        final String text;

        private Event(EventType type, ElementKind kind, String name,
                      Map<String, String> attributes, String text) {
            this.type = type;
            this.kind = kind;
            this.name = name;
            this.attributes = attributes;
            this.text = text;
        }

        static Event start(ElementKind kind, String name, Map<String, String> attributes) {
            return new Event(EventType.START, kind, name,
                             Collections.unmodifiableMap(attributes), null);
        }

        static Event text(String text) {
            return new Event(EventType.TEXT, null, null, Map.of(), text);
        }

        static Event end(ElementKind kind, String name) {
            return new Event(EventType.END, kind, name, Map.of(), null);
        }

        @Override
        public String toString() {
            switch (type) {
            case START: return "<" + name + " " + attributes + ">";
            case END:   return "</" + name + ">";
            default:    return text;
            }
        }

    }

    private static final class Recording {

        final String id;
        final List<Event> events = new ArrayList<>();

        Recording(String id) {
            this.id = id;
        }

    }

    private final Map<String, List<Event>> definitions = new HashMap<>();

    private final Deque<Recording> open = new ArrayDeque<>();

    boolean isRecording() {
        return !open.isEmpty();
    }

    /**
     * Opens a new recording with the given start event.
     */
    void begin(String id, Event start) {
        Recording recording = new Recording(id);
        recording.events.add(start);
        open.push(recording);
    }

    /**
     * Appends the given event to all open recordings.  Adjacent text
     * events are merged.
     */
    void append(Event event) {
        for (Recording recording : open) {
            List<Event> events = recording.events;
            int last = events.size() - 1;
            if (event.type == EventType.TEXT
                    && events.get(last).type == EventType.TEXT) {
                events.set(last, Event.text(events.get(last).text + event.text));
            } else {
                events.add(event);
            }
        }
    }

    /**
     * Closes the innermost recording and defines its id.  A later
     * definition replaces an earlier one with the same id.
     */
    String end() {
        Recording recording = open.pop();
        definitions.put(recording.id, Collections.unmodifiableList(recording.events));
        return recording.id;
    }

    /**
     * {@return the recorded events of the given id, starting with the
     * keyed element's start event; {@code null} if not defined}
     */
    List<Event> lookup(String id) {
        return definitions.get(id);
    }

    Set<String> ids() {
        return Collections.unmodifiableSet(definitions.keySet());
    }

}
