package com.example.mmocore;

import com.example.mmocore.net.Connection;
import com.example.mmocore.net.EventType;
import com.example.mmocore.net.OutboundMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * Connection that keeps every message sent to it.
 */
public class RecordingConnection implements Connection {

    private final String id;
    private final List<OutboundMessage> messages = new ArrayList<>();

    public RecordingConnection(String id) {
        this.id = id;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public void send(OutboundMessage message) {
        messages.add(message);
    }

    public List<OutboundMessage> all() {
        return messages;
    }

    public List<OutboundMessage> ofType(EventType type) {
        List<OutboundMessage> out = new ArrayList<>();
        for (OutboundMessage m : messages) {
            if (m.type() == type) out.add(m);
        }
        return out;
    }

    public int count(EventType type) {
        return ofType(type).size();
    }

    /**
     * Last message of a type, or null.
     */
    public OutboundMessage last(EventType type) {
        List<OutboundMessage> list = ofType(type);
        return list.isEmpty() ? null : list.get(list.size() - 1);
    }

    public void clear() {
        messages.clear();
    }
}
