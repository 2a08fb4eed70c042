package com.zonecast.pusher.support;

import com.zonecast.pusher.external.TelemetrySink;

import java.util.ArrayList;
import java.util.List;

public class RecordingTelemetry implements TelemetrySink {
    public final List<Throwable> errors = new ArrayList<>();
    public final List<String> messages = new ArrayList<>();

    @Override
    public synchronized void report(Throwable error) {
        errors.add(error);
    }

    @Override
    public synchronized void report(String message) {
        messages.add(message);
    }

    public synchronized int count() {
        return errors.size() + messages.size();
    }
}
