package com.marketsim.infra;

import com.marketsim.api.Fill;
import com.marketsim.infra.journal.Journal;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

class RecordingJournal implements Journal {

    final List<Fill> fills = new CopyOnWriteArrayList<>();
    final List<String> halts = new CopyOnWriteArrayList<>();
    final List<String> events = new CopyOnWriteArrayList<>();
    volatile boolean closed;

    @Override
    public void recordFill(Fill fill) {
        fills.add(fill);
    }

    @Override
    public void recordHalt(String symbol, long tick, String reason, String state) {
        halts.add(symbol);
    }

    @Override
    public void recordEvent(CharSequence event, long value) {
        events.add(event.toString());
    }

    @Override
    public void close() {
        closed = true;
    }
}
