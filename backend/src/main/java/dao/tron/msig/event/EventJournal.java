package dao.tron.msig.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, in-memory record of every committed ledger event.
 */
@Slf4j
@Component
public class EventJournal {

    private final List<LedgerEvent> events = new ArrayList<>();

    @EventListener
    public synchronized void record(LedgerEvent event) {
        events.add(event);
        log.debug("Journaled {}", event);
    }

    public synchronized List<LedgerEvent> findAll() {
        return new ArrayList<>(events);
    }

    public synchronized List<LedgerEvent> findByIndex(long index) {
        List<LedgerEvent> out = new ArrayList<>();
        for (LedgerEvent event : events) {
            if (event.index() == index) out.add(event);
        }
        return out;
    }

    public synchronized int size() {
        return events.size();
    }
}
