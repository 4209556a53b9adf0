package dao.tron.msig.event;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Republishes committed ledger events on the application context.
 */
@Component
public class SpringLedgerEventPublisher implements LedgerEventListener {

    private final ApplicationEventPublisher publisher;

    public SpringLedgerEventPublisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void onEvent(LedgerEvent event) {
        publisher.publishEvent(event);
    }
}
