package dao.tron.msig.event;

@FunctionalInterface
public interface LedgerEventListener {

    void onEvent(LedgerEvent event);
}
