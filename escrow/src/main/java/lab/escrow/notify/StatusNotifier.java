package lab.escrow.notify;

/**
 * Sink for request status changes. Implementations must not throw back into the pipeline.
 */
public interface StatusNotifier {

    void publish(StatusChangeEvent event);
}
