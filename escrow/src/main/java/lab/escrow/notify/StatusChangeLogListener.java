package lab.escrow.notify;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

// Stand-in for the push transport: records what subscribers of the request would receive.
@Slf4j
@Component
public class StatusChangeLogListener {

    @EventListener
    public void onStatusChange(StatusChangeEvent event) {
        log.info("event=notifier.status_change requestId={} type={} txHash={} confirmations={} reason={}",
                event.requestId(),
                event.type(),
                event.txHash(),
                event.confirmations(),
                event.failureReason());
    }
}
