package lab.escrow.notify;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ApplicationEventStatusNotifier implements StatusNotifier {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public void publish(StatusChangeEvent event) {
        try {
            eventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.warn("event=notifier.publish.failed requestId={} type={} error={}",
                    event.requestId(), event.type(), e.getMessage());
        }
    }
}
