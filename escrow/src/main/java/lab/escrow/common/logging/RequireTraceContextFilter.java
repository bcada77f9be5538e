package lab.escrow.common.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;

import java.util.Map;
import java.util.Set;

/**
 * Accepts only events that carry a trace key in the MDC: the HTTP correlationId,
 * or the requestId/txHash set by background submission and confirmation workers.
 * Used by the pipeline file appender.
 */
public class RequireTraceContextFilter extends Filter<ILoggingEvent> {

    static final Set<String> TRACE_KEYS = Set.of("correlationId", "requestId", "txHash");

    @Override
    public FilterReply decide(ILoggingEvent event) {
        if (event == null) {
            return FilterReply.DENY;
        }
        Map<String, String> mdc = event.getMDCPropertyMap();
        if (mdc == null) {
            return FilterReply.DENY;
        }
        for (String key : TRACE_KEYS) {
            if (mdc.containsKey(key)) {
                return FilterReply.NEUTRAL;
            }
        }
        return FilterReply.DENY;
    }
}
