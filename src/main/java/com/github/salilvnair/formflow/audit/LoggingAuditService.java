package com.github.salilvnair.formflow.audit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Default audit sink: one log line per dialogue milestone. Hosts override it with a {@code @Primary}
 * {@link AuditService} bean.
 */
@Slf4j
@Service
public class LoggingAuditService implements AuditService {

    @Override
    public void audit(String stage, String sessionId, String payloadJson) {
        log.info("formflow audit stage={} sessionId={} payload={}", stage, sessionId, payloadJson);
    }
}
