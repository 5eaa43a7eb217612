package com.github.salilvnair.formflow.engine.session;

import com.github.salilvnair.formflow.audit.AuditService;
import com.github.salilvnair.formflow.audit.DialogueAuditStage;
import com.github.salilvnair.formflow.config.FormFlowProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class SessionReaper {

    private final SessionStore sessionStore;
    private final FormFlowProperties properties;
    private final AuditService audit;

    @Scheduled(fixedDelayString = "${formflow.session.reaper-interval-ms:60000}")
    public void sweep() {
        Duration ttl = Duration.ofMinutes(properties.getSession().getTtlMinutes());
        int purged = sessionStore.purgeIdle(ttl);
        if (purged > 0) {
            log.info("Reaped {} idle sessions (ttl={}m, live={})", purged, ttl.toMinutes(), sessionStore.size());
            audit.audit(DialogueAuditStage.SESSION_REAPED, null, Map.of("purged", purged, "live", sessionStore.size()));
        }
    }
}
