package com.fieldcrypto.infrastructure.audit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

@Service
@Slf4j
public class LoggingAuditService implements AuditService {

    @Override
    public void record(String category, String action, String resourceId, String detail) {
        log.info("AUDIT category={} action={} resourceId={} detail={} at={}",
                category, action, resourceId, detail, Instant.now());
    }
}
