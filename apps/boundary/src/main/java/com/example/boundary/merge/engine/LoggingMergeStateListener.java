package com.example.boundary.merge.engine;

import com.example.boundary.common.util.StringSanitizer;
import com.example.boundary.merge.model.MergeState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingMergeStateListener implements MergeStateListener {

    @Override
    public void onTransition(MergeInvocation invocation, MergeState from, MergeState to) {
        if (to.isTerminal()) {
            log.info("Merge {} for couple {}: {} -> {}", invocation.invocationId(),
                    StringSanitizer.forLog(invocation.coupleId()), from, to);
        } else {
            log.debug("Merge {} for couple {}: {} -> {}", invocation.invocationId(),
                    StringSanitizer.forLog(invocation.coupleId()), from, to);
        }
    }
}
