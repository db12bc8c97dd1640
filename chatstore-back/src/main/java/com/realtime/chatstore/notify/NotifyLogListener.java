package com.realtime.chatstore.notify;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Slf4j
@Component
public class NotifyLogListener {

    // 롤백된 트랜잭션의 이벤트는 여기까지 오지 않는다
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onCommitted(NotifyEvent event) {
        log.debug("notify {} from={} to={} conversation={}",
                event.getType(), event.getFrom(), event.getTo(), event.getConversationId());
    }
}
