package com.community.moderation.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
public class TrustTierChangeListener {

    private static final Logger log = LoggerFactory.getLogger(TrustTierChangeListener.class);

    // 事务提交后才视为生效
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onTierChanged(TrustTierChangedEvent event) {
        if (event.isPromotion()) {
            log.info("用户 {} 信任等级提升: {} -> {} (score={})",
                    event.getUserId(), event.getPreviousTier(), event.getNewTier(), event.getOverallScore());
        } else {
            log.warn("用户 {} 信任等级下降: {} -> {} (score={})",
                    event.getUserId(), event.getPreviousTier(), event.getNewTier(), event.getOverallScore());
        }
    }
}
