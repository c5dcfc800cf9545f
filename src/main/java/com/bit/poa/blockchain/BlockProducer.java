package com.bit.poa.blockchain;

import com.bit.poa.authority.Authority;
import com.bit.poa.engine.ErrorType;
import com.bit.poa.engine.PoaException;
import com.bit.poa.engine.ProofOfAuthorityEngine;
import com.bit.poa.engine.RejectReason;
import com.bit.poa.structure.block.AuthorityBlock;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * 本节点出块：当前时钟槽位的调度出块者是本节点时，生成区块并提交到本地链
 * 不含定时循环，出块节奏和重试由外部调度层负责
 */
@Slf4j
public class BlockProducer {

    private final ProofOfAuthorityEngine engine;

    // 本节点的权威节点标识，为 null 时只验证不出块
    private final String localAuthority;

    private final Clock clock;

    public BlockProducer(ProofOfAuthorityEngine engine, String localAuthority, Clock clock) {
        this.engine = engine;
        this.localAuthority = localAuthority == null || localAuthority.isBlank() ? null : localAuthority.strip();
        this.clock = clock;
    }

    public boolean isProducer() {
        return localAuthority != null;
    }

    /**
     * 尝试在当前槽位出块
     * @return 被接受的区块；本节点不出块、不是当前槽位出块者或当前槽位已填充时返回 empty
     */
    public Optional<AuthorityBlock> produce(Map<String, Object> payload) {
        if (localAuthority == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        long slot = engine.getSlotClock().slotForTimestamp(now);
        if (slot == 0) {
            log.debug("当前处于创世槽位，跳过出块");
            return Optional.empty();
        }
        if (slot <= engine.getLastBlock().getSlot()) {
            log.debug("槽位 {} 已填充，跳过出块", slot);
            return Optional.empty();
        }
        Authority leader = engine.authorityForSlot(slot);
        if (!leader.getIdentifier().equals(localAuthority)) {
            log.debug("槽位 {} 出块者为 {}，本节点 {} 跳过", slot, leader.getIdentifier(), localAuthority);
            return Optional.empty();
        }
        try {
            AuthorityBlock block = engine.createBlock(localAuthority, payload, now, null);
            return Optional.of(engine.submitBlock(block));
        } catch (PoaException e) {
            // 上面的链头检查不在引擎锁内，槽位可能已被并发提交填充
            if (isSlotFilled(e)) {
                log.debug("槽位 {} 已被并发填充，跳过出块", slot);
                return Optional.empty();
            }
            throw e;
        }
    }

    private static boolean isSlotFilled(PoaException e) {
        return e.getErrorType() == ErrorType.SLOT_NOT_ADVANCING
                || (e.getErrorType() == ErrorType.BLOCK_REJECTED
                && e.getRejectReason() == RejectReason.SLOT_NOT_ADVANCING);
    }
}
