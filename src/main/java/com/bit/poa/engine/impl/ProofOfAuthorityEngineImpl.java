package com.bit.poa.engine.impl;

import com.bit.poa.authority.Authority;
import com.bit.poa.authority.AuthorityRegistry;
import com.bit.poa.authority.AuthoritySnapshot;
import com.bit.poa.chain.AuthorityChain;
import com.bit.poa.clock.SlotClock;
import com.bit.poa.engine.BlockVerification;
import com.bit.poa.engine.EngineSnapshot;
import com.bit.poa.engine.ErrorType;
import com.bit.poa.engine.PoaException;
import com.bit.poa.engine.ProofOfAuthorityEngine;
import com.bit.poa.engine.RejectReason;
import com.bit.poa.schedule.LeaderSchedule;
import com.bit.poa.structure.block.AuthorityBlock;
import com.bit.poa.util.Sha;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 单写多读：注册表变更、出块、提交都在同一把锁内串行执行，
 * 同一槽位的并发提交至多接受一个；验证与调度查询只读取不可变快照
 */
@Slf4j
public class ProofOfAuthorityEngineImpl implements ProofOfAuthorityEngine {

    private final Clock clock;

    private final SlotClock slotClock;

    private final AuthorityChain chain;

    private final AuthorityRegistry registry;

    private final LeaderSchedule schedule;

    private final Object lock = new Object();

    /**
     * @param clock           时间源，createBlock 未指定时间戳时使用
     * @param genesisTime     创世时间，null 表示取 clock 当前时间
     * @param slotDuration    槽位时长，必须为正
     * @param authorities     初始权威节点（以覆盖方式注册）
     */
    @Builder
    public ProofOfAuthorityEngineImpl(Clock clock, Instant genesisTime, Duration slotDuration,
                                      Map<String, Object> genesisPayload, Map<String, Object> genesisMetadata,
                                      List<Authority> authorities) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
        Instant genesis = genesisTime == null ? this.clock.instant() : genesisTime;
        this.slotClock = new SlotClock(genesis, slotDuration);
        this.chain = new AuthorityChain(AuthorityBlock.genesis(genesis, genesisPayload, genesisMetadata));
        this.registry = new AuthorityRegistry(() -> chain.head().getSlot() + 1);
        this.schedule = new LeaderSchedule(registry.history());
        if (authorities != null) {
            for (Authority authority : authorities) {
                registry.register(authority, true);
            }
        }
        // 确保创世之后的槽位至少有一条快照
        registry.recordState(1);
        log.info("PoA引擎初始化完成 - 创世时间: {}, 槽位时长: {}, 初始权威节点: {}",
                genesis, slotDuration, registry.authorities().size());
    }

    @Override
    public SlotClock getSlotClock() {
        return slotClock;
    }

    @Override
    public Authority registerAuthority(String identifier, String secret, int weight, boolean active,
                                       Map<String, Object> metadata, boolean overwrite) {
        synchronized (lock) {
            return registry.register(identifier, secret, weight, active, metadata, overwrite);
        }
    }

    @Override
    public Authority deregisterAuthority(String identifier) {
        synchronized (lock) {
            return registry.deregister(identifier);
        }
    }

    @Override
    public Authority updateAuthority(String identifier, String secret, Integer weight, Boolean active,
                                     Map<String, Object> metadata) {
        synchronized (lock) {
            return registry.update(identifier, secret, weight, active, metadata);
        }
    }

    @Override
    public List<Authority> activeAuthorities() {
        return registry.activeAuthorities();
    }

    @Override
    public List<Authority> getAuthorities() {
        return registry.authorities();
    }

    @Override
    public List<AuthoritySnapshot> getAuthorityHistory() {
        return registry.history().entries();
    }

    @Override
    public Authority authorityForSlot(long slot) {
        return schedule.authorityForSlot(slot);
    }

    @Override
    public Authority expectedAuthorityAt(Instant timestamp) {
        long slot = slotClock.slotForTimestamp(timestamp);
        if (slot == 0) {
            throw new PoaException(ErrorType.GENESIS_SLOT_RESERVED, "时间戳 " + timestamp + " 位于创世槽位");
        }
        return schedule.authorityForSlot(slot);
    }

    @Override
    public AuthorityBlock createBlock(String authorityId, Map<String, Object> payload, Instant timestamp,
                                      Map<String, Object> metadata) {
        String identifier = Authority.normaliseIdentifier(authorityId);
        Instant blockTime = timestamp == null ? clock.instant() : timestamp;
        synchronized (lock) {
            Authority authority = registry.find(identifier)
                    .orElseThrow(() -> new PoaException(ErrorType.UNKNOWN_AUTHORITY,
                            "权威节点 '" + identifier + "' 未注册"));
            if (!authority.isActive()) {
                throw new PoaException(ErrorType.INACTIVE_AUTHORITY, "权威节点 '" + identifier + "' 未激活");
            }
            long slot = slotClock.slotForTimestamp(blockTime);
            if (slot == 0) {
                throw new PoaException(ErrorType.GENESIS_SLOT_RESERVED, "不能在创世槽位出块");
            }
            AuthorityBlock head = chain.head();
            if (slot <= head.getSlot()) {
                throw new PoaException(ErrorType.SLOT_NOT_ADVANCING,
                        "槽位 " + slot + " 必须大于链头槽位 " + head.getSlot());
            }
            Authority expected = schedule.authorityForSlot(slot);
            if (!expected.getIdentifier().equals(identifier)) {
                throw new PoaException(ErrorType.NOT_SCHEDULED_LEADER,
                        "权威节点 '" + identifier + "' 不是槽位 " + slot + " 的出块者，期望 '"
                                + expected.getIdentifier() + "'");
            }
            AuthorityBlock block;
            try {
                block = AuthorityBlock.create(slot, identifier, blockTime, payload,
                        head.getHash().toHex(), metadata);
            } catch (IllegalArgumentException e) {
                throw new PoaException(ErrorType.CONFIG_INVALID, "区块负载非法: " + e.getMessage(), e);
            }
            AuthorityBlock signed = block.withSignature(authority.sign(block.signingMessage()));
            log.debug("生成区块 - 槽位: {}, 出块者: {}, 哈希: {}", slot, identifier, signed.getHash());
            return signed;
        }
    }

    @Override
    public BlockVerification verifyBlock(AuthorityBlock block) {
        return verify(block, null);
    }

    @Override
    public BlockVerification verifyBlock(AuthorityBlock block, AuthorityBlock previousBlock) {
        return verify(block, previousBlock);
    }

    private BlockVerification verify(AuthorityBlock block, AuthorityBlock previousBlock) {
        if (block.isGenesis()) {
            if (previousBlock == null && block.equals(chain.genesis())) {
                return BlockVerification.ok();
            }
            return BlockVerification.reject(RejectReason.GENESIS_MISMATCH, "创世区块与本地创世区块不一致");
        }
        if (!block.getHash().equals(block.computeHash())) {
            return BlockVerification.reject(RejectReason.HASH_MISMATCH,
                    "区块内容哈希不一致，存储: " + block.getHash());
        }
        AuthorityBlock previous = previousBlock == null ? chain.head() : previousBlock;
        if (block.getSlot() <= previous.getSlot()) {
            return BlockVerification.reject(RejectReason.SLOT_NOT_ADVANCING,
                    "槽位 " + block.getSlot() + " 未超过父区块槽位 " + previous.getSlot());
        }
        if (!block.getParentHash().equals(previous.getHash().toHex())) {
            return BlockVerification.reject(RejectReason.PARENT_MISMATCH,
                    "父哈希 " + block.getParentHash() + " 与父区块哈希 " + previous.getHash() + " 不一致");
        }

        // 按该槽位生效的历史快照判断，而非注册表实时状态
        Authority expected;
        try {
            expected = schedule.authorityForSlot(block.getSlot());
        } catch (PoaException e) {
            RejectReason reason = e.getErrorType() == ErrorType.INVALID_SLOT
                    ? RejectReason.NO_SNAPSHOT : RejectReason.NOT_SCHEDULED_LEADER;
            return BlockVerification.reject(reason, e.getMessage());
        }
        if (!block.getProposer().equals(expected.getIdentifier())) {
            return BlockVerification.reject(RejectReason.NOT_SCHEDULED_LEADER,
                    "出块者 '" + block.getProposer() + "' 不是槽位 " + block.getSlot()
                            + " 的调度出块者 '" + expected.getIdentifier() + "'");
        }
        Optional<Authority> recorded = schedule.authorityFromSnapshot(block.getSlot(), block.getProposer());
        if (recorded.isEmpty() || !recorded.get().isActive()) {
            return BlockVerification.reject(RejectReason.INACTIVE_AUTHORITY,
                    "出块者 '" + block.getProposer() + "' 在槽位 " + block.getSlot() + " 未激活");
        }

        long timestampSlot;
        try {
            timestampSlot = slotClock.slotForTimestamp(block.getTimestamp());
        } catch (PoaException e) {
            return BlockVerification.reject(RejectReason.SLOT_TIMESTAMP_MISMATCH, e.getMessage());
        }
        if (timestampSlot != block.getSlot()) {
            return BlockVerification.reject(RejectReason.SLOT_TIMESTAMP_MISMATCH,
                    "时间戳对应槽位 " + timestampSlot + "，区块声明槽位 " + block.getSlot());
        }

        if (!block.hasSignature()) {
            return BlockVerification.reject(RejectReason.MISSING_SIGNATURE, "区块缺少签名");
        }
        byte[] expectedSignature = recorded.get().sign(block.signingMessage());
        if (!Sha.constantTimeEquals(expectedSignature, block.getSignature())) {
            return BlockVerification.reject(RejectReason.SIGNATURE_MISMATCH, "区块签名校验失败");
        }
        return BlockVerification.ok();
    }

    @Override
    public AuthorityBlock submitBlock(AuthorityBlock block) {
        synchronized (lock) {
            BlockVerification verification = verify(block, null);
            if (!verification.isValid()) {
                log.warn("拒绝区块 - 槽位: {}, 出块者: {}, 原因: {}, {}",
                        block.getSlot(), block.getProposer(), verification.getReason(), verification.getMessage());
                throw new PoaException(ErrorType.BLOCK_REJECTED, verification.getReason(), verification.getMessage());
            }
            chain.append(block);
            log.info("接受区块 - 槽位: {}, 出块者: {}, 高度: {}, 哈希: {}",
                    block.getSlot(), block.getProposer(), chain.height(), block.getHash());
            return block;
        }
    }

    @Override
    public boolean validateChain() {
        List<AuthorityBlock> blocks = chain.blocks();
        for (int i = 0; i < blocks.size(); i++) {
            AuthorityBlock block = blocks.get(i);
            BlockVerification verification = i == 0
                    ? verify(block, null)
                    : verify(block, blocks.get(i - 1));
            if (!verification.isValid()) {
                log.warn("链验证失败 - 索引: {}, 槽位: {}, 原因: {}", i, block.getSlot(), verification.getReason());
                return false;
            }
        }
        return true;
    }

    @Override
    public List<AuthorityBlock> getChain() {
        return chain.blocks();
    }

    @Override
    public AuthorityBlock getLastBlock() {
        return chain.head();
    }

    @Override
    public int getHeight() {
        return chain.height();
    }

    @Override
    public EngineSnapshot snapshot() {
        synchronized (lock) {
            return new EngineSnapshot(
                    AuthorityBlock.formatTimestamp(slotClock.getGenesisTime()),
                    slotClock.getSlotDurationSeconds(),
                    registry.authorities().stream().map(Authority::describe).collect(Collectors.toList()),
                    registry.history().entries().stream().map(AuthoritySnapshot::describe).collect(Collectors.toList()),
                    chain.blocks().stream().map(AuthorityBlock::toRecord).collect(Collectors.toList()));
        }
    }
}
