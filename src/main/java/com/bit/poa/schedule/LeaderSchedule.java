package com.bit.poa.schedule;

import com.bit.poa.authority.Authority;
import com.bit.poa.authority.AuthorityHistory;
import com.bit.poa.authority.AuthoritySnapshot;
import com.bit.poa.engine.ErrorType;
import com.bit.poa.engine.PoaException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 出块调度：按权重轮转决定每个槽位的出块者
 * 结果只取决于 (slot, 该槽位生效的快照)，出块者与任意验证者无需协调即可得到同一答案
 */
@Slf4j
public class LeaderSchedule {

    /**
     * 缓存配置：最近 1<<16 个槽位的调度结果
     * 值中保存计算时使用的快照，快照被合并替换后命中会失效并重新计算
     */
    private static final int CACHE_SIZE = 1 << 16;

    private final AuthorityHistory history;

    private final Cache<Long, Resolved> leaderCache;

    public LeaderSchedule(AuthorityHistory history) {
        this.history = history;
        this.leaderCache = Caffeine.newBuilder()
                .maximumSize(CACHE_SIZE)
                .expireAfterAccess(Duration.ofMinutes(10))
                .build();
    }

    /**
     * 槽位的调度出块者
     * @throws PoaException INVALID_SLOT 槽位为0或无生效快照；NO_ACTIVE_AUTHORITIES 快照中无激活节点
     */
    public Authority authorityForSlot(long slot) {
        if (slot <= 0) {
            throw new PoaException(ErrorType.INVALID_SLOT, "槽位 " + slot + " 保留给创世区块");
        }
        AuthoritySnapshot snapshot = history.effectiveAt(slot);
        Resolved cached = leaderCache.getIfPresent(slot);
        if (cached != null && cached.snapshot == snapshot) {
            return cached.leader;
        }
        Authority leader = resolve(slot, snapshot);
        leaderCache.put(slot, new Resolved(snapshot, leader));
        log.debug("槽位 {} 调度出块者: {}（快照起始槽位 {}）", slot, leader.getIdentifier(), snapshot.getStartSlot());
        return leader;
    }

    /**
     * 加权轮转：position = (slot - 1) mod 总权重，按标识升序累加权重，
     * 第一个累计权重超过 position 的节点即为出块者
     */
    public static Authority resolve(long slot, AuthoritySnapshot snapshot) {
        List<Authority> active = snapshot.active();
        if (active.isEmpty()) {
            throw new PoaException(ErrorType.NO_ACTIVE_AUTHORITIES, "槽位 " + slot + " 没有激活的权威节点");
        }
        long totalWeight = 0;
        for (Authority authority : active) {
            totalWeight += authority.getWeight();
        }
        long position = Math.floorMod(slot - 1, totalWeight);
        long cumulative = 0;
        for (Authority authority : active) {
            cumulative += authority.getWeight();
            if (position < cumulative) {
                return authority;
            }
        }
        throw new IllegalStateException("槽位 " + slot + " 调度失败，累计权重 " + cumulative);
    }

    /**
     * 按该槽位生效的快照查找指定节点（节点后来被注销/停用不影响历史查询）
     */
    public Optional<Authority> authorityFromSnapshot(long slot, String identifier) {
        return history.effectiveAt(slot).find(identifier);
    }

    public AuthoritySnapshot snapshotForSlot(long slot) {
        return history.effectiveAt(slot);
    }

    private static final class Resolved {
        private final AuthoritySnapshot snapshot;
        private final Authority leader;

        private Resolved(AuthoritySnapshot snapshot, Authority leader) {
            this.snapshot = snapshot;
            this.leader = leader;
        }
    }
}
