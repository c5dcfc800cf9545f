package com.bit.poa.authority;

import com.bit.poa.engine.ErrorType;
import com.bit.poa.engine.PoaException;
import com.google.common.collect.ImmutableList;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.LongSupplier;

/**
 * 权威节点注册表：节点的增删改，以及每次变更后的历史快照
 * 变更从下一个未填充槽位（链头槽位 + 1）开始生效，从不回溯
 */
@Slf4j
public class AuthorityRegistry {

    // 标识 -> 节点，TreeMap 保证遍历顺序即标识升序
    private final TreeMap<String, Authority> authorities = new TreeMap<>();

    private final AuthorityHistory history = new AuthorityHistory();

    // 下一个未填充槽位，由链头决定
    private final LongSupplier nextSlot;

    public AuthorityRegistry(LongSupplier nextSlot) {
        this.nextSlot = nextSlot;
    }

    public synchronized Authority register(String identifier, String secret, int weight, boolean active,
                                           Map<String, Object> metadata, boolean overwrite) {
        return register(new Authority(identifier, secret, weight, active, metadata), overwrite);
    }

    public synchronized Authority register(Authority authority, boolean overwrite) {
        if (!overwrite && authorities.containsKey(authority.getIdentifier())) {
            throw new PoaException(ErrorType.DUPLICATE_AUTHORITY,
                    "权威节点 '" + authority.getIdentifier() + "' 已注册");
        }
        authorities.put(authority.getIdentifier(), authority);
        long startSlot = recordState();
        log.info("注册权威节点: {}, 权重: {}, 激活: {}, 生效槽位: {}",
                authority.getIdentifier(), authority.getWeight(), authority.isActive(), startSlot);
        return authority;
    }

    public synchronized Authority deregister(String identifier) {
        String key = Authority.normaliseIdentifier(identifier);
        Authority removed = authorities.remove(key);
        if (removed == null) {
            throw new PoaException(ErrorType.UNKNOWN_AUTHORITY, "权威节点 '" + key + "' 未注册");
        }
        long startSlot = recordState();
        log.info("注销权威节点: {}, 生效槽位: {}", key, startSlot);
        return removed;
    }

    /**
     * 部分更新，参数为 null 表示保持不变
     */
    public synchronized Authority update(String identifier, String secret, Integer weight, Boolean active,
                                         Map<String, Object> metadata) {
        String key = Authority.normaliseIdentifier(identifier);
        Authority current = authorities.get(key);
        if (current == null) {
            throw new PoaException(ErrorType.UNKNOWN_AUTHORITY, "权威节点 '" + key + "' 未注册");
        }
        Authority updated = current;
        if (secret != null) {
            updated = updated.withSecret(secret);
        }
        if (weight != null) {
            updated = updated.withWeight(weight);
        }
        if (active != null) {
            updated = updated.withActive(active);
        }
        if (metadata != null) {
            updated = updated.withMetadata(metadata);
        }
        authorities.put(key, updated);
        long startSlot = recordState();
        log.info("更新权威节点: {}, 权重: {}, 激活: {}, 生效槽位: {}",
                key, updated.getWeight(), updated.isActive(), startSlot);
        return updated;
    }

    /**
     * 当前激活的节点（标识升序），只看实时状态，不查历史
     */
    public synchronized List<Authority> activeAuthorities() {
        return authorities.values().stream()
                .filter(Authority::isActive)
                .collect(ImmutableList.toImmutableList());
    }

    public synchronized List<Authority> authorities() {
        return ImmutableList.copyOf(authorities.values());
    }

    public synchronized Optional<Authority> find(String identifier) {
        return Optional.ofNullable(authorities.get(Authority.normaliseIdentifier(identifier)));
    }

    public AuthorityHistory history() {
        return history;
    }

    /**
     * 以下一个未填充槽位为起点记录当前状态
     */
    public synchronized long recordState() {
        long startSlot = nextSlot.getAsLong();
        recordState(startSlot);
        return startSlot;
    }

    public synchronized void recordState(long startSlot) {
        history.record(new AuthoritySnapshot(startSlot, authorities.values()));
    }
}
