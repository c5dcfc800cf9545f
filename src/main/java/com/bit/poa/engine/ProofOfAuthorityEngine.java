package com.bit.poa.engine;

import com.bit.poa.authority.Authority;
import com.bit.poa.authority.AuthoritySnapshot;
import com.bit.poa.clock.SlotClock;
import com.bit.poa.structure.block.AuthorityBlock;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * PoA 引擎接口，定义权威证明共识的核心操作：
 * 维护权威节点注册表及其历史快照；
 * 按槽位时钟和加权轮转调度确定出块者；
 * 由调度出块者生成并签名区块；
 * 任意持有注册表历史的一方独立验证单个区块或整条链，验证通过的区块追加到链上。
 */
public interface ProofOfAuthorityEngine {

    SlotClock getSlotClock();

    /**
     * 注册权威节点，变更从下一个未填充槽位生效
     * @param overwrite 为 true 时替换已存在的同名节点，否则抛出 DUPLICATE_AUTHORITY
     */
    Authority registerAuthority(String identifier, String secret, int weight, boolean active,
                                Map<String, Object> metadata, boolean overwrite);

    default Authority registerAuthority(String identifier, String secret, int weight) {
        return registerAuthority(identifier, secret, weight, true, null, false);
    }

    Authority deregisterAuthority(String identifier);

    /**
     * 部分更新，参数为 null 表示保持不变
     */
    Authority updateAuthority(String identifier, String secret, Integer weight, Boolean active,
                              Map<String, Object> metadata);

    /**
     * 当前激活的节点，按标识升序
     */
    List<Authority> activeAuthorities();

    List<Authority> getAuthorities();

    List<AuthoritySnapshot> getAuthorityHistory();

    /**
     * 槽位的调度出块者（按该槽位生效的历史快照计算）
     */
    Authority authorityForSlot(long slot);

    /**
     * 时间戳所在槽位的调度出块者
     */
    Authority expectedAuthorityAt(Instant timestamp);

    /**
     * 生成并签名区块，不追加到链上
     * @param timestamp 出块时间，null 表示取注入时钟的当前时间
     */
    AuthorityBlock createBlock(String authorityId, Map<String, Object> payload, Instant timestamp,
                               Map<String, Object> metadata);

    /**
     * 以当前链头为父区块验证
     */
    BlockVerification verifyBlock(AuthorityBlock block);

    /**
     * 以指定父区块验证，previousBlock 为 null 时等同于 {@link #verifyBlock(AuthorityBlock)}
     */
    BlockVerification verifyBlock(AuthorityBlock block, AuthorityBlock previousBlock);

    default boolean isValid(AuthorityBlock block) {
        return verifyBlock(block).isValid();
    }

    /**
     * 验证通过后追加到链上，否则抛出 BLOCK_REJECTED，链保持不变
     */
    AuthorityBlock submitBlock(AuthorityBlock block);

    /**
     * 逐块验证整条链，遇到第一个失败即返回 false
     */
    boolean validateChain();

    List<AuthorityBlock> getChain();

    AuthorityBlock getLastBlock();

    int getHeight();

    /**
     * 导出引擎状态（不含密钥），仅用于外部持久化或调试
     */
    EngineSnapshot snapshot();
}
