package com.bit.poa.authority;

import com.bit.poa.engine.ErrorType;
import com.bit.poa.engine.PoaException;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 权威节点集合的历史：按 startSlot 排序的快照序列，只追加
 * 同一 startSlot 的记录会被替换（同一未填充槽位内的连续修改合并为一条）
 * 写入为写时复制，读取方拿到的列表永远不会变化
 */
public class AuthorityHistory {

    private volatile ImmutableList<AuthoritySnapshot> entries = ImmutableList.of();

    /**
     * 记录快照：删除相同 startSlot 的旧记录，追加后按 startSlot 重新排序
     */
    public synchronized void record(AuthoritySnapshot snapshot) {
        entries = coalesce(entries, snapshot);
    }

    /**
     * 纯函数版本的合并逻辑
     */
    static ImmutableList<AuthoritySnapshot> coalesce(List<AuthoritySnapshot> current, AuthoritySnapshot snapshot) {
        List<AuthoritySnapshot> next = new ArrayList<>(current.size() + 1);
        for (AuthoritySnapshot entry : current) {
            if (entry.getStartSlot() != snapshot.getStartSlot()) {
                next.add(entry);
            }
        }
        next.add(snapshot);
        next.sort(Comparator.comparingLong(AuthoritySnapshot::getStartSlot));
        return ImmutableList.copyOf(next);
    }

    /**
     * 在指定槽位生效的快照：startSlot <= slot 的最后一条
     * @throws PoaException INVALID_SLOT 不存在生效快照
     */
    public AuthoritySnapshot effectiveAt(long slot) {
        AuthoritySnapshot applicable = null;
        for (AuthoritySnapshot entry : entries) {
            if (entry.getStartSlot() <= slot) {
                applicable = entry;
            } else {
                break;
            }
        }
        if (applicable == null) {
            throw new PoaException(ErrorType.INVALID_SLOT, "槽位 " + slot + " 没有可用的权威节点快照");
        }
        return applicable;
    }

    public List<AuthoritySnapshot> entries() {
        return entries;
    }
}
