package com.bit.poa.chain;

import com.bit.poa.structure.block.AuthorityBlock;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * 只追加的区块序列，索引 0 固定为创世区块，从不修改或截断
 */
public class AuthorityChain {

    private final List<AuthorityBlock> blocks = new ArrayList<>();

    /**
     * 最新区块信息
     * volatile 保障其他线程可见
     */
    private volatile AuthorityBlock head;

    public AuthorityChain(AuthorityBlock genesis) {
        if (genesis == null || !genesis.isGenesis()) {
            throw new IllegalArgumentException("链必须以创世区块开始");
        }
        blocks.add(genesis);
        head = genesis;
    }

    /**
     * 追加区块，调用方负责先完成验证
     */
    public synchronized void append(AuthorityBlock block) {
        if (block.getSlot() <= head.getSlot()) {
            throw new IllegalStateException("区块槽位 " + block.getSlot() + " 未超过链头槽位 " + head.getSlot());
        }
        blocks.add(block);
        head = block;
    }

    public AuthorityBlock head() {
        return head;
    }

    public synchronized AuthorityBlock genesis() {
        return blocks.get(0);
    }

    public synchronized int height() {
        return blocks.size();
    }

    /**
     * 当前链的只读副本
     */
    public synchronized List<AuthorityBlock> blocks() {
        return ImmutableList.copyOf(blocks);
    }
}
