package com.bit.poa.engine;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 引擎状态导出：创世时间、槽位时长、当前节点集合、节点历史、完整链
 * 仅描述性，重新验证不依赖它
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EngineSnapshot {
    private String genesisTime;
    private double slotDurationSeconds;
    private List<Map<String, Object>> authorities;
    private List<Map<String, Object>> authorityHistory;
    private List<Map<String, Object>> chain;
}
