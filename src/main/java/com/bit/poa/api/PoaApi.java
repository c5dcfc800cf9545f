package com.bit.poa.api;

import com.bit.poa.engine.EngineSnapshot;
import com.bit.poa.engine.ProofOfAuthorityEngine;
import com.bit.poa.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 只读查询接口：状态导出、调度查询、链校验
 */
@Slf4j
@RestController
@RequestMapping("/poa")
public class PoaApi {

    @Autowired
    private ProofOfAuthorityEngine engine;

    @GetMapping("/version")
    public String version() {
        return "2025.0.0.1";
    }

    @GetMapping("/snapshot")
    public Result<EngineSnapshot> snapshot() {
        return Result.OK(engine.snapshot());
    }

    @GetMapping("/leader/{slot}")
    public Result<Map<String, Object>> leader(@PathVariable("slot") long slot) {
        return Result.OK(engine.authorityForSlot(slot).describe());
    }

    @GetMapping("/authorities/active")
    public Result<List<Map<String, Object>>> activeAuthorities() {
        return Result.OK(engine.activeAuthorities().stream()
                .map(authority -> authority.describe())
                .collect(Collectors.toList()));
    }

    @GetMapping("/head")
    public Result<Map<String, Object>> head() {
        return Result.OK(engine.getLastBlock().toRecord());
    }

    @GetMapping("/chain/valid")
    public Result<Boolean> validateChain() {
        boolean valid = engine.validateChain();
        log.info("链验证结果: {}, 高度: {}", valid, engine.getHeight());
        return Result.OK(valid);
    }
}
