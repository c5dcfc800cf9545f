package com.bit.poa.config;

import com.bit.poa.authority.Authority;
import com.bit.poa.blockchain.BlockProducer;
import com.bit.poa.engine.ProofOfAuthorityEngine;
import com.bit.poa.engine.impl.ProofOfAuthorityEngineImpl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Configuration
@EnableConfigurationProperties(PoaProperties.class)
public class PoaConfig {

    /**
     * 时间源，测试中可替换为固定时钟
     */
    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProofOfAuthorityEngine proofOfAuthorityEngine(PoaProperties properties, Clock clock) {
        List<Authority> authorities = properties.getAuthorities().stream()
                .map(entry -> new Authority(entry.getIdentifier(), entry.getSecret(), entry.getWeight(),
                        entry.isActive(), entry.getMetadata()))
                .collect(Collectors.toList());
        log.info("加载PoA配置 - 槽位时长: {}, 创世时间: {}, 权威节点数: {}",
                properties.getSlotDuration(), properties.getGenesisTime(), authorities.size());
        return ProofOfAuthorityEngineImpl.builder()
                .clock(clock)
                .genesisTime(properties.getGenesisTime())
                .slotDuration(properties.getSlotDuration())
                .genesisPayload(properties.getGenesisPayload())
                .genesisMetadata(properties.getGenesisMetadata())
                .authorities(authorities)
                .build();
    }

    @Bean
    public BlockProducer blockProducer(ProofOfAuthorityEngine engine, PoaProperties properties, Clock clock) {
        return new BlockProducer(engine, properties.getLocalAuthority(), clock);
    }
}
