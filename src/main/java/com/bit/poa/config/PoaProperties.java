package com.bit.poa.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "poa")
public class PoaProperties {
    private Duration slotDuration = Duration.ofSeconds(5);//槽位时长
    private Instant genesisTime;//创世时间，为空时取启动时间
    private Map<String, Object> genesisPayload;
    private Map<String, Object> genesisMetadata;
    private String localAuthority;//本节点出块使用的权威节点标识，为空表示只验证不出块
    private List<AuthorityEntry> authorities = new ArrayList<>();

    @Data
    public static class AuthorityEntry {
        private String identifier;
        private String secret;
        private int weight = 1;
        private boolean active = true;
        private Map<String, Object> metadata;
    }
}
