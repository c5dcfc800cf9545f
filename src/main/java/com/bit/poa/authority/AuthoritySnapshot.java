package com.bit.poa.authority;

import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 权威节点集合快照：从 startSlot 起生效，内容按标识升序且不可变（含未激活节点）
 */
@Getter
@EqualsAndHashCode
@ToString
public final class AuthoritySnapshot {

    private static final Comparator<Authority> BY_IDENTIFIER = Comparator.comparing(Authority::getIdentifier);

    private final long startSlot;

    private final ImmutableList<Authority> authorities;

    public AuthoritySnapshot(long startSlot, Collection<Authority> authorities) {
        if (startSlot < 0) {
            throw new IllegalArgumentException("快照起始槽位不能为负: " + startSlot);
        }
        this.startSlot = startSlot;
        this.authorities = authorities.stream()
                .sorted(BY_IDENTIFIER)
                .collect(ImmutableList.toImmutableList());
    }

    /**
     * 激活的节点，保持标识升序
     */
    public List<Authority> active() {
        return authorities.stream()
                .filter(Authority::isActive)
                .collect(ImmutableList.toImmutableList());
    }

    public Optional<Authority> find(String identifier) {
        return authorities.stream()
                .filter(authority -> authority.getIdentifier().equals(identifier))
                .findFirst();
    }

    public Map<String, Object> describe() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("start_slot", startSlot);
        view.put("authorities", authorities.stream().map(Authority::describe).collect(Collectors.toList()));
        return view;
    }
}
