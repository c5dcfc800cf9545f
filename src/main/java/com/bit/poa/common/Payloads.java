package com.bit.poa.common;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 区块负载/元数据的封闭值类型：String、不可变数值、Boolean、嵌套Map、List
 * 引擎从不解释其内容，只做深拷贝与类型校验；拷贝结果不可变且按键排序
 */
public final class Payloads {

    // 不可变数值类型白名单
    private static final Set<Class<?>> NUMBER_TYPES = Set.of(
            Integer.class, Long.class, Short.class, Byte.class,
            Float.class, Double.class, BigInteger.class, BigDecimal.class);

    private Payloads() {
    }

    /**
     * 深拷贝为不可变、按键排序的映射；null 视为空映射
     */
    public static ImmutableSortedMap<String, Object> copyOf(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return ImmutableSortedMap.of();
        }
        ImmutableSortedMap.Builder<String, Object> builder = ImmutableSortedMap.naturalOrder();
        for (Map.Entry<String, ?> entry : source.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("负载键不能为null");
            }
            builder.put(entry.getKey(), copyValue(entry.getKey(), entry.getValue()));
        }
        return builder.build();
    }

    /**
     * 可空版本：null 保持为 null（元数据缺省与空映射在哈希中是不同的）
     */
    public static ImmutableSortedMap<String, Object> copyOfNullable(Map<String, ?> source) {
        return source == null ? null : copyOf(source);
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(String key, Object value) {
        if (value == null) {
            throw new IllegalArgumentException("负载字段 '" + key + "' 的值不能为null");
        }
        if (value instanceof String || value instanceof Boolean || NUMBER_TYPES.contains(value.getClass())) {
            return value;
        }
        if (value instanceof Map) {
            for (Object nestedKey : ((Map<?, ?>) value).keySet()) {
                if (!(nestedKey instanceof String)) {
                    throw new IllegalArgumentException("负载字段 '" + key + "' 的嵌套键必须为字符串: " + nestedKey);
                }
            }
            return copyOf((Map<String, ?>) value);
        }
        // 只接受有序的 List
        if (value instanceof List) {
            ImmutableList.Builder<Object> list = ImmutableList.builder();
            for (Object element : (List<?>) value) {
                list.add(copyValue(key, element));
            }
            return list.build();
        }
        throw new IllegalArgumentException("负载字段 '" + key + "' 类型不受支持: " + value.getClass().getName());
    }
}
