package com.bit.poa.clock;

import com.bit.poa.engine.ErrorType;
import com.bit.poa.engine.PoaException;
import lombok.Getter;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;

/**
 * 槽位时钟：创世时间 + 固定槽位时长，负责时间戳与槽位号之间的双向换算
 * slot = floor((t - genesis) / slotDuration)，slot 0 为创世槽位
 */
@Getter
public class SlotClock {

    private final Instant genesisTime;

    private final Duration slotDuration;

    public SlotClock(Instant genesisTime, Duration slotDuration) {
        if (genesisTime == null) {
            throw new PoaException(ErrorType.CONFIG_INVALID, "创世时间不能为空");
        }
        if (slotDuration == null || slotDuration.isZero() || slotDuration.isNegative()) {
            throw new PoaException(ErrorType.CONFIG_INVALID, "槽位时长必须为正数: " + slotDuration);
        }
        this.genesisTime = genesisTime;
        this.slotDuration = slotDuration;
    }

    /**
     * 时间戳所在槽位
     * @throws PoaException OUT_OF_RANGE 时间戳早于创世时间
     */
    public long slotForTimestamp(Instant timestamp) {
        if (timestamp == null) {
            throw new PoaException(ErrorType.OUT_OF_RANGE, "时间戳不能为空");
        }
        Duration elapsed = Duration.between(genesisTime, timestamp);
        if (elapsed.isNegative()) {
            throw new PoaException(ErrorType.OUT_OF_RANGE,
                    "时间戳 " + timestamp + " 早于创世时间 " + genesisTime);
        }
        // elapsed 非负，截断即向下取整
        return elapsed.dividedBy(slotDuration);
    }

    /**
     * 槽位起始时间（slotForTimestamp 的逆运算）
     * @throws PoaException OUT_OF_RANGE 起始时间超出 Instant 可表示范围
     */
    public Instant slotStartTime(long slot) {
        if (slot < 0) {
            throw new PoaException(ErrorType.INVALID_SLOT, "槽位号不能为负: " + slot);
        }
        try {
            return genesisTime.plus(slotDuration.multipliedBy(slot));
        } catch (ArithmeticException | DateTimeException e) {
            throw new PoaException(ErrorType.OUT_OF_RANGE, "槽位 " + slot + " 的起始时间超出可表示范围", e);
        }
    }

    public double getSlotDurationSeconds() {
        return slotDuration.toNanos() / 1_000_000_000d;
    }
}
