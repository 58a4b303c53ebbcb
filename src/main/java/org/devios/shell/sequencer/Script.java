package org.devios.shell.sequencer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * 一段定时输出脚本：按顺序执行的步骤，每一步的延迟都相对上一步完成的时间计算。
 *
 * @param name  脚本名（用于日志）
 * @param steps 步骤
 */
public record Script(String name, List<Step> steps) {

    public Script {
        Objects.requireNonNull(name, "name");
        steps = List.copyOf(steps);
    }

    public static Builder named(String name) {
        return new Builder(name);
    }

    /**
     * @param delay  相对上一步完成时间的延迟
     * @param action 对输出历史的修改
     */
    public record Step(Duration delay, Consumer<Transcript> action) {

        public Step {
            Objects.requireNonNull(delay, "delay");
            Objects.requireNonNull(action, "action");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("延迟不能为负数：" + delay);
            }
        }
    }

    public static final class Builder {
        private final String name;
        private final List<Step> steps = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder then(Duration delay, Consumer<Transcript> action) {
            steps.add(new Step(delay, action));
            return this;
        }

        public Script build() {
            return new Script(name, steps);
        }
    }
}
