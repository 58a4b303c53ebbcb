package org.devios.shell.command;

import org.devios.shell.dto.ResultRecord;
import org.devios.shell.sequencer.Script;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次分发的结果：第一批输出，加上需要在输出入列后启动的定时脚本。
 *
 * @param records     第一批结果
 * @param scripts     后续定时脚本（按顺序启动）
 * @param clearScreen 是否清空输出历史（clear）
 * @param logout      是否结束会话（exit / logout）
 */
public record CommandOutcome(
        List<ResultRecord> records,
        List<Script> scripts,
        boolean clearScreen,
        boolean logout
) {

    public CommandOutcome {
        records = List.copyOf(records);
        scripts = List.copyOf(scripts);
    }

    public static CommandOutcome of(ResultRecord... records) {
        return new CommandOutcome(List.of(records), List.of(), false, false);
    }

    public static CommandOutcome of(List<ResultRecord> records) {
        return new CommandOutcome(records, List.of(), false, false);
    }

    public static CommandOutcome empty() {
        return of(List.of());
    }

    public static CommandOutcome clear() {
        return new CommandOutcome(List.of(), List.of(), true, false);
    }

    public CommandOutcome withScript(Script script) {
        List<Script> merged = new ArrayList<>(scripts);
        merged.add(script);
        return new CommandOutcome(records, merged, clearScreen, logout);
    }

    public CommandOutcome asLogout() {
        return new CommandOutcome(records, scripts, clearScreen, true);
    }

    /**
     * 在前面插入若干结果，其余保持不变。
     */
    public CommandOutcome prepend(ResultRecord... leading) {
        List<ResultRecord> merged = new ArrayList<>(List.of(leading));
        merged.addAll(records);
        return new CommandOutcome(merged, scripts, clearScreen, logout);
    }
}
