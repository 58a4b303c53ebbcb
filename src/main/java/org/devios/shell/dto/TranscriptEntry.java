package org.devios.shell.dto;

import java.util.List;

/**
 * 终端输出历史中的一项：一次提交的命令（回显文本）及其结果。
 *
 * @param command 回显的命令（输入密码时为空串）
 * @param records 结果（按展示顺序）
 */
public record TranscriptEntry(String command, List<ResultRecord> records) {

    public TranscriptEntry {
        records = List.copyOf(records);
    }
}
