package org.devios.shell.dto;

import java.util.List;

/**
 * {@code shell_execute} 的返回结果。
 *
 * @param promptBefore   执行前的提示符
 * @param command        回显的命令（读取 sudo 密码时为空串）
 * @param records        第一批结果（后续动画输出请通过 shell_transcript 获取）
 * @param promptAfter    执行后的提示符
 * @param awaitingSecret 执行后是否在等待 sudo 密码
 */
public record ExecuteResult(
        String promptBefore,
        String command,
        List<ResultRecord> records,
        String promptAfter,
        boolean awaitingSecret
) {
}
