package org.devios.shell.dto;

import java.util.List;

/**
 * 会话状态的只读快照。
 *
 * @param actor          当前用户名（未提权时的身份）
 * @param privileged     是否已提权
 * @param groups         所属组
 * @param cwd            当前目录
 * @param previousCwd    上一个目录（可能为 null）
 * @param featureLevel   RESTRICTED / FULL
 * @param language       zh_TW / en_US
 * @param darkTheme      是否为暗色主题
 * @param awaitingSecret 是否在等待 sudo 密码
 * @param historySize    已记录的命令数
 * @param prompt         当前提示符
 */
public record SessionSnapshot(
        String actor,
        boolean privileged,
        List<String> groups,
        String cwd,
        String previousCwd,
        String featureLevel,
        String language,
        boolean darkTheme,
        boolean awaitingSecret,
        int historySize,
        String prompt
) {
}
