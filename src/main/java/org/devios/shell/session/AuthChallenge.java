package org.devios.shell.session;

import java.util.Objects;

/**
 * 等待 sudo 密码时的挂起状态。
 *
 * @param pendingCommand 原始要执行的命令行（原样保存）
 * @param attempts       已失败次数
 */
public record AuthChallenge(String pendingCommand, int attempts) {

    public AuthChallenge {
        Objects.requireNonNull(pendingCommand, "pendingCommand");
    }

    public static AuthChallenge start(String pendingCommand) {
        return new AuthChallenge(pendingCommand, 0);
    }

    public AuthChallenge failed() {
        return new AuthChallenge(pendingCommand, attempts + 1);
    }
}
