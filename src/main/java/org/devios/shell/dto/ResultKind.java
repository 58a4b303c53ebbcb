package org.devios.shell.dto;

/**
 * 结果类型，决定展示层的样式。{@link #LOGOUT} 表示会话结束，展示层应回到初始欢迎状态。
 */
public enum ResultKind {
    ERROR,
    SUCCESS,
    INFO,
    WARNING,
    SYSTEM,
    LOGOUT
}
