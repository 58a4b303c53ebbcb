package org.devios.shell;

/**
 * 命令错误分类。所有错误都在分发器内转换成一条 {@code ERROR} 结果，不会中断会话。
 */
public enum ErrorKind {
    /** 路径不存在、类型不匹配（例如对目录 cat），或被受限模式隐藏 */
    NOT_FOUND,
    PERMISSION_DENIED,
    /** 缺少操作数、不支持的选项、未知的手册页等 */
    INVALID_ARGUMENT,
    /** 识别出管道/重定向等语法，但未实现 */
    UNSUPPORTED,
    AUTH_FAILURE,
    /** 连续认证失败达到上限，挂起的命令被丢弃 */
    AUTH_LOCKOUT,
    COMMAND_NOT_FOUND,
    /** Ctrl-C 中断了正在输入的行 */
    INTERRUPTED,
    /** 处理器内部的意外异常（已记录日志） */
    INTERNAL
}
